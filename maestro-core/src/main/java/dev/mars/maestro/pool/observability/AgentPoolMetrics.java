/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.maestro.pool.observability;

import dev.mars.maestro.agent.RejectionReason;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * OpenTelemetry metrics for the agent pool.
 *
 * Provides 7 pool metrics:
 * - maestro.agent.executions.total (counter) - Invocations admitted by the pool
 * - maestro.agent.executions.succeeded (counter) - Invocations that completed successfully
 * - maestro.agent.executions.failed (counter) - Invocations that failed after all retries
 * - maestro.agent.executions.rejected (counter) - Invocations refused before running
 * - maestro.agent.executions.retries (counter) - Retry attempts
 * - maestro.agent.duration.seconds (histogram) - Duration of the final attempt
 * - maestro.agent.running (gauge) - Agents currently running
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-26
 * @version 1.0 (OpenTelemetry)
 */
public class AgentPoolMetrics {

    private static final Logger logger = LoggerFactory.getLogger(AgentPoolMetrics.class);
    private static final String METER_NAME = "maestro-pool";

    private static final AttributeKey<String> AGENT_NAME_KEY = AttributeKey.stringKey("agent.name");
    private static final AttributeKey<String> REJECTION_REASON_KEY = AttributeKey.stringKey("rejection.reason");
    private static final AttributeKey<String> FAILURE_TYPE_KEY = AttributeKey.stringKey("failure.type");

    // Counters
    private final LongCounter executionsTotal;
    private final LongCounter executionsSucceeded;
    private final LongCounter executionsFailed;
    private final LongCounter executionsRejected;
    private final LongCounter retries;

    // Histograms
    private final DoubleHistogram duration;

    // Gauges (backed by AtomicLong)
    private final AtomicLong runningAgents = new AtomicLong(0);

    public AgentPoolMetrics(Meter meter) {
        Objects.requireNonNull(meter, "Meter cannot be null");

        executionsTotal = meter.counterBuilder("maestro.agent.executions.total")
                .setDescription("Total number of agent invocations admitted by the pool")
                .setUnit("1")
                .build();

        executionsSucceeded = meter.counterBuilder("maestro.agent.executions.succeeded")
                .setDescription("Number of agent invocations that completed successfully")
                .setUnit("1")
                .build();

        executionsFailed = meter.counterBuilder("maestro.agent.executions.failed")
                .setDescription("Number of agent invocations that failed after all retries")
                .setUnit("1")
                .build();

        executionsRejected = meter.counterBuilder("maestro.agent.executions.rejected")
                .setDescription("Number of agent invocations refused by the pool")
                .setUnit("1")
                .build();

        retries = meter.counterBuilder("maestro.agent.executions.retries")
                .setDescription("Number of retry attempts")
                .setUnit("1")
                .build();

        duration = meter.histogramBuilder("maestro.agent.duration.seconds")
                .setDescription("Agent execution duration in seconds")
                .setUnit("s")
                .build();

        meter.gaugeBuilder("maestro.agent.running")
                .setDescription("Number of agents currently running")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(runningAgents.get()));

        logger.debug("AgentPoolMetrics initialized");
    }

    /**
     * Metrics bound to the globally registered OpenTelemetry instance.
     */
    public static AgentPoolMetrics global() {
        return new AgentPoolMetrics(GlobalOpenTelemetry.getMeter(METER_NAME));
    }

    public void recordStarted(String agentName) {
        executionsTotal.add(1, agentAttributes(agentName));
        runningAgents.incrementAndGet();
    }

    public void recordSucceeded(String agentName, double durationSeconds) {
        runningAgents.decrementAndGet();
        Attributes attrs = agentAttributes(agentName);
        executionsSucceeded.add(1, attrs);
        duration.record(durationSeconds, attrs);
    }

    public void recordFailed(String agentName, double durationSeconds, Throwable error) {
        runningAgents.decrementAndGet();
        Attributes attrs = Attributes.builder()
                .put(AGENT_NAME_KEY, agentName)
                .put(FAILURE_TYPE_KEY, error != null ? error.getClass().getSimpleName() : "unknown")
                .build();
        executionsFailed.add(1, attrs);
        duration.record(durationSeconds, agentAttributes(agentName));
    }

    public void recordRejected(String agentName, RejectionReason reason) {
        Attributes attrs = Attributes.builder()
                .put(AGENT_NAME_KEY, agentName)
                .put(REJECTION_REASON_KEY, reason.getCode())
                .build();
        executionsRejected.add(1, attrs);
    }

    public void recordRetry(String agentName) {
        retries.add(1, agentAttributes(agentName));
    }

    public long getRunningAgents() {
        return runningAgents.get();
    }

    private static Attributes agentAttributes(String agentName) {
        return Attributes.of(AGENT_NAME_KEY, agentName);
    }
}
