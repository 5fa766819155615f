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

package dev.mars.maestro.workflow.observability;

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
 * OpenTelemetry metrics for orchestration runs.
 *
 * Provides 6 orchestration metrics:
 * - maestro.orchestration.active (gauge) - Runs currently in progress
 * - maestro.orchestration.total (counter) - Runs started
 * - maestro.orchestration.completed (counter) - Runs in which every planned agent succeeded
 * - maestro.orchestration.failed (counter) - Runs aborted or with at least one unsuccessful agent
 * - maestro.orchestration.agents.skipped (counter) - Agents skipped because a dependency did not succeed
 * - maestro.orchestration.duration.seconds (histogram) - Run duration distribution
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-26
 * @version 1.0 (OpenTelemetry)
 */
public class OrchestrationMetrics {

    private static final Logger logger = LoggerFactory.getLogger(OrchestrationMetrics.class);
    private static final String METER_NAME = "maestro-workflow";

    private static final AttributeKey<String> RUN_MODE_KEY = AttributeKey.stringKey("run.mode");
    private static final AttributeKey<String> FAILURE_REASON_KEY = AttributeKey.stringKey("failure.reason");

    // Counters
    private final LongCounter runsTotal;
    private final LongCounter runsCompleted;
    private final LongCounter runsFailed;
    private final LongCounter agentsSkipped;

    // Histograms
    private final DoubleHistogram runDuration;

    // Gauges (backed by AtomicLong)
    private final AtomicLong activeRuns = new AtomicLong(0);

    public OrchestrationMetrics(Meter meter) {
        Objects.requireNonNull(meter, "Meter cannot be null");

        runsTotal = meter.counterBuilder("maestro.orchestration.total")
                .setDescription("Total number of orchestration runs started")
                .setUnit("1")
                .build();

        runsCompleted = meter.counterBuilder("maestro.orchestration.completed")
                .setDescription("Number of orchestration runs in which every agent succeeded")
                .setUnit("1")
                .build();

        runsFailed = meter.counterBuilder("maestro.orchestration.failed")
                .setDescription("Number of orchestration runs that failed or were aborted")
                .setUnit("1")
                .build();

        agentsSkipped = meter.counterBuilder("maestro.orchestration.agents.skipped")
                .setDescription("Number of agents skipped because a dependency did not succeed")
                .setUnit("1")
                .build();

        runDuration = meter.histogramBuilder("maestro.orchestration.duration.seconds")
                .setDescription("Orchestration run duration in seconds")
                .setUnit("s")
                .build();

        meter.gaugeBuilder("maestro.orchestration.active")
                .setDescription("Number of orchestration runs in progress")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(activeRuns.get()));

        logger.debug("OrchestrationMetrics initialized");
    }

    /**
     * Metrics bound to the globally registered OpenTelemetry instance.
     */
    public static OrchestrationMetrics global() {
        return new OrchestrationMetrics(GlobalOpenTelemetry.getMeter(METER_NAME));
    }

    /**
     * Record a run started. {@code runMode} is "full" or "incremental".
     */
    public void recordRunStarted(String runMode) {
        runsTotal.add(1, Attributes.of(RUN_MODE_KEY, runMode));
        activeRuns.incrementAndGet();
    }

    public void recordRunCompleted(String runMode, double durationSeconds) {
        activeRuns.decrementAndGet();
        Attributes attrs = Attributes.of(RUN_MODE_KEY, runMode);
        runsCompleted.add(1, attrs);
        runDuration.record(durationSeconds, attrs);
    }

    public void recordRunFailed(String runMode, double durationSeconds, String failureReason) {
        activeRuns.decrementAndGet();
        Attributes attrs = Attributes.builder()
                .put(RUN_MODE_KEY, runMode)
                .put(FAILURE_REASON_KEY, failureReason != null ? failureReason : "unknown")
                .build();
        runsFailed.add(1, attrs);
        runDuration.record(durationSeconds, Attributes.of(RUN_MODE_KEY, runMode));
    }

    public void recordAgentsSkipped(String runMode, int count) {
        if (count > 0) {
            agentsSkipped.add(count, Attributes.of(RUN_MODE_KEY, runMode));
        }
    }

    public long getActiveRuns() {
        return activeRuns.get();
    }
}
