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

import dev.mars.maestro.pool.AgentPool;
import dev.mars.maestro.pool.PoolSettings;
import dev.mars.maestro.pool.observability.AgentPoolMetrics;
import dev.mars.maestro.workflow.DependencyGraph;
import dev.mars.maestro.workflow.Orchestrator;
import dev.mars.maestro.workflow.OrchestratorSettings;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

@DisplayName("OrchestrationMetrics Tests")
class OrchestrationMetricsTest {

    private InMemoryMetricReader reader;
    private SdkMeterProvider meterProvider;
    private AgentPool pool;
    private Orchestrator orchestrator;

    @BeforeEach
    void setUp() {
        reader = InMemoryMetricReader.create();
        meterProvider = SdkMeterProvider.builder().registerMetricReader(reader).build();
        pool = new AgentPool(PoolSettings.builder().maxRetries(0).build(), Clock.systemUTC(),
                new AgentPoolMetrics(OpenTelemetry.noop().getMeter("test")));
        orchestrator = new Orchestrator(new DependencyGraph(), pool, OrchestratorSettings.defaults(),
                new OrchestrationMetrics(meterProvider.get("maestro-workflow-test")));
    }

    @AfterEach
    void tearDown() {
        orchestrator.shutdown();
        pool.shutdown(1);
        meterProvider.close();
    }

    @Test
    @DisplayName("Should count completed runs")
    void testCompletedRun() throws Exception {
        orchestrator.registerAgent("document-agent", () -> "docs");

        orchestrator.execute().get(5, TimeUnit.SECONDS);

        Collection<MetricData> metrics = reader.collectAllMetrics();
        assertThat(sum(metrics, "maestro.orchestration.total")).isEqualTo(1);
        assertThat(sum(metrics, "maestro.orchestration.completed")).isEqualTo(1);
        assertThat(sum(metrics, "maestro.orchestration.failed")).isZero();
        assertThat(metrics).anyMatch(m -> m.getName().equals("maestro.orchestration.duration.seconds"));
    }

    @Test
    @DisplayName("Should count failed runs and skipped agents")
    void testFailedRun() throws Exception {
        orchestrator.registerAgent("document-agent", () -> {
            throw new IOException("boom");
        });
        orchestrator.registerAgent("backend-agent", () -> "api", List.of("document-agent"));

        orchestrator.execute().get(5, TimeUnit.SECONDS);

        Collection<MetricData> metrics = reader.collectAllMetrics();
        assertThat(sum(metrics, "maestro.orchestration.failed")).isEqualTo(1);
        assertThat(sum(metrics, "maestro.orchestration.agents.skipped")).isEqualTo(1);
        assertThat(sum(metrics, "maestro.orchestration.completed")).isZero();
    }

    @Test
    @DisplayName("Should report no active runs once a run finishes")
    void testActiveGauge() throws Exception {
        orchestrator.execute().get(5, TimeUnit.SECONDS);

        long active = reader.collectAllMetrics().stream()
                .filter(m -> m.getName().equals("maestro.orchestration.active"))
                .flatMap(m -> m.getLongGaugeData().getPoints().stream())
                .mapToLong(LongPointData::getValue)
                .sum();
        assertThat(active).isZero();
    }

    private static long sum(Collection<MetricData> metrics, String name) {
        return metrics.stream()
                .filter(m -> m.getName().equals(name))
                .flatMap(m -> m.getLongSumData().getPoints().stream())
                .mapToLong(LongPointData::getValue)
                .sum();
    }
}
