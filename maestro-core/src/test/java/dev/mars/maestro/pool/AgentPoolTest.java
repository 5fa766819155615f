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

package dev.mars.maestro.pool;

import dev.mars.maestro.agent.AgentConfig;
import dev.mars.maestro.agent.AgentConfigOverride;
import dev.mars.maestro.agent.AgentOperation;
import dev.mars.maestro.agent.AgentStatus;
import dev.mars.maestro.agent.RejectionReason;
import dev.mars.maestro.core.exceptions.AgentRejectedException;
import dev.mars.maestro.core.exceptions.AgentTimeoutException;
import dev.mars.maestro.pool.observability.AgentPoolMetrics;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.*;

import java.io.IOException;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link AgentPool}.
 */
@DisplayName("AgentPool Tests")
class AgentPoolTest {

    private MutableClock clock;
    private AgentPool pool;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        pool = newPool(PoolSettings.defaults());
    }

    @AfterEach
    void tearDown() {
        pool.shutdown(1);
    }

    private AgentPool newPool(PoolSettings settings) {
        return new AgentPool(settings, clock, new AgentPoolMetrics(OpenTelemetry.noop().getMeter("test")));
    }

    private void replacePool(PoolSettings settings) {
        pool.shutdown(1);
        pool = newPool(settings);
    }

    private static <T> T resultOf(CompletableFuture<T> future) throws Exception {
        return future.get(5, TimeUnit.SECONDS);
    }

    private static Throwable failureOf(CompletableFuture<?> future) {
        Throwable thrown = catchThrowable(() -> future.get(5, TimeUnit.SECONDS));
        assertThat(thrown).isInstanceOf(ExecutionException.class);
        return thrown.getCause();
    }

    // ==================== Registration ====================

    @Nested
    @DisplayName("Registration")
    class RegistrationTests {

        @Test
        @DisplayName("Should register agent with pool defaults")
        void testRegisterWithDefaults() {
            AgentSnapshot snapshot = pool.registerAgent("document-agent");

            assertThat(snapshot.getName()).isEqualTo("document-agent");
            assertThat(snapshot.getStatus()).isEqualTo(AgentStatus.IDLE);
            assertThat(snapshot.getConfig()).isEqualTo(new AgentConfig(30000, 3, 0));
            assertThat(snapshot.getTotalExecutions()).isZero();
            assertThat(snapshot.getRetryCount()).isZero();
            assertThat(snapshot.getLastExecutionTime()).isEmpty();
            assertThat(pool.getRegisteredAgents()).containsExactly("document-agent");
        }

        @Test
        @DisplayName("Should apply config overrides at registration")
        void testRegisterWithOverrides() {
            AgentSnapshot snapshot = pool.registerAgent("backend-agent",
                    AgentConfigOverride.builder().timeoutMs(1000).cooldownMs(500).build());

            assertThat(snapshot.getConfig().getTimeoutMs()).isEqualTo(1000);
            assertThat(snapshot.getConfig().getMaxRetries()).isEqualTo(3);
            assertThat(snapshot.getConfig().getCooldownMs()).isEqualTo(500);
        }

        @Test
        @DisplayName("Should merge config on re-registration without touching counters")
        void testReRegistrationMerges() throws Exception {
            pool.registerAgent("agent", AgentConfigOverride.builder().timeoutMs(1000).build());
            resultOf(pool.executeAgent("agent", () -> "done"));

            AgentSnapshot snapshot = pool.registerAgent("agent",
                    AgentConfigOverride.builder().maxRetries(1).build());

            assertThat(snapshot.getConfig()).isEqualTo(new AgentConfig(1000, 1, 0));
            assertThat(snapshot.getTotalExecutions()).isEqualTo(1);
            assertThat(snapshot.getSuccessfulExecutions()).isEqualTo(1);
            assertThat(snapshot.getStatus()).isEqualTo(AgentStatus.IDLE);
            assertThat(pool.getRegisteredAgents()).hasSize(1);
        }

        @Test
        @DisplayName("Should reject blank agent names")
        void testRejectBlankNames() {
            assertThatThrownBy(() -> pool.registerAgent(null))
                .isInstanceOf(NullPointerException.class);
            assertThatThrownBy(() -> pool.registerAgent("  "))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Should unregister agent and purge its history")
        void testUnregisterPurgesHistory() throws Exception {
            pool.registerAgent("a");
            pool.registerAgent("b");
            resultOf(pool.executeAgent("a", () -> 1));
            resultOf(pool.executeAgent("b", () -> 2));

            assertThat(pool.unregisterAgent("a")).isTrue();

            assertThat(pool.getAgent("a")).isEmpty();
            assertThat(pool.getExecutionHistory())
                .extracting(ExecutionRecord::getAgent)
                .containsExactly("b");
            assertThat(pool.unregisterAgent("a")).isFalse();
        }
    }

    // ==================== Admission ====================

    @Nested
    @DisplayName("Admission")
    class AdmissionTests {

        @Test
        @DisplayName("Should reject unregistered agent with no side effects")
        void testRejectUnregistered() {
            @SuppressWarnings("unchecked")
            AgentOperation<String> operation = mock(AgentOperation.class);

            assertThat(pool.canExecute("ghost").getReason()).contains(RejectionReason.NOT_REGISTERED);
            assertThatThrownBy(() -> pool.executeAgent("ghost", operation))
                .isInstanceOf(AgentRejectedException.class)
                .hasMessageContaining("not_registered")
                .satisfies(e -> assertThat(((AgentRejectedException) e).getReason())
                        .isEqualTo(RejectionReason.NOT_REGISTERED));

            verifyNoInteractions(operation);
            assertThat(pool.getRegisteredAgents()).isEmpty();
            assertThat(pool.getExecutionHistory()).isEmpty();
        }

        @Test
        @DisplayName("Should reject agent that is already running, then apply cooldown")
        void testAlreadyRunningThenCooldown() throws Exception {
            pool.registerAgent("agent", AgentConfigOverride.builder().cooldownMs(10000).build());
            CountDownLatch release = new CountDownLatch(1);

            CompletableFuture<String> running = pool.executeAgent("agent", () -> {
                release.await();
                return "done";
            });

            assertThat(pool.getAgent("agent")).get()
                .extracting(AgentSnapshot::getStatus).isEqualTo(AgentStatus.RUNNING);
            assertThatThrownBy(() -> pool.executeAgent("agent", () -> "again"))
                .isInstanceOf(AgentRejectedException.class)
                .hasMessageContaining("already_running");

            release.countDown();
            assertThat(resultOf(running)).isEqualTo("done");

            ExecutionDecision decision = pool.canExecute("agent");
            assertThat(decision.isAllowed()).isFalse();
            assertThat(decision.getReason()).contains(RejectionReason.COOLDOWN);
            assertThat(decision.getRemainingMs()).isEqualTo(10000);
            assertThat(pool.isInCooldown("agent")).isTrue();

            clock.advanceMillis(4000);
            assertThat(pool.canExecute("agent").getRemainingMs()).isEqualTo(6000);

            clock.advanceMillis(6000);
            assertThat(pool.canExecute("agent").isAllowed()).isTrue();
            assertThat(pool.isInCooldown("agent")).isFalse();
        }

        @Test
        @DisplayName("Should admit exactly one of many concurrent invocations")
        void testAtomicAdmission() throws Exception {
            pool.registerAgent("agent");
            CountDownLatch release = new CountDownLatch(1);
            CountDownLatch start = new CountDownLatch(1);
            AtomicInteger admitted = new AtomicInteger();
            AtomicInteger rejected = new AtomicInteger();
            ExecutorService callers = Executors.newFixedThreadPool(8);

            try {
                List<Future<?>> calls = new ArrayList<>();
                for (int i = 0; i < 8; i++) {
                    calls.add(callers.submit(() -> {
                        start.await();
                        try {
                            pool.executeAgent("agent", () -> {
                                release.await();
                                return null;
                            });
                            admitted.incrementAndGet();
                        } catch (AgentRejectedException e) {
                            rejected.incrementAndGet();
                        }
                        return null;
                    }));
                }
                start.countDown();
                for (Future<?> call : calls) {
                    call.get(5, TimeUnit.SECONDS);
                }
            } finally {
                release.countDown();
                callers.shutdownNow();
            }

            assertThat(admitted.get()).isEqualTo(1);
            assertThat(rejected.get()).isEqualTo(7);
        }

        @Test
        @DisplayName("Should rate limit within the trailing window")
        void testRateLimit() throws Exception {
            replacePool(PoolSettings.builder().rateLimit(2, 60000).circularUpdate(100, 300000).build());
            pool.registerAgent("agent");

            resultOf(pool.executeAgent("agent", () -> 1));
            resultOf(pool.executeAgent("agent", () -> 2));

            assertThat(pool.canExecute("agent").getReason()).contains(RejectionReason.RATE_LIMITED);
            assertThat(pool.isRateLimited("agent")).isTrue();
            assertThatThrownBy(() -> pool.executeAgent("agent", () -> 3))
                .isInstanceOf(AgentRejectedException.class)
                .hasMessageContaining("rate_limited");

            // a record starting exactly at the window edge still counts
            clock.advanceMillis(60000);
            assertThat(pool.isRateLimited("agent")).isTrue();

            clock.advanceMillis(1);
            assertThat(pool.canExecute("agent").isAllowed()).isTrue();
        }

        @Test
        @DisplayName("Should detect circular updates")
        void testCircularUpdate() throws Exception {
            replacePool(PoolSettings.builder().rateLimit(100, 60000).circularUpdate(3, 300000).build());
            pool.registerAgent("agent");

            for (int i = 0; i < 3; i++) {
                resultOf(pool.executeAgent("agent", () -> "ok"));
                clock.advanceMillis(1000);
            }

            assertThat(pool.hasCircularUpdate("agent")).isTrue();
            assertThat(pool.canExecute("agent").getReason()).contains(RejectionReason.CIRCULAR_UPDATE);

            clock.advanceMillis(300000);
            assertThat(pool.hasCircularUpdate("agent")).isFalse();
            assertThat(pool.canExecute("agent").isAllowed()).isTrue();
        }

        @Test
        @DisplayName("Should report rate limit ahead of circular update")
        void testRejectionPriority() throws Exception {
            replacePool(PoolSettings.builder().rateLimit(2, 60000).circularUpdate(2, 300000).build());
            pool.registerAgent("agent");
            resultOf(pool.executeAgent("agent", () -> 1));
            resultOf(pool.executeAgent("agent", () -> 2));

            assertThat(pool.canExecute("agent").getReason()).contains(RejectionReason.RATE_LIMITED);
        }

        @Test
        @DisplayName("Should allow a failed agent to run again")
        void testFailedAgentMayRunAgain() throws Exception {
            pool.registerAgent("agent", AgentConfigOverride.builder().maxRetries(0).build());
            failureOf(pool.executeAgent("agent", () -> {
                throw new IOException("boom");
            }));

            assertThat(pool.getAgent("agent")).get()
                .extracting(AgentSnapshot::getStatus).isEqualTo(AgentStatus.FAILED);
            assertThat(pool.canExecute("agent").isAllowed()).isTrue();
        }
    }

    // ==================== Execution ====================

    @Nested
    @DisplayName("Execution")
    class ExecutionTests {

        @Test
        @DisplayName("Should complete successfully and return to IDLE")
        void testSuccessfulExecution() throws Exception {
            pool.registerAgent("agent");

            String result = resultOf(pool.executeAgent("agent", () -> "result"));

            assertThat(result).isEqualTo("result");
            AgentSnapshot snapshot = pool.getAgent("agent").orElseThrow();
            assertThat(snapshot.getStatus()).isEqualTo(AgentStatus.IDLE);
            assertThat(snapshot.getTotalExecutions()).isEqualTo(1);
            assertThat(snapshot.getSuccessfulExecutions()).isEqualTo(1);
            assertThat(snapshot.getRetryCount()).isZero();
            assertThat(snapshot.getLastExecutionTime()).contains(clock.instant());

            assertThat(pool.getExecutionHistory()).singleElement()
                .satisfies(record -> {
                    assertThat(record.getAgent()).isEqualTo("agent");
                    assertThat(record.isSuccess()).isTrue();
                    assertThat(record.getError()).isEmpty();
                });
        }

        @Test
        @DisplayName("Should exhaust retries and fail with the original error")
        void testRetriesExhausted() throws Exception {
            pool.registerAgent("agent");
            AtomicInteger calls = new AtomicInteger();
            IOException boom = new IOException("boom");

            Throwable failure = failureOf(pool.executeAgent("agent", () -> {
                calls.incrementAndGet();
                throw boom;
            }));

            assertThat(failure).isSameAs(boom);
            assertThat(calls.get()).isEqualTo(4);

            AgentSnapshot snapshot = pool.getAgent("agent").orElseThrow();
            assertThat(snapshot.getStatus()).isEqualTo(AgentStatus.FAILED);
            assertThat(snapshot.getTotalExecutions()).isEqualTo(1);
            assertThat(snapshot.getFailedExecutions()).isEqualTo(1);
            assertThat(snapshot.getSuccessfulExecutions()).isZero();
            assertThat(snapshot.getRetryCount()).isZero();
            assertThat(pool.getExecutionHistory()).singleElement()
                .satisfies(record -> {
                    assertThat(record.isSuccess()).isFalse();
                    assertThat(record.getError()).contains("boom");
                });
        }

        @Test
        @DisplayName("Should succeed after two failures")
        void testThrowTwiceThenSucceed() throws Exception {
            pool.registerAgent("x", AgentConfigOverride.builder().maxRetries(2).build());
            AtomicInteger calls = new AtomicInteger();

            String result = resultOf(pool.executeAgent("x", () -> {
                if (calls.incrementAndGet() <= 2) {
                    throw new IllegalStateException("not yet");
                }
                return "finally";
            }));

            assertThat(result).isEqualTo("finally");
            assertThat(calls.get()).isEqualTo(3);
            AgentSnapshot snapshot = pool.getAgent("x").orElseThrow();
            assertThat(snapshot.getTotalExecutions()).isEqualTo(1);
            assertThat(snapshot.getSuccessfulExecutions()).isEqualTo(1);
            assertThat(snapshot.getFailedExecutions()).isZero();
            assertThat(snapshot.getRetryCount()).isZero();
            assertThat(snapshot.getStatus()).isEqualTo(AgentStatus.IDLE);
        }

        @Test
        @DisplayName("Should fail an attempt that exceeds the timeout")
        void testTimeout() {
            pool.registerAgent("slow", AgentConfigOverride.builder().timeoutMs(50).maxRetries(0).build());
            CountDownLatch release = new CountDownLatch(1);

            CompletableFuture<String> future;
            try {
                future = pool.executeAgent("slow", () -> {
                    release.await(2, TimeUnit.SECONDS);
                    return "late";
                });
            } catch (AgentRejectedException e) {
                throw new AssertionError(e);
            }

            Throwable failure = failureOf(future);
            release.countDown();

            assertThat(failure)
                .isInstanceOf(AgentTimeoutException.class)
                .hasMessage("Agent slow timed out after 50ms");
            assertThat(pool.getAgent("slow").orElseThrow().getStatus()).isEqualTo(AgentStatus.FAILED);
        }

        @Test
        @DisplayName("Should retry timed out attempts")
        void testTimeoutIsRetried() throws Exception {
            pool.registerAgent("flaky", AgentConfigOverride.builder().timeoutMs(50).maxRetries(1).build());
            AtomicInteger calls = new AtomicInteger();

            String result = resultOf(pool.executeAgent("flaky", () -> {
                if (calls.incrementAndGet() == 1) {
                    Thread.sleep(500);
                }
                return "second";
            }));

            assertThat(result).isEqualTo("second");
            assertThat(pool.getAgent("flaky").orElseThrow().getSuccessfulExecutions()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should wait the cooldown between retries")
        void testRetryWaitsCooldown() {
            pool.registerAgent("agent", AgentConfigOverride.builder().maxRetries(2).cooldownMs(100).build());
            List<Long> attemptTimes = Collections.synchronizedList(new ArrayList<>());

            long started = System.nanoTime();
            CompletableFuture<Object> future;
            try {
                future = pool.executeAgent("agent", () -> {
                    attemptTimes.add(System.nanoTime());
                    throw new IllegalStateException("fail");
                });
            } catch (AgentRejectedException e) {
                throw new AssertionError(e);
            }

            failureOf(future);
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

            assertThat(attemptTimes).hasSize(3);
            assertThat(elapsedMs).isGreaterThanOrEqualTo(200);
        }

        @Test
        @DisplayName("Should stay RUNNING across retries")
        void testRunningDuringRetries() throws Exception {
            pool.registerAgent("agent", AgentConfigOverride.builder().maxRetries(1).cooldownMs(300).build());

            CompletableFuture<Object> future = pool.executeAgent("agent", () -> {
                throw new IllegalStateException("fail");
            });

            await().atMost(2, TimeUnit.SECONDS)
                .until(() -> pool.getAgent("agent").orElseThrow().getRetryCount() == 1);
            assertThat(pool.getAgent("agent").orElseThrow().getStatus()).isEqualTo(AgentStatus.RUNNING);

            failureOf(future);
            assertThat(pool.getAgent("agent").orElseThrow().getRetryCount()).isZero();
        }

        @Test
        @DisplayName("Should fail an invocation waiting to retry when the pool shuts down")
        void testShutdownDuringRetryWait() throws Exception {
            pool.registerAgent("agent", AgentConfigOverride.builder().maxRetries(1).cooldownMs(1000).build());
            AtomicInteger calls = new AtomicInteger();
            IOException failure = new IOException("boom");

            CompletableFuture<Integer> future = pool.executeAgent("agent", () -> {
                calls.incrementAndGet();
                throw failure;
            });
            await().atMost(Duration.ofSeconds(5))
                .until(() -> pool.getAgent("agent").orElseThrow().getRetryCount() == 1);

            pool.shutdown(1);

            assertThat(failureOf(future)).isSameAs(failure);
            assertThat(calls).hasValue(1);
            AgentSnapshot snapshot = pool.getAgent("agent").orElseThrow();
            assertThat(snapshot.getStatus()).isEqualTo(AgentStatus.FAILED);
            assertThat(snapshot.getFailedExecutions()).isEqualTo(1);
            assertThat(snapshot.getRetryCount()).isZero();
            assertThat(pool.getExecutionHistory("agent")).hasSize(1);
        }

        @Test
        @DisplayName("Should refuse invocations after shutdown")
        void testShutdown() {
            pool.registerAgent("agent");
            assertThat(pool.shutdown(1)).isTrue();

            assertThat(pool.isShutdown()).isTrue();
            assertThatThrownBy(() -> pool.executeAgent("agent", () -> 1))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("shutdown");
        }
    }

    // ==================== Reset ====================

    @Nested
    @DisplayName("Reset")
    class ResetTests {

        @Test
        @DisplayName("Should reset status and clear cooldown but keep counters")
        void testResetAgent() throws Exception {
            pool.registerAgent("agent", AgentConfigOverride.builder().maxRetries(0).cooldownMs(60000).build());
            failureOf(pool.executeAgent("agent", () -> {
                throw new IOException("boom");
            }));
            assertThat(pool.isInCooldown("agent")).isTrue();

            assertThat(pool.resetAgent("agent")).isTrue();

            AgentSnapshot snapshot = pool.getAgent("agent").orElseThrow();
            assertThat(snapshot.getStatus()).isEqualTo(AgentStatus.IDLE);
            assertThat(snapshot.getRetryCount()).isZero();
            assertThat(snapshot.getLastExecutionTime()).isEmpty();
            assertThat(snapshot.getFailedExecutions()).isEqualTo(1);
            assertThat(pool.canExecute("agent").isAllowed()).isTrue();
        }

        @Test
        @DisplayName("Should report unknown agent on reset")
        void testResetUnknown() {
            assertThat(pool.resetAgent("ghost")).isFalse();
        }
    }

    // ==================== History ====================

    @Nested
    @DisplayName("History")
    class HistoryTests {

        @Test
        @DisplayName("Should cap history and evict the oldest records first")
        void testHistoryCap() throws Exception {
            replacePool(PoolSettings.builder().maxHistorySize(3).build());
            for (int i = 1; i <= 5; i++) {
                pool.registerAgent("agent-" + i);
                resultOf(pool.executeAgent("agent-" + i, () -> "ok"));
            }

            assertThat(pool.getExecutionHistory())
                .extracting(ExecutionRecord::getAgent)
                .containsExactly("agent-3", "agent-4", "agent-5");
            assertThat(pool.getPoolStats().getHistorySize()).isEqualTo(3);
        }

        @Test
        @DisplayName("Should clear history per agent and globally")
        void testClearHistory() throws Exception {
            pool.registerAgent("a");
            pool.registerAgent("b");
            resultOf(pool.executeAgent("a", () -> 1));
            resultOf(pool.executeAgent("b", () -> 2));

            pool.clearAgentHistory("a");
            assertThat(pool.getExecutionHistory("a")).isEmpty();
            assertThat(pool.getExecutionHistory("b")).hasSize(1);

            pool.clearAllHistory();
            assertThat(pool.getExecutionHistory()).isEmpty();
            assertThat(pool.getAgent("b").orElseThrow().getTotalExecutions()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should lift the rate limit once history is cleared")
        void testClearHistoryLiftsRateLimit() throws Exception {
            replacePool(PoolSettings.builder().rateLimit(1, 60000).build());
            pool.registerAgent("agent");
            resultOf(pool.executeAgent("agent", () -> 1));
            assertThat(pool.isRateLimited("agent")).isTrue();

            pool.clearAgentHistory("agent");

            assertThat(pool.isRateLimited("agent")).isFalse();
        }
    }

    // ==================== Statistics ====================

    @Nested
    @DisplayName("Statistics")
    class StatisticsTests {

        @Test
        @DisplayName("Should report 0.00% for an agent that never ran")
        void testEmptySuccessRate() {
            pool.registerAgent("agent");

            AgentStats stats = pool.getAgentStats("agent").orElseThrow();

            assertThat(stats.getFormattedSuccessRate()).isEqualTo("0.00%");
            assertThat(stats.getAverageDuration()).isEqualTo(Duration.ZERO);
            assertThat(stats.getRecentExecutionCount()).isZero();
        }

        @Test
        @DisplayName("Should compute success rate and average duration")
        void testAgentStats() throws Exception {
            pool.registerAgent("agent", AgentConfigOverride.builder().maxRetries(0).build());

            resultOf(pool.executeAgent("agent", () -> {
                clock.advanceMillis(100);
                return 1;
            }));
            resultOf(pool.executeAgent("agent", () -> {
                clock.advanceMillis(300);
                return 2;
            }));
            failureOf(pool.executeAgent("agent", () -> {
                clock.advanceMillis(200);
                throw new IOException("boom");
            }));

            AgentStats stats = pool.getAgentStats("agent").orElseThrow();
            assertThat(stats.getFormattedSuccessRate()).isEqualTo("66.67%");
            assertThat(stats.getAverageDuration()).isEqualTo(Duration.ofMillis(200));
            assertThat(stats.getLastExecutionDuration()).contains(Duration.ofMillis(200));
            assertThat(stats.getRecentExecutionCount()).isEqualTo(3);
            assertThat(stats.toMap()).containsEntry("successRate", "66.67%");
        }

        @Test
        @DisplayName("Should summarise pool state")
        void testPoolStats() throws Exception {
            pool.registerAgent("ok");
            pool.registerAgent("broken", AgentConfigOverride.builder().maxRetries(0).build());
            pool.registerAgent("idle");
            resultOf(pool.executeAgent("ok", () -> 1));
            failureOf(pool.executeAgent("broken", () -> {
                throw new IOException("boom");
            }));

            PoolStats stats = pool.getPoolStats();

            assertThat(stats.getTotalAgents()).isEqualTo(3);
            assertThat(stats.getIdleAgents()).isEqualTo(2);
            assertThat(stats.getFailedAgents()).isEqualTo(1);
            assertThat(stats.getRunningAgents()).isZero();
            assertThat(stats.getTotalExecutions()).isEqualTo(2);
            assertThat(stats.getAgents()).containsOnlyKeys("ok", "broken", "idle");
            assertThat(stats.getAgent("ok")).get()
                .extracting(AgentStats::getFormattedSuccessRate).isEqualTo("100.00%");
        }

        @Test
        @DisplayName("Should return empty stats for unknown agents")
        void testUnknownAgentStats() {
            assertThat(pool.getAgentStats("ghost")).isEmpty();
            assertThat(pool.getAgent("ghost")).isEmpty();
        }
    }
}
