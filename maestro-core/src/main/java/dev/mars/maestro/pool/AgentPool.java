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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Registry and execution gate for agents.
 * <p>
 * The pool owns every agent's runtime state, decides whether an agent may run
 * (registration, mutual exclusion, cooldown, rate limit, circular update
 * detection), runs the agent's operation under a timeout with a bounded number
 * of retries and keeps a capped log of completed invocations.
 * <p>
 * All agent state and the execution history are guarded by the pool monitor.
 * Operations run on a cached pool of daemon worker threads; retry waits are
 * scheduled rather than slept.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-26
 * @version 1.0
 */
public class AgentPool {

    private static final Logger logger = LoggerFactory.getLogger(AgentPool.class);

    private final PoolSettings settings;
    private final Clock clock;
    private final AgentPoolMetrics metrics;
    private final Map<String, AgentRecord> agents = new LinkedHashMap<>();
    private final Deque<ExecutionRecord> history = new ArrayDeque<>();
    private final ExecutorService workerExecutor;
    private final ScheduledExecutorService retryScheduler;
    private final AtomicBoolean shutdown = new AtomicBoolean(false);
    private final Set<PendingRetry<?>> pendingRetries = ConcurrentHashMap.newKeySet();

    public AgentPool() {
        this(PoolSettings.defaults());
    }

    public AgentPool(PoolSettings settings) {
        this(settings, Clock.systemUTC());
    }

    public AgentPool(PoolSettings settings, Clock clock) {
        this(settings, clock, AgentPoolMetrics.global());
    }

    public AgentPool(PoolSettings settings, Clock clock, AgentPoolMetrics metrics) {
        this.settings = Objects.requireNonNull(settings, "Pool settings cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "Metrics cannot be null");
        this.workerExecutor = Executors.newCachedThreadPool(daemonThreadFactory("maestro-agent-"));
        this.retryScheduler = Executors.newSingleThreadScheduledExecutor(daemonThreadFactory("maestro-retry-"));

        logger.info("AgentPool initialized with {}", settings);
    }

    public PoolSettings getSettings() {
        return settings;
    }

    /**
     * Registers an agent with the pool defaults.
     *
     * @see #registerAgent(String, AgentConfigOverride)
     */
    public AgentSnapshot registerAgent(String name) {
        return registerAgent(name, AgentConfigOverride.none());
    }

    /**
     * Registers a new agent, or merges the given overrides into the
     * configuration of an existing one. Re-registration never resets the
     * agent's status or counters.
     */
    public synchronized AgentSnapshot registerAgent(String name, AgentConfigOverride override) {
        requireName(name);
        Objects.requireNonNull(override, "Config override cannot be null");

        AgentRecord existing = agents.get(name);
        if (existing != null) {
            existing.setConfig(existing.getConfig().merge(override));
            logger.warn("Agent {} already registered, updated config to {}", name, existing.getConfig());
            return existing.snapshot();
        }

        AgentRecord record = new AgentRecord(name, settings.getDefaultAgentConfig().merge(override));
        agents.put(name, record);
        logger.info("Registered agent {} with {}", name, record.getConfig());
        return record.snapshot();
    }

    /**
     * Removes an agent together with its execution history. An invocation
     * already in flight still completes its future but leaves no record.
     *
     * @return true if the agent was registered
     */
    public synchronized boolean unregisterAgent(String name) {
        AgentRecord removed = agents.remove(name);
        if (removed == null) {
            return false;
        }
        history.removeIf(record -> record.getAgent().equals(name));
        logger.info("Unregistered agent {}", name);
        return true;
    }

    public synchronized Optional<AgentSnapshot> getAgent(String name) {
        AgentRecord record = agents.get(name);
        return record == null ? Optional.empty() : Optional.of(record.snapshot());
    }

    public synchronized List<String> getRegisteredAgents() {
        return new ArrayList<>(agents.keySet());
    }

    /**
     * Decides whether the agent may start now. Checks run in a fixed order and
     * the first failing check determines the reason.
     */
    public synchronized ExecutionDecision canExecute(String name) {
        AgentRecord record = agents.get(name);
        if (record == null) {
            return ExecutionDecision.rejected(RejectionReason.NOT_REGISTERED);
        }
        if (record.getStatus() == AgentStatus.RUNNING) {
            return ExecutionDecision.rejected(RejectionReason.ALREADY_RUNNING);
        }

        Instant now = clock.instant();
        long remaining = cooldownRemainingMs(record, now);
        if (remaining > 0) {
            return ExecutionDecision.rejected(RejectionReason.COOLDOWN, remaining);
        }
        if (countRecent(name, settings.getRateLimitWindowMs(), now) >= settings.getRateLimitMax()) {
            return ExecutionDecision.rejected(RejectionReason.RATE_LIMITED);
        }
        if (countRecent(name, settings.getCircularUpdateWindowMs(), now) >= settings.getCircularUpdateThreshold()) {
            logger.warn("Circular update detected for agent {}", name);
            return ExecutionDecision.rejected(RejectionReason.CIRCULAR_UPDATE);
        }
        return ExecutionDecision.allowed();
    }

    public synchronized boolean isInCooldown(String name) {
        AgentRecord record = agents.get(name);
        return record != null && cooldownRemainingMs(record, clock.instant()) > 0;
    }

    public synchronized boolean isRateLimited(String name) {
        return countRecent(name, settings.getRateLimitWindowMs(), clock.instant()) >= settings.getRateLimitMax();
    }

    public synchronized boolean hasCircularUpdate(String name) {
        return countRecent(name, settings.getCircularUpdateWindowMs(), clock.instant())
                >= settings.getCircularUpdateThreshold();
    }

    /**
     * Runs an agent's operation under the pool's rules.
     * <p>
     * Admission is decided synchronously: a refused invocation throws and
     * changes nothing. An admitted invocation marks the agent RUNNING and
     * returns a future that completes with the operation's result, or
     * exceptionally with the last attempt's error once the retries are used
     * up. An attempt exceeding the agent's timeout fails with
     * {@link AgentTimeoutException}; the operation itself is not interrupted.
     *
     * @throws AgentRejectedException if {@link #canExecute(String)} refuses
     */
    public <T> CompletableFuture<T> executeAgent(String name, AgentOperation<T> operation)
            throws AgentRejectedException {
        Objects.requireNonNull(operation, "Operation cannot be null");
        if (shutdown.get()) {
            throw new IllegalStateException("Agent pool is shutdown");
        }

        AgentRecord record;
        Instant startTime;
        synchronized (this) {
            ExecutionDecision decision = canExecute(name);
            if (!decision.isAllowed()) {
                RejectionReason reason = decision.getReason().orElseThrow();
                metrics.recordRejected(name, reason);
                logger.warn("Agent {} cannot execute: {}", name, reason);
                throw new AgentRejectedException(name, reason, decision.getRemainingMs());
            }
            record = agents.get(name);
            record.markRunning();
            startTime = clock.instant();
        }

        metrics.recordStarted(name);
        logger.info("Executing agent {}", name);

        CompletableFuture<T> result = new CompletableFuture<>();
        attempt(record, operation, startTime, result);
        return result;
    }

    /**
     * Returns the agent to IDLE, clears its retry count and forgets its last
     * execution time so that no cooldown applies. Counters are kept.
     *
     * @return true if the agent is registered
     */
    public synchronized boolean resetAgent(String name) {
        AgentRecord record = agents.get(name);
        if (record == null) {
            return false;
        }
        record.reset();
        logger.info("Reset agent {}", name);
        return true;
    }

    public synchronized Optional<AgentStats> getAgentStats(String name) {
        AgentRecord record = agents.get(name);
        if (record == null) {
            return Optional.empty();
        }
        return Optional.of(buildStats(record, clock.instant()));
    }

    public synchronized PoolStats getPoolStats() {
        Instant now = clock.instant();
        Map<String, AgentStats> stats = new LinkedHashMap<>();
        for (AgentRecord record : agents.values()) {
            stats.put(record.getName(), buildStats(record, now));
        }
        return new PoolStats(stats, history.size());
    }

    /**
     * Retained execution records, oldest first.
     */
    public synchronized List<ExecutionRecord> getExecutionHistory() {
        return new ArrayList<>(history);
    }

    public synchronized List<ExecutionRecord> getExecutionHistory(String name) {
        List<ExecutionRecord> records = new ArrayList<>();
        for (ExecutionRecord record : history) {
            if (record.getAgent().equals(name)) {
                records.add(record);
            }
        }
        return records;
    }

    public synchronized void clearAgentHistory(String name) {
        history.removeIf(record -> record.getAgent().equals(name));
        logger.info("Cleared execution history for agent {}", name);
    }

    public synchronized void clearAllHistory() {
        history.clear();
        logger.info("Cleared all execution history");
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    public boolean shutdown() {
        return shutdown(5);
    }

    /**
     * Stops accepting invocations and shuts down the worker threads.
     *
     * @return true if all worker threads finished within the timeout
     */
    public boolean shutdown(long timeoutSeconds) {
        if (shutdown.getAndSet(true)) {
            return true;
        }

        logger.info("Shutting down agent pool...");
        retryScheduler.shutdownNow();
        abandonPendingRetries();
        workerExecutor.shutdown();

        try {
            boolean terminated = workerExecutor.awaitTermination(timeoutSeconds, TimeUnit.SECONDS);
            if (!terminated) {
                logger.warn("Agent pool shutdown timed out, forcing shutdown");
                workerExecutor.shutdownNow();
            } else {
                logger.info("Agent pool shutdown completed");
            }
            return terminated;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workerExecutor.shutdownNow();
            return false;
        }
    }

    private <T> void attempt(AgentRecord record, AgentOperation<T> operation, Instant startTime,
                             CompletableFuture<T> result) {
        long timeoutMs;
        synchronized (this) {
            timeoutMs = record.getConfig().getTimeoutMs();
        }

        CompletableFuture<T> attemptFuture;
        try {
            attemptFuture = CompletableFuture.supplyAsync(() -> invoke(operation), workerExecutor);
        } catch (RejectedExecutionException e) {
            completeFailure(record, startTime, result, e);
            return;
        }

        attemptFuture
                .orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .whenComplete((value, error) -> {
                    if (error == null) {
                        completeSuccess(record, startTime, result, value);
                    } else {
                        handleFailure(record, operation, startTime, result, unwrap(error, record.getName(), timeoutMs));
                    }
                });
    }

    private <T> void handleFailure(AgentRecord record, AgentOperation<T> operation, Instant startTime,
                                   CompletableFuture<T> result, Throwable error) {
        int attemptNumber;
        long cooldownMs;
        synchronized (this) {
            if (shutdown.get() || record.getRetryCount() >= record.getConfig().getMaxRetries()) {
                attemptNumber = -1;
                cooldownMs = 0;
            } else {
                attemptNumber = record.incrementRetryCount();
                cooldownMs = record.getConfig().getCooldownMs();
            }
        }

        if (attemptNumber < 0) {
            completeFailure(record, startTime, result, error);
            return;
        }

        metrics.recordRetry(record.getName());
        logger.warn("Agent {} failed, retrying ({}/{}): {}",
                record.getName(), attemptNumber, record.getConfig().getMaxRetries(), error.getMessage());

        if (cooldownMs <= 0) {
            attempt(record, operation, startTime, result);
            return;
        }

        PendingRetry<T> retry = new PendingRetry<>(record, operation, startTime, result, error);
        pendingRetries.add(retry);
        try {
            retryScheduler.schedule(retry, cooldownMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            if (pendingRetries.remove(retry)) {
                retry.abandon();
            }
        }
    }

    // Retries still waiting out their cooldown fail with the error of their last attempt.
    private void abandonPendingRetries() {
        for (PendingRetry<?> retry : new ArrayList<>(pendingRetries)) {
            if (pendingRetries.remove(retry)) {
                logger.warn("Agent {} retry abandoned by pool shutdown", retry.record.getName());
                retry.abandon();
            }
        }
    }

    private <T> void completeSuccess(AgentRecord record, Instant startTime, CompletableFuture<T> result, T value) {
        Instant completedAt = clock.instant();
        Duration duration = elapsed(startTime, completedAt);
        synchronized (this) {
            record.recordSuccess(completedAt, duration);
            if (agents.get(record.getName()) == record) {
                appendHistory(ExecutionRecord.success(record.getName(), startTime, duration));
            }
        }

        metrics.recordSucceeded(record.getName(), duration.toMillis() / 1000.0);
        logger.info("Agent {} completed successfully in {}ms", record.getName(), duration.toMillis());
        result.complete(value);
    }

    private <T> void completeFailure(AgentRecord record, Instant startTime, CompletableFuture<T> result,
                                     Throwable error) {
        Instant completedAt = clock.instant();
        Duration duration = elapsed(startTime, completedAt);
        synchronized (this) {
            record.recordFailure(completedAt, duration);
            if (agents.get(record.getName()) == record) {
                appendHistory(ExecutionRecord.failure(record.getName(), startTime, duration, describe(error)));
            }
        }

        metrics.recordFailed(record.getName(), duration.toMillis() / 1000.0, error);
        logger.error("Agent {} failed permanently after {}ms: {}", record.getName(), duration.toMillis(),
                describe(error));
        result.completeExceptionally(error);
    }

    // Caller holds the monitor.
    private void appendHistory(ExecutionRecord record) {
        history.addLast(record);
        while (history.size() > settings.getMaxHistorySize()) {
            history.removeFirst();
        }
    }

    private AgentStats buildStats(AgentRecord record, Instant now) {
        long totalMillis = 0;
        int count = 0;
        for (ExecutionRecord execution : history) {
            if (execution.getAgent().equals(record.getName())) {
                totalMillis += execution.getDuration().toMillis();
                count++;
            }
        }
        Duration average = count > 0 ? Duration.ofMillis(totalMillis / count) : Duration.ZERO;
        return new AgentStats(record.snapshot(), average,
                cooldownRemainingMs(record, now) > 0,
                countRecent(record.getName(), settings.getRateLimitWindowMs(), now) >= settings.getRateLimitMax(),
                countRecent(record.getName(), settings.getRateLimitWindowMs(), now));
    }

    private long cooldownRemainingMs(AgentRecord record, Instant now) {
        Instant last = record.getLastExecutionTime();
        long cooldownMs = record.getConfig().getCooldownMs();
        if (last == null || cooldownMs <= 0) {
            return 0;
        }
        long elapsedMs = Duration.between(last, now).toMillis();
        return elapsedMs < cooldownMs ? cooldownMs - elapsedMs : 0;
    }

    private int countRecent(String name, long windowMs, Instant now) {
        Instant windowStart = now.minusMillis(windowMs);
        int count = 0;
        for (ExecutionRecord record : history) {
            if (record.getAgent().equals(name) && !record.getStartTime().isBefore(windowStart)) {
                count++;
            }
        }
        return count;
    }

    private static <T> T invoke(AgentOperation<T> operation) {
        try {
            return operation.execute();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new CompletionException(e);
        }
    }

    private static Throwable unwrap(Throwable error, String agentName, long timeoutMs) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof TimeoutException) {
            return new AgentTimeoutException(agentName, timeoutMs);
        }
        return cause;
    }

    private static Duration elapsed(Instant start, Instant end) {
        Duration duration = Duration.between(start, end);
        return duration.isNegative() ? Duration.ZERO : duration;
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getName();
    }

    private static void requireName(String name) {
        Objects.requireNonNull(name, "Agent name cannot be null");
        if (name.trim().isEmpty()) {
            throw new IllegalArgumentException("Agent name cannot be empty");
        }
    }

    /**
     * A retry scheduled after a cooldown. Whoever removes it from
     * {@code pendingRetries} first either runs or abandons it.
     */
    private final class PendingRetry<T> implements Runnable {
        private final AgentRecord record;
        private final AgentOperation<T> operation;
        private final Instant startTime;
        private final CompletableFuture<T> result;
        private final Throwable lastError;

        PendingRetry(AgentRecord record, AgentOperation<T> operation, Instant startTime,
                     CompletableFuture<T> result, Throwable lastError) {
            this.record = record;
            this.operation = operation;
            this.startTime = startTime;
            this.result = result;
            this.lastError = lastError;
        }

        @Override
        public void run() {
            if (pendingRetries.remove(this)) {
                attempt(record, operation, startTime, result);
            }
        }

        void abandon() {
            completeFailure(record, startTime, result, lastError);
        }
    }

    private static ThreadFactory daemonThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
