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

package dev.mars.maestro.workflow;

import dev.mars.maestro.agent.AgentConfigOverride;
import dev.mars.maestro.agent.AgentOperation;
import dev.mars.maestro.core.exceptions.AgentRejectedException;
import dev.mars.maestro.core.exceptions.CircularDependencyException;
import dev.mars.maestro.core.exceptions.MaestroException;
import dev.mars.maestro.core.exceptions.OrchestrationException;
import dev.mars.maestro.core.exceptions.OrchestrationInProgressException;
import dev.mars.maestro.pool.AgentPool;
import dev.mars.maestro.workflow.observability.OrchestrationMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Runs registered agents in dependency order.
 * <p>
 * A run plans the affected agents, then executes them level by level: every
 * agent of a level finishes before the next level starts, and no more than
 * the configured number of agents are in flight at once. Agents execute
 * through the {@link AgentPool}, so pool refusals and failures are recorded
 * per agent instead of aborting the run. Only one run may be in progress.
 * <p>
 * The orchestrator does not own the pool; {@link #shutdown()} stops only the
 * orchestrator's own driver thread.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-26
 * @version 1.0
 */
public class Orchestrator {

    private static final Logger logger = LoggerFactory.getLogger(Orchestrator.class);

    private final DependencyGraph graph;
    private final AgentPool pool;
    private final OrchestratorSettings settings;
    private final OrchestrationMetrics metrics;
    private final Map<String, AgentOperation<?>> operations = new LinkedHashMap<>();
    private final List<ExecutionValidator> validators = new CopyOnWriteArrayList<>();
    private final ExecutorService driverExecutor;
    private final AtomicBoolean executing = new AtomicBoolean(false);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final Set<String> currentlyRunning = ConcurrentHashMap.newKeySet();
    private final List<String> completedAgents = new CopyOnWriteArrayList<>();

    public Orchestrator(DependencyGraph graph, AgentPool pool) {
        this(graph, pool, OrchestratorSettings.defaults());
    }

    public Orchestrator(DependencyGraph graph, AgentPool pool, OrchestratorSettings settings) {
        this(graph, pool, settings, OrchestrationMetrics.global());
    }

    public Orchestrator(DependencyGraph graph, AgentPool pool, OrchestratorSettings settings,
                        OrchestrationMetrics metrics) {
        this.graph = Objects.requireNonNull(graph, "Dependency graph cannot be null");
        this.pool = Objects.requireNonNull(pool, "Agent pool cannot be null");
        this.settings = Objects.requireNonNull(settings, "Settings cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "Metrics cannot be null");

        AtomicInteger threadCount = new AtomicInteger();
        this.driverExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "maestro-orchestrator-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        logger.info("Orchestrator initialized with {}", settings);
    }

    public DependencyGraph getGraph() {
        return graph;
    }

    public AgentPool getPool() {
        return pool;
    }

    public OrchestratorSettings getSettings() {
        return settings;
    }

    // ==================== Registration ====================

    public void registerAgent(String name, AgentOperation<?> operation) {
        registerAgent(name, operation, List.of(), AgentConfigOverride.none());
    }

    public void registerAgent(String name, AgentOperation<?> operation, Collection<String> dependencies) {
        registerAgent(name, operation, dependencies, AgentConfigOverride.none());
    }

    /**
     * Binds an operation to an agent, declares its dependencies in the graph
     * and registers it with the pool. Registering again replaces the
     * operation and dependencies and merges the config override.
     */
    public synchronized void registerAgent(String name, AgentOperation<?> operation,
                                           Collection<String> dependencies, AgentConfigOverride override) {
        Objects.requireNonNull(name, "Agent name cannot be null");
        Objects.requireNonNull(operation, "Operation cannot be null");
        Objects.requireNonNull(dependencies, "Dependencies cannot be null");
        Objects.requireNonNull(override, "Config override cannot be null");

        pool.registerAgent(name, override);
        graph.addAgent(name, dependencies);
        operations.put(name, operation);
        logger.info("Registered agent {} depending on {}", name, dependencies);
    }

    /**
     * Removes the agent's operation, its pool record and its graph node.
     *
     * @return true if the agent was registered
     */
    public synchronized boolean unregisterAgent(String name) {
        boolean removed = operations.remove(name) != null;
        pool.unregisterAgent(name);
        graph.removeAgent(name);
        if (removed) {
            logger.info("Unregistered agent {}", name);
        }
        return removed;
    }

    public synchronized List<String> getRegisteredAgents() {
        return new ArrayList<>(operations.keySet());
    }

    public void addValidator(ExecutionValidator validator) {
        validators.add(Objects.requireNonNull(validator, "Validator cannot be null"));
    }

    public boolean removeValidator(ExecutionValidator validator) {
        return validators.remove(validator);
    }

    // ==================== Planning ====================

    /**
     * Plans a run. With no changed inputs every registered agent is planned;
     * otherwise the registered agents affected by the inputs. Dependencies on
     * agents outside the plan are assumed to be satisfied.
     *
     * @throws CircularDependencyException if the graph contains a cycle
     */
    public ExecutionPlan buildExecutionPlan(Collection<String> changedInputs) throws CircularDependencyException {
        Objects.requireNonNull(changedInputs, "Changed inputs cannot be null");

        List<String> registered = getRegisteredAgents();
        graph.buildExecutionOrder();

        List<String> affected;
        if (changedInputs.isEmpty()) {
            affected = registered;
        } else {
            Set<String> known = new HashSet<>(registered);
            affected = graph.getAffectedAgents(changedInputs).stream()
                    .filter(known::contains)
                    .collect(Collectors.toList());
        }

        Set<String> selected = new HashSet<>(affected);
        List<ParallelGroup> groups = graph.getParallelGroups().stream()
                .map(group -> group.retainAll(selected))
                .filter(group -> !group.isEmpty())
                .collect(Collectors.toList());

        ExecutionPlan plan = new ExecutionPlan(new ArrayList<>(changedInputs), affected, groups);
        logger.info("Built execution plan: {} agents in {} groups", plan.getTotalAgents(), groups.size());
        return plan;
    }

    // ==================== Execution ====================

    public CompletableFuture<OrchestrationResult> execute() throws OrchestrationInProgressException {
        return execute(List.of());
    }

    /**
     * Starts a run for the given changed inputs, or for every registered agent
     * when there are none.
     * <p>
     * The returned future completes with the run's result, or exceptionally
     * with a {@link CircularDependencyException} or an
     * {@link OrchestrationException} when the run could not start.
     *
     * @throws OrchestrationInProgressException if a run is already in progress
     */
    public CompletableFuture<OrchestrationResult> execute(Collection<String> changedInputs)
            throws OrchestrationInProgressException {
        Objects.requireNonNull(changedInputs, "Changed inputs cannot be null");
        List<String> inputs = List.copyOf(changedInputs);

        if (!executing.compareAndSet(false, true)) {
            logger.warn("Orchestration already in progress, rejecting new run");
            throw new OrchestrationInProgressException();
        }
        stopRequested.set(false);
        completedAgents.clear();

        CompletableFuture<OrchestrationResult> result = new CompletableFuture<>();
        try {
            driverExecutor.execute(() -> drive(inputs, result));
        } catch (RejectedExecutionException e) {
            executing.set(false);
            throw new IllegalStateException("Orchestrator is shutdown", e);
        }
        return result;
    }

    public boolean isExecuting() {
        return executing.get();
    }

    /**
     * Requests an emergency stop of the current run. Agents already running
     * finish; agents not yet started are marked cancelled.
     *
     * @return true if a run was in progress
     */
    public boolean stop() {
        if (!executing.get()) {
            return false;
        }
        stopRequested.set(true);
        logger.warn("Emergency stop requested, running agents: {}", currentlyRunning);
        return true;
    }

    public OrchestratorStatus getStatus() {
        return new OrchestratorStatus(executing.get(), new ArrayList<>(currentlyRunning),
                new ArrayList<>(completedAgents), getRegisteredAgents());
    }

    public void shutdown() {
        stopRequested.set(true);
        driverExecutor.shutdown();
        try {
            if (!driverExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("Orchestrator shutdown timed out, forcing shutdown");
                driverExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            driverExecutor.shutdownNow();
        }
        logger.info("Orchestrator shutdown completed");
    }

    private void drive(List<String> inputs, CompletableFuture<OrchestrationResult> result) {
        String mode = inputs.isEmpty() ? "full" : "incremental";
        long startNanos = System.nanoTime();
        metrics.recordRunStarted(mode);

        OrchestrationResult outcome = null;
        Exception failure = null;
        try {
            outcome = run(inputs, mode, startNanos);
        } catch (Exception e) {
            failure = e;
        } finally {
            currentlyRunning.clear();
            executing.set(false);
        }

        double seconds = (System.nanoTime() - startNanos) / 1_000_000_000.0;
        if (failure != null) {
            metrics.recordRunFailed(mode, seconds, failure.getClass().getSimpleName());
            logger.error("Orchestration failed: {}", failure.getMessage());
            result.completeExceptionally(failure);
            return;
        }

        metrics.recordAgentsSkipped(mode, outcome.getAgentsSkipped());
        if (outcome.isSuccess()) {
            metrics.recordRunCompleted(mode, seconds);
            logger.info("Orchestration completed successfully in {}ms: {} agents executed",
                    outcome.getDuration().toMillis(), outcome.getAgentsExecuted());
        } else {
            metrics.recordRunFailed(mode, seconds, "agent_failure");
            logger.warn("Orchestration finished with problems in {}ms: {}",
                    outcome.getDuration().toMillis(), outcome);
        }
        result.complete(outcome);
    }

    private OrchestrationResult run(List<String> inputs, String mode, long startNanos) throws MaestroException {
        logger.info("Starting {} orchestration, changed inputs: {}", mode, inputs);

        ExecutionPlan plan = buildExecutionPlan(inputs);
        runValidators(plan);

        Map<String, AgentRunResult> results = new ConcurrentHashMap<>();
        Semaphore permits = new Semaphore(settings.getMaxConcurrency());
        for (ParallelGroup group : plan.getGroups()) {
            runGroup(group, results, permits);
        }

        Map<String, AgentRunResult> ordered = new LinkedHashMap<>();
        for (String agent : plan.getAgents()) {
            ordered.put(agent, results.get(agent));
        }
        return new OrchestrationResult(plan, Duration.ofNanos(System.nanoTime() - startNanos), ordered);
    }

    private void runValidators(ExecutionPlan plan) throws OrchestrationException {
        ValidationResult combined = new ValidationResult();
        for (ExecutionValidator validator : validators) {
            ValidationResult result = validator.validate(plan);
            if (result != null) {
                combined.merge(result);
            }
        }
        if (combined.hasWarnings()) {
            logger.warn("Pre-execution validation warnings: {}", combined.getWarnings());
        }
        if (!combined.isValid()) {
            throw new OrchestrationException("Pre-execution validation failed: " + combined.getErrorSummary());
        }
    }

    private void runGroup(ParallelGroup group, Map<String, AgentRunResult> results, Semaphore permits)
            throws OrchestrationException {
        if (stopRequested.get()) {
            logger.warn("Skipping level {} after stop request", group.getLevel());
            for (String agent : group.getAgents()) {
                results.put(agent, AgentRunResult.cancelled(agent));
            }
            return;
        }

        logger.info("Executing level {} with {} agents: {}", group.getLevel(), group.size(), group.getAgents());
        List<CompletableFuture<Void>> inFlight = new ArrayList<>();
        InterruptedException interrupted = null;
        try {
            for (String agent : group.getAgents()) {
                if (stopRequested.get()) {
                    results.put(agent, AgentRunResult.cancelled(agent));
                    continue;
                }

                Optional<String> blocker = settings.isSkipDependentsOnFailure()
                        ? findUnsuccessfulDependency(agent, results)
                        : Optional.empty();
                if (blocker.isPresent()) {
                    logger.warn("Skipping agent {}: dependency {} did not succeed", agent, blocker.get());
                    results.put(agent, AgentRunResult.skipped(agent,
                            "Dependency " + blocker.get() + " did not succeed"));
                    continue;
                }

                permits.acquire();
                if (stopRequested.get()) {
                    permits.release();
                    results.put(agent, AgentRunResult.cancelled(agent));
                    continue;
                }
                inFlight.add(runAgent(agent, results).whenComplete((ignored, error) -> permits.release()));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            interrupted = e;
        }

        // Agents already dispatched finish before the run may end.
        CompletableFuture.allOf(inFlight.toArray(new CompletableFuture[0])).join();
        if (interrupted != null) {
            throw new OrchestrationException("Orchestration interrupted at level " + group.getLevel(), interrupted);
        }
    }

    private CompletableFuture<Void> runAgent(String agent, Map<String, AgentRunResult> results) {
        AgentOperation<?> operation;
        synchronized (this) {
            operation = operations.get(agent);
        }
        if (operation == null) {
            results.put(agent, AgentRunResult.skipped(agent, "Agent is no longer registered"));
            return CompletableFuture.completedFuture(null);
        }

        long startNanos = System.nanoTime();
        CompletableFuture<?> execution;
        try {
            execution = pool.executeAgent(agent, operation);
        } catch (AgentRejectedException e) {
            logger.warn("Agent {} rejected by pool: {}", agent, e.getReason());
            results.put(agent, AgentRunResult.rejected(agent, e.getReason(), e.getMessage()));
            return CompletableFuture.completedFuture(null);
        } catch (RuntimeException e) {
            logger.error("Agent {} could not be started: {}", agent, e.getMessage());
            results.put(agent, AgentRunResult.failed(agent, Duration.ZERO, e));
            return CompletableFuture.completedFuture(null);
        }

        currentlyRunning.add(agent);
        return execution.handle((value, error) -> {
            Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);
            currentlyRunning.remove(agent);
            completedAgents.add(agent);
            if (error == null) {
                results.put(agent, AgentRunResult.succeeded(agent, duration, value));
            } else {
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                        ? error.getCause() : error;
                results.put(agent, AgentRunResult.failed(agent, duration, cause));
            }
            return null;
        });
    }

    private Optional<String> findUnsuccessfulDependency(String agent, Map<String, AgentRunResult> results) {
        for (String dependency : graph.getDependencies(agent)) {
            AgentRunResult result = results.get(dependency);
            if (result != null && result.getOutcome().isUnsuccessful()) {
                return Optional.of(dependency);
            }
        }
        return Optional.empty();
    }
}
