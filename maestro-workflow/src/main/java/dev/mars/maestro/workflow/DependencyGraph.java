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

import dev.mars.maestro.core.exceptions.CircularDependencyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Represents the dependency graph between agents.
 * Provides topological ordering, cycle detection, level assignment for
 * parallel execution and impact analysis for changed inputs.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class DependencyGraph {

    private static final Logger logger = LoggerFactory.getLogger(DependencyGraph.class);

    private final Map<String, DependencyNode> nodes;
    private final InputPatterns inputPatterns;
    private boolean levelsDirty;

    public DependencyGraph() {
        this(InputPatterns.empty());
    }

    public DependencyGraph(InputPatterns inputPatterns) {
        this.nodes = new LinkedHashMap<>();
        this.inputPatterns = Objects.requireNonNull(inputPatterns, "Input patterns cannot be null");
    }

    public InputPatterns getInputPatterns() {
        return inputPatterns;
    }

    /**
     * Declares an agent and the agents it depends on. Declaring an agent again
     * replaces its dependencies. Unknown dependencies are added as placeholder
     * nodes.
     *
     * @param name the agent name
     * @param dependencies names of the agents that must run first
     */
    public synchronized void addAgent(String name, Collection<String> dependencies) {
        Objects.requireNonNull(name, "Agent name cannot be null");
        Objects.requireNonNull(dependencies, "Dependencies cannot be null");

        DependencyNode node = nodes.computeIfAbsent(name, DependencyNode::new);
        node.setDeclared(true);

        Set<String> updated = new LinkedHashSet<>(dependencies);
        for (String former : new ArrayList<>(node.dependencies())) {
            if (!updated.contains(former)) {
                unlink(name, former);
            }
        }
        for (String dependency : updated) {
            node.dependencies().add(dependency);
            nodes.computeIfAbsent(dependency, DependencyNode::new).dependents().add(name);
        }

        levelsDirty = true;
        logger.debug("Added agent {} with dependencies {}", name, updated);
    }

    public void addAgent(String name, String... dependencies) {
        addAgent(name, Arrays.asList(dependencies));
    }

    /**
     * Removes an agent. A node other agents still depend on stays behind as a
     * placeholder without dependencies.
     *
     * @return true if the agent was present
     */
    public synchronized boolean removeAgent(String name) {
        DependencyNode node = nodes.get(name);
        if (node == null) {
            return false;
        }
        for (String dependency : new ArrayList<>(node.dependencies())) {
            unlink(name, dependency);
        }
        if (node.dependents().isEmpty()) {
            nodes.remove(name);
        } else {
            node.setDeclared(false);
        }
        levelsDirty = true;
        logger.debug("Removed agent {}", name);
        return true;
    }

    /**
     * Removes a single edge.
     *
     * @return true if {@code name} depended on {@code dependency}
     */
    public synchronized boolean removeDependency(String name, String dependency) {
        DependencyNode node = nodes.get(name);
        if (node == null || !node.dependencies().contains(dependency)) {
            return false;
        }
        unlink(name, dependency);
        levelsDirty = true;
        return true;
    }

    public synchronized boolean contains(String name) {
        return nodes.containsKey(name);
    }

    /**
     * All node names, including placeholders, in insertion order.
     */
    public synchronized List<String> getAgentNames() {
        return new ArrayList<>(nodes.keySet());
    }

    public synchronized Optional<DependencyNode> getNode(String name) {
        DependencyNode node = nodes.get(name);
        return node == null ? Optional.empty() : Optional.of(node.copy());
    }

    /**
     * Gets the direct dependencies of an agent, empty for unknown agents.
     */
    public synchronized Set<String> getDependencies(String name) {
        DependencyNode node = nodes.get(name);
        return node == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(node.dependencies()));
    }

    /**
     * Gets the agents that directly depend on an agent, empty for unknown agents.
     */
    public synchronized Set<String> getDependents(String name) {
        DependencyNode node = nodes.get(name);
        return node == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(node.dependents()));
    }

    public synchronized OptionalInt getLevel(String name) {
        DependencyNode node = nodes.get(name);
        if (node == null) {
            return OptionalInt.empty();
        }
        ensureLevels();
        return OptionalInt.of(node.getLevel());
    }

    /**
     * Performs a depth-first topological sort and refreshes the node levels.
     *
     * @return every node, each after all of its dependencies
     * @throws CircularDependencyException if the graph contains a cycle
     */
    public synchronized List<String> buildExecutionOrder() throws CircularDependencyException {
        List<String> order = topologicalOrder();
        recalculateLevels();
        logger.debug("Execution order: {}", order);
        return order;
    }

    /**
     * Detects circular dependencies in the graph.
     *
     * @return true if circular dependencies exist
     */
    public synchronized boolean hasCircularDependencies() {
        try {
            topologicalOrder();
            return false;
        } catch (CircularDependencyException e) {
            logger.debug("Cycle found: {}", e.getMessage());
            return true;
        }
    }

    /**
     * Groups the nodes by level, lowest level first.
     */
    public synchronized List<ParallelGroup> getParallelGroups() {
        ensureLevels();
        SortedMap<Integer, List<String>> byLevel = new TreeMap<>();
        for (DependencyNode node : nodes.values()) {
            byLevel.computeIfAbsent(node.getLevel(), k -> new ArrayList<>()).add(node.getName());
        }
        List<ParallelGroup> groups = new ArrayList<>();
        byLevel.forEach((level, agents) -> groups.add(new ParallelGroup(level, agents)));
        return groups;
    }

    /**
     * Finds the agents affected by a set of changed inputs: every agent with
     * a pattern matching one of the inputs, plus all of their transitive
     * dependents.
     *
     * @return affected agents without duplicates, directly matched agents first
     */
    public synchronized List<String> getAffectedAgents(Collection<String> changedInputs) {
        Objects.requireNonNull(changedInputs, "Changed inputs cannot be null");

        Set<String> affected = new LinkedHashSet<>();
        for (String input : changedInputs) {
            affected.addAll(inputPatterns.agentsMatching(input));
        }

        Deque<String> queue = new ArrayDeque<>(affected);
        while (!queue.isEmpty()) {
            DependencyNode node = nodes.get(queue.poll());
            if (node == null) {
                continue;
            }
            for (String dependent : node.dependents()) {
                if (affected.add(dependent)) {
                    queue.add(dependent);
                }
            }
        }

        logger.debug("Inputs {} affect agents {}", changedInputs, affected);
        return new ArrayList<>(affected);
    }

    /**
     * Validates the dependency graph for consistency.
     *
     * @return validation result
     */
    public synchronized ValidationResult validate() {
        ValidationResult result = new ValidationResult();

        for (DependencyNode node : nodes.values()) {
            if (node.dependencies().contains(node.getName())) {
                result.addError(node.getName(), "Agent cannot depend on itself");
            }
            for (String dependency : node.dependencies()) {
                DependencyNode target = nodes.get(dependency);
                if (target != null && !target.isDeclared() && !dependency.equals(node.getName())) {
                    result.addWarning(node.getName(), "Dependency '" + dependency + "' is not a declared agent");
                }
            }
        }

        if (hasCircularDependencies()) {
            result.addError("Circular dependencies detected between agents");
        }

        return result;
    }

    public synchronized GraphStats getStats() {
        ensureLevels();
        int maxLevel = 0;
        Set<Integer> levels = new HashSet<>();
        for (DependencyNode node : nodes.values()) {
            maxLevel = Math.max(maxLevel, node.getLevel());
            levels.add(node.getLevel());
        }
        return new GraphStats(nodes.size(), maxLevel, levels.size());
    }

    public synchronized void clear() {
        nodes.clear();
        levelsDirty = false;
        logger.debug("Dependency graph cleared");
    }

    private List<String> topologicalOrder() throws CircularDependencyException {
        List<String> order = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Set<String> visiting = new HashSet<>();
        for (String name : nodes.keySet()) {
            visit(name, visited, visiting, order);
        }
        return order;
    }

    private void visit(String name, Set<String> visited, Set<String> visiting, List<String> order)
            throws CircularDependencyException {
        if (visiting.contains(name)) {
            throw new CircularDependencyException(name);
        }
        if (visited.contains(name)) {
            return;
        }

        visiting.add(name);
        DependencyNode node = nodes.get(name);
        if (node != null) {
            for (String dependency : node.dependencies()) {
                visit(dependency, visited, visiting, order);
            }
        }
        visiting.remove(name);
        visited.add(name);
        order.add(name);
    }

    private void ensureLevels() {
        if (levelsDirty) {
            recalculateLevels();
        }
    }

    // Relaxation bounded by the node count so that a cyclic graph still terminates.
    private void recalculateLevels() {
        for (DependencyNode node : nodes.values()) {
            node.setLevel(1);
        }
        for (int pass = 0; pass < nodes.size(); pass++) {
            boolean changed = false;
            for (DependencyNode node : nodes.values()) {
                int level = 1;
                for (String dependency : node.dependencies()) {
                    DependencyNode target = nodes.get(dependency);
                    if (target != null) {
                        level = Math.max(level, target.getLevel() + 1);
                    }
                }
                if (level != node.getLevel()) {
                    node.setLevel(level);
                    changed = true;
                }
            }
            if (!changed) {
                break;
            }
        }
        levelsDirty = false;
    }

    private void unlink(String name, String dependency) {
        DependencyNode node = nodes.get(name);
        if (node != null) {
            node.dependencies().remove(dependency);
        }
        DependencyNode target = nodes.get(dependency);
        if (target == null) {
            return;
        }
        target.dependents().remove(name);
        if (!target.isDeclared() && target.dependents().isEmpty()) {
            nodes.remove(dependency);
        }
    }

    @Override
    public synchronized String toString() {
        return "DependencyGraph{" +
               "agents=" + nodes.keySet() +
               ", levelsDirty=" + levelsDirty +
               '}';
    }
}
