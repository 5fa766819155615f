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

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A vertex of the {@link DependencyGraph}. Instances handed out by the graph
 * are copies; only the graph mutates its own nodes.
 */
public final class DependencyNode {

    private final String name;
    private final Set<String> dependencies = new LinkedHashSet<>();
    private final Set<String> dependents = new LinkedHashSet<>();
    private int level = 1;
    private boolean declared;

    DependencyNode(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public Set<String> getDependencies() {
        return Set.copyOf(dependencies);
    }

    public Set<String> getDependents() {
        return Set.copyOf(dependents);
    }

    /**
     * 1 for a node without dependencies, otherwise one more than the highest
     * level among its dependencies.
     */
    public int getLevel() {
        return level;
    }

    /**
     * False for placeholder nodes that only exist because another agent
     * depends on them.
     */
    public boolean isDeclared() {
        return declared;
    }

    Set<String> dependencies() {
        return dependencies;
    }

    Set<String> dependents() {
        return dependents;
    }

    void setLevel(int level) {
        this.level = level;
    }

    void setDeclared(boolean declared) {
        this.declared = declared;
    }

    DependencyNode copy() {
        DependencyNode copy = new DependencyNode(name);
        copy.dependencies.addAll(dependencies);
        copy.dependents.addAll(dependents);
        copy.level = level;
        copy.declared = declared;
        return copy;
    }

    @Override
    public String toString() {
        return "DependencyNode{" +
               "name='" + name + '\'' +
               ", dependencies=" + dependencies +
               ", level=" + level +
               (declared ? "" : ", placeholder") +
               '}';
    }
}
