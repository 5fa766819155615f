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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Agents sharing a dependency level. Agents in one group have no dependency
 * on each other and may run concurrently.
 */
public final class ParallelGroup {

    private final int level;
    private final List<String> agents;

    public ParallelGroup(int level, List<String> agents) {
        if (level < 1) {
            throw new IllegalArgumentException("Level must be at least 1, got: " + level);
        }
        this.level = level;
        this.agents = List.copyOf(Objects.requireNonNull(agents, "Agents cannot be null"));
    }

    public int getLevel() {
        return level;
    }

    public List<String> getAgents() {
        return agents;
    }

    public int size() {
        return agents.size();
    }

    public boolean isEmpty() {
        return agents.isEmpty();
    }

    /**
     * Same level, keeping only the agents contained in {@code selected}.
     */
    public ParallelGroup retainAll(Collection<String> selected) {
        List<String> kept = new ArrayList<>();
        for (String agent : agents) {
            if (selected.contains(agent)) {
                kept.add(agent);
            }
        }
        return new ParallelGroup(level, kept);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ParallelGroup that = (ParallelGroup) o;
        return level == that.level && agents.equals(that.agents);
    }

    @Override
    public int hashCode() {
        return Objects.hash(level, agents);
    }

    @Override
    public String toString() {
        return "ParallelGroup{level=" + level + ", agents=" + agents + '}';
    }
}
