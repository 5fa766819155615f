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
import java.util.List;
import java.util.Objects;

/**
 * The agents one orchestration run will consider, grouped by dependency level
 * in ascending order. Plans are rebuilt for every run.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-26
 */
public final class ExecutionPlan {

    private final List<String> changedInputs;
    private final List<String> affectedAgents;
    private final List<ParallelGroup> groups;

    public ExecutionPlan(List<String> changedInputs, List<String> affectedAgents, List<ParallelGroup> groups) {
        this.changedInputs = List.copyOf(Objects.requireNonNull(changedInputs, "Changed inputs cannot be null"));
        this.affectedAgents = List.copyOf(Objects.requireNonNull(affectedAgents, "Affected agents cannot be null"));
        this.groups = List.copyOf(Objects.requireNonNull(groups, "Groups cannot be null"));
    }

    /**
     * Inputs the plan was built for; empty for a full run.
     */
    public List<String> getChangedInputs() {
        return changedInputs;
    }

    public List<String> getAffectedAgents() {
        return affectedAgents;
    }

    public List<ParallelGroup> getGroups() {
        return groups;
    }

    public int getTotalAgents() {
        return groups.stream().mapToInt(ParallelGroup::size).sum();
    }

    /**
     * Planned agents in execution order.
     */
    public List<String> getAgents() {
        List<String> agents = new ArrayList<>();
        for (ParallelGroup group : groups) {
            agents.addAll(group.getAgents());
        }
        return agents;
    }

    public boolean isEmpty() {
        return groups.isEmpty();
    }

    @Override
    public String toString() {
        return "ExecutionPlan{" +
               "affectedAgents=" + affectedAgents +
               ", groups=" + groups +
               ", totalAgents=" + getTotalAgents() +
               '}';
    }
}
