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

public final class GraphStats {

    private final int totalAgents;
    private final int maxLevel;
    private final int parallelGroups;

    public GraphStats(int totalAgents, int maxLevel, int parallelGroups) {
        this.totalAgents = totalAgents;
        this.maxLevel = maxLevel;
        this.parallelGroups = parallelGroups;
    }

    public int getTotalAgents() {
        return totalAgents;
    }

    public int getMaxLevel() {
        return maxLevel;
    }

    public int getParallelGroups() {
        return parallelGroups;
    }

    @Override
    public String toString() {
        return "GraphStats{" +
               "totalAgents=" + totalAgents +
               ", maxLevel=" + maxLevel +
               ", parallelGroups=" + parallelGroups +
               '}';
    }
}
