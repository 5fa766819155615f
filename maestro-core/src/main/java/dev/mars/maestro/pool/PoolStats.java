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

import dev.mars.maestro.agent.AgentStatus;

import java.util.Map;
import java.util.Optional;

/**
 * Pool-wide counts plus the statistics of every registered agent.
 */
public final class PoolStats {

    private final Map<String, AgentStats> agents;
    private final int historySize;

    public PoolStats(Map<String, AgentStats> agents, int historySize) {
        this.agents = Map.copyOf(agents);
        this.historySize = historySize;
    }

    public int getTotalAgents() {
        return agents.size();
    }

    public int getIdleAgents() {
        return countWithStatus(AgentStatus.IDLE);
    }

    public int getRunningAgents() {
        return countWithStatus(AgentStatus.RUNNING);
    }

    public int getFailedAgents() {
        return countWithStatus(AgentStatus.FAILED);
    }

    public long getTotalExecutions() {
        return agents.values().stream().mapToLong(AgentStats::getTotalExecutions).sum();
    }

    public int getHistorySize() {
        return historySize;
    }

    public Map<String, AgentStats> getAgents() {
        return agents;
    }

    public Optional<AgentStats> getAgent(String name) {
        return Optional.ofNullable(agents.get(name));
    }

    private int countWithStatus(AgentStatus status) {
        return (int) agents.values().stream()
                .filter(stats -> stats.getStatus() == status)
                .count();
    }

    @Override
    public String toString() {
        return "PoolStats{" +
               "totalAgents=" + getTotalAgents() +
               ", idle=" + getIdleAgents() +
               ", running=" + getRunningAgents() +
               ", failed=" + getFailedAgents() +
               ", totalExecutions=" + getTotalExecutions() +
               ", historySize=" + historySize +
               '}';
    }
}
