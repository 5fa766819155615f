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

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Derived statistics for a single agent.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-26
 */
public final class AgentStats {

    private final AgentSnapshot agent;
    private final Duration averageDuration;
    private final boolean inCooldown;
    private final boolean rateLimited;
    private final int recentExecutionCount;

    public AgentStats(AgentSnapshot agent, Duration averageDuration, boolean inCooldown,
                      boolean rateLimited, int recentExecutionCount) {
        this.agent = Objects.requireNonNull(agent, "Agent snapshot cannot be null");
        this.averageDuration = Objects.requireNonNull(averageDuration, "Average duration cannot be null");
        this.inCooldown = inCooldown;
        this.rateLimited = rateLimited;
        this.recentExecutionCount = recentExecutionCount;
    }

    public String getName() {
        return agent.getName();
    }

    public AgentStatus getStatus() {
        return agent.getStatus();
    }

    public long getTotalExecutions() {
        return agent.getTotalExecutions();
    }

    public long getSuccessfulExecutions() {
        return agent.getSuccessfulExecutions();
    }

    public long getFailedExecutions() {
        return agent.getFailedExecutions();
    }

    /**
     * Successful executions as a percentage of all executions, 0 when the
     * agent has never run.
     */
    public double getSuccessRate() {
        long total = agent.getTotalExecutions();
        return total > 0 ? (agent.getSuccessfulExecutions() * 100.0) / total : 0.0;
    }

    /**
     * Success rate formatted like {@code 66.67%}.
     */
    public String getFormattedSuccessRate() {
        return String.format(java.util.Locale.ROOT, "%.2f%%", getSuccessRate());
    }

    /**
     * Mean duration over the records still held in the execution history.
     */
    public Duration getAverageDuration() {
        return averageDuration;
    }

    public Optional<Instant> getLastExecutionTime() {
        return agent.getLastExecutionTime();
    }

    public Optional<Duration> getLastExecutionDuration() {
        return agent.getLastExecutionDuration();
    }

    public boolean isInCooldown() {
        return inCooldown;
    }

    public boolean isRateLimited() {
        return rateLimited;
    }

    public int getRecentExecutionCount() {
        return recentExecutionCount;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new HashMap<>();
        map.put("name", getName());
        map.put("status", getStatus().getValue());
        map.put("totalExecutions", getTotalExecutions());
        map.put("successfulExecutions", getSuccessfulExecutions());
        map.put("failedExecutions", getFailedExecutions());
        map.put("successRate", getFormattedSuccessRate());
        map.put("averageDuration", averageDuration.toMillis() + "ms");
        map.put("isInCooldown", inCooldown);
        map.put("isRateLimited", rateLimited);
        map.put("recentExecutionCount", recentExecutionCount);
        return map;
    }

    @Override
    public String toString() {
        return "AgentStats" + toMap();
    }
}
