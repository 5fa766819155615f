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
import dev.mars.maestro.agent.AgentStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Point-in-time, read-only copy of an agent's state in the pool.
 */
public final class AgentSnapshot {

    private final String name;
    private final AgentStatus status;
    private final AgentConfig config;
    private final long totalExecutions;
    private final long successfulExecutions;
    private final long failedExecutions;
    private final int retryCount;
    private final Instant lastExecutionTime;
    private final Duration lastExecutionDuration;

    public AgentSnapshot(String name, AgentStatus status, AgentConfig config,
                         long totalExecutions, long successfulExecutions, long failedExecutions,
                         int retryCount, Instant lastExecutionTime, Duration lastExecutionDuration) {
        this.name = Objects.requireNonNull(name, "Agent name cannot be null");
        this.status = Objects.requireNonNull(status, "Status cannot be null");
        this.config = Objects.requireNonNull(config, "Config cannot be null");
        this.totalExecutions = totalExecutions;
        this.successfulExecutions = successfulExecutions;
        this.failedExecutions = failedExecutions;
        this.retryCount = retryCount;
        this.lastExecutionTime = lastExecutionTime;
        this.lastExecutionDuration = lastExecutionDuration;
    }

    public String getName() {
        return name;
    }

    public AgentStatus getStatus() {
        return status;
    }

    public AgentConfig getConfig() {
        return config;
    }

    public long getTotalExecutions() {
        return totalExecutions;
    }

    public long getSuccessfulExecutions() {
        return successfulExecutions;
    }

    public long getFailedExecutions() {
        return failedExecutions;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public Optional<Instant> getLastExecutionTime() {
        return Optional.ofNullable(lastExecutionTime);
    }

    public Optional<Duration> getLastExecutionDuration() {
        return Optional.ofNullable(lastExecutionDuration);
    }

    @Override
    public String toString() {
        return "AgentSnapshot{" +
               "name='" + name + '\'' +
               ", status=" + status +
               ", total=" + totalExecutions +
               ", successful=" + successfulExecutions +
               ", failed=" + failedExecutions +
               ", retryCount=" + retryCount +
               '}';
    }
}
