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

/**
 * Mutable runtime state of one agent. Only {@link AgentPool} touches it, and
 * only while holding the pool monitor.
 */
final class AgentRecord {

    private final String name;
    private AgentConfig config;
    private AgentStatus status = AgentStatus.IDLE;
    private long totalExecutions;
    private long successfulExecutions;
    private long failedExecutions;
    private int retryCount;
    private Instant lastExecutionTime;
    private Duration lastExecutionDuration;

    AgentRecord(String name, AgentConfig config) {
        this.name = name;
        this.config = config;
    }

    String getName() {
        return name;
    }

    AgentConfig getConfig() {
        return config;
    }

    void setConfig(AgentConfig config) {
        this.config = config;
    }

    AgentStatus getStatus() {
        return status;
    }

    int getRetryCount() {
        return retryCount;
    }

    Instant getLastExecutionTime() {
        return lastExecutionTime;
    }

    void markRunning() {
        status = AgentStatus.RUNNING;
    }

    int incrementRetryCount() {
        return ++retryCount;
    }

    void recordSuccess(Instant completedAt, Duration duration) {
        totalExecutions++;
        successfulExecutions++;
        retryCount = 0;
        status = AgentStatus.IDLE;
        lastExecutionTime = completedAt;
        lastExecutionDuration = duration;
    }

    void recordFailure(Instant completedAt, Duration duration) {
        totalExecutions++;
        failedExecutions++;
        retryCount = 0;
        status = AgentStatus.FAILED;
        lastExecutionTime = completedAt;
        lastExecutionDuration = duration;
    }

    void reset() {
        status = AgentStatus.IDLE;
        retryCount = 0;
        lastExecutionTime = null;
    }

    AgentSnapshot snapshot() {
        return new AgentSnapshot(name, status, config, totalExecutions, successfulExecutions,
                failedExecutions, retryCount, lastExecutionTime, lastExecutionDuration);
    }
}
