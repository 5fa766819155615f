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

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * One completed invocation of an agent, written to the pool's execution
 * history when the invocation succeeds or fails for good.
 */
public final class ExecutionRecord {

    private final String agent;
    private final Instant startTime;
    private final Duration duration;
    private final boolean success;
    private final String error;

    public ExecutionRecord(String agent, Instant startTime, Duration duration, boolean success, String error) {
        this.agent = Objects.requireNonNull(agent, "Agent name cannot be null");
        this.startTime = Objects.requireNonNull(startTime, "Start time cannot be null");
        this.duration = Objects.requireNonNull(duration, "Duration cannot be null");
        this.success = success;
        this.error = error;
    }

    public static ExecutionRecord success(String agent, Instant startTime, Duration duration) {
        return new ExecutionRecord(agent, startTime, duration, true, null);
    }

    public static ExecutionRecord failure(String agent, Instant startTime, Duration duration, String error) {
        return new ExecutionRecord(agent, startTime, duration, false, error);
    }

    public String getAgent() {
        return agent;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Duration getDuration() {
        return duration;
    }

    public boolean isSuccess() {
        return success;
    }

    public Optional<String> getError() {
        return Optional.ofNullable(error);
    }

    @Override
    public String toString() {
        return "ExecutionRecord{" +
               "agent='" + agent + '\'' +
               ", startTime=" + startTime +
               ", duration=" + duration.toMillis() + "ms" +
               ", success=" + success +
               (error != null ? ", error='" + error + '\'' : "") +
               '}';
    }
}
