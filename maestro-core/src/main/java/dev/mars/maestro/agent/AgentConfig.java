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

package dev.mars.maestro.agent;

import java.util.Objects;

/**
 * Resolved per-agent invocation policy: attempt timeout, retry budget and
 * cooldown between invocations. Instances are immutable.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-26
 * @version 1.0
 */
public final class AgentConfig {

    private final long timeoutMs;
    private final int maxRetries;
    private final long cooldownMs;

    public AgentConfig(long timeoutMs, int maxRetries, long cooldownMs) {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("Timeout must be positive, got: " + timeoutMs);
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("Max retries cannot be negative, got: " + maxRetries);
        }
        if (cooldownMs < 0) {
            throw new IllegalArgumentException("Cooldown cannot be negative, got: " + cooldownMs);
        }
        this.timeoutMs = timeoutMs;
        this.maxRetries = maxRetries;
        this.cooldownMs = cooldownMs;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public long getCooldownMs() {
        return cooldownMs;
    }

    /**
     * Returns a copy with every field present in {@code override} replacing
     * the corresponding field of this configuration.
     */
    public AgentConfig merge(AgentConfigOverride override) {
        Objects.requireNonNull(override, "Override cannot be null");
        if (override.isEmpty()) {
            return this;
        }
        return new AgentConfig(
                override.getTimeoutMs().orElse(timeoutMs),
                override.getMaxRetries().orElse(maxRetries),
                override.getCooldownMs().orElse(cooldownMs));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AgentConfig that = (AgentConfig) o;
        return timeoutMs == that.timeoutMs &&
               maxRetries == that.maxRetries &&
               cooldownMs == that.cooldownMs;
    }

    @Override
    public int hashCode() {
        return Objects.hash(timeoutMs, maxRetries, cooldownMs);
    }

    @Override
    public String toString() {
        return "AgentConfig{" +
               "timeoutMs=" + timeoutMs +
               ", maxRetries=" + maxRetries +
               ", cooldownMs=" + cooldownMs +
               '}';
    }
}
