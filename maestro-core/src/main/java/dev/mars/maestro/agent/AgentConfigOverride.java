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

import java.util.Optional;

/**
 * Partial agent configuration supplied at registration time.
 *
 * <p>Every field is optional. Fields left unset keep their current value on
 * re-registration, or fall back to the pool defaults on first registration.</p>
 */
public final class AgentConfigOverride {

    private static final AgentConfigOverride NONE = new AgentConfigOverride(builder());

    private final Long timeoutMs;
    private final Integer maxRetries;
    private final Long cooldownMs;

    private AgentConfigOverride(Builder builder) {
        this.timeoutMs = builder.timeoutMs;
        this.maxRetries = builder.maxRetries;
        this.cooldownMs = builder.cooldownMs;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * An override that changes nothing.
     */
    public static AgentConfigOverride none() {
        return NONE;
    }

    public Optional<Long> getTimeoutMs() {
        return Optional.ofNullable(timeoutMs);
    }

    public Optional<Integer> getMaxRetries() {
        return Optional.ofNullable(maxRetries);
    }

    public Optional<Long> getCooldownMs() {
        return Optional.ofNullable(cooldownMs);
    }

    public boolean isEmpty() {
        return timeoutMs == null && maxRetries == null && cooldownMs == null;
    }

    @Override
    public String toString() {
        return "AgentConfigOverride{" +
               "timeoutMs=" + timeoutMs +
               ", maxRetries=" + maxRetries +
               ", cooldownMs=" + cooldownMs +
               '}';
    }

    public static class Builder {
        private Long timeoutMs;
        private Integer maxRetries;
        private Long cooldownMs;

        public Builder timeoutMs(long timeoutMs) {
            if (timeoutMs <= 0) {
                throw new IllegalArgumentException("Timeout must be positive, got: " + timeoutMs);
            }
            this.timeoutMs = timeoutMs;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            if (maxRetries < 0) {
                throw new IllegalArgumentException("Max retries cannot be negative, got: " + maxRetries);
            }
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder cooldownMs(long cooldownMs) {
            if (cooldownMs < 0) {
                throw new IllegalArgumentException("Cooldown cannot be negative, got: " + cooldownMs);
            }
            this.cooldownMs = cooldownMs;
            return this;
        }

        public AgentConfigOverride build() {
            return new AgentConfigOverride(this);
        }
    }
}
