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
import dev.mars.maestro.config.MaestroConfiguration;

import java.util.Objects;

/**
 * Pool-wide policy: the default per-agent configuration, the rate-limit and
 * circular-update windows, and the execution history cap.
 */
public final class PoolSettings {

    private final AgentConfig defaultAgentConfig;
    private final int rateLimitMax;
    private final long rateLimitWindowMs;
    private final int circularUpdateThreshold;
    private final long circularUpdateWindowMs;
    private final int maxHistorySize;

    private PoolSettings(Builder builder) {
        this.defaultAgentConfig = new AgentConfig(builder.timeoutMs, builder.maxRetries, builder.cooldownMs);
        this.rateLimitMax = requirePositive("Rate limit max", builder.rateLimitMax);
        this.rateLimitWindowMs = requirePositive("Rate limit window", builder.rateLimitWindowMs);
        this.circularUpdateThreshold = requirePositive("Circular update threshold", builder.circularUpdateThreshold);
        this.circularUpdateWindowMs = requirePositive("Circular update window", builder.circularUpdateWindowMs);
        this.maxHistorySize = requirePositive("Max history size", builder.maxHistorySize);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static PoolSettings defaults() {
        return builder().build();
    }

    /**
     * Builds settings from the {@code maestro.pool.*} keys of a configuration.
     */
    public static PoolSettings from(MaestroConfiguration configuration) {
        Objects.requireNonNull(configuration, "Configuration cannot be null");
        return builder()
                .timeoutMs(configuration.getDefaultTimeoutMs())
                .maxRetries(configuration.getDefaultMaxRetries())
                .cooldownMs(configuration.getDefaultCooldownMs())
                .rateLimit(configuration.getRateLimitMax(), configuration.getRateLimitWindowMs())
                .circularUpdate(configuration.getCircularUpdateThreshold(), configuration.getCircularUpdateWindowMs())
                .maxHistorySize(configuration.getMaxHistorySize())
                .build();
    }

    public AgentConfig getDefaultAgentConfig() {
        return defaultAgentConfig;
    }

    public int getRateLimitMax() {
        return rateLimitMax;
    }

    public long getRateLimitWindowMs() {
        return rateLimitWindowMs;
    }

    public int getCircularUpdateThreshold() {
        return circularUpdateThreshold;
    }

    public long getCircularUpdateWindowMs() {
        return circularUpdateWindowMs;
    }

    public int getMaxHistorySize() {
        return maxHistorySize;
    }

    private static int requirePositive(String name, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got: " + value);
        }
        return value;
    }

    private static long requirePositive(String name, long value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got: " + value);
        }
        return value;
    }

    @Override
    public String toString() {
        return "PoolSettings{" +
               "defaultAgentConfig=" + defaultAgentConfig +
               ", rateLimit=" + rateLimitMax + "/" + rateLimitWindowMs + "ms" +
               ", circularUpdate=" + circularUpdateThreshold + "/" + circularUpdateWindowMs + "ms" +
               ", maxHistorySize=" + maxHistorySize +
               '}';
    }

    public static class Builder {
        private long timeoutMs = 30000;
        private int maxRetries = 3;
        private long cooldownMs = 0;
        private int rateLimitMax = 10;
        private long rateLimitWindowMs = 60000;
        private int circularUpdateThreshold = 3;
        private long circularUpdateWindowMs = 300000;
        private int maxHistorySize = 100;

        public Builder timeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder cooldownMs(long cooldownMs) {
            this.cooldownMs = cooldownMs;
            return this;
        }

        public Builder rateLimit(int max, long windowMs) {
            this.rateLimitMax = max;
            this.rateLimitWindowMs = windowMs;
            return this;
        }

        public Builder circularUpdate(int threshold, long windowMs) {
            this.circularUpdateThreshold = threshold;
            this.circularUpdateWindowMs = windowMs;
            return this;
        }

        public Builder maxHistorySize(int maxHistorySize) {
            this.maxHistorySize = maxHistorySize;
            return this;
        }

        public PoolSettings build() {
            return new PoolSettings(this);
        }
    }
}
