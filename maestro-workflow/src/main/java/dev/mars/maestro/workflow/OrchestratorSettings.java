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

import dev.mars.maestro.config.MaestroConfiguration;

import java.util.Objects;

/**
 * Tunables of an {@link Orchestrator}.
 */
public final class OrchestratorSettings {

    private final int maxConcurrency;
    private final boolean skipDependentsOnFailure;

    private OrchestratorSettings(Builder builder) {
        if (builder.maxConcurrency <= 0) {
            throw new IllegalArgumentException("Max concurrency must be positive, got: " + builder.maxConcurrency);
        }
        this.maxConcurrency = builder.maxConcurrency;
        this.skipDependentsOnFailure = builder.skipDependentsOnFailure;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static OrchestratorSettings defaults() {
        return builder().build();
    }

    /**
     * Builds settings from the {@code maestro.orchestrator.*} keys of a configuration.
     */
    public static OrchestratorSettings from(MaestroConfiguration configuration) {
        Objects.requireNonNull(configuration, "Configuration cannot be null");
        return builder()
                .maxConcurrency(configuration.getMaxConcurrency())
                .skipDependentsOnFailure(configuration.isSkipDependentsOnFailure())
                .build();
    }

    /**
     * Upper bound on agents in flight at once.
     */
    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    /**
     * Whether agents whose dependency failed, was rejected or was skipped in
     * the same run are skipped instead of attempted.
     */
    public boolean isSkipDependentsOnFailure() {
        return skipDependentsOnFailure;
    }

    @Override
    public String toString() {
        return "OrchestratorSettings{" +
               "maxConcurrency=" + maxConcurrency +
               ", skipDependentsOnFailure=" + skipDependentsOnFailure +
               '}';
    }

    public static class Builder {
        private int maxConcurrency = 5;
        private boolean skipDependentsOnFailure = true;

        public Builder maxConcurrency(int maxConcurrency) {
            this.maxConcurrency = maxConcurrency;
            return this;
        }

        public Builder skipDependentsOnFailure(boolean skipDependentsOnFailure) {
            this.skipDependentsOnFailure = skipDependentsOnFailure;
            return this;
        }

        public OrchestratorSettings build() {
            return new OrchestratorSettings(this);
        }
    }
}
