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

/**
 * What happened to one planned agent during an orchestration run.
 */
public enum AgentRunOutcome {

    SUCCEEDED("succeeded"),

    FAILED("failed"),

    /**
     * The agent pool refused to start the agent, for example because of a
     * cooldown or a rate limit.
     */
    REJECTED("rejected"),

    /**
     * Not attempted because a dependency did not succeed in the same run.
     */
    SKIPPED("skipped"),

    /**
     * Not attempted because the run was stopped.
     */
    CANCELLED("cancelled");

    private final String value;

    AgentRunOutcome(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * True for outcomes that leave dependents without a successful input.
     */
    public boolean isUnsuccessful() {
        return this != SUCCEEDED;
    }

    @Override
    public String toString() {
        return value;
    }
}
