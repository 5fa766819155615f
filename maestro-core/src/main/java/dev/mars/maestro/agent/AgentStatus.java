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

/**
 * Runtime states of an agent managed by the agent pool.
 *
 * <p>{@code FAILED} is not terminal: an operator can reset the agent, or a
 * later invocation may run once the cooldown has elapsed.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-26
 * @version 1.0
 */
public enum AgentStatus {

    /**
     * Agent is registered and not executing.
     */
    IDLE("idle", "Agent is idle and ready for work"),

    /**
     * Agent is executing an invocation, possibly retrying it.
     */
    RUNNING("running", "Agent is executing an invocation"),

    /**
     * Agent's last invocation failed after exhausting its retries.
     */
    FAILED("failed", "Agent's last invocation failed");

    private final String value;
    private final String description;

    AgentStatus(String value, String description) {
        this.value = value;
        this.description = description;
    }

    public String getValue() {
        return value;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Parse status from its string value.
     *
     * @param value the string value, case-insensitive
     * @return the matching status
     * @throws IllegalArgumentException if no status matches
     */
    public static AgentStatus fromValue(String value) {
        for (AgentStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown agent status: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
