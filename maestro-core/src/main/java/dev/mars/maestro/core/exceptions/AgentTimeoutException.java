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

package dev.mars.maestro.core.exceptions;

/**
 * Thrown when a single attempt of an agent operation does not settle within
 * the agent's configured timeout. The operation itself may still be running.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class AgentTimeoutException extends MaestroException {

    private final String agentName;
    private final long timeoutMs;

    public AgentTimeoutException(String agentName, long timeoutMs) {
        super(String.format("Agent %s timed out after %dms", agentName, timeoutMs));
        this.agentName = agentName;
        this.timeoutMs = timeoutMs;
    }

    public String getAgentName() {
        return agentName;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
