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
 * Thrown when an execution order is requested over a dependency graph that
 * contains a cycle. The graph itself is left intact and can be corrected.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class CircularDependencyException extends MaestroException {

    private final String agentName;

    public CircularDependencyException(String agentName) {
        super("Circular dependency detected involving " + agentName);
        this.agentName = agentName;
    }

    /**
     * The agent that was reached a second time on the current traversal path.
     */
    public String getAgentName() {
        return agentName;
    }
}
