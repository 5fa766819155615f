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

import java.util.List;

/**
 * Read-only snapshot of an {@link Orchestrator}.
 */
public final class OrchestratorStatus {

    private final boolean executing;
    private final List<String> currentlyRunning;
    private final List<String> completedAgents;
    private final List<String> registeredAgents;

    public OrchestratorStatus(boolean executing, List<String> currentlyRunning, List<String> completedAgents,
                              List<String> registeredAgents) {
        this.executing = executing;
        this.currentlyRunning = List.copyOf(currentlyRunning);
        this.completedAgents = List.copyOf(completedAgents);
        this.registeredAgents = List.copyOf(registeredAgents);
    }

    public boolean isExecuting() {
        return executing;
    }

    public List<String> getCurrentlyRunning() {
        return currentlyRunning;
    }

    /**
     * Agents of the current or most recent run whose operation finished.
     */
    public List<String> getCompletedAgents() {
        return completedAgents;
    }

    public List<String> getRegisteredAgents() {
        return registeredAgents;
    }

    @Override
    public String toString() {
        return "OrchestratorStatus{" +
               "executing=" + executing +
               ", running=" + currentlyRunning +
               ", completed=" + completedAgents.size() +
               ", registered=" + registeredAgents.size() +
               '}';
    }
}
