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

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Summary of one orchestration run.
 * <p>
 * A run is successful only when every planned agent succeeded. Failed and
 * rejected agents both count as failed; skipped and cancelled agents are
 * counted separately and never as executed.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-26
 * @version 1.0
 */
public final class OrchestrationResult {

    private final ExecutionPlan plan;
    private final Duration duration;
    private final Map<String, AgentRunResult> perAgentResults;

    public OrchestrationResult(ExecutionPlan plan, Duration duration, Map<String, AgentRunResult> perAgentResults) {
        this.plan = Objects.requireNonNull(plan, "Plan cannot be null");
        this.duration = Objects.requireNonNull(duration, "Duration cannot be null");
        this.perAgentResults = Collections.unmodifiableMap(new LinkedHashMap<>(
                Objects.requireNonNull(perAgentResults, "Results cannot be null")));
    }

    public boolean isSuccess() {
        return perAgentResults.size() == plan.getTotalAgents()
                && perAgentResults.values().stream().allMatch(AgentRunResult::isSuccess);
    }

    public Duration getDuration() {
        return duration;
    }

    public ExecutionPlan getPlan() {
        return plan;
    }

    /**
     * Agents whose operation actually ran, whether it succeeded or not.
     */
    public int getAgentsExecuted() {
        return count(AgentRunOutcome.SUCCEEDED) + count(AgentRunOutcome.FAILED);
    }

    public int getAgentsSucceeded() {
        return count(AgentRunOutcome.SUCCEEDED);
    }

    public int getAgentsFailed() {
        return count(AgentRunOutcome.FAILED) + count(AgentRunOutcome.REJECTED);
    }

    public int getAgentsSkipped() {
        return count(AgentRunOutcome.SKIPPED);
    }

    public int getAgentsCancelled() {
        return count(AgentRunOutcome.CANCELLED);
    }

    public Map<String, AgentRunResult> getPerAgentResults() {
        return perAgentResults;
    }

    public Optional<AgentRunResult> getResult(String agentName) {
        return Optional.ofNullable(perAgentResults.get(agentName));
    }

    public List<String> getAgentsWithOutcome(AgentRunOutcome outcome) {
        return perAgentResults.values().stream()
                .filter(result -> result.getOutcome() == outcome)
                .map(AgentRunResult::getAgentName)
                .collect(Collectors.toList());
    }

    private int count(AgentRunOutcome outcome) {
        return (int) perAgentResults.values().stream()
                .filter(result -> result.getOutcome() == outcome)
                .count();
    }

    @Override
    public String toString() {
        return "OrchestrationResult{" +
               "success=" + isSuccess() +
               ", duration=" + duration.toMillis() + "ms" +
               ", executed=" + getAgentsExecuted() +
               ", failed=" + getAgentsFailed() +
               ", skipped=" + getAgentsSkipped() +
               ", cancelled=" + getAgentsCancelled() +
               '}';
    }
}
