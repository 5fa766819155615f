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

import dev.mars.maestro.agent.RejectionReason;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of one agent within an orchestration run.
 */
public final class AgentRunResult {

    private final String agentName;
    private final AgentRunOutcome outcome;
    private final Duration duration;
    private final Object output;
    private final Throwable error;
    private final RejectionReason rejectionReason;
    private final String message;

    private AgentRunResult(String agentName, AgentRunOutcome outcome, Duration duration, Object output,
                           Throwable error, RejectionReason rejectionReason, String message) {
        this.agentName = Objects.requireNonNull(agentName, "Agent name cannot be null");
        this.outcome = Objects.requireNonNull(outcome, "Outcome cannot be null");
        this.duration = duration != null ? duration : Duration.ZERO;
        this.output = output;
        this.error = error;
        this.rejectionReason = rejectionReason;
        this.message = message;
    }

    public static AgentRunResult succeeded(String agentName, Duration duration, Object output) {
        return new AgentRunResult(agentName, AgentRunOutcome.SUCCEEDED, duration, output, null, null, null);
    }

    public static AgentRunResult failed(String agentName, Duration duration, Throwable error) {
        Objects.requireNonNull(error, "Error cannot be null");
        return new AgentRunResult(agentName, AgentRunOutcome.FAILED, duration, null, error, null,
                error.getMessage());
    }

    public static AgentRunResult rejected(String agentName, RejectionReason reason, String message) {
        return new AgentRunResult(agentName, AgentRunOutcome.REJECTED, Duration.ZERO, null, null,
                Objects.requireNonNull(reason, "Reason cannot be null"), message);
    }

    public static AgentRunResult skipped(String agentName, String message) {
        return new AgentRunResult(agentName, AgentRunOutcome.SKIPPED, Duration.ZERO, null, null, null, message);
    }

    public static AgentRunResult cancelled(String agentName) {
        return new AgentRunResult(agentName, AgentRunOutcome.CANCELLED, Duration.ZERO, null, null, null,
                "Orchestration stopped");
    }

    public String getAgentName() {
        return agentName;
    }

    public AgentRunOutcome getOutcome() {
        return outcome;
    }

    public boolean isSuccess() {
        return outcome == AgentRunOutcome.SUCCEEDED;
    }

    public Duration getDuration() {
        return duration;
    }

    /**
     * Value returned by the agent's operation; empty unless it succeeded with
     * a non-null value.
     */
    public Optional<Object> getOutput() {
        return Optional.ofNullable(output);
    }

    public Optional<Throwable> getError() {
        return Optional.ofNullable(error);
    }

    public Optional<RejectionReason> getRejectionReason() {
        return Optional.ofNullable(rejectionReason);
    }

    public Optional<String> getMessage() {
        return Optional.ofNullable(message);
    }

    @Override
    public String toString() {
        return "AgentRunResult{" +
               "agent='" + agentName + '\'' +
               ", outcome=" + outcome +
               ", duration=" + duration.toMillis() + "ms" +
               (message != null ? ", message='" + message + '\'' : "") +
               '}';
    }
}
