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

import dev.mars.maestro.agent.RejectionReason;

import java.util.Objects;

/**
 * Thrown when the agent pool refuses to start an invocation.
 *
 * <p>A rejection never mutates agent counters or history. The message always
 * contains the reason code (for example {@code cooldown}) so that callers
 * matching on text and callers matching on {@link #getReason()} agree.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.0
 */
public class AgentRejectedException extends MaestroException {

    private final String agentName;
    private final RejectionReason reason;
    private final long remainingMs;

    public AgentRejectedException(String agentName, RejectionReason reason) {
        this(agentName, reason, 0L);
    }

    public AgentRejectedException(String agentName, RejectionReason reason, long remainingMs) {
        super(String.format("Agent %s cannot execute: %s", agentName,
                Objects.requireNonNull(reason, "Reason cannot be null").getCode()));
        this.agentName = agentName;
        this.reason = reason;
        this.remainingMs = remainingMs;
    }

    public String getAgentName() {
        return agentName;
    }

    public RejectionReason getReason() {
        return reason;
    }

    /**
     * Milliseconds until the cooldown expires, or 0 for other reasons.
     */
    public long getRemainingMs() {
        return remainingMs;
    }
}
