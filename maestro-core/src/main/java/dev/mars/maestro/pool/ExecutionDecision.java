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

import dev.mars.maestro.agent.RejectionReason;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of {@link AgentPool#canExecute(String)}.
 */
public final class ExecutionDecision {

    private static final ExecutionDecision ALLOWED = new ExecutionDecision(true, null, 0L);

    private final boolean allowed;
    private final RejectionReason reason;
    private final long remainingMs;

    private ExecutionDecision(boolean allowed, RejectionReason reason, long remainingMs) {
        this.allowed = allowed;
        this.reason = reason;
        this.remainingMs = remainingMs;
    }

    public static ExecutionDecision allowed() {
        return ALLOWED;
    }

    public static ExecutionDecision rejected(RejectionReason reason) {
        return rejected(reason, 0L);
    }

    public static ExecutionDecision rejected(RejectionReason reason, long remainingMs) {
        return new ExecutionDecision(false, Objects.requireNonNull(reason, "Reason cannot be null"), remainingMs);
    }

    public boolean isAllowed() {
        return allowed;
    }

    public Optional<RejectionReason> getReason() {
        return Optional.ofNullable(reason);
    }

    /**
     * Milliseconds left on the cooldown when the reason is
     * {@link RejectionReason#COOLDOWN}, otherwise 0.
     */
    public long getRemainingMs() {
        return remainingMs;
    }

    @Override
    public String toString() {
        if (allowed) {
            return "ExecutionDecision{allowed}";
        }
        return "ExecutionDecision{rejected=" + reason +
               (remainingMs > 0 ? ", remainingMs=" + remainingMs : "") + '}';
    }
}
