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
 * Reasons an agent pool can refuse to start an invocation.
 *
 * <p>The constants are declared in the order the pool evaluates them; the
 * first failing check wins. Each reason carries a stable lower-case code that
 * appears in rejection messages so callers can match on it.</p>
 */
public enum RejectionReason {

    /**
     * No agent with the requested name is registered.
     */
    NOT_REGISTERED("not_registered"),

    /**
     * The agent is already executing an invocation.
     */
    ALREADY_RUNNING("already_running"),

    /**
     * The agent completed an invocation less than its cooldown ago.
     */
    COOLDOWN("cooldown"),

    /**
     * The agent reached the pool's rate limit for the trailing window.
     */
    RATE_LIMITED("rate_limited"),

    /**
     * The agent re-ran often enough in the circular-update window to look
     * like a feedback loop.
     */
    CIRCULAR_UPDATE("circular_update");

    private final String code;

    RejectionReason(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    @Override
    public String toString() {
        return code;
    }
}
