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
 * The unit of work an agent performs.
 *
 * <p>The pool runs the operation on one of its worker threads, so blocking
 * is allowed. Returning normally is a successful attempt; throwing is a
 * failed attempt that may be retried. An attempt that outlives the agent's
 * timeout is booked as failed even though the call may keep running.</p>
 *
 * @param <T> the result type
 */
@FunctionalInterface
public interface AgentOperation<T> {

    T execute() throws Exception;
}
