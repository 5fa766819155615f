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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Table mapping agents to the regular expressions of the inputs they care
 * about, typically file paths. An input matches when any of an agent's
 * patterns is found anywhere in it.
 *
 * <pre>{@code
 * InputPatterns patterns = InputPatterns.builder()
 *         .agent("document-agent", "docs/.*\\.md$")
 *         .agent("backend-agent", "backend/.*\\.(js|ts)$", "backend/.*\\.json$")
 *         .build();
 * }</pre>
 */
public final class InputPatterns {

    private static final InputPatterns EMPTY = new InputPatterns(Map.of());

    private final Map<String, List<Pattern>> patterns;

    private InputPatterns(Map<String, List<Pattern>> patterns) {
        this.patterns = patterns;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static InputPatterns empty() {
        return EMPTY;
    }

    /**
     * Agents with at least one pattern matching {@code input}, in table order.
     */
    public Set<String> agentsMatching(String input) {
        Objects.requireNonNull(input, "Input cannot be null");
        Set<String> matched = new LinkedHashSet<>();
        for (Map.Entry<String, List<Pattern>> entry : patterns.entrySet()) {
            for (Pattern pattern : entry.getValue()) {
                if (pattern.matcher(input).find()) {
                    matched.add(entry.getKey());
                    break;
                }
            }
        }
        return matched;
    }

    public Set<String> getAgents() {
        return Collections.unmodifiableSet(patterns.keySet());
    }

    public List<Pattern> getPatterns(String agentName) {
        return patterns.getOrDefault(agentName, List.of());
    }

    public boolean isEmpty() {
        return patterns.isEmpty();
    }

    @Override
    public String toString() {
        return "InputPatterns" + patterns;
    }

    public static class Builder {
        private final Map<String, List<Pattern>> patterns = new LinkedHashMap<>();

        /**
         * Adds patterns for an agent; repeated calls for the same agent append.
         *
         * @throws java.util.regex.PatternSyntaxException if a pattern is invalid
         */
        public Builder agent(String agentName, String... regexes) {
            Objects.requireNonNull(agentName, "Agent name cannot be null");
            List<Pattern> compiled = patterns.computeIfAbsent(agentName, k -> new ArrayList<>());
            for (String regex : regexes) {
                compiled.add(Pattern.compile(Objects.requireNonNull(regex, "Pattern cannot be null")));
            }
            return this;
        }

        public InputPatterns build() {
            Map<String, List<Pattern>> copy = new LinkedHashMap<>();
            patterns.forEach((agent, list) -> copy.put(agent, List.copyOf(list)));
            return new InputPatterns(Collections.unmodifiableMap(copy));
        }
    }
}
