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
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Errors and warnings collected by a graph check or an
 * {@link ExecutionValidator}. Only errors make a result invalid.
 */
public class ValidationResult {

    private final List<ValidationIssue> errors;
    private final List<ValidationIssue> warnings;

    public ValidationResult() {
        this.errors = new ArrayList<>();
        this.warnings = new ArrayList<>();
    }

    public ValidationResult(List<ValidationIssue> errors, List<ValidationIssue> warnings) {
        this.errors = new ArrayList<>(errors != null ? errors : List.of());
        this.warnings = new ArrayList<>(warnings != null ? warnings : List.of());
    }

    public static ValidationResult valid() {
        return new ValidationResult();
    }

    public void addError(String message) {
        errors.add(new ValidationIssue(ValidationIssue.Severity.ERROR, message));
    }

    public void addError(String agentName, String message) {
        errors.add(new ValidationIssue(ValidationIssue.Severity.ERROR, agentName, message));
    }

    public void addWarning(String message) {
        warnings.add(new ValidationIssue(ValidationIssue.Severity.WARNING, message));
    }

    public void addWarning(String agentName, String message) {
        warnings.add(new ValidationIssue(ValidationIssue.Severity.WARNING, agentName, message));
    }

    /**
     * Appends every issue of {@code other} to this result.
     */
    public ValidationResult merge(ValidationResult other) {
        Objects.requireNonNull(other, "Other result cannot be null");
        errors.addAll(other.errors);
        warnings.addAll(other.warnings);
        return this;
    }

    public List<ValidationIssue> getErrors() {
        return List.copyOf(errors);
    }

    public List<ValidationIssue> getWarnings() {
        return List.copyOf(warnings);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public int getErrorCount() {
        return errors.size();
    }

    public int getWarningCount() {
        return warnings.size();
    }

    /**
     * Error messages joined with "; ", empty when valid.
     */
    public String getErrorSummary() {
        return errors.stream().map(ValidationIssue::toString).collect(Collectors.joining("; "));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("ValidationResult{");
        sb.append("valid=").append(isValid());
        sb.append(", errors=").append(errors.size());
        sb.append(", warnings=").append(warnings.size());
        sb.append("}");
        return sb.toString();
    }

    /**
     * Represents a single validation issue (error or warning).
     */
    public static class ValidationIssue {

        public enum Severity {
            ERROR, WARNING
        }

        private final Severity severity;
        private final String agentName;
        private final String message;

        public ValidationIssue(Severity severity, String message) {
            this(severity, null, message);
        }

        public ValidationIssue(Severity severity, String agentName, String message) {
            this.severity = Objects.requireNonNull(severity, "Severity cannot be null");
            this.agentName = agentName;
            this.message = Objects.requireNonNull(message, "Message cannot be null");
        }

        public Severity getSeverity() {
            return severity;
        }

        /**
         * Agent the issue refers to, or null for graph-wide issues.
         */
        public String getAgentName() {
            return agentName;
        }

        public String getMessage() {
            return message;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            ValidationIssue that = (ValidationIssue) o;
            return severity == that.severity &&
                   Objects.equals(agentName, that.agentName) &&
                   Objects.equals(message, that.message);
        }

        @Override
        public int hashCode() {
            return Objects.hash(severity, agentName, message);
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            sb.append(severity.name());
            if (agentName != null) {
                sb.append(" [").append(agentName).append("]");
            }
            sb.append(": ").append(message);
            return sb.toString();
        }
    }
}
