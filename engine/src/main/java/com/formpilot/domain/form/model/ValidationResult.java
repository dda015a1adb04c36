package com.formpilot.domain.form.model;

import java.util.List;

/**
 * Result of answer validation.
 *
 * @param passed true if no issues were found
 * @param issues every issue found; rules are additive
 */
public record ValidationResult(
        boolean passed,
        List<ValidationIssue> issues
) {
    public static ValidationResult of(List<ValidationIssue> issues) {
        return new ValidationResult(issues.isEmpty(), List.copyOf(issues));
    }

    public List<String> messages() {
        return issues.stream().map(ValidationIssue::message).toList();
    }
}
