package com.formpilot.domain.form.model;

/**
 * Individual problem found in a candidate answer.
 *
 * @param type    the rule that produced the issue
 * @param message human-readable description shown to the reviewer
 */
public record ValidationIssue(
        ValidationIssueType type,
        String message
) {}
