package com.formpilot.domain.form.model;

public enum ValidationIssueType {
    TOO_SHORT,
    INCOMPLETE_NAME,
    INVALID_EMAIL,
    SHORT_PHONE
}
