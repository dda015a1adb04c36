package com.formpilot.domain.form.model;

/**
 * Where an answer came from. Only AI and manual answers go through review before they are learned.
 */
public enum AnswerSource {
    EXACT,
    FUZZY,
    KEYWORD_PATTERN,
    AI,
    MANUAL
}
