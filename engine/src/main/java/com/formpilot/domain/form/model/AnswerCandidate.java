package com.formpilot.domain.form.model;

public record AnswerCandidate(String value, AnswerSource source) {}
