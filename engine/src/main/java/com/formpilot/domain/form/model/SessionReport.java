package com.formpilot.domain.form.model;

/**
 * Summary of one form-fill session across all of its pages.
 */
public record SessionReport(
        int pagesProcessed,
        int fieldsFilled,
        int itemsSaved,
        int pagesDeclined,
        PageGate finalGate,
        String stopReason
) {}
