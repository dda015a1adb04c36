package com.formpilot.domain.form.model;

/**
 * Gates of the per-page pipeline, in the order a page passes through them.
 */
public enum PageGate {
    IDLE,
    EXTRACTED,
    RESOLVED,
    FILLED,
    MONITORING_AWAITING_NAV,
    REVIEWING,
    PERSISTED,
    NEXT_PAGE,
    DONE
}
