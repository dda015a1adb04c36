package com.formpilot.domain.form.service;

import com.formpilot.domain.form.model.PendingReviewItem;

import java.util.List;

/**
 * Obtains the user's accept/decline decision for the answers collected on one page.
 * Implementations block until a decision is made.
 */
@FunctionalInterface
public interface Reviewer {

    /**
     * @param aiItems     answers produced by the AI tier
     * @param manualItems edits the user made by hand
     * @return true to learn the page's answers, false to discard them
     */
    boolean presentForReview(List<PendingReviewItem> aiItems, List<PendingReviewItem> manualItems);

    Reviewer AUTO_ACCEPT = (aiItems, manualItems) -> true;

    Reviewer AUTO_DECLINE = (aiItems, manualItems) -> false;
}
