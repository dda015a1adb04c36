package com.formpilot.domain.form.model;

import java.util.List;

/**
 * Decision returned by the review gate.
 *
 * @param accepted true if the reviewer accepted the page
 * @param items    AI items followed by manual items, each annotated with its validation verdict
 */
public record ReviewOutcome(boolean accepted, List<PendingReviewItem> items) {

    public static ReviewOutcome nothingToReview() {
        return new ReviewOutcome(false, List.of());
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }
}
