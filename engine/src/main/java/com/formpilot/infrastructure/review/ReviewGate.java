package com.formpilot.infrastructure.review;

import com.formpilot.domain.form.model.PageSession;
import com.formpilot.domain.form.model.PendingReviewItem;
import com.formpilot.domain.form.model.ReviewOutcome;
import com.formpilot.domain.form.service.Reviewer;
import com.formpilot.infrastructure.validation.AnswerValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the page's AI answers and manual edits, annotates each with the validator's verdict
 * and asks the {@link Reviewer} whether to learn them. Pages with nothing to review are not
 * shown to the reviewer.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReviewGate {

    private final AnswerValidator answerValidator;
    private final Reviewer reviewer;

    public ReviewOutcome review(PageSession session) {
        if (!session.hasPendingChanges()) {
            log.info("[Review] Nothing to review on this page");
            return ReviewOutcome.nothingToReview();
        }

        List<PendingReviewItem> aiItems = new ArrayList<>();
        session.aiFilledSnapshot().forEach((question, candidate) ->
                aiItems.add(PendingReviewItem.ai(question, candidate.value(),
                        answerValidator.validate(question, candidate.value()))));

        List<PendingReviewItem> manualItems = new ArrayList<>();
        session.manualChangesSnapshot().forEach((question, change) ->
                manualItems.add(PendingReviewItem.manual(question, change,
                        answerValidator.validate(question, change.newValue()))));

        long invalid = aiItems.stream().filter(i -> !i.valid()).count()
                + manualItems.stream().filter(i -> !i.valid()).count();
        log.info("[Review] Presenting {} AI and {} manual items ({} with warnings)",
                aiItems.size(), manualItems.size(), invalid);

        boolean accepted = reviewer.presentForReview(List.copyOf(aiItems), List.copyOf(manualItems));
        log.info("[Review] Reviewer {}", accepted ? "accepted" : "declined");

        List<PendingReviewItem> items = new ArrayList<>(aiItems);
        items.addAll(manualItems);
        return new ReviewOutcome(accepted, List.copyOf(items));
    }
}
