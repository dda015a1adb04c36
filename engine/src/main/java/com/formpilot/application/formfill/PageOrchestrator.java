package com.formpilot.application.formfill;

import com.formpilot.domain.form.model.AnswerCandidate;
import com.formpilot.domain.form.model.PageGate;
import com.formpilot.domain.form.model.PageSession;
import com.formpilot.domain.form.model.PendingReviewItem;
import com.formpilot.domain.form.model.PersistOutcome;
import com.formpilot.domain.form.model.Question;
import com.formpilot.domain.form.model.ReviewOutcome;
import com.formpilot.domain.form.model.SessionReport;
import com.formpilot.domain.form.surface.FormSurface;
import com.formpilot.domain.form.surface.FormSurfaceException;
import com.formpilot.infrastructure.answer.AnswerResolver;
import com.formpilot.infrastructure.extraction.FieldExtractor;
import com.formpilot.infrastructure.filling.FormFiller;
import com.formpilot.infrastructure.monitoring.ChangeMonitor;
import com.formpilot.infrastructure.review.ReviewGate;
import com.formpilot.infrastructure.store.LearnedStore;
import com.formpilot.infrastructure.store.LearnedStoreException;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Drives one form session page by page.
 * <p>
 * Gates per page: extract, resolve, fill, monitor while waiting for the user to leave the page,
 * review, persist. After each page the new page is checked for questions; the session ends when
 * none are found, when it is stopped, or when the page can no longer be read. The profile is
 * loaded before the first page; a profile that cannot be read or created ends the session.
 * </p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PageOrchestrator {

    static final String STOP_NO_FORM = "no form page";
    static final String STOP_NO_QUESTIONS = "no questions on page";
    static final String STOP_REQUESTED = "stopped";
    static final String STOP_SURFACE_LOST = "form surface unavailable";
    static final String STOP_PROFILE_UNREADABLE = "profile unreadable";

    private final FormSurface surface;
    private final FieldExtractor fieldExtractor;
    private final AnswerResolver answerResolver;
    private final FormFiller formFiller;
    private final ChangeMonitor changeMonitor;
    private final ReviewGate reviewGate;
    private final LearnedStore learnedStore;

    @Value("${form-filler.navigation.poll-interval:1s}")
    private Duration navigationPollInterval = Duration.ofSeconds(1);

    @Value("${form-filler.navigation.page-load-delay:1s}")
    private Duration pageLoadDelay = Duration.ofSeconds(1);

    @Value("${form-filler.form-url-pattern:docs\\.google\\.com/forms/.*viewform}")
    private String formUrlPattern = "docs\\.google\\.com/forms/.*viewform";

    @Value("${form-filler.store.persist-attempts:2}")
    private int persistAttempts = 2;

    private volatile boolean stopRequested;

    private PageGate gate = PageGate.IDLE;
    private int pagesProcessed;
    private int fieldsFilled;
    private int itemsSaved;
    private int pagesDeclined;

    /**
     * Runs the session to completion on the calling thread.
     */
    public SessionReport run() {
        resetCounters();

        String stopReason;
        try {
            stopReason = runPages();
        } catch (FormSurfaceException e) {
            log.error("[Gate] Form surface lost, ending session: {}", e.getMessage());
            stopReason = STOP_SURFACE_LOST;
        } catch (LearnedStoreException e) {
            log.error("[Gate] Profile unavailable, ending session: {}", e.getMessage());
            stopReason = STOP_PROFILE_UNREADABLE;
        }

        transition(PageGate.DONE);
        SessionReport report = new SessionReport(pagesProcessed, fieldsFilled, itemsSaved, pagesDeclined, gate, stopReason);
        log.info("[Gate] Session finished: {}", report);
        return report;
    }

    /**
     * Asks a running session to stop at its next check.
     */
    @PreDestroy
    public void stop() {
        stopRequested = true;
    }

    private String runPages() {
        learnedStore.document();

        String url = awaitFormPage();
        if (url == null) {
            return stopRequested ? STOP_REQUESTED : STOP_NO_FORM;
        }

        List<Question> questions = fieldExtractor.extract(surface, url);

        while (true) {
            if (stopRequested) return STOP_REQUESTED;
            if (questions.isEmpty()) {
                log.info("[Gate] No questions on {}", url);
                return STOP_NO_QUESTIONS;
            }

            PageSession session = new PageSession(url, questions);
            transition(PageGate.EXTRACTED);

            String nextUrl = processPage(session);
            if (nextUrl == null) {
                session.clear();
                return STOP_REQUESTED;
            }

            session.clear();
            pause(pageLoadDelay);

            url = nextUrl;
            questions = fieldExtractor.extract(surface, url);
            if (!questions.isEmpty()) {
                transition(PageGate.NEXT_PAGE);
            }
        }
    }

    /**
     * Runs every gate of one page.
     *
     * @return URL the user navigated to, or null if the session was stopped first
     */
    private String processPage(PageSession session) {
        pagesProcessed++;

        if (learnedStore.preference("auto_fill_enabled", true)) {
            Map<String, AnswerCandidate> answers = answerResolver.resolve(session);
            transition(PageGate.RESOLVED);

            fieldsFilled += formFiller.fill(surface, session.getQuestions(), answers);
            transition(PageGate.FILLED);
        } else {
            log.info("[Gate] auto_fill_enabled is off, only watching for manual answers");
        }

        ChangeMonitor.Watch watch = changeMonitor.start(surface, session);
        transition(PageGate.MONITORING_AWAITING_NAV);

        String nextUrl;
        try {
            nextUrl = awaitNavigation(session.getPageUrl());
        } finally {
            watch.stop();
        }
        if (nextUrl == null) {
            return null;
        }

        transition(PageGate.REVIEWING);
        ReviewOutcome outcome = reviewGate.review(session);

        if (outcome.accepted()) {
            persist(outcome.items());
            transition(PageGate.PERSISTED);
        } else if (!outcome.isEmpty()) {
            pagesDeclined++;
            log.info("[Gate] Review declined, discarding {} items", outcome.items().size());
        }

        return nextUrl;
    }

    private void persist(List<PendingReviewItem> items) {
        for (int attempt = 1; attempt <= persistAttempts; attempt++) {
            try {
                PersistOutcome result = learnedStore.mergeAndPersist(items);
                itemsSaved += result.savedCount();
                return;
            } catch (LearnedStoreException e) {
                log.warn("[Gate] Persist attempt {}/{} failed: {}", attempt, persistAttempts, e.getMessage());
            }
        }
        log.error("[Gate] Answers for this page were not saved to disk");
    }

    /**
     * Polls until the surface shows a page matching the form URL pattern.
     *
     * @return the form page URL, or null if stopped first
     */
    private String awaitFormPage() {
        Pattern pattern = formUrlPattern == null || formUrlPattern.isBlank()
                ? null
                : Pattern.compile(formUrlPattern);

        boolean announced = false;
        while (!stopRequested) {
            String url = surface.currentPageUrl();
            if (pattern == null || (url != null && pattern.matcher(url).find())) {
                log.info("[Gate] Form page detected: {}", url);
                return url;
            }
            if (!announced) {
                log.info("[Gate] Waiting for a form page (current: {})", url);
                announced = true;
            }
            pause(navigationPollInterval);
        }
        return null;
    }

    /**
     * Blocks until the page URL differs from {@code pageUrl}.
     *
     * @return the new URL, or null if stopped first
     */
    private String awaitNavigation(String pageUrl) {
        log.info("[Gate] Waiting for Submit/Next");
        while (!stopRequested) {
            pause(navigationPollInterval);
            String current = surface.currentPageUrl();
            if (!Objects.equals(current, pageUrl)) {
                log.info("[Gate] Page changed to {}", current);
                return current;
            }
        }
        return null;
    }

    private void pause(Duration duration) {
        if (duration.isZero() || duration.isNegative()) return;
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopRequested = true;
        }
    }

    private void transition(PageGate next) {
        log.debug("[Gate] {} -> {}", gate, next);
        gate = next;
    }

    private void resetCounters() {
        gate = PageGate.IDLE;
        pagesProcessed = 0;
        fieldsFilled = 0;
        itemsSaved = 0;
        pagesDeclined = 0;
    }
}
