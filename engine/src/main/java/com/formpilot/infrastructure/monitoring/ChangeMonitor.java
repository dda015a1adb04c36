package com.formpilot.infrastructure.monitoring;

import com.formpilot.domain.form.model.FieldSet;
import com.formpilot.domain.form.model.FieldType;
import com.formpilot.domain.form.model.ManualChange;
import com.formpilot.domain.form.model.PageSession;
import com.formpilot.domain.form.model.Question;
import com.formpilot.domain.form.model.ValidationResult;
import com.formpilot.domain.form.surface.FieldHandle;
import com.formpilot.domain.form.surface.FormSurface;
import com.formpilot.infrastructure.validation.AnswerValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.stream.Collectors;

/**
 * Watches a filled page for manual edits.
 * <p>
 * Every poll reads each question's current value. A value that differs from the one captured
 * at start must be seen unchanged on {@code stability-threshold} consecutive polls before it is
 * validated and recorded as a {@link ManualChange}; a later stable edit overwrites the earlier
 * one. Going back to the captured value resets the counter and drops any recorded change.
 * </p>
 */
@Slf4j
@Component
public class ChangeMonitor {

    private final AnswerValidator answerValidator;
    private final TaskScheduler scheduler;

    @Value("${form-filler.monitor.poll-interval:500ms}")
    private Duration pollInterval = Duration.ofMillis(500);

    @Value("${form-filler.monitor.stability-threshold:3}")
    private int stabilityThreshold = 3;

    public ChangeMonitor(AnswerValidator answerValidator,
                         @Qualifier("changeMonitorScheduler") TaskScheduler scheduler) {
        this.answerValidator = answerValidator;
        this.scheduler = scheduler;
    }

    /**
     * Captures initial values and starts polling in the background until {@link Watch#stop()}.
     */
    public Watch start(FormSurface surface, PageSession session) {
        Watch watch = prepare(surface, session);
        watch.future = scheduler.scheduleAtFixedRate(watch::tick, pollInterval);
        log.info("[Monitor] Watching {} questions every {}ms",
                session.getQuestions().size(), pollInterval.toMillis());
        return watch;
    }

    Watch prepare(FormSurface surface, PageSession session) {
        for (Question question : session.getQuestions()) {
            session.recordInitialValue(question.text(), safeCurrentValue(surface, question.fields()));
        }
        return new Watch(surface, session);
    }

    /**
     * Value of a question as the user sees it: the text of the first text, textarea or select
     * field, or the comma-joined labels of the selected radio/checkbox options.
     */
    String currentValue(FormSurface surface, FieldSet fields) {
        Optional<FieldType> type = fields.dominantType();
        if (type.isEmpty()) {
            return "";
        }

        List<FieldHandle> handles = fields.get(type.get());
        String value = switch (type.get()) {
            case TEXT, TEXTAREA, SELECT -> surface.readFieldValue(handles.get(0));
            case RADIO, CHECKBOX -> handles.stream()
                    .filter(surface::isSelected)
                    .map(surface::optionLabel)
                    .collect(Collectors.joining(", "));
        };
        return value == null ? "" : value;
    }

    private String safeCurrentValue(FormSurface surface, FieldSet fields) {
        try {
            return currentValue(surface, fields);
        } catch (RuntimeException e) {
            log.debug("[Monitor] Could not read initial value: {}", e.getMessage());
            return "";
        }
    }

    /**
     * A running watch over one page. Only the page teardown stops it.
     */
    public class Watch {

        private final FormSurface surface;
        private final PageSession session;
        private final Map<String, String> lastSeen = new HashMap<>();
        private final Object tickLock = new Object();
        private volatile boolean stopped;
        private ScheduledFuture<?> future;

        private Watch(FormSurface surface, PageSession session) {
            this.surface = surface;
            this.session = session;
        }

        void tick() {
            synchronized (tickLock) {
                if (stopped) return;

                for (Question question : session.getQuestions()) {
                    if (stopped) return;
                    try {
                        observe(question, currentValue(surface, question.fields()));
                    } catch (RuntimeException e) {
                        log.debug("[Monitor] Could not read '{}': {}", question.text(), e.getMessage());
                    }
                }
            }
        }

        private void observe(Question question, String current) {
            String text = question.text();
            String initial = session.initialValue(text);

            if (current.equals(initial)) {
                session.resetStability(text);
                lastSeen.remove(text);
                if (session.removeManualChange(text)) {
                    log.info("[Monitor] '{}' reverted to its original value", text);
                }
                return;
            }

            int count;
            if (current.equals(lastSeen.get(text))) {
                count = session.incrementStability(text);
            } else {
                session.restartStability(text);
                lastSeen.put(text, current);
                count = 1;
            }

            if (count != stabilityThreshold) return;

            ValidationResult validation = answerValidator.validate(text, current);
            if (!validation.passed()) {
                log.warn("[Monitor] Ignoring edit of '{}': {}", text, String.join(", ", validation.messages()));
                return;
            }

            FieldType fieldType = question.fields().dominantType().orElse(FieldType.TEXT);
            session.recordManualChange(text, new ManualChange(initial, current, fieldType));
            log.info("[Monitor] Manual change recorded: '{}' -> '{}'", text, current);
        }

        /**
         * Cancels polling and waits for a poll that is already running to finish.
         */
        public void stop() {
            stopped = true;
            if (future != null) {
                future.cancel(false);
            }
            synchronized (tickLock) {
                log.info("[Monitor] Stopped, {} manual changes", session.manualChangesSnapshot().size());
            }
        }

        boolean isStopped() {
            return stopped;
        }
    }
}
