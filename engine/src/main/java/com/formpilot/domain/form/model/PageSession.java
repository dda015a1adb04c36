package com.formpilot.domain.form.model;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Transient state of one form page, owned by the page orchestrator.
 * <p>
 * The answer resolver is the only writer of the AI-filled answers; the change monitor is the
 * only writer of initial values, stability counters and manual changes. The monitor writes
 * from its own thread, so every map is guarded by a single lock and read through snapshots.
 * </p>
 */
public class PageSession {

    private final Object lock = new Object();

    @Getter
    private final String pageUrl;

    @Getter
    private final List<Question> questions;

    private final Map<String, AnswerCandidate> aiFilled = new LinkedHashMap<>();
    private final Map<String, ManualChange> manualChanges = new LinkedHashMap<>();
    private final Map<String, String> initialValues = new LinkedHashMap<>();
    private final Map<String, Integer> stabilityCounters = new LinkedHashMap<>();

    public PageSession(String pageUrl, List<Question> questions) {
        this.pageUrl = pageUrl;
        this.questions = List.copyOf(questions);
    }

    // --- AI answers (resolver) ---

    public void recordAiAnswer(String question, AnswerCandidate candidate) {
        synchronized (lock) {
            aiFilled.put(question, candidate);
        }
    }

    public Map<String, AnswerCandidate> aiFilledSnapshot() {
        synchronized (lock) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(aiFilled));
        }
    }

    // --- Monitor state ---

    public void recordInitialValue(String question, String value) {
        synchronized (lock) {
            initialValues.put(question, value);
            stabilityCounters.put(question, 0);
        }
    }

    public String initialValue(String question) {
        synchronized (lock) {
            return initialValues.getOrDefault(question, "");
        }
    }

    public int incrementStability(String question) {
        synchronized (lock) {
            return stabilityCounters.merge(question, 1, Integer::sum);
        }
    }

    public void restartStability(String question) {
        synchronized (lock) {
            stabilityCounters.put(question, 1);
        }
    }

    public void resetStability(String question) {
        synchronized (lock) {
            stabilityCounters.put(question, 0);
        }
    }

    public int stability(String question) {
        synchronized (lock) {
            return stabilityCounters.getOrDefault(question, 0);
        }
    }

    public void recordManualChange(String question, ManualChange change) {
        synchronized (lock) {
            manualChanges.put(question, change);
        }
    }

    public boolean removeManualChange(String question) {
        synchronized (lock) {
            return manualChanges.remove(question) != null;
        }
    }

    public Map<String, ManualChange> manualChangesSnapshot() {
        synchronized (lock) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(manualChanges));
        }
    }

    public boolean hasPendingChanges() {
        synchronized (lock) {
            return !aiFilled.isEmpty() || !manualChanges.isEmpty();
        }
    }

    /**
     * Discards every tracked value. Called after persistence or a declined review.
     */
    public void clear() {
        synchronized (lock) {
            aiFilled.clear();
            manualChanges.clear();
            initialValues.clear();
            stabilityCounters.clear();
        }
    }
}
