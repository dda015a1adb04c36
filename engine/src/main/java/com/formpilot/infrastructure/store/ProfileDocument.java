package com.formpilot.infrastructure.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory view of the JSON profile document.
 * <p>
 * Only {@code learned_questions} is written by the pipeline. The other sections
 * ({@code personal_info}, {@code education}, {@code professional}, {@code preferences} and any
 * unknown key) are read-only here and are written back exactly as loaded.
 * </p>
 */
public class ProfileDocument {

    public static final String LEARNED_QUESTIONS = "learned_questions";
    public static final String PERSONAL_INFO = "personal_info";
    public static final String PREFERENCES = "preferences";

    private final ObjectNode root;

    public ProfileDocument(ObjectNode root) {
        this.root = root;
    }

    /**
     * Skeleton written when no profile file exists yet.
     */
    public static ProfileDocument defaults() {
        ObjectNode root = JsonNodeFactory.instance.objectNode();
        root.putObject(PERSONAL_INFO);
        root.putObject("education");
        root.putObject("professional");
        root.putObject(LEARNED_QUESTIONS);
        ObjectNode preferences = root.putObject(PREFERENCES);
        preferences.put("auto_fill_enabled", true);
        preferences.put("learn_new_questions", true);
        return new ProfileDocument(root);
    }

    public ObjectNode root() {
        return root;
    }

    /**
     * Learned answers in stored order. Non-text values are skipped.
     */
    public Map<String, String> learnedQuestions() {
        Map<String, String> learned = new LinkedHashMap<>();
        JsonNode node = root.path(LEARNED_QUESTIONS);
        if (node.isObject()) {
            node.fields().forEachRemaining(entry -> {
                if (entry.getValue().isValueNode() && !entry.getValue().isNull()) {
                    learned.put(entry.getKey(), entry.getValue().asText());
                }
            });
        }
        return learned;
    }

    public void putLearned(String question, String answer) {
        JsonNode node = root.get(LEARNED_QUESTIONS);
        ObjectNode learned = node instanceof ObjectNode objectNode
                ? objectNode
                : root.putObject(LEARNED_QUESTIONS);
        learned.put(question, answer);
    }

    public Optional<String> personalInfo(String field) {
        JsonNode value = root.path(PERSONAL_INFO).path(field);
        if (!value.isValueNode() || value.isNull()) {
            return Optional.empty();
        }
        String text = value.asText();
        return text.isBlank() ? Optional.empty() : Optional.of(text);
    }

    public boolean preference(String name, boolean defaultValue) {
        JsonNode value = root.path(PREFERENCES).path(name);
        return value.isBoolean() ? value.asBoolean() : defaultValue;
    }
}
