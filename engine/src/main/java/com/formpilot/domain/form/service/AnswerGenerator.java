package com.formpilot.domain.form.service;

import java.util.List;

/**
 * Remote text-generation collaborator used as the last resolution tier.
 */
public interface AnswerGenerator {

    /**
     * Sends one batched request for all unresolved questions.
     *
     * @param profileDocumentJson the full profile document, serialized
     * @param questions           unresolved questions; the prompt numbers them from 1
     * @return raw reply text, expected to hold one {@code Qn: <answer>} line per question
     */
    String sendBatchPrompt(String profileDocumentJson, List<String> questions);
}
