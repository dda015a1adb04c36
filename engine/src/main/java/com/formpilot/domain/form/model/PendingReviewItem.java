package com.formpilot.domain.form.model;

import java.util.List;

/**
 * An answer awaiting the reviewer's decision, annotated with the validator's verdict.
 *
 * @param question      cleaned question text
 * @param value         the answer that would be learned
 * @param source        {@link AnswerSource#AI} or {@link AnswerSource#MANUAL}
 * @param valid         validator verdict
 * @param issues        validator messages, empty when valid
 * @param originalValue value before the user's edit (manual items only, nullable)
 * @param fieldType     modality of the question (manual items only, nullable)
 */
public record PendingReviewItem(
        String question,
        String value,
        AnswerSource source,
        boolean valid,
        List<String> issues,
        String originalValue,
        FieldType fieldType
) {
    public static PendingReviewItem ai(String question, String value, ValidationResult validation) {
        return new PendingReviewItem(question, value, AnswerSource.AI,
                validation.passed(), validation.messages(), null, null);
    }

    public static PendingReviewItem manual(String question, ManualChange change, ValidationResult validation) {
        return new PendingReviewItem(question, change.newValue(), AnswerSource.MANUAL,
                validation.passed(), validation.messages(), change.original(), change.fieldType());
    }
}
