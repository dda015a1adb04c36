package com.formpilot.infrastructure.review;

import com.formpilot.domain.form.model.FieldType;
import com.formpilot.domain.form.model.ManualChange;
import com.formpilot.domain.form.model.PendingReviewItem;
import com.formpilot.domain.form.model.ValidationResult;
import com.formpilot.infrastructure.validation.AnswerValidator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ConsoleReviewerTest {

    private final AnswerValidator validator = new AnswerValidator();
    private final ByteArrayOutputStream output = new ByteArrayOutputStream();

    private ConsoleReviewer reviewer(String input) {
        return new ConsoleReviewer(
                new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(output, true, StandardCharsets.UTF_8));
    }

    private String printed() {
        return output.toString(StandardCharsets.UTF_8);
    }

    private final List<PendingReviewItem> aiItems = List.of(
            PendingReviewItem.ai("Email", "not-an-email", validator.validate("Email", "not-an-email")));

    private final List<PendingReviewItem> manualItems = List.of(
            PendingReviewItem.manual("City", new ManualChange("Bonn", "Berlin", FieldType.TEXT),
                    ValidationResult.of(List.of())));

    @Test
    @DisplayName("Summary lists AI answers with warnings and manual edits")
    void printsSummary() {
        reviewer("y\n").presentForReview(aiItems, manualItems);

        assertThat(printed())
                .contains("Email: not-an-email")
                .contains("! Email format appears invalid")
                .contains("City [text]: 'Bonn' -> 'Berlin'");
    }

    @Test
    @DisplayName("Yes accepts, no declines")
    void decisions() {
        assertThat(reviewer("yes\n").presentForReview(aiItems, List.of())).isTrue();
        assertThat(reviewer("N\n").presentForReview(aiItems, List.of())).isFalse();
    }

    @Test
    @DisplayName("Unrecognised input asks again")
    void reprompts() {
        assertThat(reviewer("maybe\n\ny\n").presentForReview(aiItems, List.of())).isTrue();
        assertThat(printed().split("Save these answers", -1)).hasSize(4);
    }

    @Test
    @DisplayName("Closed input declines")
    void endOfInput() {
        assertThat(reviewer("").presentForReview(aiItems, manualItems)).isFalse();
    }
}
