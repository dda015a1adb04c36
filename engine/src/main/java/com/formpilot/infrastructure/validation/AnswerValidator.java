package com.formpilot.infrastructure.validation;

import com.formpilot.domain.form.model.ValidationIssue;
import com.formpilot.domain.form.model.ValidationIssueType;
import com.formpilot.domain.form.model.ValidationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Rule-based check of a candidate answer against its question.
 * Rules are additive: every failing rule contributes an issue.
 */
@Slf4j
@Component
public class AnswerValidator {

    private static final int MIN_ANSWER_LENGTH = 2;
    private static final int MIN_PHONE_DIGITS = 10;

    private static final Pattern EMAIL_PATTERN = Pattern.compile("^[^@]+@[^@]+\\.[^@]+$");
    private static final Pattern NON_DIGITS = Pattern.compile("\\D");

    /**
     * Validate an answer for a question.
     *
     * @param question cleaned question text
     * @param answer   candidate answer (null is treated as empty)
     * @return validation result; passed iff no issue was found
     */
    public ValidationResult validate(String question, String answer) {
        String q = question == null ? "" : question.toLowerCase(Locale.ROOT);
        String a = answer == null ? "" : answer;
        List<ValidationIssue> issues = new ArrayList<>();

        checkLength(a, issues);
        checkFullName(q, a, issues);
        checkEmail(q, a, issues);
        checkPhone(q, a, issues);

        if (!issues.isEmpty()) {
            log.debug("[Validator] '{}' -> {} issue(s): {}", question, issues.size(),
                    issues.stream().map(ValidationIssue::message).toList());
        }

        return ValidationResult.of(issues);
    }

    private void checkLength(String answer, List<ValidationIssue> issues) {
        if (answer.length() < MIN_ANSWER_LENGTH) {
            issues.add(new ValidationIssue(ValidationIssueType.TOO_SHORT, "Answer seems too short"));
        }
    }

    private void checkFullName(String question, String answer, List<ValidationIssue> issues) {
        if (!question.contains("name") || question.contains("user")) {
            return;
        }
        if (question.contains("full") || question.contains("complete")) {
            String trimmed = answer.strip();
            int tokens = trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
            if (tokens < 2) {
                issues.add(new ValidationIssue(ValidationIssueType.INCOMPLETE_NAME,
                        "Full name should have first and last name"));
            }
        }
    }

    private void checkEmail(String question, String answer, List<ValidationIssue> issues) {
        if (question.contains("email") || question.contains("e-mail")) {
            if (!EMAIL_PATTERN.matcher(answer).matches()) {
                issues.add(new ValidationIssue(ValidationIssueType.INVALID_EMAIL,
                        "Email format appears invalid"));
            }
        }
    }

    private void checkPhone(String question, String answer, List<ValidationIssue> issues) {
        if (question.contains("phone") || question.contains("mobile")) {
            String digits = NON_DIGITS.matcher(answer).replaceAll("");
            if (digits.length() < MIN_PHONE_DIGITS) {
                issues.add(new ValidationIssue(ValidationIssueType.SHORT_PHONE,
                        "Phone number seems too short"));
            }
        }
    }
}
