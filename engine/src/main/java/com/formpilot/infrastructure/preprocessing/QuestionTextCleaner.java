package com.formpilot.infrastructure.preprocessing;

import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalizes question labels into the canonical key used for every lookup:
 * - Unicode NFC normalization
 * - Invisible/control character removal
 * - Required-field asterisks removed
 * - Whitespace and newlines collapsed to single spaces
 * - Trailing '?' and ':' trimmed
 * <p>
 * Cleaning is idempotent: cleaning an already cleaned label returns it unchanged.
 * </p>
 */
@Component
public class QuestionTextCleaner {

    // Zero-width and invisible Unicode characters
    private static final Pattern INVISIBLE_CHARS = Pattern.compile(
            "[\\u200B\\u200C\\u200D\\uFEFF\\u00AD\\u2060\\u180E]"
    );

    // Control characters except common whitespace (\n, \r, \t)
    private static final Pattern CONTROL_CHARS = Pattern.compile(
            "[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]"
    );

    private static final Pattern WHITESPACE_RUNS = Pattern.compile("\\s+");

    // Any mix of '?', ':' and spaces at the end, e.g. "Name ?:" or "Email: "
    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[\\s?:]+$");

    /**
     * Clean a raw question label.
     *
     * @param text raw label as read from the page
     * @return cleaned label, original case preserved; empty string for null input
     */
    public String clean(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }

        String result = Normalizer.normalize(text, Normalizer.Form.NFC);
        result = INVISIBLE_CHARS.matcher(result).replaceAll("");
        result = CONTROL_CHARS.matcher(result).replaceAll("");
        result = result.replace("*", "");
        result = WHITESPACE_RUNS.matcher(result).replaceAll(" ");
        result = TRAILING_PUNCTUATION.matcher(result).replaceAll("");

        return result.strip();
    }

    /**
     * Cleaned, lower-cased form used for case-insensitive key comparison.
     */
    public String matchKey(String text) {
        return clean(text).toLowerCase(Locale.ROOT);
    }
}
