package com.formpilot.infrastructure.answer;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Token-overlap similarity between question texts.
 * <p>
 * similarity = |common tokens| / max(|tokens a|, |tokens b|), after lower-casing, splitting on
 * whitespace and dropping stop words. Questions that mention a key indicator (mother, work,
 * previous, ...) only match questions mentioning exactly the same indicators. Indicators are
 * also recognised in possessive or punctuated form ("mother's", "work:").
 * </p>
 */
@Slf4j
@Component
public class FuzzyMatcher {

    private static final Set<String> STOP_WORDS = Set.of(
            "what", "is", "your", "the", "a", "an", "are", "you", "my", "enter"
    );

    private static final Set<String> KEY_INDICATORS = Set.of(
            "mother", "father", "parent", "emergency", "current", "previous",
            "dream", "favorite", "home", "work", "school", "primary", "alternate"
    );

    private static final Pattern EDGE_PUNCTUATION = Pattern.compile("^[^\\p{L}\\p{N}]+|[^\\p{L}\\p{N}]+$");

    @Value("${form-filler.fuzzy.threshold:0.75}")
    private double threshold = 0.75;

    /**
     * Similarity score in [0, 1]. Zero when either side has no meaningful tokens.
     */
    public double similarity(String a, String b) {
        Set<String> tokensA = tokens(a);
        Set<String> tokensB = tokens(b);
        if (tokensA.isEmpty() || tokensB.isEmpty()) {
            return 0;
        }

        Set<String> common = new HashSet<>(tokensA);
        common.retainAll(tokensB);

        return (double) common.size() / Math.max(tokensA.size(), tokensB.size());
    }

    /**
     * True if either side mentions a key indicator and the two indicator sets differ.
     */
    public boolean indicatorsConflict(String a, String b) {
        Set<String> indicatorsA = indicators(tokens(a));
        Set<String> indicatorsB = indicators(tokens(b));
        if (indicatorsA.isEmpty() && indicatorsB.isEmpty()) {
            return false;
        }
        return !indicatorsA.equals(indicatorsB);
    }

    public boolean matches(String a, String b) {
        if (indicatorsConflict(a, b)) {
            return false;
        }
        return similarity(a, b) >= threshold;
    }

    /**
     * First candidate, in iteration order, that matches the question.
     */
    public Optional<String> findMatch(String question, Collection<String> candidates) {
        for (String candidate : candidates) {
            if (matches(question, candidate)) {
                log.debug("[Fuzzy] '{}' matched '{}' (score {})", question, candidate,
                        String.format("%.2f", similarity(question, candidate)));
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private Set<String> tokens(String text) {
        if (text == null || text.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(text.toLowerCase(Locale.ROOT).strip().split("\\s+"))
                .filter(token -> !STOP_WORDS.contains(token))
                .collect(Collectors.toSet());
    }

    private Set<String> indicators(Set<String> tokens) {
        return tokens.stream()
                .map(FuzzyMatcher::indicatorForm)
                .filter(KEY_INDICATORS::contains)
                .collect(Collectors.toSet());
    }

    private static String indicatorForm(String token) {
        String word = EDGE_PUNCTUATION.matcher(token).replaceAll("");
        if (word.endsWith("'s") || word.endsWith("\u2019s")) {
            word = word.substring(0, word.length() - 2);
        }
        return word;
    }
}
