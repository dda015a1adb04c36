package com.formpilot.infrastructure.answer;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Fixed mapping from personal_info profile fields to the question phrasings that ask for them.
 * A question matches a keyword when it equals it or starts with it (case-insensitive).
 */
@Component
public class KeywordPatternTable {

    private static final Map<String, List<String>> PATTERNS = new LinkedHashMap<>();

    static {
        PATTERNS.put("full_name", List.of("full name", "complete name", "your name"));
        PATTERNS.put("first_name", List.of("first name", "given name"));
        PATTERNS.put("last_name", List.of("last name", "surname", "family name"));
        PATTERNS.put("email", List.of("email address", "email", "e-mail"));
        PATTERNS.put("phone", List.of("phone number", "mobile number", "contact number"));
        PATTERNS.put("address", List.of("address", "street address"));
        PATTERNS.put("city", List.of("city", "town"));
        PATTERNS.put("state", List.of("state", "province"));
        PATTERNS.put("country", List.of("country", "nation"));
        PATTERNS.put("zip_code", List.of("zip code", "postal code", "pin code"));
    }

    /**
     * Profile fields whose keywords match the question, in table order.
     */
    public List<String> matchingFields(String question) {
        List<String> matches = new ArrayList<>();
        if (question == null || question.isBlank()) {
            return matches;
        }

        String q = question.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, List<String>> entry : PATTERNS.entrySet()) {
            boolean hit = entry.getValue().stream()
                    .anyMatch(keyword -> q.equals(keyword) || q.startsWith(keyword));
            if (hit) {
                matches.add(entry.getKey());
            }
        }
        return matches;
    }
}
