package com.formpilot.infrastructure.ai;

import com.formpilot.domain.form.model.AnswerCandidate;
import com.formpilot.domain.form.model.AnswerSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses a batched AI reply of {@code Qn: <answer>} lines into AI candidates.
 * <p>
 * Never throws: lines that do not follow the format, indexes outside the question list,
 * repeated indexes, empty answers and answers containing the sentinel token all yield
 * no candidate for that index.
 * </p>
 */
@Slf4j
@Component
public class BatchAnswerParser {

    private static final Pattern ENTRY_PATTERN = Pattern.compile("^\\s*[Qq](\\d+)\\s*:\\s*(.*)$");

    /**
     * @param reply     raw reply text (nullable)
     * @param questions the questions in the order they were numbered in the prompt
     * @return question text to AI candidate, in question order; absent questions have no answer
     */
    public Map<String, AnswerCandidate> parse(String reply, List<String> questions) {
        Map<String, AnswerCandidate> answers = new LinkedHashMap<>();
        if (reply == null || reply.isBlank()) {
            log.warn("[BatchParser] Empty AI reply, no answers for {} questions", questions.size());
            return answers;
        }

        String[] parsed = new String[questions.size()];
        boolean[] seen = new boolean[questions.size()];
        int matchedLines = 0;

        for (String line : reply.split("\\R")) {
            Matcher m = ENTRY_PATTERN.matcher(line);
            if (!m.matches()) continue;

            int index;
            try {
                index = Integer.parseInt(m.group(1)) - 1;
            } catch (NumberFormatException e) {
                continue;
            }
            if (index < 0 || index >= questions.size() || seen[index]) continue;

            seen[index] = true;
            matchedLines++;
            parsed[index] = m.group(2).strip();
        }

        if (matchedLines == 0) {
            log.warn("[BatchParser] AI reply had no 'Qn:' lines, treating as no answers. Reply: {}",
                    abbreviate(reply));
            return answers;
        }

        for (int i = 0; i < questions.size(); i++) {
            String answer = parsed[i];
            if (answer == null || answer.isEmpty() || answer.contains(BatchPromptBuilder.SENTINEL)) {
                log.debug("[BatchParser] No data for Q{} '{}'", i + 1, questions.get(i));
                continue;
            }
            answers.putIfAbsent(questions.get(i), new AnswerCandidate(answer, AnswerSource.AI));
        }

        log.info("[BatchParser] {} of {} questions answered by AI", answers.size(), questions.size());
        return answers;
    }

    private String abbreviate(String text) {
        return text.length() > 200 ? text.substring(0, 200) + "..." : text;
    }
}
