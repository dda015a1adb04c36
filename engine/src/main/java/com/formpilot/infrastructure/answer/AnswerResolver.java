package com.formpilot.infrastructure.answer;

import com.formpilot.domain.form.model.AnswerCandidate;
import com.formpilot.domain.form.model.AnswerSource;
import com.formpilot.domain.form.model.PageSession;
import com.formpilot.domain.form.model.Question;
import com.formpilot.domain.form.service.AnswerGenerator;
import com.formpilot.infrastructure.ai.BatchAnswerParser;
import com.formpilot.infrastructure.store.LearnedStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves answers for the questions of one page.
 * <p>
 * Tiers, per question: exact learned answer, fuzzy learned answer, keyword pattern over
 * {@code personal_info}. Whatever is still unresolved goes to the AI collaborator in a single
 * batched call. AI answers are staged on the {@link PageSession} for review.
 * </p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnswerResolver {

    private final LearnedStore learnedStore;
    private final FuzzyMatcher fuzzyMatcher;
    private final KeywordPatternTable keywordPatterns;
    private final BatchAnswerParser batchAnswerParser;
    private final ObjectProvider<AnswerGenerator> answerGenerator;

    /**
     * @return question text to resolved candidate; questions without an answer are absent
     */
    public Map<String, AnswerCandidate> resolve(PageSession session) {
        Map<String, AnswerCandidate> resolved = new LinkedHashMap<>();
        Set<String> unresolved = new LinkedHashSet<>();
        Map<String, String> learned = learnedStore.learnedAnswers();

        for (Question question : session.getQuestions()) {
            String text = question.text();
            if (resolved.containsKey(text) || unresolved.contains(text)) continue;

            Optional<AnswerCandidate> local = resolveLocally(text, learned);
            if (local.isPresent()) {
                resolved.put(text, local.get());
                log.info("[Resolver] {} answer for '{}'", local.get().source(), text);
            } else {
                unresolved.add(text);
            }
        }

        log.info("[Resolver] {} resolved locally, {} left for AI", resolved.size(), unresolved.size());

        if (!unresolved.isEmpty()) {
            Map<String, AnswerCandidate> aiAnswers = resolveWithAi(new ArrayList<>(unresolved));
            aiAnswers.forEach((question, candidate) -> {
                resolved.put(question, candidate);
                session.recordAiAnswer(question, candidate);
            });
        }

        return resolved;
    }

    private Optional<AnswerCandidate> resolveLocally(String question, Map<String, String> learned) {
        Optional<String> exact = learnedStore.lookupExact(question);
        if (exact.isPresent()) {
            return Optional.of(new AnswerCandidate(exact.get(), AnswerSource.EXACT));
        }

        Optional<String> fuzzyKey = fuzzyMatcher.findMatch(question, learned.keySet());
        if (fuzzyKey.isPresent()) {
            return Optional.of(new AnswerCandidate(learned.get(fuzzyKey.get()), AnswerSource.FUZZY));
        }

        for (String field : keywordPatterns.matchingFields(question)) {
            Optional<String> value = learnedStore.personalInfo(field);
            if (value.isPresent()) {
                return Optional.of(new AnswerCandidate(value.get(), AnswerSource.KEYWORD_PATTERN));
            }
        }

        return Optional.empty();
    }

    private Map<String, AnswerCandidate> resolveWithAi(List<String> questions) {
        AnswerGenerator generator = answerGenerator.getIfAvailable();
        if (generator == null) {
            log.info("[Resolver] AI collaborator not configured, {} questions stay unanswered", questions.size());
            return Map.of();
        }

        try {
            String reply = generator.sendBatchPrompt(learnedStore.profileJson(), questions);
            return batchAnswerParser.parse(reply, questions);
        } catch (RuntimeException e) {
            log.warn("[Resolver] AI batch call failed, treating as no answers: {}", e.getMessage());
            return Map.of();
        }
    }
}
