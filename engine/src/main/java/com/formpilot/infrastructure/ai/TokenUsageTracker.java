package com.formpilot.infrastructure.ai;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

@Slf4j
@Component
public class TokenUsageTracker {

    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong totalPromptTokens = new AtomicLong();
    private final AtomicLong totalCompletionTokens = new AtomicLong();
    private final AtomicLong totalQuestions = new AtomicLong();

    public void recordUsage(int questionCount, long promptTokens, long completionTokens) {
        totalRequests.incrementAndGet();
        totalQuestions.addAndGet(questionCount);
        totalPromptTokens.addAndGet(promptTokens);
        totalCompletionTokens.addAndGet(completionTokens);

        log.info("AI usage - batch #{}: questions={}, promptTokens={}, completionTokens={}, " +
                        "cumulative: questions={}, promptTokens={}, avgPromptTokensPerQuestion={}",
                totalRequests.get(), questionCount, promptTokens, completionTokens,
                totalQuestions.get(), totalPromptTokens.get(),
                String.format("%.1f", getAveragePromptTokensPerQuestion()));
    }

    public long getTotalRequests() {
        return totalRequests.get();
    }

    public long getTotalCompletionTokens() {
        return totalCompletionTokens.get();
    }

    public double getAveragePromptTokensPerQuestion() {
        long questions = totalQuestions.get();
        return questions > 0 ? (double) totalPromptTokens.get() / questions : 0;
    }
}
