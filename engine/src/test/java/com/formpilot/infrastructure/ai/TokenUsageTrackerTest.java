package com.formpilot.infrastructure.ai;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TokenUsageTrackerTest {

    @Test
    @DisplayName("Usage accumulates across batches")
    void accumulates() {
        TokenUsageTracker tracker = new TokenUsageTracker();
        tracker.recordUsage(2, 400, 20);
        tracker.recordUsage(3, 600, 30);

        assertThat(tracker.getTotalRequests()).isEqualTo(2);
        assertThat(tracker.getTotalCompletionTokens()).isEqualTo(50);
        assertThat(tracker.getAveragePromptTokensPerQuestion()).isEqualTo(200.0);
    }

    @Test
    @DisplayName("Average is zero before any batch")
    void emptyAverage() {
        assertThat(new TokenUsageTracker().getAveragePromptTokensPerQuestion()).isZero();
    }
}
