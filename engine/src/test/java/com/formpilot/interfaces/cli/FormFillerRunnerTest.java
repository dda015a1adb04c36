package com.formpilot.interfaces.cli;

import com.formpilot.application.formfill.PageOrchestrator;
import com.formpilot.domain.form.model.PageGate;
import com.formpilot.domain.form.model.SessionReport;
import com.formpilot.infrastructure.ai.TokenUsageTracker;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FormFillerRunnerTest {

    @Mock
    private PageOrchestrator orchestrator;

    @Mock
    private TokenUsageTracker usageTracker;

    private final SessionReport report = new SessionReport(2, 5, 3, 0, PageGate.DONE, "no questions on page");

    @Test
    @DisplayName("Runs one session and reports AI usage when batches were sent")
    void reportsUsage() {
        when(orchestrator.run()).thenReturn(report);
        when(usageTracker.getTotalRequests()).thenReturn(2L);
        when(usageTracker.getTotalCompletionTokens()).thenReturn(80L);

        new FormFillerRunner(orchestrator, usageTracker).run();

        verify(orchestrator).run();
        verify(usageTracker).getTotalCompletionTokens();
    }

    @Test
    @DisplayName("No AI line when no batch was sent")
    void noUsage() {
        when(orchestrator.run()).thenReturn(report);
        when(usageTracker.getTotalRequests()).thenReturn(0L);

        new FormFillerRunner(orchestrator, usageTracker).run();

        verify(usageTracker, never()).getTotalCompletionTokens();
    }
}
