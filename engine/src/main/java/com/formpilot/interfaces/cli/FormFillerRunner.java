package com.formpilot.interfaces.cli;

import com.formpilot.application.formfill.PageOrchestrator;
import com.formpilot.domain.form.model.SessionReport;
import com.formpilot.infrastructure.ai.TokenUsageTracker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "form-filler.runner.enabled", havingValue = "true", matchIfMissing = true)
public class FormFillerRunner implements CommandLineRunner {

    private final PageOrchestrator orchestrator;
    private final TokenUsageTracker usageTracker;

    @Override
    public void run(String... args) {
        log.info("Form filler started, open a form in the attached browser");
        SessionReport report = orchestrator.run();
        log.info("Pages: {}, filled: {}, learned: {}, declined: {} ({})",
                report.pagesProcessed(), report.fieldsFilled(), report.itemsSaved(),
                report.pagesDeclined(), report.stopReason());
        if (usageTracker.getTotalRequests() > 0) {
            log.info("AI batches: {}, completion tokens: {}",
                    usageTracker.getTotalRequests(), usageTracker.getTotalCompletionTokens());
        }
    }
}
