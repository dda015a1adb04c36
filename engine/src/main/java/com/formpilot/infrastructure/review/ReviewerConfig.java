package com.formpilot.infrastructure.review;

import com.formpilot.domain.form.service.Reviewer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the reviewer by {@code form-filler.review.mode}: console, auto-accept or auto-decline.
 */
@Slf4j
@Configuration
public class ReviewerConfig {

    @Value("${form-filler.review.mode:console}")
    private String mode;

    @Bean
    public Reviewer reviewer() {
        log.info("[Review] Reviewer mode: {}", mode);
        return switch (mode) {
            case "auto-accept" -> Reviewer.AUTO_ACCEPT;
            case "auto-decline" -> Reviewer.AUTO_DECLINE;
            case "console" -> new ConsoleReviewer(System.in, System.out);
            default -> throw new IllegalStateException("Unknown form-filler.review.mode: " + mode);
        };
    }
}
