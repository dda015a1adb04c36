package com.formpilot.infrastructure.ai;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * OpenAI client for the AI resolution tier. Absent when disabled or when no API key is set,
 * in which case unresolved questions are simply left unanswered.
 */
@Configuration
@ConditionalOnExpression(OpenAiConfig.AI_ENABLED)
public class OpenAiConfig {

    static final String AI_ENABLED = "${openai.enabled:true} and '${openai.api-key:}' != ''";

    @Value("${openai.api-key}")
    private String apiKey;

    @Value("${openai.timeout:30s}")
    private Duration timeout;

    @Bean
    public OpenAIClient openAIClient() {
        return OpenAIOkHttpClient.builder()
                .apiKey(apiKey)
                .timeout(timeout)
                .build();
    }
}
