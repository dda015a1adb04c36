package com.formpilot.infrastructure.ai;

import com.formpilot.domain.form.service.AnswerGenerator;
import com.openai.client.OpenAIClient;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Batch answer generation through the OpenAI chat completions API.
 * The client timeout bounds the call; any failure surfaces as {@link AiAnswerException}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnExpression(OpenAiConfig.AI_ENABLED)
public class OpenAiAnswerGenerator implements AnswerGenerator {

    private final OpenAIClient openAIClient;
    private final BatchPromptBuilder promptBuilder;
    private final TokenUsageTracker usageTracker;

    @Value("${openai.model:gpt-4o-mini}")
    private String model;

    @Value("${openai.temperature:0.0}")
    private double temperature;

    @Value("${openai.max-tokens:800}")
    private int maxTokens;

    @Override
    public String sendBatchPrompt(String profileDocumentJson, List<String> questions) {
        String userMessage = promptBuilder.buildBatchUserMessage(profileDocumentJson, questions);
        log.info("Batch AI call - model: {}, questions: {}, promptLength: {}",
                model, questions.size(), userMessage.length());

        try {
            ChatCompletionCreateParams params = ChatCompletionCreateParams.builder()
                    .model(model)
                    .temperature(temperature)
                    .maxCompletionTokens(maxTokens)
                    .addSystemMessage(promptBuilder.getSystemPrompt())
                    .addUserMessage(userMessage)
                    .build();

            ChatCompletion completion = openAIClient.chat().completions().create(params);

            completion.usage().ifPresent(usage ->
                    usageTracker.recordUsage(questions.size(), usage.promptTokens(), usage.completionTokens()));

            String content = completion.choices().stream()
                    .findFirst()
                    .flatMap(choice -> choice.message().content())
                    .orElseThrow(() -> new AiAnswerException("OpenAI reply has no content"));

            return content.trim();
        } catch (AiAnswerException e) {
            throw e;
        } catch (Exception e) {
            log.error("OpenAI batch call failed [{}]", model, e);
            throw new AiAnswerException("AI answer service is temporarily unavailable", e);
        }
    }
}
