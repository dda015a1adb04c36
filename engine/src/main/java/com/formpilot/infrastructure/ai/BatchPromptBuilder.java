package com.formpilot.infrastructure.ai;

import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class BatchPromptBuilder {

    public static final String SENTINEL = "DATA_NOT_AVAILABLE";

    private static final String SYSTEM_PROMPT = """
            You are a form-filling assistant. You answer web form questions strictly from the \
            user's profile data. You never guess and never invent data.""";

    private static final String INSTRUCTIONS = """
            INSTRUCTIONS:
            1. Look through ALL sections of the profile data
            2. For each question, if you find relevant information, provide ONLY the answer value
            3. If NO relevant information exists for a question, respond EXACTLY with: %s
            4. Use semantic matching (e.g., "Student Name" can use "full_name")
            5. DO NOT make assumptions or guess
            6. DO NOT hallucinate data
            7. Return answers in this exact format, one line per question, in order:
            Q1: [answer to question 1]
            Q2: [answer to question 2]
            Q3: [answer to question 3]
            etc.""".formatted(SENTINEL);

    public String getSystemPrompt() {
        return SYSTEM_PROMPT;
    }

    /**
     * Build the user message for one batch: profile data, numbered questions, output rules.
     *
     * @param profileDocumentJson serialized profile document
     * @param questions           unresolved questions, numbered from 1 in list order
     */
    public String buildBatchUserMessage(String profileDocumentJson, List<String> questions) {
        StringBuilder sb = new StringBuilder();
        sb.append("Based on the user's profile data, answer ALL these questions.\n\n");

        sb.append("USER PROFILE DATA:\n");
        sb.append(profileDocumentJson).append("\n\n");

        sb.append("QUESTIONS:\n");
        for (int i = 0; i < questions.size(); i++) {
            sb.append(i + 1).append(". ").append(questions.get(i)).append("\n");
        }
        sb.append("\n");

        sb.append(INSTRUCTIONS).append("\n\n");
        sb.append("Answers:");
        return sb.toString();
    }
}
