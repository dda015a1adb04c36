package com.formpilot.infrastructure.ai;

public class AiAnswerException extends RuntimeException {

    public AiAnswerException(String message) {
        super(message);
    }

    public AiAnswerException(String message, Throwable cause) {
        super(message, cause);
    }
}
