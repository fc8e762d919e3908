package com.example.routing.llm;

/**
 * Every provider failed for one request. {@link #errorType()} is one of the
 * buckets produced by {@code LlmService.classifyError}.
 */
public class LlmUnavailableException extends RuntimeException {

    private final String errorType;

    public LlmUnavailableException(String errorType, Throwable cause) {
        super("All LLM providers failed (" + errorType + ")"
            + (cause != null && cause.getMessage() != null ? ": " + cause.getMessage() : ""), cause);
        this.errorType = errorType;
    }

    public String errorType() {
        return errorType;
    }
}
