package com.example.routing.classifier;

import com.example.routing.model.CompletenessInfo;
import com.example.routing.model.IntentCategory;
import com.example.routing.model.Scores;

/**
 * Layer 3 output. {@code completeness} is only present when the model was
 * asked for it and returned a usable block; {@code errorType} is set when the
 * call failed and the result is a stand-in UNKNOWN.
 */
public record LlmClassificationResult(
    IntentCategory category,
    String subIntent,
    double confidence,
    String reasoning,
    CompletenessInfo completeness,
    String model,
    int inputTokens,
    int outputTokens,
    double costUsd,
    String errorType
) {

    public LlmClassificationResult {
        category = category != null ? category : IntentCategory.UNKNOWN;
        confidence = Scores.clamp(confidence);
        reasoning = reasoning != null ? reasoning : "";
    }

    public static LlmClassificationResult of(IntentCategory category, String subIntent, double confidence,
                                             String reasoning) {
        return new LlmClassificationResult(category, subIntent, confidence, reasoning, null, null, 0, 0, 0.0, null);
    }

    public static LlmClassificationResult failure(String errorType, String reasoning) {
        return new LlmClassificationResult(IntentCategory.UNKNOWN, null, 0.0, reasoning, null, null, 0, 0, 0.0,
            errorType);
    }

    public boolean failed() {
        return errorType != null;
    }

    public LlmClassificationResult withUsage(String model, int inputTokens, int outputTokens, double costUsd) {
        return new LlmClassificationResult(category, subIntent, confidence, reasoning, completeness,
            model, inputTokens, outputTokens, costUsd, errorType);
    }
}
