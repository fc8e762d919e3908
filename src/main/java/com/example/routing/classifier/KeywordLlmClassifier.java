package com.example.routing.classifier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.routing.model.IntentCategory;

/**
 * Deterministic stand-in for the model-backed classifier. Used in tests and
 * when no chat model is configured.
 */
public class KeywordLlmClassifier implements LlmClassifier {

    private static final Logger log = LoggerFactory.getLogger(KeywordLlmClassifier.class);

    public static final String NAME = "keyword";

    @Override
    public LlmClassificationResult classify(String text, boolean includeCompleteness) {
        KeywordIntentInference.Inference inference = KeywordIntentInference.infer(text);
        if (inference.category() == IntentCategory.UNKNOWN) {
            return LlmClassificationResult.of(IntentCategory.UNKNOWN, null, 0.0,
                "No classification keywords found");
        }
        log.debug("Keyword classification: {}/{} hits={}",
            inference.category(), inference.subIntent(), inference.hits());
        return LlmClassificationResult.of(inference.category(), inference.subIntent(), inference.confidence(),
            "Keyword classification matched " + String.join(", ", inference.hits()))
            .withUsage(NAME, 0, 0, 0.0);
    }

    @Override
    public String name() {
        return NAME;
    }
}
