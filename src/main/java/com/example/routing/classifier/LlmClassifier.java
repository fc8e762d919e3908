package com.example.routing.classifier;

/**
 * Layer 3 of the cascade. Never throws: transport and parse failures come back
 * as UNKNOWN with confidence 0 and a reasoning that names the failure.
 */
public interface LlmClassifier {

    default LlmClassificationResult classify(String text) {
        return classify(text, false);
    }

    LlmClassificationResult classify(String text, boolean includeCompleteness);

    String name();
}
