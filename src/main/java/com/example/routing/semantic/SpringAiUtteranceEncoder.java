package com.example.routing.semantic;

import java.time.Duration;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Encoder backed by whichever Spring AI {@link EmbeddingModel} is configured.
 * The call runs on the bounded elastic scheduler so the timeout can cancel it;
 * an interrupted caller disposes the in-flight call as well.
 */
public class SpringAiUtteranceEncoder implements UtteranceEncoder {

    private static final Logger log = LoggerFactory.getLogger(SpringAiUtteranceEncoder.class);

    private final EmbeddingModel embeddingModel;
    private final Duration timeout;

    public SpringAiUtteranceEncoder(EmbeddingModel embeddingModel, Duration timeout) {
        this.embeddingModel = embeddingModel;
        this.timeout = timeout;
    }

    @Override
    public List<float[]> encode(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        List<float[]> vectors = Mono.fromCallable(() -> embeddingModel.embed(texts))
            .subscribeOn(Schedulers.boundedElastic())
            .timeout(timeout)
            .doOnError(e -> log.warn("Embedding call failed for {} texts: {}", texts.size(), e.toString()))
            .block();
        if (vectors == null || vectors.size() != texts.size()) {
            throw new IllegalStateException("Embedding service returned "
                + (vectors == null ? 0 : vectors.size()) + " vectors for " + texts.size() + " texts");
        }
        return vectors;
    }
}
