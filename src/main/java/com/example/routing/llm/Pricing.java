package com.example.routing.llm;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-million-token prices used to attach a cost to LLM-classified decisions.
 * Versioned model names ("gpt-4.1-mini-2025-04-14") resolve to their longest
 * priced prefix.
 */
public class Pricing {

    private static final Logger log = LoggerFactory.getLogger(Pricing.class);
    private static final double FALLBACK_INPUT = 3.0;
    private static final double FALLBACK_OUTPUT = 15.0;
    private static final double PER_MILLION = 1_000_000.0;

    private final Map<String, ModelPricing> models;

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PricingFile(String version, Map<String, ModelPricing> models) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ModelPricing(String provider, double input, double output) {}

    Pricing(Map<String, ModelPricing> models) {
        this.models = Map.copyOf(models);
    }

    public static Pricing fallbackOnly() {
        return new Pricing(Map.of());
    }

    /** Loads from {@code pricingFile} when it exists, else from classpath {@code pricing.json}. */
    public static Pricing load(String pricingFile) {
        var objectMapper = new ObjectMapper();
        try {
            InputStream stream;
            if (pricingFile != null && Files.exists(Path.of(pricingFile))) {
                stream = Files.newInputStream(Path.of(pricingFile));
                log.info("Loading pricing from {}", pricingFile);
            } else {
                stream = Pricing.class.getClassLoader().getResourceAsStream("pricing.json");
                if (stream == null) {
                    log.warn("No pricing.json found, using fallback pricing");
                    return fallbackOnly();
                }
            }
            try (stream) {
                var file = objectMapper.readValue(stream, PricingFile.class);
                Map<String, ModelPricing> loaded = file.models() != null ? file.models() : Map.of();
                log.info("Loaded pricing v{} with {} models", file.version(), loaded.size());
                return new Pricing(loaded);
            }
        } catch (IOException e) {
            log.warn("Failed to load pricing: {}", e.getMessage());
            return fallbackOnly();
        }
    }

    public double calculateCost(String model, int inputTokens, int outputTokens) {
        var pricing = resolve(model);
        double inputRate = pricing != null ? pricing.input() : FALLBACK_INPUT;
        double outputRate = pricing != null ? pricing.output() : FALLBACK_OUTPUT;
        return (inputTokens * inputRate + outputTokens * outputRate) / PER_MILLION;
    }

    public boolean hasModel(String model) {
        return resolve(model) != null;
    }

    private ModelPricing resolve(String model) {
        if (model == null) {
            return null;
        }
        var exact = models.get(model);
        if (exact != null) {
            return exact;
        }
        return models.entrySet().stream()
            .filter(e -> model.startsWith(e.getKey()))
            .max(Comparator.comparingInt(e -> e.getKey().length()))
            .map(Map.Entry::getValue)
            .orElse(null);
    }
}
