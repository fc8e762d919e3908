package com.example.routing.llm;

import java.util.Map;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PricingTest {

    @Test
    void calculateCostUnknownModelUsesFallback() {
        var pricing = Pricing.fallbackOnly();
        // fallback rates are $3.0 input and $15.0 output per million tokens
        double cost = pricing.calculateCost("unknown-model", 1000, 500);
        assertEquals(0.0105, cost, 0.0001);
    }

    @Test
    void hasModelReturnsFalseWhenNotLoaded() {
        assertFalse(Pricing.fallbackOnly().hasModel("gpt-4.1"));
        assertFalse(Pricing.fallbackOnly().hasModel(null));
    }

    @Test
    void versionedModelResolvesToLongestPricedPrefix() {
        var pricing = new Pricing(Map.of(
            "gpt-4.1", new Pricing.ModelPricing("openai", 2.0, 8.0),
            "gpt-4.1-mini", new Pricing.ModelPricing("openai", 0.4, 1.6)));

        assertEquals(0.4, pricing.calculateCost("gpt-4.1-mini-2025-04-14", 1_000_000, 0), 1e-9);
        assertEquals(2.0, pricing.calculateCost("gpt-4.1-2025-04-14", 1_000_000, 0), 1e-9);
        assertTrue(pricing.hasModel("gpt-4.1-mini"));
    }

    @Test
    void loadsBundledPricingWhenNoFileGiven() {
        var pricing = Pricing.load("does/not/exist.json");

        assertTrue(pricing.hasModel("claude-3-5-haiku-20241022"));
        assertEquals(0.0, pricing.calculateCost("llama3.1", 5000, 5000));
    }
}
