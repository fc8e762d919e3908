package com.example.routing.classifier;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.example.routing.model.IntentCategory;

import static org.junit.jupiter.api.Assertions.*;

class LlmResponseParserTest {

    private final LlmResponseParser parser = new LlmResponseParser();

    @Test
    void parsesStrictJson() {
        var parsed = parser.parse("""
            {"intent_category": "incident", "sub_intent": "etl_failure",
             "confidence": 0.92, "reasoning": "ETL job failed"}
            """);

        assertEquals(LlmResponseParser.Strategy.STRICT, parsed.strategy());
        assertEquals(IntentCategory.INCIDENT, parsed.result().category());
        assertEquals("etl_failure", parsed.result().subIntent());
        assertEquals(0.92, parsed.result().confidence(), 1e-9);
        assertEquals("ETL job failed", parsed.result().reasoning());
    }

    @Test
    void stripsMarkdownFences() {
        var parsed = parser.parse("""
            ```json
            {"intent_category": "request", "sub_intent": "access_request", "confidence": 0.8}
            ```
            """);

        assertEquals(LlmResponseParser.Strategy.STRICT, parsed.strategy());
        assertEquals(IntentCategory.REQUEST, parsed.result().category());
        assertEquals("access_request", parsed.result().subIntent());
    }

    @Test
    void extractsObjectEmbeddedInProse() {
        var parsed = parser.parse(
            "Here is the result: {\"intent_category\": \"change\", \"confidence\": 0.7, "
                + "\"reasoning\": \"uses {braces} inside\"} hope it helps");

        assertEquals(LlmResponseParser.Strategy.EMBEDDED, parsed.strategy());
        assertEquals(IntentCategory.CHANGE, parsed.result().category());
        assertNull(parsed.result().subIntent());
        assertEquals("uses {braces} inside", parsed.result().reasoning());
    }

    @Test
    void fallsBackToKeywordsWithCappedConfidence() {
        var parsed = parser.parse("I think this is an incident about the ETL job");

        assertEquals(LlmResponseParser.Strategy.KEYWORD, parsed.strategy());
        assertEquals(IntentCategory.INCIDENT, parsed.result().category());
        assertEquals("etl_failure", parsed.result().subIntent());
        assertEquals(LlmResponseParser.UNSTRUCTURED_CONFIDENCE_CAP, parsed.result().confidence(), 1e-9);
    }

    @Test
    void unusableOutputIsUnknownWithZeroConfidence() {
        var parsed = parser.parse("no idea");

        assertEquals(IntentCategory.UNKNOWN, parsed.result().category());
        assertEquals(0.0, parsed.result().confidence());
    }

    @Test
    void normalizesCategoryConfidenceAndNullSubIntent() {
        var parsed = parser.parse("""
            {"category": " Incident ", "sub_intent": "null", "confidence": 1.7}
            """);

        assertEquals(IntentCategory.INCIDENT, parsed.result().category());
        assertNull(parsed.result().subIntent());
        assertEquals(1.0, parsed.result().confidence());
    }

    @Test
    void unknownCategoryNameBecomesUnknown() {
        var parsed = parser.parse("{\"intent_category\": \"complaint\", \"confidence\": 0.9}");

        assertEquals(IntentCategory.UNKNOWN, parsed.result().category());
    }

    @Test
    void readsCompletenessBlock() {
        var parsed = parser.parse("""
            {"intent_category": "incident", "confidence": 0.8,
             "completeness": {"is_complete": false, "completeness_score": 0.33,
                              "missing_fields": ["urgency", "affected_system"]}}
            """);

        var completeness = parsed.result().completeness();
        assertNotNull(completeness);
        assertFalse(completeness.isComplete());
        assertEquals(0.33, completeness.completenessScore(), 1e-9);
        assertEquals(List.of("urgency", "affected_system"), completeness.missingFields());
    }

    @Test
    void embeddedObjectExtractionHonoursStrings() {
        assertEquals("{\"a\": \"}\"}", LlmResponseParser.extractEmbeddedObject("x {\"a\": \"}\"} y"));
        assertNull(LlmResponseParser.extractEmbeddedObject("no braces here"));
        assertNull(LlmResponseParser.extractEmbeddedObject("{ unbalanced"));
    }
}
