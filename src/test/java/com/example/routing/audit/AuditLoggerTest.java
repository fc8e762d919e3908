package com.example.routing.audit;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.example.routing.filter.PiiFilter;
import com.example.routing.model.IntentCategory;
import com.example.routing.model.RoutingDecision;
import com.example.routing.model.RoutingLayer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import static org.junit.jupiter.api.Assertions.*;

class AuditLoggerTest {

    private final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();

    private AuditLogger logger(int capacity) {
        return new AuditLogger(new PiiFilter(), mapper, capacity);
    }

    @Test
    void decisionEntryCarriesLayerAndDecision() {
        AuditLogger logger = logger(10);
        RoutingDecision decision = RoutingDecision.builder()
            .intentCategory(IntentCategory.INCIDENT)
            .subIntent("etl_failure")
            .routingLayer(RoutingLayer.PATTERN)
            .processingTimeMs(1.5)
            .build();

        logger.logDecision("req-1", "ETL failed", decision);

        AuditEntry entry = logger.recent(1).get(0);
        assertEquals("req-1", entry.correlationId());
        assertEquals(AuditEventType.ROUTING_DECISION, entry.eventType());
        assertEquals("pattern", entry.layer());
        assertEquals(1.5, entry.processingTimeMs());
        assertSame(decision, entry.routingDecision());
    }

    @Test
    void userInputIsScrubbedAndTruncated() {
        AuditLogger logger = logger(10);
        String input = "mail john@example.com " + "x".repeat(500);

        logger.logEscalation("req-2", input, "pattern", "semantic", 0.4);

        String stored = logger.recent(1).get(0).userInput();
        assertTrue(stored.startsWith("mail [EMAIL] "), stored);
        assertFalse(stored.contains("john@example.com"));
        assertTrue(stored.length() <= AuditLogger.MAX_INPUT_LENGTH + 3, "length " + stored.length());
    }

    @Test
    void bufferEvictsOldestEntryAtCapacity() {
        AuditLogger logger = logger(2);

        logger.logPatternMatch("a", "one", "r1", 0.9, true);
        logger.logPatternMatch("b", "two", "r2", 0.8, true);
        logger.logPatternMatch("c", "three", null, 0.0, false);

        assertEquals(2, logger.size());
        assertTrue(logger.byCorrelationId("a").isEmpty());
        assertEquals(List.of("c", "b"), logger.recent(5).stream().map(AuditEntry::correlationId).toList());
    }

    @Test
    void patternMatchMetadataOmitsMissingRuleId() {
        AuditLogger logger = logger(10);

        logger.logPatternMatch("a", "text", null, 0.0, false);

        AuditEntry entry = logger.recent(1).get(0);
        assertFalse(entry.metadata().containsKey("rule_id"));
        assertEquals(Boolean.FALSE, entry.metadata().get("accepted"));
    }

    @Test
    void errorEntryRecordsTypeAndMessage() {
        AuditLogger logger = logger(10);

        logger.logError("req-3", "input", "llm", new IllegalStateException());

        AuditEntry entry = logger.byCorrelationId("req-3").get(0);
        assertEquals(AuditEventType.ERROR, entry.eventType());
        assertEquals("IllegalStateException", entry.metadata().get("error_type"));
        assertEquals("", entry.metadata().get("error_message"));
    }

    @Test
    void entrySerializesWithSnakeCaseKeys() throws Exception {
        AuditEntry entry = new AuditEntry("req-4", null, AuditEventType.RISK_ASSESSMENT, null, null, "risk", 0.0,
            null);

        JsonNode json = mapper.readTree(mapper.writeValueAsString(entry));

        assertEquals("req-4", json.get("correlation_id").asText());
        assertEquals("risk_assessment", json.get("event_type").asText());
        assertEquals("", json.get("user_input").asText());
        assertTrue(json.get("routing_decision").isNull());
        assertTrue(json.get("metadata").isObject());
    }
}
