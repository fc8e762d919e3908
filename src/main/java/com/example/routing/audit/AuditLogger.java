package com.example.routing.audit;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import com.example.routing.filter.PiiFilter;
import com.example.routing.model.RoutingDecision;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Append-only audit trail. Each entry is written as one JSON line to the
 * {@code AUDIT} logger and kept in a bounded in-memory buffer for the admin
 * API. Routing never reads entries back.
 */
public class AuditLogger {

    private static final Logger log = LoggerFactory.getLogger(AuditLogger.class);
    private static final Logger audit = LoggerFactory.getLogger("AUDIT");

    public static final int MAX_INPUT_LENGTH = 200;
    public static final String MDC_CORRELATION_ID = "correlation_id";

    private final PiiFilter piiFilter;
    private final ObjectMapper objectMapper;
    private final int capacity;
    private final Deque<AuditEntry> buffer;

    public AuditLogger(PiiFilter piiFilter, ObjectMapper objectMapper, int capacity) {
        this.piiFilter = piiFilter;
        this.objectMapper = objectMapper;
        this.capacity = Math.max(1, capacity);
        this.buffer = new ArrayDeque<>(this.capacity);
    }

    public void logDecision(String correlationId, String userInput, RoutingDecision decision) {
        record(correlationId, AuditEventType.ROUTING_DECISION, userInput, decision,
            decision.routingLayer().value(), decision.processingTimeMs(), Map.of());
    }

    public void logPatternMatch(String correlationId, String userInput, String ruleId, double confidence,
                                boolean accepted) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (ruleId != null) {
            metadata.put("rule_id", ruleId);
        }
        metadata.put("confidence", confidence);
        metadata.put("accepted", accepted);
        record(correlationId, AuditEventType.PATTERN_MATCH, userInput, null, "pattern", 0.0, metadata);
    }

    public void logEscalation(String correlationId, String userInput, String fromLayer, String toLayer,
                              double observedScore) {
        record(correlationId, AuditEventType.LAYER_ESCALATION, userInput, null, fromLayer, 0.0,
            Map.of("from_layer", fromLayer, "to_layer", toLayer, "observed_score", observedScore));
    }

    public void logError(String correlationId, String userInput, String layer, Throwable error) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("error_type", error.getClass().getSimpleName());
        metadata.put("error_message", error.getMessage() != null ? error.getMessage() : "");
        record(correlationId, AuditEventType.ERROR, userInput, null, layer, 0.0, metadata);
    }

    public void record(String correlationId, AuditEventType eventType, String userInput,
                       RoutingDecision decision, String layer, double processingTimeMs,
                       Map<String, Object> metadata) {
        AuditEntry entry = new AuditEntry(correlationId, Instant.now(), eventType,
            piiFilter.scrubAndTruncate(userInput, MAX_INPUT_LENGTH), decision, layer, processingTimeMs, metadata);

        synchronized (buffer) {
            if (buffer.size() >= capacity) {
                buffer.pollFirst();
            }
            buffer.addLast(entry);
        }
        write(entry);
    }

    /** Most recent entries, newest first. */
    public List<AuditEntry> recent(int limit) {
        List<AuditEntry> result = new ArrayList<>();
        synchronized (buffer) {
            var it = buffer.descendingIterator();
            while (it.hasNext() && result.size() < limit) {
                result.add(it.next());
            }
        }
        return result;
    }

    public List<AuditEntry> byCorrelationId(String correlationId) {
        List<AuditEntry> result = new ArrayList<>();
        synchronized (buffer) {
            for (AuditEntry entry : buffer) {
                if (entry.correlationId() != null && entry.correlationId().equals(correlationId)) {
                    result.add(entry);
                }
            }
        }
        return result;
    }

    public int size() {
        synchronized (buffer) {
            return buffer.size();
        }
    }

    private void write(AuditEntry entry) {
        if (!audit.isInfoEnabled()) {
            return;
        }
        String previous = MDC.get(MDC_CORRELATION_ID);
        try {
            if (entry.correlationId() != null) {
                MDC.put(MDC_CORRELATION_ID, entry.correlationId());
            }
            audit.info(objectMapper.writeValueAsString(entry));
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize audit entry {} for {}: {}",
                entry.eventType().value(), entry.correlationId(), e.getMessage());
        } finally {
            if (previous != null) {
                MDC.put(MDC_CORRELATION_ID, previous);
            } else {
                MDC.remove(MDC_CORRELATION_ID);
            }
        }
    }
}
