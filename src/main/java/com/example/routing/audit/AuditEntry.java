package com.example.routing.audit;

import java.time.Instant;
import java.util.Map;

import com.example.routing.model.RoutingDecision;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.ALWAYS)
public record AuditEntry(
    @JsonProperty("correlation_id") String correlationId,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("event_type") AuditEventType eventType,
    @JsonProperty("user_input") String userInput,
    @JsonProperty("routing_decision") RoutingDecision routingDecision,
    @JsonProperty("layer") String layer,
    @JsonProperty("processing_time_ms") double processingTimeMs,
    @JsonProperty("metadata") Map<String, Object> metadata
) {

    public AuditEntry {
        timestamp = timestamp != null ? timestamp : Instant.now();
        userInput = userInput != null ? userInput : "";
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
