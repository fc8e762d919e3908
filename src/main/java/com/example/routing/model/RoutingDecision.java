package com.example.routing.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The authoritative output of the routing core. Immutable; dialog turns and
 * the gateway derive new instances through {@link #toBuilder()}.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonIgnoreProperties(ignoreUnknown = true)
public record RoutingDecision(
    @JsonProperty("intent_category") IntentCategory intentCategory,
    @JsonProperty("sub_intent") String subIntent,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("workflow_type") WorkflowType workflowType,
    @JsonProperty("risk_level") RiskLevel riskLevel,
    @JsonProperty("completeness") CompletenessInfo completeness,
    @JsonProperty("routing_layer") RoutingLayer routingLayer,
    @JsonProperty("rule_id") String ruleId,
    @JsonProperty("reasoning") String reasoning,
    @JsonProperty("metadata") Map<String, Object> metadata,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("processing_time_ms") double processingTimeMs
) {

    public RoutingDecision {
        intentCategory = intentCategory != null ? intentCategory : IntentCategory.UNKNOWN;
        confidence = Scores.clamp(confidence);
        workflowType = workflowType != null ? workflowType : WorkflowType.HANDOFF;
        riskLevel = riskLevel != null ? riskLevel : RiskLevel.MEDIUM;
        completeness = completeness != null ? completeness : CompletenessInfo.incomplete();
        routingLayer = routingLayer != null ? routingLayer : RoutingLayer.NONE;
        reasoning = reasoning != null ? reasoning : "";
        metadata = metadata == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        timestamp = timestamp != null ? timestamp : Instant.now();
        processingTimeMs = Math.max(0.0, processingTimeMs);
    }

    public boolean requiresApproval() {
        return riskLevel.atLeast(RiskLevel.HIGH);
    }

    public static RoutingDecision emptyInput() {
        return builder()
            .intentCategory(IntentCategory.UNKNOWN)
            .confidence(0.0)
            .workflowType(WorkflowType.HANDOFF)
            .riskLevel(RiskLevel.MEDIUM)
            .completeness(CompletenessInfo.incomplete())
            .routingLayer(RoutingLayer.NONE)
            .reasoning("Empty or invalid input")
            .build();
    }

    public static RoutingDecision unclassified(String reasoning) {
        return builder()
            .intentCategory(IntentCategory.UNKNOWN)
            .confidence(0.0)
            .workflowType(WorkflowType.HANDOFF)
            .riskLevel(RiskLevel.MEDIUM)
            .completeness(CompletenessInfo.incomplete())
            .routingLayer(RoutingLayer.NONE)
            .reasoning(reasoning)
            .build();
    }

    public static RoutingDecision error(String reasoning, Map<String, Object> metadata) {
        return builder()
            .intentCategory(IntentCategory.UNKNOWN)
            .confidence(0.0)
            .workflowType(WorkflowType.HANDOFF)
            .riskLevel(RiskLevel.MEDIUM)
            .completeness(CompletenessInfo.incomplete())
            .routingLayer(RoutingLayer.ERROR)
            .reasoning(reasoning)
            .metadata(metadata)
            .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .intentCategory(intentCategory)
            .subIntent(subIntent)
            .confidence(confidence)
            .workflowType(workflowType)
            .riskLevel(riskLevel)
            .completeness(completeness)
            .routingLayer(routingLayer)
            .ruleId(ruleId)
            .reasoning(reasoning)
            .metadata(metadata)
            .timestamp(timestamp)
            .processingTimeMs(processingTimeMs);
    }

    public static final class Builder {
        private IntentCategory intentCategory;
        private String subIntent;
        private double confidence;
        private WorkflowType workflowType;
        private RiskLevel riskLevel;
        private CompletenessInfo completeness;
        private RoutingLayer routingLayer;
        private String ruleId;
        private String reasoning;
        private final Map<String, Object> metadata = new LinkedHashMap<>();
        private Instant timestamp;
        private double processingTimeMs;

        private Builder() {}

        public Builder intentCategory(IntentCategory intentCategory) {
            this.intentCategory = intentCategory;
            return this;
        }

        public Builder subIntent(String subIntent) {
            this.subIntent = subIntent;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder workflowType(WorkflowType workflowType) {
            this.workflowType = workflowType;
            return this;
        }

        public Builder riskLevel(RiskLevel riskLevel) {
            this.riskLevel = riskLevel;
            return this;
        }

        public Builder completeness(CompletenessInfo completeness) {
            this.completeness = completeness;
            return this;
        }

        public Builder routingLayer(RoutingLayer routingLayer) {
            this.routingLayer = routingLayer;
            return this;
        }

        public Builder ruleId(String ruleId) {
            this.ruleId = ruleId;
            return this;
        }

        public Builder reasoning(String reasoning) {
            this.reasoning = reasoning;
            return this;
        }

        /** Replaces the metadata map. */
        public Builder metadata(Map<String, Object> metadata) {
            this.metadata.clear();
            if (metadata != null) {
                this.metadata.putAll(metadata);
            }
            return this;
        }

        /** Adds a single entry; null values are dropped. */
        public Builder putMetadata(String key, Object value) {
            if (value != null) {
                this.metadata.put(key, value);
            }
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder processingTimeMs(double processingTimeMs) {
            this.processingTimeMs = processingTimeMs;
            return this;
        }

        public RoutingDecision build() {
            return new RoutingDecision(intentCategory, subIntent, confidence, workflowType, riskLevel,
                completeness, routingLayer, ruleId, reasoning, metadata, timestamp, processingTimeMs);
        }
    }
}
