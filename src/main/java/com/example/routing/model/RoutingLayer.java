package com.example.routing.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of producers a {@link RoutingDecision} can come from.
 */
public enum RoutingLayer {
    PATTERN("pattern"),
    SEMANTIC("semantic"),
    LLM("llm"),
    NONE("none"),
    SERVICENOW_MAPPING("servicenow_mapping"),
    PROMETHEUS_MAPPING("prometheus_mapping"),
    USER_INPUT("user_input"),
    DIALOG("dialog"),
    ERROR("error");

    private final String value;

    RoutingLayer(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static RoutingLayer fromString(String raw) {
        for (RoutingLayer layer : values()) {
            if (layer.value.equalsIgnoreCase(raw)) {
                return layer;
            }
        }
        throw new IllegalArgumentException("Unknown routing layer: " + raw);
    }
}
