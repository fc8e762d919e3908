package com.example.routing.model;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum WorkflowType {
    SIMPLE("simple"),
    SEQUENTIAL("sequential"),
    CONCURRENT("concurrent"),
    MAGENTIC("magentic"),
    HANDOFF("handoff");

    private final String value;

    WorkflowType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static WorkflowType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return SIMPLE;
        }
        String normalized = raw.strip().toLowerCase(Locale.ROOT);
        for (WorkflowType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        return SIMPLE;
    }
}
