package com.example.routing.model;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum IntentCategory {
    INCIDENT("incident"),
    REQUEST("request"),
    CHANGE("change"),
    QUERY("query"),
    UNKNOWN("unknown");

    private final String value;

    IntentCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Lenient parse used for rule tables, LLM output and wire input.
     * Anything unrecognised becomes {@link #UNKNOWN}.
     */
    @JsonCreator
    public static IntentCategory fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        String normalized = raw.strip().toLowerCase(Locale.ROOT);
        for (IntentCategory category : values()) {
            if (category.value.equals(normalized)) {
                return category;
            }
        }
        return UNKNOWN;
    }
}
