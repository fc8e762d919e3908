package com.example.routing.gateway;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SourceType {
    USER("user"),
    SERVICENOW("servicenow"),
    PROMETHEUS("prometheus"),
    API("api"),
    UNKNOWN("unknown");

    private final String value;

    SourceType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /** Machine sources are served from static mappings and never reach the classifier cascade. */
    public boolean isMachineSource() {
        return this == SERVICENOW || this == PROMETHEUS;
    }

    @JsonCreator
    public static SourceType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        String normalized = raw.strip().toLowerCase(Locale.ROOT);
        for (SourceType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
