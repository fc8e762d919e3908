package com.example.routing.risk;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ApprovalType {
    NONE("none"),
    SINGLE("single"),
    MULTI("multi");

    private final String value;

    ApprovalType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /** Strict: policy files with an unknown approval type are rejected. */
    @JsonCreator
    public static ApprovalType fromString(String raw) {
        if (raw == null) {
            return NONE;
        }
        String normalized = raw.strip().toLowerCase(Locale.ROOT);
        for (ApprovalType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("approval_type must be one of none, single, multi: " + raw);
    }
}
