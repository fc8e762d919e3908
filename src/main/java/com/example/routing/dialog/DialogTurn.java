package com.example.routing.dialog;

import java.time.Instant;
import java.util.Locale;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

public record DialogTurn(
    @JsonProperty("role") Role role,
    @JsonProperty("content") String content,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("extracted") Map<String, String> extracted,
    @JsonProperty("context_snapshot") Map<String, String> contextSnapshot
) {

    public enum Role {
        USER, ASSISTANT;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public DialogTurn {
        content = content != null ? content : "";
        extracted = extracted == null ? Map.of() : Map.copyOf(extracted);
        contextSnapshot = contextSnapshot == null ? Map.of() : Map.copyOf(contextSnapshot);
    }
}
