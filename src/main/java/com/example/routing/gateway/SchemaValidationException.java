package com.example.routing.gateway;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Raised for malformed machine payloads, only when strict validation is enabled. */
public class SchemaValidationException extends RuntimeException {

    public record FieldError(@JsonProperty("field") String field, @JsonProperty("message") String message) {}

    private final SourceType source;
    private final List<FieldError> errors;

    public SchemaValidationException(SourceType source, List<FieldError> errors) {
        super("Invalid " + source.value() + " payload: " + describe(errors));
        this.source = source;
        this.errors = List.copyOf(errors);
    }

    public SourceType source() {
        return source;
    }

    public List<FieldError> errors() {
        return errors;
    }

    private static String describe(List<FieldError> errors) {
        StringBuilder sb = new StringBuilder();
        for (FieldError error : errors) {
            if (sb.length() > 0) {
                sb.append("; ");
            }
            sb.append(error.field()).append(": ").append(error.message());
        }
        return sb.toString();
    }
}
