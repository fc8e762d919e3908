package com.example.routing.dialog;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One field test of a refinement rule. {@code fieldValue} is a regex when
 * {@code isPattern}, a {@code |}-separated keyword list when {@code matchAny},
 * otherwise a single keyword. Keyword tests are case-insensitive containment.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RefinementCondition(
    @JsonProperty("field_name") String fieldName,
    @JsonProperty("field_value") String fieldValue,
    @JsonProperty("is_pattern") boolean isPattern,
    @JsonProperty("match_any") boolean matchAny
) {

    public RefinementCondition {
        if (fieldName == null || fieldName.isBlank()) {
            throw new IllegalArgumentException("field_name is required");
        }
        fieldValue = fieldValue != null ? fieldValue : "";
    }
}
