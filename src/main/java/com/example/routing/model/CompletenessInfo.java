package com.example.routing.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CompletenessInfo(
    @JsonProperty("is_complete") boolean isComplete,
    @JsonProperty("completeness_score") double completenessScore,
    @JsonProperty("missing_fields") List<String> missingFields,
    @JsonProperty("optional_missing") List<String> optionalMissing,
    @JsonProperty("suggestions") List<String> suggestions
) {

    public CompletenessInfo {
        completenessScore = Scores.clamp(completenessScore);
        missingFields = missingFields == null ? List.of() : List.copyOf(missingFields);
        optionalMissing = optionalMissing == null ? List.of() : List.copyOf(optionalMissing);
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    public static CompletenessInfo complete() {
        return new CompletenessInfo(true, 1.0, List.of(), List.of(), List.of());
    }

    public static CompletenessInfo incomplete() {
        return new CompletenessInfo(false, 0.0, List.of(), List.of(), List.of());
    }
}
