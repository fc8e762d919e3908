package com.example.routing.dialog;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

public record GeneratedQuestion(
    @JsonProperty("question") String question,
    @JsonProperty("target_field") String targetField,
    @JsonProperty("priority") int priority,
    @JsonProperty("examples") List<String> examples
) {

    public GeneratedQuestion {
        examples = examples == null ? List.of() : List.copyOf(examples);
    }
}
