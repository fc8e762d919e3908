package com.example.routing.completeness;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record FieldDefinition(
    @JsonProperty("name") String name,
    @JsonProperty("display_name") String displayName,
    @JsonProperty("description") String description,
    @JsonProperty("keywords") List<String> keywords,
    @JsonProperty("patterns") List<String> patterns,
    @JsonProperty("examples") List<String> examples
) {

    public FieldDefinition {
        displayName = displayName != null ? displayName : name;
        description = description != null ? description : "";
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        patterns = patterns == null ? List.of() : List.copyOf(patterns);
        examples = examples == null ? List.of() : List.copyOf(examples);
    }
}
