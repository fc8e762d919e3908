package com.example.routing.completeness;

import java.util.List;

import com.example.routing.model.IntentCategory;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CompletenessRule(
    @JsonProperty("category") IntentCategory category,
    @JsonProperty("threshold") double threshold,
    @JsonProperty("minimum_length") int minimumLength,
    @JsonProperty("description") String description,
    @JsonProperty("suggestion_template") String suggestionTemplate,
    @JsonProperty("required_fields") List<FieldDefinition> requiredFields,
    @JsonProperty("optional_fields") List<FieldDefinition> optionalFields
) {

    public static final String FIELD_PLACEHOLDER = "{field_name}";

    public CompletenessRule {
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be between 0.0 and 1.0, was " + threshold);
        }
        description = description != null ? description : "";
        suggestionTemplate = suggestionTemplate != null ? suggestionTemplate : "請提供" + FIELD_PLACEHOLDER;
        requiredFields = requiredFields == null ? List.of() : List.copyOf(requiredFields);
        optionalFields = optionalFields == null ? List.of() : List.copyOf(optionalFields);
    }

    public CompletenessRule withThreshold(double newThreshold) {
        return new CompletenessRule(category, newThreshold, minimumLength, description, suggestionTemplate,
            requiredFields, optionalFields);
    }

    public String suggestionFor(FieldDefinition field) {
        return suggestionTemplate.replace(FIELD_PLACEHOLDER, field.displayName());
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RuleFile(@JsonProperty("version") String version, @JsonProperty("rules") List<CompletenessRule> rules) {
        public RuleFile {
            rules = rules == null ? List.of() : List.copyOf(rules);
        }
    }
}
