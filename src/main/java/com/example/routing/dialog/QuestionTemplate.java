package com.example.routing.dialog;

import java.util.List;

import com.example.routing.model.IntentCategory;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** A question for one field. A null category marks a general template. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record QuestionTemplate(
    @JsonProperty("field_name") String fieldName,
    @JsonProperty("category") IntentCategory category,
    @JsonProperty("question") String question,
    @JsonProperty("priority") int priority,
    @JsonProperty("examples") List<String> examples,
    @JsonProperty("follow_up") List<String> followUp
) {

    public QuestionTemplate {
        if (fieldName == null || fieldName.isBlank()) {
            throw new IllegalArgumentException("field_name is required");
        }
        if (question == null || question.isBlank()) {
            throw new IllegalArgumentException("question is required for field " + fieldName);
        }
        examples = examples == null ? List.of() : List.copyOf(examples);
        followUp = followUp == null ? List.of() : List.copyOf(followUp);
    }

    public boolean isGeneral() {
        return category == null;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TemplateFile(
        @JsonProperty("version") String version,
        @JsonProperty("templates") List<QuestionTemplate> templates
    ) {
        public TemplateFile {
            templates = templates == null ? List.of() : List.copyOf(templates);
        }
    }
}
