package com.example.routing.dialog;

import java.util.List;

import com.example.routing.model.IntentCategory;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RefinementRule(
    @JsonProperty("id") String id,
    @JsonProperty("category") IntentCategory category,
    @JsonProperty("from_sub_intent") String fromSubIntent,
    @JsonProperty("to_sub_intent") String toSubIntent,
    @JsonProperty("conditions") List<RefinementCondition> conditions,
    @JsonProperty("description") String description,
    @JsonProperty("priority") Integer priority,
    @JsonProperty("enabled") Boolean enabled
) {

    public static final String WILDCARD = "*";

    public RefinementRule {
        fromSubIntent = fromSubIntent == null || fromSubIntent.isBlank() ? WILDCARD : fromSubIntent;
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
        description = description != null ? description : "";
        priority = priority != null ? priority : 100;
        enabled = enabled == null || enabled;
    }

    public boolean appliesTo(String currentSubIntent) {
        return WILDCARD.equals(fromSubIntent) || fromSubIntent.equals(currentSubIntent);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RuleFile(@JsonProperty("version") String version, @JsonProperty("rules") List<RefinementRule> rules) {
        public RuleFile {
            rules = rules == null ? List.of() : List.copyOf(rules);
        }
    }
}
