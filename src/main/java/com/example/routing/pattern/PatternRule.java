package com.example.routing.pattern;

import java.util.List;

import com.example.routing.model.IntentCategory;
import com.example.routing.model.RiskLevel;
import com.example.routing.model.WorkflowType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record PatternRule(
    @JsonProperty("id") String id,
    @JsonProperty("category") IntentCategory category,
    @JsonProperty("sub_intent") String subIntent,
    @JsonProperty("patterns") List<String> patterns,
    @JsonProperty("priority") int priority,
    @JsonProperty("workflow_type") WorkflowType workflowType,
    @JsonProperty("risk_level") RiskLevel riskLevel,
    @JsonProperty("description") String description,
    @JsonProperty("enabled") Boolean enabled
) {

    public PatternRule {
        category = category != null ? category : IntentCategory.UNKNOWN;
        patterns = patterns == null ? List.of() : List.copyOf(patterns);
        description = description != null ? description : "";
        enabled = enabled == null || enabled;
    }

    /** Rule file layout: {@code rules: [...]}. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RuleFile(@JsonProperty("version") String version, @JsonProperty("rules") List<PatternRule> rules) {
        public RuleFile {
            rules = rules == null ? List.of() : List.copyOf(rules);
        }
    }
}
