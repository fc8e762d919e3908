package com.example.routing.risk;

import java.util.List;
import java.util.Map;

import com.example.routing.model.IntentCategory;
import com.example.routing.model.RiskLevel;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RiskPolicy(
    @JsonProperty("id") String id,
    @JsonProperty("category") IntentCategory category,
    @JsonProperty("sub_intent") String subIntent,
    @JsonProperty("default_risk_level") RiskLevel defaultRiskLevel,
    @JsonProperty("requires_approval") boolean requiresApproval,
    @JsonProperty("approval_type") ApprovalType approvalType,
    @JsonProperty("factors") List<String> factors,
    @JsonProperty("description") String description,
    @JsonProperty("enabled") Boolean enabled,
    @JsonProperty("priority") Integer priority
) {

    public static final String WILDCARD = "*";
    public static final int DEFAULT_PRIORITY = 100;

    public RiskPolicy {
        category = category != null ? category : IntentCategory.UNKNOWN;
        subIntent = subIntent == null || subIntent.isBlank() ? WILDCARD : subIntent;
        defaultRiskLevel = defaultRiskLevel != null ? defaultRiskLevel : RiskLevel.MEDIUM;
        approvalType = approvalType != null ? approvalType : ApprovalType.NONE;
        factors = factors == null ? List.of() : List.copyOf(factors);
        description = description != null ? description : "";
        enabled = enabled == null || enabled;
        priority = priority != null ? priority : DEFAULT_PRIORITY;
    }

    public String key() {
        return key(category, subIntent);
    }

    static String key(IntentCategory category, String subIntent) {
        return category.value() + ":" + (subIntent == null || subIntent.isBlank() ? WILDCARD : subIntent);
    }

    /** The policy every lookup falls back to. */
    public static RiskPolicy globalDefault() {
        return new RiskPolicy("global_default", IntentCategory.UNKNOWN, WILDCARD, RiskLevel.MEDIUM,
            false, ApprovalType.NONE, List.of(), "Global fallback policy", true, 0);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PolicyFile(
        @JsonProperty("version") String version,
        @JsonProperty("global_default") RiskPolicy globalDefault,
        @JsonProperty("policies") List<RiskPolicy> policies,
        @JsonProperty("presets") Map<String, List<RiskPolicy>> presets
    ) {
        public PolicyFile {
            policies = policies == null ? List.of() : List.copyOf(policies);
            presets = presets == null ? Map.of() : Map.copyOf(presets);
        }
    }
}
