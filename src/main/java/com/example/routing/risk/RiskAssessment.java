package com.example.routing.risk;

import java.time.Instant;
import java.util.List;

import com.example.routing.model.RiskLevel;
import com.fasterxml.jackson.annotation.JsonProperty;

public record RiskAssessment(
    @JsonProperty("level") RiskLevel level,
    @JsonProperty("score") double score,
    @JsonProperty("requires_approval") boolean requiresApproval,
    @JsonProperty("approval_type") ApprovalType approvalType,
    @JsonProperty("factors") List<RiskFactor> factors,
    @JsonProperty("reasoning") String reasoning,
    @JsonProperty("policy_id") String policyId,
    @JsonProperty("adjustments_applied") List<String> adjustmentsApplied,
    @JsonProperty("timestamp") Instant timestamp
) {

    public RiskAssessment {
        if (score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("score must be between 0.0 and 1.0, got " + score);
        }
        approvalType = approvalType != null ? approvalType : ApprovalType.NONE;
        factors = factors == null ? List.of() : List.copyOf(factors);
        reasoning = reasoning != null ? reasoning : "";
        adjustmentsApplied = adjustmentsApplied == null ? List.of() : List.copyOf(adjustmentsApplied);
        timestamp = timestamp != null ? timestamp : Instant.now();
    }
}
