package com.example.routing.approval;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.example.routing.model.RoutingDecision;
import com.example.routing.risk.ApprovalType;
import com.example.routing.risk.RiskAssessment;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * What the approval gate receives when a routed request needs human sign-off.
 */
public record ApprovalRequest(
    @JsonProperty("request_id") String requestId,
    @JsonProperty("correlation_id") String correlationId,
    @JsonProperty("routing_decision") RoutingDecision routingDecision,
    @JsonProperty("risk_assessment") RiskAssessment riskAssessment,
    @JsonProperty("requester") String requester,
    @JsonProperty("approval_type") ApprovalType approvalType,
    @JsonProperty("approvers") List<String> approvers,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("expires_at") Instant expiresAt,
    @JsonProperty("metadata") Map<String, Object> metadata
) {

    public ApprovalRequest {
        approvers = approvers == null ? List.of() : List.copyOf(approvers);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static ApprovalRequest of(String correlationId, RoutingDecision decision, RiskAssessment assessment,
                                     String requester, Duration timeout) {
        Instant now = Instant.now();
        return new ApprovalRequest(UUID.randomUUID().toString(), correlationId, decision, assessment,
            requester != null ? requester : "anonymous", assessment.approvalType(), List.of(), now,
            now.plus(timeout), Map.of());
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }
}
