package com.example.routing.pipeline;

import com.example.routing.approval.ApprovalTicket;
import com.example.routing.model.RoutingDecision;
import com.example.routing.risk.RiskAssessment;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Decision, risk and (when required) the approval ticket for one request. */
public record TriageResult(
    @JsonProperty("request_id") String requestId,
    @JsonProperty("routing_decision") RoutingDecision routingDecision,
    @JsonProperty("risk_assessment") RiskAssessment riskAssessment,
    @JsonProperty("approval") ApprovalTicket approval,
    @JsonProperty("processing_time_ms") double processingTimeMs
) {

    public boolean awaitingApproval() {
        return approval != null;
    }
}
