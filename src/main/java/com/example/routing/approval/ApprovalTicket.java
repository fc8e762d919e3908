package com.example.routing.approval;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ApprovalTicket(
    @JsonProperty("request_id") String requestId,
    @JsonProperty("status") ApprovalStatus status,
    @JsonProperty("approval_type") String approvalType,
    @JsonProperty("expires_at") Instant expiresAt
) {}
