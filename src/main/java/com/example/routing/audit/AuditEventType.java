package com.example.routing.audit;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AuditEventType {
    ROUTING_DECISION("routing_decision"),
    PATTERN_MATCH("pattern_match"),
    LAYER_ESCALATION("layer_escalation"),
    DIALOG_TURN("dialog_turn"),
    RISK_ASSESSMENT("risk_assessment"),
    APPROVAL_REQUESTED("approval_requested"),
    ERROR("error");

    private final String value;

    AuditEventType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
