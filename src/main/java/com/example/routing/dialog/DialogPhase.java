package com.example.routing.dialog;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DialogPhase {
    INITIAL("initial"),
    GATHERING("gathering"),
    COMPLETE("complete"),
    HANDOFF("handoff"),
    CLARIFICATION("clarification");

    private final String value;

    DialogPhase(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /** No further responses are accepted once a dialog reaches a terminal phase. */
    public boolean isTerminal() {
        return this == COMPLETE || this == HANDOFF;
    }
}
