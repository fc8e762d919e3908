package com.example.routing.dialog;

import java.time.Instant;
import java.util.List;

import com.example.routing.model.RoutingDecision;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Immutable view of a dialog after a turn. */
public record DialogState(
    @JsonProperty("phase") DialogPhase phase,
    @JsonProperty("routing_decision") RoutingDecision routingDecision,
    @JsonProperty("questions") List<GeneratedQuestion> questions,
    @JsonProperty("is_complete") boolean isComplete,
    @JsonProperty("turn_count") int turnCount,
    @JsonProperty("started_at") Instant startedAt
) {

    public DialogState {
        questions = questions == null ? List.of() : List.copyOf(questions);
    }
}
