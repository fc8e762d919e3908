package com.example.routing.dialog;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DialogResponse(
    @JsonProperty("message") String message,
    @JsonProperty("questions") List<GeneratedQuestion> questions,
    @JsonProperty("state") DialogState state,
    @JsonProperty("should_continue") boolean shouldContinue,
    @JsonProperty("next_action") String nextAction
) {

    public DialogResponse {
        questions = questions == null ? List.of() : List.copyOf(questions);
    }

    public DialogPhase phase() {
        return state.phase();
    }
}
