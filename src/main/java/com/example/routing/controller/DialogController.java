package com.example.routing.controller;

import java.util.Map;
import java.util.UUID;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import com.example.routing.dialog.DialogResponse;
import com.example.routing.dialog.DialogSessionManager;
import com.fasterxml.jackson.annotation.JsonProperty;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
public class DialogController {

    private final DialogSessionManager sessions;

    public DialogController(DialogSessionManager sessions) {
        this.sessions = sessions;
    }

    public record DialogRequest(String text) {}

    public record DialogTurnResponse(
        @JsonProperty("conversation_id") String conversationId,
        @JsonProperty("response") DialogResponse response
    ) {}

    @PostMapping("/api/dialog")
    public Mono<DialogTurnResponse> start(@RequestBody DialogRequest request) {
        if (request.text() == null || request.text().isBlank()) {
            return Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST, "Text cannot be empty"));
        }
        String conversationId = UUID.randomUUID().toString();
        return Mono.fromCallable(() -> new DialogTurnResponse(conversationId,
                sessions.start(conversationId, request.text())))
            .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/api/dialog/{id}/responses")
    public Mono<DialogTurnResponse> respond(@PathVariable String id, @RequestBody DialogRequest request) {
        return Mono.fromCallable(() -> new DialogTurnResponse(id, sessions.respond(id, request.text())))
            .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/api/dialog/{id}")
    public Mono<Map<String, Object>> summary(@PathVariable String id) {
        return Mono.fromCallable(() -> sessions.summary(id));
    }

    @DeleteMapping("/api/dialog/{id}")
    public Mono<ResponseEntity<Void>> reset(@PathVariable String id) {
        return Mono.fromCallable(() -> sessions.reset(id)
            ? ResponseEntity.noContent().<Void>build()
            : ResponseEntity.notFound().<Void>build());
    }
}
