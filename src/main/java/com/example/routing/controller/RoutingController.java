package com.example.routing.controller;

import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import com.example.routing.gateway.IncomingRequest;
import com.example.routing.gateway.InputGateway;
import com.example.routing.gateway.SourceType;
import com.example.routing.model.RoutingDecision;
import com.example.routing.pipeline.TriagePipeline;
import com.example.routing.pipeline.TriageResult;
import com.example.routing.risk.AssessmentContext;
import com.example.routing.router.BusinessIntentRouter;
import com.fasterxml.jackson.annotation.JsonProperty;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
public class RoutingController {

    private final BusinessIntentRouter router;
    private final InputGateway gateway;
    private final TriagePipeline pipeline;

    public RoutingController(BusinessIntentRouter router, InputGateway gateway, TriagePipeline pipeline) {
        this.router = router;
        this.gateway = gateway;
        this.pipeline = pipeline;
    }

    public record RouteRequest(String text) {}

    public record TriageRequest(
        String text,
        Map<String, Object> payload,
        Map<String, String> headers,
        @JsonProperty("source_type") String sourceType,
        AssessmentContext context
    ) {}

    @PostMapping("/api/route")
    public Mono<RoutingDecision> route(@RequestBody RouteRequest request) {
        if (request.text() == null || request.text().isBlank()) {
            return Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST, "Text cannot be empty"));
        }
        return Mono.fromCallable(() -> router.route(request.text()))
            .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/api/triage")
    public Mono<TriageResult> triage(@RequestBody TriageRequest request) {
        IncomingRequest incoming = new IncomingRequest(request.text(), SourceType.fromString(request.sourceType()),
            request.payload(), request.headers(), null, null);
        return pipeline.process(incoming, request.context());
    }

    @PostMapping("/api/webhooks/servicenow")
    public Mono<RoutingDecision> serviceNow(@RequestBody Map<String, Object> payload) {
        return Mono.fromCallable(() -> gateway.process(IncomingRequest.fromServiceNow(payload)))
            .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/api/webhooks/alertmanager")
    public Mono<RoutingDecision> alertmanager(@RequestBody Map<String, Object> payload) {
        return Mono.fromCallable(() -> gateway.process(IncomingRequest.fromPrometheus(payload)))
            .subscribeOn(Schedulers.boundedElastic());
    }
}
