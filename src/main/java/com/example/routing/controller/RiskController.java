package com.example.routing.controller;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import com.example.routing.model.RoutingDecision;
import com.example.routing.risk.AssessmentContext;
import com.example.routing.risk.RiskAssessment;
import com.example.routing.risk.RiskAssessor;

import reactor.core.publisher.Mono;

@RestController
public class RiskController {

    private final RiskAssessor riskAssessor;

    public RiskController(RiskAssessor riskAssessor) {
        this.riskAssessor = riskAssessor;
    }

    public record AssessRequest(RoutingDecision decision, AssessmentContext context) {}

    @PostMapping("/api/risk/assess")
    public Mono<RiskAssessment> assess(@RequestBody AssessRequest request) {
        if (request.decision() == null) {
            return Mono.error(new ResponseStatusException(HttpStatus.BAD_REQUEST, "Decision is required"));
        }
        return Mono.fromCallable(() -> riskAssessor.assess(request.decision(), request.context()));
    }
}
