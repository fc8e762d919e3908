package com.example.routing.controller;

import java.util.Map;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import com.example.routing.pattern.PatternMatcher;
import com.example.routing.semantic.SemanticRouter;

import reactor.core.publisher.Mono;

@RestController
public class HealthController {

    private final PatternMatcher patternMatcher;
    private final SemanticRouter semanticRouter;

    public HealthController(PatternMatcher patternMatcher, SemanticRouter semanticRouter) {
        this.patternMatcher = patternMatcher;
        this.semanticRouter = semanticRouter;
    }

    @GetMapping("/api/health")
    public Mono<Map<String, Object>> health() {
        return Mono.just(Map.of(
            "status", "ok",
            "service", "itsm-intent-router",
            "pattern_rules", patternMatcher.rules().size(),
            "semantic_routes", semanticRouter.routes().size(),
            "semantic_backend", semanticRouter.backend()
        ));
    }
}
