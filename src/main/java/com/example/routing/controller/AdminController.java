package com.example.routing.controller;

import java.util.List;
import java.util.Map;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.example.routing.audit.AuditEntry;
import com.example.routing.audit.AuditLogger;
import com.example.routing.config.RuleReloadService;
import com.example.routing.dialog.DialogSessionManager;
import com.example.routing.gateway.InputGateway;
import com.example.routing.router.BusinessIntentRouter;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
public class AdminController {

    private static final int MAX_AUDIT_LIMIT = 1000;

    private final BusinessIntentRouter router;
    private final InputGateway gateway;
    private final DialogSessionManager sessions;
    private final AuditLogger auditLogger;
    private final RuleReloadService reloadService;

    public AdminController(BusinessIntentRouter router, InputGateway gateway, DialogSessionManager sessions,
                           AuditLogger auditLogger, RuleReloadService reloadService) {
        this.router = router;
        this.gateway = gateway;
        this.sessions = sessions;
        this.auditLogger = auditLogger;
        this.reloadService = reloadService;
    }

    @GetMapping("/api/metrics/routing")
    public Mono<Map<String, Object>> metrics() {
        return Mono.just(Map.of(
            "routing", router.metrics(),
            "gateway", gateway.metrics(),
            "active_dialogs", sessions.activeSessions()
        ));
    }

    @GetMapping("/api/audit")
    public Mono<List<AuditEntry>> audit(@RequestParam(defaultValue = "50") int limit) {
        return Mono.just(auditLogger.recent(Math.max(1, Math.min(limit, MAX_AUDIT_LIMIT))));
    }

    @PostMapping("/api/admin/reload")
    public Mono<Map<String, Object>> reload() {
        return Mono.fromCallable(() -> Map.<String, Object>of("status", "reloaded", "counts",
                reloadService.reloadAll()))
            .subscribeOn(Schedulers.boundedElastic());
    }
}
