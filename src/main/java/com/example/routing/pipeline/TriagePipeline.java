package com.example.routing.pipeline;

import java.time.Duration;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.routing.approval.ApprovalGate;
import com.example.routing.approval.ApprovalRequest;
import com.example.routing.approval.ApprovalTicket;
import com.example.routing.audit.AuditEventType;
import com.example.routing.audit.AuditLogger;
import com.example.routing.gateway.IncomingRequest;
import com.example.routing.gateway.InputGateway;
import com.example.routing.model.RoutingDecision;
import com.example.routing.risk.AssessmentContext;
import com.example.routing.risk.RiskAssessment;
import com.example.routing.risk.RiskAssessor;
import com.example.routing.telemetry.RoutingMetrics;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * End-to-end handling of one request: gateway, risk assessment, and an
 * approval request when the assessed risk calls for one.
 */
public class TriagePipeline {

    private static final Logger log = LoggerFactory.getLogger(TriagePipeline.class);

    private final InputGateway gateway;
    private final RiskAssessor riskAssessor;
    private final ApprovalGate approvalGate;
    private final RoutingMetrics metrics;
    private final AuditLogger auditLogger;
    private final Duration approvalTimeout;
    private final Tracer tracer;

    public TriagePipeline(
        InputGateway gateway,
        RiskAssessor riskAssessor,
        ApprovalGate approvalGate,
        RoutingMetrics metrics,
        AuditLogger auditLogger,
        Duration approvalTimeout,
        OpenTelemetry openTelemetry
    ) {
        this.gateway = gateway;
        this.riskAssessor = riskAssessor;
        this.approvalGate = approvalGate;
        this.metrics = metrics;
        this.auditLogger = auditLogger;
        this.approvalTimeout = approvalTimeout;
        this.tracer = openTelemetry.getTracer("itsm-intent-router");
    }

    public Mono<TriageResult> process(IncomingRequest request, AssessmentContext context) {
        return Mono.fromCallable(() -> run(request, context))
            .subscribeOn(Schedulers.boundedElastic());
    }

    TriageResult run(IncomingRequest request, AssessmentContext context) {
        long startNanos = System.nanoTime();
        Span span = tracer.spanBuilder("triage")
            .setAttribute("routing.request_id", request.requestId())
            .startSpan();

        try (Scope ignored = span.makeCurrent()) {
            // 1. Identify source and decide
            RoutingDecision decision = gateway.process(request);
            span.setAttribute("routing.intent", decision.intentCategory().value());
            span.setAttribute("routing.layer", decision.routingLayer().value());

            // 2. Assess risk
            RiskAssessment assessment = riskAssessor.assess(decision, context);
            auditLogger.record(request.requestId(), AuditEventType.RISK_ASSESSMENT, request.content(), decision,
                "risk", 0.0, Map.of(
                    "risk_level", assessment.level().value(),
                    "score", assessment.score(),
                    "policy_id", assessment.policyId()));

            // 3. Gate on approval
            ApprovalTicket ticket = null;
            if (assessment.requiresApproval()) {
                String requester = context != null && context.userRole() != null ? context.userRole() : null;
                ticket = approvalGate.submit(ApprovalRequest.of(request.requestId(), decision, assessment,
                    requester, approvalTimeout));
                metrics.recordApprovalRequest(assessment.level().value(), assessment.approvalType().value());
                auditLogger.record(request.requestId(), AuditEventType.APPROVAL_REQUESTED, request.content(),
                    decision, "approval", 0.0, Map.of(
                        "approval_request_id", ticket.requestId(),
                        "approval_type", ticket.approvalType()));
            }
            span.setAttribute("routing.risk_level", assessment.level().value());
            span.setAttribute("routing.requires_approval", assessment.requiresApproval());

            double elapsedMs = (System.nanoTime() - startNanos) / 1_000_000.0;
            log.info("Triage complete: request={} intent={}/{} risk={} approval={}",
                request.requestId(), decision.intentCategory().value(), decision.subIntent(),
                assessment.level().value(), ticket != null ? ticket.requestId() : "none");
            return new TriageResult(request.requestId(), decision, assessment, ticket, elapsedMs);

        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            log.error("Triage failed for request {}: {}", request.requestId(), e.getMessage());
            throw e;

        } finally {
            span.end();
        }
    }
}
