package com.example.routing.gateway;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.routing.audit.AuditLogger;
import com.example.routing.model.RoutingDecision;
import com.example.routing.telemetry.GatewayMetrics;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

/**
 * Single entry point for every request. Identifies the source, dispatches to
 * its handler and stamps gateway metadata on the result. Always returns a
 * decision; the only exception that escapes is a strict-mode
 * {@link SchemaValidationException}.
 */
public class InputGateway {

    private static final Logger log = LoggerFactory.getLogger(InputGateway.class);

    private final Map<SourceType, SourceHandler> handlers;
    private final SourceType defaultSource;
    private final GatewayMetrics metrics;
    private final AuditLogger auditLogger;
    private final Tracer tracer;

    public InputGateway(List<SourceHandler> handlers, SourceType defaultSource, GatewayMetrics metrics,
                        AuditLogger auditLogger, OpenTelemetry openTelemetry) {
        Map<SourceType, SourceHandler> table = new EnumMap<>(SourceType.class);
        for (SourceHandler handler : handlers) {
            table.put(handler.sourceType(), handler);
        }
        if (!table.containsKey(defaultSource)) {
            throw new IllegalArgumentException("No handler registered for default source " + defaultSource.value());
        }
        this.handlers = table;
        this.defaultSource = defaultSource;
        this.metrics = metrics;
        this.auditLogger = auditLogger;
        this.tracer = openTelemetry.getTracer("itsm-intent-router");
    }

    public RoutingDecision process(IncomingRequest request) {
        long start = System.nanoTime();
        SourceType source = identifySource(request);
        SourceHandler handler = handlers.getOrDefault(source, handlers.get(defaultSource));

        Span span = tracer.spanBuilder("gateway_process")
            .setAttribute("routing.stage", "gateway")
            .setAttribute("gateway.source", source.value())
            .setAttribute("gateway.request_id", request.requestId())
            .startSpan();

        try (Scope ignored = span.makeCurrent()) {
            RoutingDecision decision = handler.process(request);
            double latencyMs = elapsedMs(start);
            RoutingDecision enriched = decision.toBuilder()
                .putMetadata("source", source.value())
                .putMetadata("request_id", request.requestId())
                .putMetadata("gateway_latency_ms", latencyMs)
                .build();

            metrics.recordRequest(source.value(), handler.fastPath(), latencyMs);
            if (handler.fastPath()) {
                // The router audits its own decisions; fast-path ones are recorded here.
                auditLogger.logDecision(request.requestId(), request.content(), enriched);
            }
            span.setAttribute("routing.layer", enriched.routingLayer().value());
            span.setAttribute("routing.intent", enriched.intentCategory().value());
            return enriched;

        } catch (SchemaValidationException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            metrics.recordError(source.value(), "schema_validation");
            auditLogger.logError(request.requestId(), request.content(), "gateway", e);
            throw e;

        } catch (RuntimeException e) {
            log.error("Gateway failed for {} request {}: {}", source.value(), request.requestId(), e.getMessage(), e);
            span.setStatus(StatusCode.ERROR, e.getMessage());
            metrics.recordError(source.value(), e.getClass().getSimpleName());
            auditLogger.logError(request.requestId(), request.content(), "gateway", e);
            return RoutingDecision.error("Gateway processing failed: " + e.getMessage(), Map.of(
                "error_type", e.getClass().getSimpleName(),
                "source", source.value(),
                "request_id", request.requestId()));

        } finally {
            span.end();
        }
    }

    /** Marker headers first, then the declared source type, then the configured default. */
    public SourceType identifySource(IncomingRequest request) {
        if (request.hasHeader(IncomingRequest.SERVICENOW_HEADER)) {
            return SourceType.SERVICENOW;
        }
        if (request.hasHeader(IncomingRequest.ALERTMANAGER_HEADER)) {
            return SourceType.PROMETHEUS;
        }
        if (request.sourceType() != SourceType.UNKNOWN) {
            return request.sourceType();
        }
        return defaultSource;
    }

    public GatewayMetrics.Snapshot metrics() {
        return metrics.snapshot();
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }
}
