package com.example.routing.router;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.routing.audit.AuditLogger;
import com.example.routing.classifier.LlmClassificationResult;
import com.example.routing.classifier.LlmClassifier;
import com.example.routing.completeness.CompletenessChecker;
import com.example.routing.config.RouterProperties;
import com.example.routing.model.CompletenessInfo;
import com.example.routing.model.IntentCategory;
import com.example.routing.model.RiskLevel;
import com.example.routing.model.RoutingDecision;
import com.example.routing.model.RoutingLayer;
import com.example.routing.model.Scores;
import com.example.routing.model.WorkflowType;
import com.example.routing.pattern.PatternMatchResult;
import com.example.routing.pattern.PatternMatcher;
import com.example.routing.semantic.SemanticRouteResult;
import com.example.routing.semantic.SemanticRouter;
import com.example.routing.telemetry.RoutingMetrics;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

/**
 * Three-layer cascade: pattern rules, then semantic similarity, then the LLM
 * classifier. The first layer whose score clears its threshold wins and later
 * layers are never invoked.
 */
public class BusinessIntentRouter {

    private static final Logger log = LoggerFactory.getLogger(BusinessIntentRouter.class);

    private static final List<String> CRITICAL_KEYWORDS = List.of("緊急", "嚴重", "critical", "urgent", "停機", "當機");
    private static final List<String> HIGH_KEYWORDS = List.of("影響", "生產", "無法", "業務", "客戶");
    private static final List<String> HIGH_CHANGE_KEYWORDS = List.of("生產", "資料庫");

    private static final List<String> MAGENTIC_INCIDENTS = List.of("system_down", "system_unavailable",
        "security_incident");
    private static final List<String> MAGENTIC_CHANGES = List.of("release_deployment", "database_change");

    public record Settings(
        double patternThreshold,
        double semanticThreshold,
        boolean enableLlmFallback,
        boolean enableCompleteness,
        boolean trackLatency
    ) {
        public static Settings defaults() {
            return new Settings(0.90, 0.85, true, true, true);
        }

        public static Settings from(RouterProperties props) {
            return new Settings(props.patternThreshold(), props.semanticThreshold(), props.enableLlmFallback(),
                props.enableCompleteness(), props.trackLatency());
        }
    }

    private final PatternMatcher patternMatcher;
    private final SemanticRouter semanticRouter;
    private final LlmClassifier llmClassifier;
    private final CompletenessChecker completenessChecker;
    private final Settings settings;
    private final RoutingMetrics metrics;
    private final AuditLogger auditLogger;
    private final Tracer tracer;

    public BusinessIntentRouter(
        PatternMatcher patternMatcher,
        SemanticRouter semanticRouter,
        LlmClassifier llmClassifier,
        CompletenessChecker completenessChecker,
        Settings settings,
        RoutingMetrics metrics,
        AuditLogger auditLogger,
        OpenTelemetry openTelemetry
    ) {
        this.patternMatcher = patternMatcher;
        this.semanticRouter = semanticRouter;
        this.llmClassifier = llmClassifier;
        this.completenessChecker = completenessChecker;
        this.settings = settings;
        this.metrics = metrics;
        this.auditLogger = auditLogger;
        this.tracer = openTelemetry.getTracer("itsm-intent-router");
    }

    public RoutingDecision route(String text) {
        return route(text, UUID.randomUUID().toString());
    }

    public RoutingDecision route(String text, String correlationId) {
        long start = System.nanoTime();

        if (text == null || text.isBlank()) {
            RoutingDecision empty = RoutingDecision.emptyInput().toBuilder()
                .processingTimeMs(elapsedMs(start))
                .build();
            record(correlationId, text, empty);
            return empty;
        }

        String input = text.strip();
        Span span = tracer.spanBuilder("route_intent")
            .setAttribute("routing.stage", "route")
            .setAttribute("routing.correlation_id", correlationId)
            .setAttribute("routing.input_length", (long) input.length())
            .startSpan();

        try (Scope ignored = span.makeCurrent()) {
            RoutingDecision decision = cascade(input, correlationId, start);
            span.setAttribute("routing.layer", decision.routingLayer().value());
            span.setAttribute("routing.intent", decision.intentCategory().value());
            span.setAttribute("routing.confidence", decision.confidence());
            record(correlationId, input, decision);
            return decision;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            span.recordException(e);
            log.error("Routing failed for correlation {}: {}", correlationId, e.getMessage(), e);
            auditLogger.logError(correlationId, input, "route", e);
            RoutingDecision failed = RoutingDecision.error("Routing failed: " + e.getClass().getSimpleName(),
                    Map.of("error_type", e.getClass().getSimpleName()))
                .toBuilder()
                .processingTimeMs(elapsedMs(start))
                .build();
            metrics.recordDecision(failed);
            return failed;
        } finally {
            span.end();
        }
    }

    private RoutingDecision cascade(String input, String correlationId, long start) {
        Map<String, Double> layerLatencies = new LinkedHashMap<>();

        long layerStart = System.nanoTime();
        PatternMatchResult pattern = patternMatcher.match(input);
        layerLatencies.put("pattern", elapsedMs(layerStart));
        boolean patternAccepted = pattern.matched() && pattern.confidence() >= settings.patternThreshold();
        if (pattern.matched()) {
            auditLogger.logPatternMatch(correlationId, input, pattern.ruleId(), pattern.confidence(), patternAccepted);
        }
        if (patternAccepted) {
            log.debug("Pattern match: {} (confidence={}, rule={})",
                pattern.category().value(), pattern.confidence(), pattern.ruleId());
            return fromPattern(pattern, input, layerLatencies, start);
        }
        auditLogger.logEscalation(correlationId, input, RoutingLayer.PATTERN.value(), RoutingLayer.SEMANTIC.value(),
            pattern.confidence());

        layerStart = System.nanoTime();
        SemanticRouteResult semantic = semanticRouter.route(input);
        layerLatencies.put("semantic", elapsedMs(layerStart));
        if (semantic.matched() && semantic.similarity() >= settings.semanticThreshold()) {
            log.debug("Semantic match: {} (similarity={}, route={})",
                semantic.category().value(), semantic.similarity(), semantic.routeName());
            return fromSemantic(semantic, input, layerLatencies, start);
        }

        if (!settings.enableLlmFallback()) {
            log.warn("Unable to classify input ({} chars) and LLM fallback is disabled", input.length());
            return RoutingDecision.unclassified("Unable to classify with sufficient confidence").toBuilder()
                .putMetadata("layer_latencies", layerLatencies)
                .putMetadata("similarity", semantic.similarity())
                .putMetadata("total_latency_ms", elapsedMs(start))
                .processingTimeMs(elapsedMs(start))
                .build();
        }
        auditLogger.logEscalation(correlationId, input, RoutingLayer.SEMANTIC.value(), RoutingLayer.LLM.value(),
            semantic.similarity());

        layerStart = System.nanoTime();
        LlmClassificationResult llm = llmClassifier.classify(input, settings.enableCompleteness());
        layerLatencies.put("llm", elapsedMs(layerStart));
        if (llm.failed()) {
            log.warn("LLM classification degraded ({}): {}", llm.errorType(), llm.reasoning());
        } else {
            log.debug("LLM classification: {} (confidence={})", llm.category().value(), llm.confidence());
        }
        return fromLlm(llm, input, layerLatencies, start);
    }

    private RoutingDecision fromPattern(PatternMatchResult result, String input, Map<String, Double> latencies,
                                        long start) {
        IntentCategory category = result.category();
        double total = elapsedMs(start);
        return RoutingDecision.builder()
            .intentCategory(category)
            .subIntent(result.subIntent())
            .confidence(result.confidence())
            .workflowType(result.workflowType() != null
                ? result.workflowType() : workflowFor(category, result.subIntent()))
            .riskLevel(result.riskLevel() != null ? result.riskLevel() : riskFor(category, input))
            .completeness(completeness(category, input))
            .routingLayer(RoutingLayer.PATTERN)
            .ruleId(result.ruleId())
            .reasoning("Pattern matched: " + result.matchedPattern())
            .putMetadata("matched_pattern", result.matchedPattern())
            .putMetadata("match_position", result.matchPosition())
            .putMetadata("layer_latencies", latencies)
            .putMetadata("total_latency_ms", total)
            .processingTimeMs(total)
            .build();
    }

    private RoutingDecision fromSemantic(SemanticRouteResult result, String input, Map<String, Double> latencies,
                                         long start) {
        IntentCategory category = result.category();
        double total = elapsedMs(start);
        return RoutingDecision.builder()
            .intentCategory(category)
            .subIntent(result.subIntent())
            .confidence(result.similarity())
            .workflowType(result.workflowType() != null
                ? result.workflowType() : workflowFor(category, result.subIntent()))
            .riskLevel(result.riskLevel() != null ? result.riskLevel() : riskFor(category, input))
            .completeness(completeness(category, input))
            .routingLayer(RoutingLayer.SEMANTIC)
            .reasoning("Semantic route: " + result.routeName())
            .putMetadata("route_name", result.routeName())
            .putMetadata("similarity", Scores.round(result.similarity(), 4))
            .putMetadata("semantic_backend", result.metadata().get("backend"))
            .putMetadata("layer_latencies", latencies)
            .putMetadata("total_latency_ms", total)
            .processingTimeMs(total)
            .build();
    }

    private RoutingDecision fromLlm(LlmClassificationResult result, String input, Map<String, Double> latencies,
                                    long start) {
        IntentCategory category = result.category();
        CompletenessInfo completeness = result.completeness() != null
            && result.completeness().completenessScore() > 0
            ? result.completeness()
            : completeness(category, input);
        double total = elapsedMs(start);
        return RoutingDecision.builder()
            .intentCategory(category)
            .subIntent(result.subIntent())
            .confidence(result.confidence())
            .workflowType(workflowFor(category, result.subIntent()))
            .riskLevel(riskFor(category, input))
            .completeness(completeness)
            .routingLayer(RoutingLayer.LLM)
            .reasoning(result.reasoning())
            .putMetadata("llm_model", result.model())
            .putMetadata("llm_classifier", llmClassifier.name())
            .putMetadata("input_tokens", result.inputTokens())
            .putMetadata("output_tokens", result.outputTokens())
            .putMetadata("cost_usd", result.costUsd())
            .putMetadata("error_type", result.errorType())
            .putMetadata("layer_latencies", latencies)
            .putMetadata("total_latency_ms", total)
            .processingTimeMs(total)
            .build();
    }

    private CompletenessInfo completeness(IntentCategory category, String input) {
        if (!settings.enableCompleteness()) {
            return CompletenessInfo.complete();
        }
        return completenessChecker.check(category, input);
    }

    private void record(String correlationId, String input, RoutingDecision decision) {
        if (settings.trackLatency()) {
            metrics.recordDecision(decision);
        }
        auditLogger.logDecision(correlationId, input, decision);
    }

    public static WorkflowType workflowFor(IntentCategory category, String subIntent) {
        String sub = subIntent != null ? subIntent : "";
        return switch (category) {
            case INCIDENT -> MAGENTIC_INCIDENTS.contains(sub) ? WorkflowType.MAGENTIC : WorkflowType.SEQUENTIAL;
            case CHANGE -> MAGENTIC_CHANGES.contains(sub) ? WorkflowType.MAGENTIC : WorkflowType.SEQUENTIAL;
            case REQUEST, QUERY -> WorkflowType.SIMPLE;
            default -> WorkflowType.HANDOFF;
        };
    }

    /** Keyword hints used when the matching rule or route carries no risk level. */
    public static RiskLevel riskFor(IntentCategory category, String input) {
        String lowered = input == null ? "" : input.toLowerCase(Locale.ROOT);
        return switch (category) {
            case INCIDENT -> {
                if (containsAny(lowered, CRITICAL_KEYWORDS)) {
                    yield RiskLevel.CRITICAL;
                }
                yield containsAny(lowered, HIGH_KEYWORDS) ? RiskLevel.HIGH : RiskLevel.MEDIUM;
            }
            case CHANGE -> containsAny(lowered, HIGH_CHANGE_KEYWORDS) ? RiskLevel.HIGH : RiskLevel.MEDIUM;
            case QUERY -> RiskLevel.LOW;
            default -> RiskLevel.MEDIUM;
        };
    }

    private static boolean containsAny(String text, List<String> keywords) {
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    public RoutingMetrics.Snapshot metrics() {
        return metrics.snapshot();
    }

    public void resetMetrics() {
        metrics.reset();
    }

    public CompletenessChecker completenessChecker() {
        return completenessChecker;
    }

    public PatternMatcher patternMatcher() {
        return patternMatcher;
    }

    public SemanticRouter semanticRouter() {
        return semanticRouter;
    }

    private static double elapsedMs(long startNanos) {
        return Scores.round((System.nanoTime() - startNanos) / 1_000_000.0, 3);
    }
}
