package com.example.routing.router;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.example.routing.audit.AuditEntry;
import com.example.routing.audit.AuditEventType;
import com.example.routing.audit.AuditLogger;
import com.example.routing.classifier.LlmClassificationResult;
import com.example.routing.classifier.LlmClassifier;
import com.example.routing.completeness.CompletenessChecker;
import com.example.routing.config.RuleTables;
import com.example.routing.filter.PiiFilter;
import com.example.routing.model.CompletenessInfo;
import com.example.routing.model.IntentCategory;
import com.example.routing.model.RiskLevel;
import com.example.routing.model.RoutingDecision;
import com.example.routing.model.RoutingLayer;
import com.example.routing.model.WorkflowType;
import com.example.routing.pattern.PatternMatcher;
import com.example.routing.pattern.PatternRule;
import com.example.routing.semantic.SemanticRoute;
import com.example.routing.semantic.SemanticRouteResult;
import com.example.routing.semantic.SemanticRouter;
import com.example.routing.telemetry.RoutingMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.opentelemetry.api.OpenTelemetry;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class BusinessIntentRouterTest {

    private static final RuleTables TABLES = RuleTables.defaults();
    private static final SemanticRoute DATABASE_ROUTE = new SemanticRoute("database_issue", IntentCategory.INCIDENT,
        "database_issue", List.of("資料庫連線有問題"), null, null, null);

    private final SemanticRouter semantic = mock(SemanticRouter.class);
    private final LlmClassifier llm = mock(LlmClassifier.class);
    private final RoutingMetrics metrics = new RoutingMetrics(OpenTelemetry.noop(), 100);
    private final AuditLogger audit = new AuditLogger(new PiiFilter(), new ObjectMapper().findAndRegisterModules(), 100);

    private BusinessIntentRouter router(PatternMatcher patterns, BusinessIntentRouter.Settings settings) {
        CompletenessChecker checker =
            new CompletenessChecker(TABLES.completenessRules(), Map.of(), OpenTelemetry.noop());
        return new BusinessIntentRouter(patterns, semantic, llm, checker, settings, metrics, audit,
            OpenTelemetry.noop());
    }

    private BusinessIntentRouter router() {
        return router(new PatternMatcher(TABLES.patternRules(), OpenTelemetry.noop()),
            BusinessIntentRouter.Settings.defaults());
    }

    private List<AuditEventType> auditTrail(String correlationId) {
        return audit.byCorrelationId(correlationId).stream().map(AuditEntry::eventType).toList();
    }

    @Test
    void confidentPatternMatchShortCircuitsLaterLayers() {
        RoutingDecision decision = router().route("ETL 今天跑失敗了", "c-pattern");

        assertEquals(RoutingLayer.PATTERN, decision.routingLayer());
        assertEquals(IntentCategory.INCIDENT, decision.intentCategory());
        assertEquals("etl_failure", decision.subIntent());
        assertEquals("incident_etl_failure", decision.ruleId());
        assertEquals(WorkflowType.SEQUENTIAL, decision.workflowType());
        assertTrue(decision.confidence() >= 0.90);
        assertTrue(decision.metadata().containsKey("layer_latencies"));
        verifyNoInteractions(semantic, llm);

        assertEquals(List.of(AuditEventType.PATTERN_MATCH, AuditEventType.ROUTING_DECISION),
            auditTrail("c-pattern"));
        assertEquals(Long.valueOf(1), metrics.snapshot().byLayer().get("pattern"));
    }

    @Test
    void semanticMatchAboveThresholdSkipsLlm() {
        when(semantic.route(anyString())).thenReturn(SemanticRouteResult.matched(DATABASE_ROUTE, 0.9, "lexical"));

        RoutingDecision decision = router().route("今天天氣很好", "c-semantic");

        assertEquals(RoutingLayer.SEMANTIC, decision.routingLayer());
        assertEquals("database_issue", decision.subIntent());
        assertEquals(0.9, decision.confidence(), 1e-9);
        assertEquals(WorkflowType.SEQUENTIAL, decision.workflowType());
        assertEquals("database_issue", decision.metadata().get("route_name"));
        verifyNoInteractions(llm);
        assertEquals(List.of(AuditEventType.LAYER_ESCALATION, AuditEventType.ROUTING_DECISION),
            auditTrail("c-semantic"));
    }

    @Test
    void semanticMatchBelowRouterThresholdEscalatesToLlm() {
        when(semantic.route(anyString())).thenReturn(SemanticRouteResult.matched(DATABASE_ROUTE, 0.80, "lexical"));
        when(llm.name()).thenReturn("keyword");
        when(llm.classify(anyString(), anyBoolean())).thenReturn(
            LlmClassificationResult.of(IntentCategory.INCIDENT, "system_down", 0.7, "sounds like an outage")
                .withUsage("gpt-4.1-mini", 10, 5, 0.001));

        RoutingDecision decision = router().route("  今天天氣很好  ", "c-llm");

        assertEquals(RoutingLayer.LLM, decision.routingLayer());
        assertEquals("system_down", decision.subIntent());
        assertEquals(WorkflowType.MAGENTIC, decision.workflowType());
        assertEquals(RiskLevel.MEDIUM, decision.riskLevel());
        assertEquals("sounds like an outage", decision.reasoning());
        assertEquals("gpt-4.1-mini", decision.metadata().get("llm_model"));
        assertEquals("keyword", decision.metadata().get("llm_classifier"));
        verify(llm).classify("今天天氣很好", true);
        assertEquals(List.of(AuditEventType.LAYER_ESCALATION, AuditEventType.LAYER_ESCALATION,
            AuditEventType.ROUTING_DECISION), auditTrail("c-llm"));
    }

    @Test
    void llmCompletenessIsUsedWhenProvided() {
        CompletenessInfo fromModel = new CompletenessInfo(false, 0.4, List.of("urgency"), List.of(), List.of());
        when(semantic.route(anyString())).thenReturn(SemanticRouteResult.noMatch(0.1, "lexical"));
        when(llm.classify(anyString(), anyBoolean())).thenReturn(new LlmClassificationResult(
            IntentCategory.INCIDENT, "performance_issue", 0.8, "slow", fromModel, "m", 0, 0, 0.0, null));

        RoutingDecision decision = router().route("今天天氣很好", "c-llm-completeness");

        assertEquals(fromModel, decision.completeness());
    }

    @Test
    void lowConfidencePatternMatchIsAuditedAndEscalated() {
        PatternMatcher weak = new PatternMatcher(List.of(new PatternRule("vpn_weak", IntentCategory.REQUEST,
            "access_request", List.of("VPN"), 0, null, null, null, null)), OpenTelemetry.noop());
        when(semantic.route(anyString())).thenReturn(SemanticRouteResult.noMatch(0.2, "lexical"));
        when(llm.classify(anyString(), anyBoolean())).thenReturn(
            LlmClassificationResult.of(IntentCategory.REQUEST, "access_request", 0.75, "vpn access"));

        RoutingDecision decision = router(weak, BusinessIntentRouter.Settings.defaults())
            .route("please help me with the company VPN", "c-weak");

        assertEquals(RoutingLayer.LLM, decision.routingLayer());
        AuditEntry patternEntry = audit.byCorrelationId("c-weak").get(0);
        assertEquals(AuditEventType.PATTERN_MATCH, patternEntry.eventType());
        assertEquals(false, patternEntry.metadata().get("accepted"));
        assertEquals("vpn_weak", patternEntry.metadata().get("rule_id"));
    }

    @Test
    void disabledLlmFallbackLeavesInputUnclassified() {
        when(semantic.route(anyString())).thenReturn(SemanticRouteResult.noMatch(0.3, "lexical"));
        BusinessIntentRouter.Settings noLlm = new BusinessIntentRouter.Settings(0.90, 0.85, false, true, true);

        RoutingDecision decision = router(new PatternMatcher(TABLES.patternRules(), OpenTelemetry.noop()), noLlm)
            .route("今天天氣很好", "c-nollm");

        assertEquals(RoutingLayer.NONE, decision.routingLayer());
        assertEquals(IntentCategory.UNKNOWN, decision.intentCategory());
        assertEquals(WorkflowType.HANDOFF, decision.workflowType());
        assertEquals(0.3, decision.metadata().get("similarity"));
        verifyNoInteractions(llm);
    }

    @Test
    void blankInputNeverReachesAnyLayer() {
        RoutingDecision decision = router().route("   ", "c-blank");

        assertEquals(RoutingLayer.NONE, decision.routingLayer());
        assertEquals("Empty or invalid input", decision.reasoning());
        assertEquals(0.0, decision.confidence());
        verifyNoInteractions(semantic, llm);
        assertEquals(List.of(AuditEventType.ROUTING_DECISION), auditTrail("c-blank"));
    }

    @Test
    void layerFailureBecomesErrorDecision() {
        when(semantic.route(anyString())).thenThrow(new IllegalStateException("index corrupted"));

        RoutingDecision decision = router().route("今天天氣很好", "c-error");

        assertEquals(RoutingLayer.ERROR, decision.routingLayer());
        assertEquals(IntentCategory.UNKNOWN, decision.intentCategory());
        assertEquals("IllegalStateException", decision.metadata().get("error_type"));
        assertEquals("Routing failed: IllegalStateException", decision.reasoning());
        assertTrue(auditTrail("c-error").contains(AuditEventType.ERROR));
        assertEquals(Long.valueOf(1), metrics.snapshot().byLayer().get("error"));
    }

    @Test
    void completenessDisabledMarksDecisionsComplete() {
        BusinessIntentRouter.Settings noCompleteness = new BusinessIntentRouter.Settings(0.90, 0.85, true, false, true);

        RoutingDecision decision = router(new PatternMatcher(TABLES.patternRules(), OpenTelemetry.noop()),
            noCompleteness).route("ETL 今天跑失敗了");

        assertEquals(CompletenessInfo.complete(), decision.completeness());
    }

    @ParameterizedTest
    @CsvSource({
        "incident, system_down,      magentic",
        "incident, etl_failure,      sequential",
        "change,   database_change,  magentic",
        "change,   config_update,    sequential",
        "request,  access_request,   simple",
        "query,    ,                 simple",
        "unknown,  ,                 handoff",
    })
    void workflowForCategoryAndSubIntent(String category, String subIntent, String workflow) {
        assertEquals(WorkflowType.fromString(workflow),
            BusinessIntentRouter.workflowFor(IntentCategory.fromString(category), subIntent));
    }

    @ParameterizedTest
    @CsvSource({
        "incident, '系統當機了',       critical",
        "incident, '影響客戶下單',     high",
        "incident, '有點怪',           medium",
        "change,   '修改生產資料庫',   high",
        "change,   '調整設定',         medium",
        "query,    '緊急查詢',         low",
        "request,  '緊急申請',         medium",
    })
    void keywordRiskHints(String category, String text, String level) {
        assertEquals(RiskLevel.fromString(level),
            BusinessIntentRouter.riskFor(IntentCategory.fromString(category), text));
    }
}
