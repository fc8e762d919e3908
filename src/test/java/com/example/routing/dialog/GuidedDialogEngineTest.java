package com.example.routing.dialog;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.example.routing.audit.AuditEventType;
import com.example.routing.audit.AuditLogger;
import com.example.routing.completeness.CompletenessChecker;
import com.example.routing.config.RuleTables;
import com.example.routing.filter.PiiFilter;
import com.example.routing.model.CompletenessInfo;
import com.example.routing.model.IntentCategory;
import com.example.routing.model.RoutingDecision;
import com.example.routing.model.RoutingLayer;
import com.example.routing.model.WorkflowType;
import com.example.routing.router.BusinessIntentRouter;
import com.example.routing.telemetry.RoutingMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.opentelemetry.api.OpenTelemetry;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class GuidedDialogEngineTest {

    static final RuleTables TABLES = RuleTables.defaults();
    static final Clock CLOCK = Clock.fixed(Instant.parse("2025-06-04T02:00:00Z"), ZoneOffset.UTC);

    final CompletenessChecker checker =
        new CompletenessChecker(TABLES.completenessRules(), Map.of(), OpenTelemetry.noop());
    final BusinessIntentRouter router = mock(BusinessIntentRouter.class);
    final RoutingMetrics metrics = new RoutingMetrics(OpenTelemetry.noop(), 100);
    final AuditLogger audit = new AuditLogger(new PiiFilter(), new ObjectMapper().findAndRegisterModules(), 100);

    GuidedDialogEngine engine(int maxTurns) {
        when(router.completenessChecker()).thenReturn(checker);
        return new GuidedDialogEngine(router, new RefinementRules(TABLES.refinementRules()),
            new QuestionGenerator(TABLES.questionTemplates(), 3), maxTurns, metrics, audit, OpenTelemetry.noop(),
            CLOCK);
    }

    RoutingDecision vagueIncident(String text) {
        return RoutingDecision.builder()
            .intentCategory(IntentCategory.INCIDENT)
            .confidence(0.7)
            .workflowType(WorkflowType.SEQUENTIAL)
            .completeness(checker.check(IntentCategory.INCIDENT, text))
            .routingLayer(RoutingLayer.LLM)
            .reasoning("LLM classification")
            .build();
    }

    @Test
    void vagueIncidentGathersThenCompletesAfterRefinement() {
        when(router.route(anyString(), anyString())).thenReturn(vagueIncident("幫幫我"));
        GuidedDialogEngine engine = engine(5);

        DialogResponse first = engine.startDialog("幫幫我", "conv-1");

        assertEquals(DialogPhase.GATHERING, first.phase());
        assertTrue(first.shouldContinue());
        assertEquals("gather_info", first.nextAction());
        assertTrue(first.message().startsWith("了解，這是一個事件報告"));
        assertEquals(List.of("affected_system", "symptom_type", "urgency"),
            first.questions().stream().map(GeneratedQuestion::targetField).toList());

        DialogResponse second = engine.processResponse("ETL 一直報錯");

        assertEquals(DialogPhase.COMPLETE, second.phase());
        assertFalse(second.shouldContinue());
        assertEquals("execute_sequential", second.nextAction());
        assertTrue(second.state().isComplete());
        assertEquals(1, second.state().turnCount());
        RoutingDecision decision = second.state().routingDecision();
        assertEquals("etl_failure", decision.subIntent());
        assertEquals(RoutingLayer.DIALOG, decision.routingLayer());
        assertFalse(engine.isActive());

        verify(router, times(1)).route(anyString(), anyString());
    }

    @Test
    void terminalDialogRejectsFurtherResponses() {
        when(router.route(anyString(), anyString())).thenReturn(vagueIncident("幫幫我"));
        GuidedDialogEngine engine = engine(5);
        engine.startDialog("幫幫我", "conv-2");
        engine.processResponse("ETL 一直報錯");

        DialogStateException e = assertThrows(DialogStateException.class, () -> engine.processResponse("還有嗎"));
        assertEquals(DialogStateException.Reason.NOT_ACTIVE, e.reason());
    }

    @Test
    void completeOpeningTurnNeedsNoQuestions() {
        RoutingDecision complete = vagueIncident("ETL 作業今天執行失敗了喔").toBuilder()
            .subIntent("etl_failure")
            .build();
        when(router.route(anyString(), anyString())).thenReturn(complete);

        DialogResponse response = engine(5).startDialog("ETL 作業今天執行失敗了喔", "conv-3");

        assertEquals(DialogPhase.COMPLETE, response.phase());
        assertTrue(response.questions().isEmpty());
        assertTrue(response.message().contains("etl_failure"));
    }

    @Test
    void maxTurnsHandsOffToHuman() {
        when(router.route(anyString(), anyString())).thenReturn(vagueIncident("幫幫我"));
        GuidedDialogEngine engine = engine(2);
        engine.startDialog("幫幫我", "conv-4");

        DialogResponse stillGathering = engine.processResponse("嗯");
        DialogResponse handedOff = engine.processResponse("還是不行");

        assertEquals(DialogPhase.GATHERING, stillGathering.phase());
        assertEquals(DialogPhase.HANDOFF, handedOff.phase());
        assertEquals("handoff", handedOff.nextAction());
        assertFalse(handedOff.shouldContinue());
        RoutingDecision decision = handedOff.state().routingDecision();
        assertEquals(WorkflowType.HANDOFF, decision.workflowType());
        assertEquals(GuidedDialogEngine.MAX_TURNS_REASONING, decision.reasoning());
        assertEquals("max_turns", decision.metadata().get("handoff_reason"));
    }

    @Test
    void shortIncidentWithEveryFieldAsksForDetail() {
        when(router.route(anyString(), anyString())).thenReturn(vagueIncident("ETL失敗,緊急"));
        GuidedDialogEngine engine = engine(5);

        DialogResponse first = engine.startDialog("ETL失敗,緊急", "conv-8");

        assertEquals(DialogPhase.GATHERING, first.phase());
        assertEquals(1, first.questions().size());
        assertEquals(CompletenessChecker.DETAIL_FIELD, first.questions().get(0).targetField());
        assertTrue(first.message().endsWith("1. " + GuidedDialogEngine.CLARIFICATION_QUESTION));

        DialogResponse second = engine.processResponse("從凌晨開始每個批次都卡住");

        assertEquals(DialogPhase.COMPLETE, second.phase());
    }

    @Test
    void incompleteDecisionWithoutMissingFieldsStillAsksSomething() {
        RoutingDecision modelJudged = vagueIncident("幫幫我").toBuilder()
            .completeness(new CompletenessInfo(false, 0.5, List.of(), List.of(), List.of()))
            .build();
        when(router.route(anyString(), anyString())).thenReturn(modelJudged);

        DialogResponse first = engine(5).startDialog("幫幫我", "conv-9");

        assertEquals(DialogPhase.GATHERING, first.phase());
        assertFalse(first.questions().isEmpty());
        assertTrue(first.shouldContinue());
    }

    @Test
    void unknownIntentAsksForClarificationWithoutRerouting() {
        when(router.route(anyString(), anyString()))
            .thenReturn(RoutingDecision.unclassified("Unable to classify with sufficient confidence"));
        GuidedDialogEngine engine = engine(5);

        DialogResponse first = engine.startDialog("嗨", "conv-5");
        DialogResponse second = engine.processResponse("ETL 一直報錯");

        assertEquals(DialogPhase.CLARIFICATION, first.phase());
        assertEquals("clarify", first.nextAction());
        assertEquals("clarification", first.questions().get(0).targetField());
        assertEquals(DialogPhase.CLARIFICATION, second.phase());
        assertTrue(engine.isActive());
        verify(router, times(1)).route(anyString(), anyString());
    }

    @Test
    void summaryAndStateBeforeAndAfterStart() {
        when(router.route(anyString(), anyString())).thenReturn(vagueIncident("幫幫我"));
        GuidedDialogEngine engine = engine(5);

        assertNull(engine.state());
        assertEquals("not_started", engine.summary().get("status"));

        engine.startDialog("幫幫我", "conv-6");
        engine.processResponse("ETL 一直報錯");
        Map<String, Object> summary = engine.summary();

        assertEquals("conv-6", summary.get("conversation_id"));
        assertEquals("complete", summary.get("status"));
        assertEquals(Integer.valueOf(1), summary.get("turn_count"));
        assertEquals(List.of("INC_REF_001"), summary.get("refinements"));
        assertEquals(Map.of("affected_system", "ETL", "symptom_type", "報錯"), summary.get("collected_fields"));
    }

    @Test
    void everyTurnIsAuditedAndCounted() {
        when(router.route(anyString(), anyString())).thenReturn(vagueIncident("幫幫我"));
        GuidedDialogEngine engine = engine(5);

        engine.startDialog("幫幫我", "conv-7");
        engine.processResponse("ETL 一直報錯");

        assertEquals(2, metrics.snapshot().dialogTurns());
        assertEquals(List.of(AuditEventType.DIALOG_TURN, AuditEventType.DIALOG_TURN),
            audit.byCorrelationId("conv-7").stream().map(e -> e.eventType()).toList());
    }
}
