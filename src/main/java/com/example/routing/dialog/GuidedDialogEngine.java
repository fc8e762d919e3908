package com.example.routing.dialog;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.routing.audit.AuditEventType;
import com.example.routing.audit.AuditLogger;
import com.example.routing.completeness.CompletenessChecker;
import com.example.routing.model.IntentCategory;
import com.example.routing.model.RoutingDecision;
import com.example.routing.model.RoutingLayer;
import com.example.routing.model.WorkflowType;
import com.example.routing.router.BusinessIntentRouter;
import com.example.routing.telemetry.RoutingMetrics;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

/**
 * Multi-turn information gathering for one conversation. The opening turn
 * classifies through the router exactly once; every later turn refines that
 * decision with extraction and refinement rules only.
 *
 * <p>Not thread-safe. {@link DialogSessionManager} serializes turns per
 * conversation.
 */
public class GuidedDialogEngine {

    private static final Logger log = LoggerFactory.getLogger(GuidedDialogEngine.class);

    public static final int DEFAULT_MAX_TURNS = 5;
    public static final String MAX_TURNS_REASONING = "max turns reached";

    static final String CLARIFICATION_MESSAGE =
        "抱歉，我不太確定您的需求。請問您是遇到系統問題、需要申請服務、還是有其他問題呢？";
    static final String CLARIFICATION_QUESTION = "請更詳細地描述您的需求";
    static final String HANDOFF_MESSAGE = "已達最大對話次數，將轉交人工處理\n\n我們將會盡快有專人與您聯繫。";

    private final BusinessIntentRouter router;
    private final ConversationContextManager context;
    private final QuestionGenerator questionGenerator;
    private final int maxTurns;
    private final RoutingMetrics metrics;
    private final AuditLogger auditLogger;
    private final Tracer tracer;
    private final Clock clock;

    private String conversationId;
    private DialogPhase phase;
    private RoutingDecision current;
    private List<GeneratedQuestion> questions = List.of();
    private int turnCount;
    private Instant startedAt;

    public GuidedDialogEngine(BusinessIntentRouter router, RefinementRules refinementRules,
                              QuestionGenerator questionGenerator, int maxTurns, RoutingMetrics metrics,
                              AuditLogger auditLogger, OpenTelemetry openTelemetry, Clock clock) {
        this.router = router;
        this.context = new ConversationContextManager(refinementRules, router.completenessChecker(), clock);
        this.questionGenerator = questionGenerator;
        this.maxTurns = maxTurns > 0 ? maxTurns : DEFAULT_MAX_TURNS;
        this.metrics = metrics;
        this.auditLogger = auditLogger;
        this.tracer = openTelemetry.getTracer("itsm-intent-router");
        this.clock = clock;
    }

    public DialogResponse startDialog(String text) {
        return startDialog(text, UUID.randomUUID().toString());
    }

    /** Opens a conversation, discarding any previous state held by this engine. */
    public DialogResponse startDialog(String text, String conversationId) {
        reset();
        this.conversationId = conversationId;
        Span span = tracer.spanBuilder("dialog_start")
            .setAttribute("routing.stage", "dialog")
            .setAttribute("dialog.conversation_id", conversationId)
            .startSpan();

        try (Scope ignored = span.makeCurrent()) {
            startedAt = clock.instant();
            phase = DialogPhase.INITIAL;
            RoutingDecision decision = router.route(text, conversationId);
            context.initialize(decision, text);
            current = decision;

            DialogResponse response = evaluate(decision);
            span.setAttribute("dialog.phase", phase.value());
            recordTurn(text, response);
            return response;
        } finally {
            span.end();
        }
    }

    public DialogResponse processResponse(String text) {
        if (!isActive()) {
            throw new DialogStateException(DialogStateException.Reason.NOT_ACTIVE,
                "No active dialog" + (conversationId != null ? " for " + conversationId : ""));
        }
        Span span = tracer.spanBuilder("dialog_turn")
            .setAttribute("routing.stage", "dialog")
            .setAttribute("dialog.conversation_id", conversationId)
            .startSpan();

        try (Scope ignored = span.makeCurrent()) {
            RoutingDecision decision = context.update(text);
            current = decision;
            turnCount++;
            span.setAttribute("dialog.turn", turnCount);

            DialogResponse response = turnCount >= maxTurns ? handoff(decision) : evaluate(decision);
            span.setAttribute("dialog.phase", phase.value());
            recordTurn(text, response);
            return response;
        } finally {
            span.end();
        }
    }

    /** Clears engine and context state so the engine can serve a new conversation. */
    public void reset() {
        conversationId = null;
        phase = null;
        current = null;
        questions = List.of();
        turnCount = 0;
        startedAt = null;
        context.reset();
    }

    public boolean isActive() {
        return phase != null && !phase.isTerminal();
    }

    public DialogState state() {
        if (phase == null) {
            return null;
        }
        return new DialogState(phase, current, questions, phase == DialogPhase.COMPLETE,
            turnCount, startedAt);
    }

    public Map<String, Object> summary() {
        Map<String, Object> summary = new LinkedHashMap<>();
        if (phase == null) {
            summary.put("status", "not_started");
            return summary;
        }
        RoutingDecision decision = current;
        summary.put("conversation_id", conversationId);
        summary.put("status", phase.value());
        summary.put("turn_count", turnCount);
        summary.put("is_complete", phase == DialogPhase.COMPLETE);
        summary.put("collected_fields", context.collectedInfo());
        summary.put("missing_fields", decision.completeness().missingFields());
        summary.put("refinements", context.refinementsApplied());
        summary.put("routing_decision", decision);
        return summary;
    }

    public String conversationId() {
        return conversationId;
    }

    public ConversationContextManager context() {
        return context;
    }

    private DialogResponse evaluate(RoutingDecision decision) {
        if (decision.intentCategory() == IntentCategory.UNKNOWN) {
            phase = DialogPhase.CLARIFICATION;
            questions = List.of(new GeneratedQuestion(CLARIFICATION_QUESTION, "clarification", 100, List.of()));
            return respond(CLARIFICATION_MESSAGE, true, "clarify");
        }
        if (decision.completeness().isComplete()) {
            phase = DialogPhase.COMPLETE;
            questions = List.of();
            return respond(completionMessage(decision), false,
                "execute_" + decision.workflowType().value());
        }
        phase = DialogPhase.GATHERING;
        questions = questionGenerator.generate(decision.intentCategory(), decision.completeness().missingFields());
        if (questions.isEmpty()) {
            questions = List.of(new GeneratedQuestion(CLARIFICATION_QUESTION, CompletenessChecker.DETAIL_FIELD,
                100, List.of()));
        }
        return respond(gatheringMessage(decision.intentCategory(), questions), true, "gather_info");
    }

    private DialogResponse handoff(RoutingDecision decision) {
        RoutingDecision handedOff = decision.toBuilder()
            .workflowType(WorkflowType.HANDOFF)
            .routingLayer(RoutingLayer.DIALOG)
            .reasoning(MAX_TURNS_REASONING)
            .putMetadata("handoff_reason", "max_turns")
            .putMetadata("max_turns", maxTurns)
            .build();
        log.info("Dialog {} handed off after {} turns", conversationId, turnCount);
        current = handedOff;
        phase = DialogPhase.HANDOFF;
        questions = List.of();
        return respond(HANDOFF_MESSAGE, false, "handoff");
    }

    private DialogResponse respond(String message, boolean shouldContinue, String nextAction) {
        context.addAssistantTurn(message);
        return new DialogResponse(message, questions, state(), shouldContinue, nextAction);
    }

    private void recordTurn(String text, DialogResponse response) {
        RoutingDecision decision = response.state().routingDecision();
        metrics.recordDialogTurn(phase.value());
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("phase", phase.value());
        metadata.put("turn_count", turnCount);
        metadata.put("next_action", response.nextAction());
        auditLogger.record(conversationId, AuditEventType.DIALOG_TURN, text, decision,
            RoutingLayer.DIALOG.value(), 0.0, metadata);
        log.debug("Dialog {} turn {} → {}", conversationId, turnCount, phase.value());
    }

    static String completionMessage(RoutingDecision decision) {
        String subIntent = decision.subIntent() != null && !decision.subIntent().isBlank()
            ? decision.subIntent() : "一般";
        return "感謝您提供的資訊。\n\n已收集完成，將進行" + categoryLabel(decision.intentCategory()) + "處理：\n"
            + "- 類型：" + subIntent + "\n"
            + "- 處理方式：" + decision.workflowType().value() + "\n"
            + "- 風險等級：" + decision.riskLevel().value();
    }

    static String gatheringMessage(IntentCategory category, List<GeneratedQuestion> questions) {
        StringBuilder sb = new StringBuilder("了解，這是一個").append(requestLabel(category))
            .append("。\n為了更快地協助您，請回答以下問題：\n");
        for (int i = 0; i < questions.size(); i++) {
            sb.append('\n').append(i + 1).append(". ").append(questions.get(i).question());
        }
        return sb.toString();
    }

    private static String categoryLabel(IntentCategory category) {
        return switch (category) {
            case INCIDENT -> "事件";
            case REQUEST -> "請求";
            case CHANGE -> "變更";
            case QUERY -> "查詢";
            default -> "請求";
        };
    }

    private static String requestLabel(IntentCategory category) {
        return switch (category) {
            case INCIDENT -> "事件報告";
            case REQUEST -> "服務請求";
            case CHANGE -> "變更請求";
            case QUERY -> "查詢";
            default -> "請求";
        };
    }
}
