package com.example.routing.risk;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.routing.model.IntentCategory;
import com.example.routing.model.RiskLevel;
import com.example.routing.model.RoutingDecision;
import com.example.routing.model.Scores;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

/**
 * Turns a routing decision plus situational context into a risk assessment.
 * The policy supplies the base level; context conditions may each elevate it
 * by one step.
 */
public class RiskAssessor {

    private static final Logger log = LoggerFactory.getLogger(RiskAssessor.class);

    private static final double LOW_CONFIDENCE_THRESHOLD = 0.8;
    private static final int MULTI_SYSTEM_ELEVATION = 3;

    private static final Map<IntentCategory, Double> CATEGORY_WEIGHTS = new EnumMap<>(Map.of(
        IntentCategory.INCIDENT, 0.8,
        IntentCategory.CHANGE, 0.6,
        IntentCategory.REQUEST, 0.4,
        IntentCategory.QUERY, 0.2,
        IntentCategory.UNKNOWN, 0.5));

    private static final Map<String, Double> SUB_INTENT_WEIGHTS = Map.of(
        "system_down", 0.5,
        "system_unavailable", 0.5,
        "security_incident", 0.5,
        "emergency_change", 0.5,
        "etl_failure", 0.4,
        "database_change", 0.4,
        "access_request", 0.3);

    private static final double DEFAULT_SUB_INTENT_WEIGHT = 0.1;

    private final RiskPolicies policies;
    private final Tracer tracer;

    public RiskAssessor(RiskPolicies policies, OpenTelemetry openTelemetry) {
        this.policies = policies;
        this.tracer = openTelemetry.getTracer("itsm-intent-router");
    }

    public RiskAssessment assess(RoutingDecision decision, AssessmentContext context) {
        AssessmentContext ctx = context != null ? context : AssessmentContext.empty();
        Span span = tracer.spanBuilder("risk_assess")
            .setAttribute("routing.stage", "risk")
            .setAttribute("routing.intent", decision.intentCategory().value())
            .startSpan();

        try (Scope ignored = span.makeCurrent()) {
            RiskPolicy policy = policies.lookup(decision.intentCategory(), decision.subIntent());
            List<RiskFactor> factors = collectFactors(decision, ctx);

            List<String> adjustments = new ArrayList<>();
            RiskLevel level = policy.defaultRiskLevel();
            level = elevateIf(ctx.isProduction(), level, "Production environment", adjustments);
            level = elevateIf(ctx.isWeekend(), level, "Weekend execution", adjustments);
            level = elevateIf(ctx.isUrgent(), level, "Urgent flag", adjustments);
            int systems = ctx.affectedSystems().size();
            level = elevateIf(systems > MULTI_SYSTEM_ELEVATION, level,
                "Multiple systems (" + systems + ")", adjustments);

            double score = score(level, factors);
            RiskAssessment assessment = new RiskAssessment(level, score, level.atLeast(RiskLevel.HIGH),
                approvalTypeFor(level), factors, reasoning(decision, policy, level, adjustments),
                policy.id(), adjustments, Instant.now());

            span.setAttribute("routing.risk_level", level.value());
            span.setAttribute("routing.risk_policy", policy.id());
            log.info("Risk assessment: {} (score={}, approval={}, policy={})",
                level.value(), String.format("%.2f", score), assessment.approvalType().value(), policy.id());
            return assessment;
        } finally {
            span.end();
        }
    }

    /** Convenience entry point when no routing decision exists yet. */
    public RiskAssessment assessFromIntent(IntentCategory category, String subIntent, AssessmentContext context) {
        RoutingDecision decision = RoutingDecision.builder()
            .intentCategory(category)
            .subIntent(subIntent)
            .confidence(1.0)
            .build();
        return assess(decision, context);
    }

    /**
     * Raises an existing assessment by one level. At CRITICAL the assessment
     * is returned unchanged.
     */
    public RiskAssessment elevate(RiskAssessment assessment, String reason) {
        RiskLevel next = assessment.level().elevate();
        if (next == assessment.level()) {
            return assessment;
        }
        List<String> adjustments = new ArrayList<>(assessment.adjustmentsApplied());
        adjustments.add(reason + ": " + assessment.level().value() + " → " + next.value());
        double score = score(next, assessment.factors());
        String reasoning = assessment.reasoning() + " Elevated: " + reason;
        return new RiskAssessment(next, score, next.atLeast(RiskLevel.HIGH), approvalTypeFor(next),
            assessment.factors(), reasoning, assessment.policyId(), adjustments, Instant.now());
    }

    public RiskPolicies policies() {
        return policies;
    }

    List<RiskFactor> collectFactors(RoutingDecision decision, AssessmentContext ctx) {
        List<RiskFactor> factors = new ArrayList<>();

        IntentCategory category = decision.intentCategory();
        double categoryWeight = CATEGORY_WEIGHTS.getOrDefault(category, 0.5);
        factors.add(new RiskFactor("intent_category", "Intent category: " + category.value(), categoryWeight,
            category.value(), categoryWeight > 0.5 ? RiskFactor.Impact.INCREASE : RiskFactor.Impact.NEUTRAL));

        String subIntent = decision.subIntent();
        if (subIntent != null && !subIntent.isBlank()) {
            double subWeight = SUB_INTENT_WEIGHTS.getOrDefault(subIntent, DEFAULT_SUB_INTENT_WEIGHT);
            factors.add(new RiskFactor("sub_intent", "Sub-intent: " + subIntent, subWeight, subIntent,
                subWeight > 0.3 ? RiskFactor.Impact.INCREASE : RiskFactor.Impact.NEUTRAL));
        }

        if (ctx.isProduction()) {
            factors.add(new RiskFactor("is_production", "Affects production environment", 0.3, true,
                RiskFactor.Impact.INCREASE));
        }
        if (ctx.isWeekend()) {
            factors.add(new RiskFactor("is_weekend", "Executed during weekend", 0.2, true,
                RiskFactor.Impact.INCREASE));
        }
        if (ctx.isUrgent()) {
            factors.add(new RiskFactor("is_urgent", "Marked as urgent", 0.15, true, RiskFactor.Impact.INCREASE));
        }

        int systems = ctx.affectedSystems().size();
        if (systems > 0) {
            factors.add(new RiskFactor("affected_systems", "Number of affected systems: " + systems,
                Math.min(0.1 * systems, 0.3), systems,
                systems > 2 ? RiskFactor.Impact.INCREASE : RiskFactor.Impact.NEUTRAL));
        }

        double confidence = decision.confidence();
        if (confidence < LOW_CONFIDENCE_THRESHOLD) {
            factors.add(new RiskFactor("low_confidence",
                String.format("Low routing confidence: %.2f", confidence),
                0.2 * (1.0 - confidence), confidence, RiskFactor.Impact.INCREASE));
        }
        return factors;
    }

    static double score(RiskLevel level, List<RiskFactor> factors) {
        double adjustment = 0.0;
        for (RiskFactor factor : factors) {
            adjustment += factor.scoreContribution();
        }
        return Scores.clamp(level.baseScore() + adjustment);
    }

    static ApprovalType approvalTypeFor(RiskLevel level) {
        return switch (level) {
            case CRITICAL -> ApprovalType.MULTI;
            case HIGH -> ApprovalType.SINGLE;
            default -> ApprovalType.NONE;
        };
    }

    private static RiskLevel elevateIf(boolean condition, RiskLevel current, String label, List<String> adjustments) {
        if (!condition) {
            return current;
        }
        RiskLevel next = current.elevate();
        if (next != current) {
            adjustments.add(label + ": " + current.value() + " → " + next.value());
        }
        return next;
    }

    private static String reasoning(RoutingDecision decision, RiskPolicy policy, RiskLevel level,
                                    List<String> adjustments) {
        StringBuilder sb = new StringBuilder("Intent '").append(decision.intentCategory().value()).append('\'');
        if (decision.subIntent() != null && !decision.subIntent().isBlank()) {
            sb.append('/').append(decision.subIntent());
        }
        sb.append(" assessed as ").append(level.value()).append(" risk.");
        sb.append(" Policy: ").append(policy.id());
        if (!adjustments.isEmpty()) {
            sb.append(" Adjustments: ").append(String.join("; ", adjustments));
        }
        return sb.toString();
    }
}
