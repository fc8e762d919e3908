package com.example.routing.semantic;

import java.util.Map;

import com.example.routing.model.IntentCategory;
import com.example.routing.model.RiskLevel;
import com.example.routing.model.Scores;
import com.example.routing.model.WorkflowType;

/**
 * Outcome of a semantic lookup. A no-match still reports the best similarity
 * observed so callers can log how close the input came.
 */
public record SemanticRouteResult(
    boolean matched,
    String routeName,
    IntentCategory category,
    String subIntent,
    double similarity,
    WorkflowType workflowType,
    RiskLevel riskLevel,
    Map<String, Object> metadata
) {

    public SemanticRouteResult {
        similarity = Scores.clamp(similarity);
        category = category != null ? category : IntentCategory.UNKNOWN;
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static SemanticRouteResult matched(SemanticRoute route, double similarity, String backend) {
        return new SemanticRouteResult(true, route.name(), route.category(), route.subIntent(), similarity,
            route.workflowType(), route.riskLevel(), Map.of("backend", backend));
    }

    public static SemanticRouteResult noMatch(double similarity, String backend) {
        return new SemanticRouteResult(false, null, IntentCategory.UNKNOWN, null, similarity,
            null, null, Map.of("backend", backend));
    }
}
