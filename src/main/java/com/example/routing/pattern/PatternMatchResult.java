package com.example.routing.pattern;

import com.example.routing.model.IntentCategory;
import com.example.routing.model.RiskLevel;
import com.example.routing.model.WorkflowType;

public record PatternMatchResult(
    boolean matched,
    IntentCategory category,
    String subIntent,
    String ruleId,
    String matchedPattern,
    int matchPosition,
    double confidence,
    WorkflowType workflowType,
    RiskLevel riskLevel
) {

    public static PatternMatchResult noMatch() {
        return new PatternMatchResult(false, IntentCategory.UNKNOWN, null, null, null, -1, 0.0, null, null);
    }
}
