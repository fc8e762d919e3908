package com.example.routing.config;

import java.util.List;

import com.example.routing.completeness.CompletenessRule;
import com.example.routing.dialog.QuestionTemplate;
import com.example.routing.dialog.RefinementRule;
import com.example.routing.pattern.PatternRule;
import com.example.routing.risk.RiskPolicy;
import com.example.routing.semantic.SemanticRoute;

/** Every rule table the router needs, parsed together so a reload installs all or nothing. */
public record RuleTables(
    List<PatternRule> patternRules,
    List<SemanticRoute> semanticRoutes,
    List<CompletenessRule> completenessRules,
    RiskPolicy.PolicyFile riskPolicies,
    List<RefinementRule> refinementRules,
    List<QuestionTemplate> questionTemplates
) {

    public static final String PATTERN_RULES = "rules/pattern-rules.yaml";
    public static final String SEMANTIC_ROUTES = "rules/semantic-routes.yaml";
    public static final String COMPLETENESS_RULES = "rules/completeness-rules.yaml";
    public static final String RISK_POLICIES = "rules/risk-policies.yaml";
    public static final String REFINEMENT_RULES = "rules/refinement-rules.yaml";
    public static final String QUESTION_TEMPLATES = "rules/question-templates.yaml";

    /** Loads each table from its override path when set, otherwise from the bundled default. */
    public static RuleTables load(RouterProperties.Tables paths) {
        RouterProperties.Tables p = paths != null
            ? paths : new RouterProperties.Tables(null, null, null, null, null, null);
        return new RuleTables(
            TableLoader.load(p.patternRules(), PATTERN_RULES, PatternRule.RuleFile.class).rules(),
            TableLoader.load(p.semanticRoutes(), SEMANTIC_ROUTES, SemanticRoute.RouteFile.class).routes(),
            TableLoader.load(p.completenessRules(), COMPLETENESS_RULES, CompletenessRule.RuleFile.class).rules(),
            TableLoader.load(p.riskPolicies(), RISK_POLICIES, RiskPolicy.PolicyFile.class),
            TableLoader.load(p.refinementRules(), REFINEMENT_RULES, RefinementRule.RuleFile.class).rules(),
            TableLoader.load(p.questionTemplates(), QUESTION_TEMPLATES, QuestionTemplate.TemplateFile.class)
                .templates());
    }

    public static RuleTables defaults() {
        return load(null);
    }
}
