package com.example.routing.config;

import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.routing.completeness.CompletenessChecker;
import com.example.routing.dialog.QuestionGenerator;
import com.example.routing.dialog.RefinementRules;
import com.example.routing.pattern.PatternMatcher;
import com.example.routing.risk.RiskPolicies;
import com.example.routing.semantic.SemanticRouter;

/**
 * Re-reads every rule table and swaps them in. All files are parsed before
 * anything is installed, so a broken file leaves the running tables untouched.
 */
public class RuleReloadService {

    private static final Logger log = LoggerFactory.getLogger(RuleReloadService.class);

    private final RouterProperties properties;
    private final PatternMatcher patternMatcher;
    private final SemanticRouter semanticRouter;
    private final CompletenessChecker completenessChecker;
    private final RiskPolicies riskPolicies;
    private final RefinementRules refinementRules;
    private final QuestionGenerator questionGenerator;

    public RuleReloadService(
        RouterProperties properties,
        PatternMatcher patternMatcher,
        SemanticRouter semanticRouter,
        CompletenessChecker completenessChecker,
        RiskPolicies riskPolicies,
        RefinementRules refinementRules,
        QuestionGenerator questionGenerator
    ) {
        this.properties = properties;
        this.patternMatcher = patternMatcher;
        this.semanticRouter = semanticRouter;
        this.completenessChecker = completenessChecker;
        this.riskPolicies = riskPolicies;
        this.refinementRules = refinementRules;
        this.questionGenerator = questionGenerator;
    }

    /** Returns the number of entries installed per table. */
    public synchronized Map<String, Integer> reloadAll() {
        RuleTables tables = RuleTables.load(properties.tables());

        Map<String, Integer> counts = new LinkedHashMap<>();
        counts.put("pattern_rules", patternMatcher.reload(tables.patternRules()));
        counts.put("semantic_routes", semanticRouter.reload(tables.semanticRoutes()));
        counts.put("completeness_rules", completenessChecker.reload(tables.completenessRules()));
        counts.put("risk_policies", riskPolicies.reload(
            RiskPolicies.withPreset(tables.riskPolicies(), properties.riskPreset()),
            tables.riskPolicies().globalDefault()));
        counts.put("refinement_rules", refinementRules.reload(tables.refinementRules()));
        counts.put("question_templates", questionGenerator.reload(tables.questionTemplates()));
        log.info("Reloaded rule tables: {}", counts);
        return counts;
    }
}
