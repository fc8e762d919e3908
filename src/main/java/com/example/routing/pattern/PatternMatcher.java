package com.example.routing.pattern;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.routing.model.Scores;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

/**
 * Layer 1 of the cascade. Regexes are compiled once per load; the active rule
 * set is an immutable snapshot swapped atomically on reload.
 */
public class PatternMatcher {

    private static final Logger log = LoggerFactory.getLogger(PatternMatcher.class);

    static final double BASE_CONFIDENCE = 0.85;
    static final double COVERAGE_WEIGHT = 0.10;
    static final double PRIORITY_WEIGHT = 0.05;
    static final double POSITION_WEIGHT = 0.02;
    static final int PRIORITY_CEILING = 100;

    private static final int PATTERN_FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    record CompiledRule(PatternRule rule, List<Pattern> patterns) {}

    public record Statistics(int totalRules, int totalPatterns, Map<String, Integer> categoryDistribution) {}

    private final AtomicReference<List<CompiledRule>> compiled = new AtomicReference<>(List.of());
    private final Tracer tracer;

    public PatternMatcher(List<PatternRule> rules, OpenTelemetry openTelemetry) {
        this.tracer = openTelemetry.getTracer("itsm-intent-router");
        reload(rules);
    }

    public PatternMatchResult match(String text) {
        if (text == null || text.isBlank()) {
            return PatternMatchResult.noMatch();
        }
        Span span = tracer.spanBuilder("pattern_match")
            .setAttribute("routing.stage", "pattern")
            .startSpan();

        try (Scope ignored = span.makeCurrent()) {
            for (CompiledRule rule : compiled.get()) {
                PatternMatchResult result = tryRule(rule, text);
                if (result != null) {
                    span.setAttribute("routing.rule_id", result.ruleId());
                    span.setAttribute("routing.confidence", result.confidence());
                    log.debug("Pattern rule {} matched '{}' (confidence={})",
                        result.ruleId(), result.matchedPattern(), result.confidence());
                    return result;
                }
            }
            span.setAttribute("routing.matched", false);
            return PatternMatchResult.noMatch();
        } finally {
            span.end();
        }
    }

    /** All matching rules in priority order, capped at {@code topN}. For inspection only. */
    public List<PatternMatchResult> matchAll(String text, int topN) {
        if (text == null || text.isBlank() || topN <= 0) {
            return List.of();
        }
        List<PatternMatchResult> results = new ArrayList<>();
        for (CompiledRule rule : compiled.get()) {
            PatternMatchResult result = tryRule(rule, text);
            if (result != null) {
                results.add(result);
                if (results.size() >= topN) {
                    break;
                }
            }
        }
        return List.copyOf(results);
    }

    private PatternMatchResult tryRule(CompiledRule compiledRule, String text) {
        PatternRule rule = compiledRule.rule();
        for (Pattern pattern : compiledRule.patterns()) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                double confidence = computeConfidence(
                    matcher.end() - matcher.start(), matcher.start(), text.length(), rule.priority());
                return new PatternMatchResult(true, rule.category(), rule.subIntent(), rule.id(),
                    pattern.pattern(), matcher.start(), confidence, rule.workflowType(), rule.riskLevel());
            }
        }
        return null;
    }

    static double computeConfidence(int matchLength, int matchStart, int textLength, int priority) {
        if (textLength <= 0) {
            return 0.0;
        }
        double coverage = Math.min(1.0, (double) matchLength / textLength);
        double normalizedPriority = Math.max(0, Math.min(priority, PRIORITY_CEILING)) / (double) PRIORITY_CEILING;
        double positionBonus = 1.0 - Math.min(1.0, (double) matchStart / textLength);
        double confidence = BASE_CONFIDENCE
            + COVERAGE_WEIGHT * coverage
            + PRIORITY_WEIGHT * normalizedPriority
            + POSITION_WEIGHT * positionBonus;
        return Scores.clamp(confidence);
    }

    /**
     * Compiles and installs a new rule set. Disabled rules and bad regexes are
     * skipped; a rule left with no valid pattern is dropped.
     *
     * @return number of rules now active
     */
    public int reload(List<PatternRule> rules) {
        List<CompiledRule> next = compile(rules == null ? List.of() : rules);
        compiled.set(next);
        log.info("Loaded {} pattern rules", next.size());
        return next.size();
    }

    public boolean addRule(PatternRule rule) {
        if (rule == null || rule.id() == null) {
            return false;
        }
        List<CompiledRule> fresh = compile(List.of(rule));
        if (fresh.isEmpty()) {
            return false;
        }
        compiled.updateAndGet(current -> {
            List<CompiledRule> next = new ArrayList<>();
            for (CompiledRule existing : current) {
                if (!existing.rule().id().equals(rule.id())) {
                    next.add(existing);
                }
            }
            next.addAll(fresh);
            next.sort(byPriority());
            return List.copyOf(next);
        });
        return true;
    }

    public boolean removeRule(String ruleId) {
        List<CompiledRule> before = compiled.get();
        List<CompiledRule> after = compiled.updateAndGet(current -> current.stream()
            .filter(r -> !r.rule().id().equals(ruleId))
            .toList());
        return after.size() < before.size();
    }

    public Optional<PatternRule> getRule(String ruleId) {
        return compiled.get().stream()
            .map(CompiledRule::rule)
            .filter(r -> r.id().equals(ruleId))
            .findFirst();
    }

    public List<PatternRule> rules() {
        return compiled.get().stream().map(CompiledRule::rule).toList();
    }

    public Statistics statistics() {
        List<CompiledRule> snapshot = compiled.get();
        Map<String, Integer> distribution = new LinkedHashMap<>();
        int totalPatterns = 0;
        for (CompiledRule rule : snapshot) {
            totalPatterns += rule.patterns().size();
            distribution.merge(rule.rule().category().value(), 1, Integer::sum);
        }
        return new Statistics(snapshot.size(), totalPatterns, Map.copyOf(distribution));
    }

    private static List<CompiledRule> compile(List<PatternRule> rules) {
        List<CompiledRule> result = new ArrayList<>();
        for (PatternRule rule : rules) {
            if (rule == null || rule.id() == null) {
                log.warn("Skipping pattern rule without id");
                continue;
            }
            if (!rule.enabled()) {
                log.debug("Skipping disabled pattern rule {}", rule.id());
                continue;
            }
            List<Pattern> patterns = new ArrayList<>();
            for (String regex : rule.patterns()) {
                try {
                    patterns.add(Pattern.compile(regex, PATTERN_FLAGS));
                } catch (PatternSyntaxException e) {
                    log.warn("Invalid pattern in rule {}: '{}' ({})", rule.id(), regex, e.getDescription());
                }
            }
            if (patterns.isEmpty()) {
                log.warn("Pattern rule {} has no valid patterns, skipping", rule.id());
                continue;
            }
            result.add(new CompiledRule(rule, List.copyOf(patterns)));
        }
        result.sort(byPriority());
        return List.copyOf(result);
    }

    private static Comparator<CompiledRule> byPriority() {
        return Comparator.comparingInt((CompiledRule r) -> r.rule().priority()).reversed();
    }
}
