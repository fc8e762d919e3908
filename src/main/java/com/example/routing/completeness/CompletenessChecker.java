package com.example.routing.completeness;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.routing.model.CompletenessInfo;
import com.example.routing.model.IntentCategory;
import com.example.routing.model.Scores;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

/**
 * Scores how much of the information an intent category needs is present.
 * Stateless over the loaded rules: the same text and collected info always
 * produce the same result.
 */
public class CompletenessChecker {

    private static final Logger log = LoggerFactory.getLogger(CompletenessChecker.class);

    private static final int PATTERN_FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    /** Reported as missing when the text is shorter than the rule's minimum length. */
    public static final String DETAIL_FIELD = "description";
    static final String DETAIL_DISPLAY_NAME = "問題描述";

    record CompiledField(FieldDefinition definition, List<String> loweredKeywords, List<Pattern> patterns) {}

    record CompiledRule(CompletenessRule rule, List<CompiledField> required, List<CompiledField> optional) {}

    private final AtomicReference<Map<IntentCategory, CompiledRule>> rules = new AtomicReference<>(Map.of());
    private final Map<IntentCategory, Double> thresholdOverrides;
    private final Tracer tracer;

    public CompletenessChecker(List<CompletenessRule> rules, Map<IntentCategory, Double> thresholdOverrides,
                               OpenTelemetry openTelemetry) {
        this.thresholdOverrides = thresholdOverrides == null ? Map.of() : Map.copyOf(thresholdOverrides);
        this.tracer = openTelemetry.getTracer("itsm-intent-router");
        reload(rules);
    }

    public CompletenessInfo check(IntentCategory category, String text) {
        return check(category, text, Map.of());
    }

    public CompletenessInfo check(IntentCategory category, String text, Map<String, String> collectedInfo) {
        Span span = tracer.spanBuilder("completeness_check")
            .setAttribute("routing.stage", "completeness")
            .setAttribute("routing.intent", category.value())
            .startSpan();

        try (Scope ignored = span.makeCurrent()) {
            CompletenessInfo info = evaluate(category, text == null ? "" : text,
                collectedInfo == null ? Map.of() : collectedInfo);
            span.setAttribute("routing.completeness_score", info.completenessScore());
            span.setAttribute("routing.is_complete", info.isComplete());
            return info;
        } finally {
            span.end();
        }
    }

    private CompletenessInfo evaluate(IntentCategory category, String text, Map<String, String> collected) {
        CompiledRule compiled = rules.get().get(category);
        if (compiled == null || compiled.required().isEmpty()) {
            return CompletenessInfo.complete();
        }
        CompletenessRule rule = compiled.rule();

        List<String> missing = new ArrayList<>();
        List<String> suggestions = new ArrayList<>();
        int present = 0;
        for (CompiledField field : compiled.required()) {
            if (isPresent(field, text, collected)) {
                present++;
            } else {
                missing.add(field.definition().name());
                suggestions.add(rule.suggestionFor(field.definition()));
            }
        }

        List<String> optionalMissing = new ArrayList<>();
        for (CompiledField field : compiled.optional()) {
            if (!isPresent(field, text, collected)) {
                optionalMissing.add(field.definition().name());
            }
        }

        int required = compiled.required().size();
        double score = Scores.round((double) present / required, 4);
        boolean complete = score >= rule.threshold();
        if (complete && collected.isEmpty() && text.strip().length() < rule.minimumLength()) {
            // Too short to act on: the detail counts as one more missing required field.
            complete = false;
            missing.add(DETAIL_FIELD);
            suggestions.add(rule.suggestionFor(new FieldDefinition(DETAIL_FIELD, DETAIL_DISPLAY_NAME,
                null, null, null, null)));
            score = Math.min(score, Scores.round(rule.threshold() * required / (required + 1), 4));
        }
        return new CompletenessInfo(complete, score, missing, optionalMissing, suggestions);
    }

    /**
     * Values for every field of the category found in the text: the first
     * capture group of a matching pattern, else the matched keyword.
     */
    public Map<String, String> extractFields(IntentCategory category, String text) {
        Map<String, String> extracted = new LinkedHashMap<>();
        CompiledRule compiled = rules.get().get(category);
        if (compiled == null || text == null || text.isBlank()) {
            return extracted;
        }
        List<CompiledField> all = new ArrayList<>(compiled.required());
        all.addAll(compiled.optional());
        for (CompiledField field : all) {
            extractValue(field, text).ifPresent(value -> extracted.put(field.definition().name(), value));
        }
        return extracted;
    }

    public Optional<FieldDefinition> fieldDefinition(IntentCategory category, String fieldName) {
        CompiledRule compiled = rules.get().get(category);
        if (compiled == null) {
            return Optional.empty();
        }
        return Stream.concat(compiled.required().stream(), compiled.optional().stream())
            .map(CompiledField::definition)
            .filter(f -> f.name().equals(fieldName))
            .findFirst();
    }

    public Optional<CompletenessRule> ruleFor(IntentCategory category) {
        return Optional.ofNullable(rules.get().get(category)).map(CompiledRule::rule);
    }

    private static boolean isPresent(CompiledField field, String text, Map<String, String> collected) {
        String value = collected.get(field.definition().name());
        if (value != null && !value.isBlank()) {
            return true;
        }
        String lowered = text.toLowerCase(Locale.ROOT);
        for (String keyword : field.loweredKeywords()) {
            if (lowered.contains(keyword)) {
                return true;
            }
        }
        for (Pattern pattern : field.patterns()) {
            if (pattern.matcher(text).find()) {
                return true;
            }
        }
        return false;
    }

    private static Optional<String> extractValue(CompiledField field, String text) {
        for (Pattern pattern : field.patterns()) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                String value = matcher.groupCount() >= 1 && matcher.group(1) != null
                    ? matcher.group(1) : matcher.group();
                if (value != null && !value.isBlank()) {
                    return Optional.of(value.strip());
                }
            }
        }
        String lowered = text.toLowerCase(Locale.ROOT);
        for (int i = 0; i < field.loweredKeywords().size(); i++) {
            if (lowered.contains(field.loweredKeywords().get(i))) {
                return Optional.of(field.definition().keywords().get(i));
            }
        }
        return Optional.empty();
    }

    /** Installs a new rule table atomically. Threshold overrides are re-applied. */
    public int reload(List<CompletenessRule> newRules) {
        Map<IntentCategory, CompiledRule> next = new EnumMap<>(IntentCategory.class);
        for (CompletenessRule rule : newRules == null ? List.<CompletenessRule>of() : newRules) {
            if (rule == null || rule.category() == null) {
                continue;
            }
            CompletenessRule effective = rule;
            Double override = thresholdOverrides.get(rule.category());
            if (override != null && override >= 0.0 && override <= 1.0) {
                effective = rule.withThreshold(override);
            }
            next.put(rule.category(), new CompiledRule(effective,
                compileFields(rule.category(), effective.requiredFields()),
                compileFields(rule.category(), effective.optionalFields())));
        }
        rules.set(Map.copyOf(next));
        log.info("Loaded completeness rules for {} categories", next.size());
        return next.size();
    }

    private static List<CompiledField> compileFields(IntentCategory category, List<FieldDefinition> fields) {
        List<CompiledField> compiled = new ArrayList<>();
        for (FieldDefinition field : fields) {
            List<Pattern> patterns = new ArrayList<>();
            for (String regex : field.patterns()) {
                try {
                    patterns.add(Pattern.compile(regex, PATTERN_FLAGS));
                } catch (PatternSyntaxException e) {
                    log.warn("Invalid pattern for {}.{}: '{}' ({})",
                        category.value(), field.name(), regex, e.getDescription());
                }
            }
            List<String> lowered = field.keywords().stream()
                .map(k -> k.toLowerCase(Locale.ROOT))
                .toList();
            compiled.add(new CompiledField(field, lowered, List.copyOf(patterns)));
        }
        return List.copyOf(compiled);
    }
}
