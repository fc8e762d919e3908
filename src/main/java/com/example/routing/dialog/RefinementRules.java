package com.example.routing.dialog;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.routing.model.IntentCategory;

/**
 * Sub-intent refinement table, indexed by category and sorted by descending
 * priority. Conditions are compiled when the table is installed.
 */
public class RefinementRules {

    private static final Logger log = LoggerFactory.getLogger(RefinementRules.class);

    record CompiledRule(RefinementRule rule, List<Predicate<Map<String, String>>> conditions) {

        boolean matches(String currentSubIntent, Map<String, String> info) {
            if (!rule.appliesTo(currentSubIntent)) {
                return false;
            }
            for (Predicate<Map<String, String>> condition : conditions) {
                if (!condition.test(info)) {
                    return false;
                }
            }
            return true;
        }
    }

    private final AtomicReference<Map<IntentCategory, List<CompiledRule>>> rules = new AtomicReference<>(Map.of());

    public RefinementRules(List<RefinementRule> rules) {
        reload(rules);
    }

    /** Highest-priority enabled rule whose source sub-intent and conditions all match. */
    public Optional<RefinementRule> find(IntentCategory category, String currentSubIntent, Map<String, String> info) {
        for (CompiledRule compiled : rules.get().getOrDefault(category, List.of())) {
            if (compiled.matches(currentSubIntent, info)) {
                log.debug("Refinement rule matched: {} ({} → {})",
                    compiled.rule().id(), currentSubIntent, compiled.rule().toSubIntent());
                return Optional.of(compiled.rule());
            }
        }
        return Optional.empty();
    }

    public List<RefinementRule> rulesFor(IntentCategory category) {
        return rules.get().getOrDefault(category, List.of()).stream().map(CompiledRule::rule).toList();
    }

    public Set<String> targetSubIntents(IntentCategory category) {
        Set<String> targets = new LinkedHashSet<>();
        rulesFor(category).forEach(rule -> targets.add(rule.toSubIntent()));
        return targets;
    }

    public List<RefinementRule> all() {
        List<RefinementRule> all = new ArrayList<>();
        rules.get().values().forEach(list -> list.forEach(compiled -> all.add(compiled.rule())));
        return all;
    }

    public void add(RefinementRule rule) {
        List<RefinementRule> next = new ArrayList<>(all());
        next.removeIf(existing -> existing.id().equals(rule.id()));
        next.add(rule);
        reload(next);
    }

    public boolean remove(String ruleId) {
        List<RefinementRule> next = new ArrayList<>(all());
        boolean removed = next.removeIf(existing -> existing.id().equals(ruleId));
        if (removed) {
            reload(next);
        }
        return removed;
    }

    public int reload(List<RefinementRule> newRules) {
        Map<IntentCategory, List<CompiledRule>> grouped = new EnumMap<>(IntentCategory.class);
        int count = 0;
        for (RefinementRule rule : newRules == null ? List.<RefinementRule>of() : newRules) {
            if (rule == null || rule.id() == null || rule.category() == null || rule.toSubIntent() == null) {
                log.warn("Skipping incomplete refinement rule: {}", rule);
                continue;
            }
            if (!rule.enabled()) {
                continue;
            }
            grouped.computeIfAbsent(rule.category(), c -> new ArrayList<>()).add(compile(rule));
            count++;
        }
        Map<IntentCategory, List<CompiledRule>> snapshot = new EnumMap<>(IntentCategory.class);
        grouped.forEach((category, list) -> snapshot.put(category, list.stream()
            .sorted(Comparator.comparingInt((CompiledRule c) -> c.rule().priority()).reversed())
            .toList()));
        rules.set(Map.copyOf(snapshot));
        log.info("Loaded {} refinement rules", count);
        return count;
    }

    private static CompiledRule compile(RefinementRule rule) {
        List<Predicate<Map<String, String>>> predicates = new ArrayList<>();
        for (RefinementCondition condition : rule.conditions()) {
            predicates.add(compile(rule.id(), condition));
        }
        return new CompiledRule(rule, List.copyOf(predicates));
    }

    static Predicate<Map<String, String>> compile(String ruleId, RefinementCondition condition) {
        String field = condition.fieldName();
        if (condition.isPattern()) {
            try {
                Pattern pattern = Pattern.compile(condition.fieldValue(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
                return info -> {
                    String value = info.get(field);
                    return value != null && pattern.matcher(value).find();
                };
            } catch (PatternSyntaxException e) {
                log.warn("Invalid pattern in refinement rule {}: '{}' ({})", ruleId, condition.fieldValue(),
                    e.getDescription());
                return info -> false;
            }
        }
        List<String> keywords = condition.matchAny()
            ? List.of(condition.fieldValue().toLowerCase(Locale.ROOT).split("\\|"))
            : List.of(condition.fieldValue().toLowerCase(Locale.ROOT));
        return info -> {
            String value = info.get(field);
            if (value == null) {
                return false;
            }
            String lowered = value.toLowerCase(Locale.ROOT);
            for (String keyword : keywords) {
                if (!keyword.isEmpty() && lowered.contains(keyword)) {
                    return true;
                }
            }
            return false;
        };
    }
}
