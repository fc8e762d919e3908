package com.example.routing.dialog;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.routing.completeness.CompletenessChecker;
import com.example.routing.completeness.CompletenessRule;
import com.example.routing.completeness.FieldDefinition;
import com.example.routing.model.IntentCategory;

/**
 * Template-driven question selection. For each missing field the
 * category-specific template wins over a general one; the result is ordered
 * by priority and capped.
 */
public class QuestionGenerator {

    private static final Logger log = LoggerFactory.getLogger(QuestionGenerator.class);

    public static final int DEFAULT_MAX_QUESTIONS = 3;

    private final AtomicReference<Map<String, List<QuestionTemplate>>> templates =
        new AtomicReference<>(Map.of());
    private final int maxQuestions;

    public QuestionGenerator(List<QuestionTemplate> templates, int maxQuestions) {
        this.maxQuestions = maxQuestions > 0 ? maxQuestions : DEFAULT_MAX_QUESTIONS;
        reload(templates);
    }

    public List<GeneratedQuestion> generate(IntentCategory category, List<String> missingFields) {
        return generate(category, missingFields, maxQuestions);
    }

    public List<GeneratedQuestion> generate(IntentCategory category, List<String> missingFields, int limit) {
        if (missingFields == null || missingFields.isEmpty()) {
            return List.of();
        }
        List<GeneratedQuestion> questions = new ArrayList<>();
        for (String field : missingFields) {
            bestTemplate(field, category).ifPresent(t ->
                questions.add(new GeneratedQuestion(t.question(), t.fieldName(), t.priority(), t.examples())));
        }
        questions.sort(Comparator.comparingInt(GeneratedQuestion::priority).reversed());
        List<GeneratedQuestion> selected = questions.size() > limit ? questions.subList(0, limit) : questions;
        log.debug("Generated {} questions for {} ({} missing fields)",
            selected.size(), category.value(), missingFields.size());
        return List.copyOf(selected);
    }

    /**
     * Questions for every required field of the category that is not yet in
     * {@code collected}.
     */
    public List<GeneratedQuestion> generateForIntent(IntentCategory category, Map<String, String> collected,
                                                     CompletenessChecker checker) {
        Optional<CompletenessRule> rule = checker.ruleFor(category);
        if (rule.isEmpty()) {
            return List.of();
        }
        List<String> missing = new ArrayList<>();
        for (FieldDefinition field : rule.get().requiredFields()) {
            String value = collected == null ? null : collected.get(field.name());
            if (value == null || value.isBlank()) {
                missing.add(field.name());
            }
        }
        return generate(category, missing);
    }

    public Optional<String> questionText(String fieldName, IntentCategory category) {
        return bestTemplate(fieldName, category).map(QuestionTemplate::question);
    }

    public int maxQuestions() {
        return maxQuestions;
    }

    public int reload(List<QuestionTemplate> newTemplates) {
        Map<String, List<QuestionTemplate>> byField = new LinkedHashMap<>();
        for (QuestionTemplate template : newTemplates == null ? List.<QuestionTemplate>of() : newTemplates) {
            byField.computeIfAbsent(template.fieldName(), f -> new ArrayList<>()).add(template);
        }
        Map<String, List<QuestionTemplate>> snapshot = new LinkedHashMap<>();
        byField.forEach((field, list) -> snapshot.put(field, List.copyOf(list)));
        templates.set(Map.copyOf(snapshot));
        log.info("Loaded question templates for {} fields", snapshot.size());
        return snapshot.size();
    }

    private Optional<QuestionTemplate> bestTemplate(String fieldName, IntentCategory category) {
        List<QuestionTemplate> candidates = templates.get().getOrDefault(fieldName, List.of());
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        for (QuestionTemplate template : candidates) {
            if (template.category() == category) {
                return Optional.of(template);
            }
        }
        for (QuestionTemplate template : candidates) {
            if (template.isGeneral()) {
                return Optional.of(template);
            }
        }
        return Optional.of(candidates.get(0));
    }
}
