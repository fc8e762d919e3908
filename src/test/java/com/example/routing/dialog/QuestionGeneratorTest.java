package com.example.routing.dialog;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.example.routing.completeness.CompletenessChecker;
import com.example.routing.config.RuleTables;
import com.example.routing.model.IntentCategory;

import io.opentelemetry.api.OpenTelemetry;

import static org.junit.jupiter.api.Assertions.*;

class QuestionGeneratorTest {

    private static final RuleTables TABLES = RuleTables.defaults();

    private final QuestionGenerator generator = new QuestionGenerator(TABLES.questionTemplates(), 3);

    @Test
    void questionsAreOrderedByPriority() {
        List<GeneratedQuestion> questions = generator.generate(IntentCategory.INCIDENT,
            List.of("urgency", "affected_system", "symptom_type"));

        assertEquals(List.of("affected_system", "symptom_type", "urgency"),
            questions.stream().map(GeneratedQuestion::targetField).toList());
        assertEquals("請問是哪個系統有問題？", questions.get(0).question());
    }

    @Test
    void resultIsCappedAtLimit() {
        QuestionGenerator two = new QuestionGenerator(TABLES.questionTemplates(), 2);

        List<GeneratedQuestion> questions = two.generate(IntentCategory.INCIDENT,
            List.of("urgency", "affected_system", "symptom_type", "error_message"));

        assertEquals(2, questions.size());
        assertEquals(1, generator.generate(IntentCategory.INCIDENT, List.of("urgency", "symptom_type"), 1).size());
    }

    @Test
    void fieldsWithoutTemplateAreSkipped() {
        assertTrue(generator.generate(IntentCategory.INCIDENT, List.of("favourite_colour")).isEmpty());
        assertTrue(generator.generate(IntentCategory.INCIDENT, List.of()).isEmpty());
        assertTrue(generator.generate(IntentCategory.INCIDENT, null).isEmpty());
    }

    @Test
    void generalTemplateAppliesToAnyCategory() {
        assertEquals("請問還有其他需要補充的資訊嗎？",
            generator.questionText("additional_details", IntentCategory.CHANGE).orElseThrow());
    }

    @Test
    void categorySpecificTemplateBeatsGeneralOne() {
        QuestionGenerator custom = new QuestionGenerator(List.of(
            new QuestionTemplate("system", null, "Which system?", 10, null, null),
            new QuestionTemplate("system", IntentCategory.CHANGE, "Which system will change?", 10, null, null),
            new QuestionTemplate("owner", IntentCategory.REQUEST, "Who owns it?", 10, null, null)), 3);

        assertEquals("Which system will change?", custom.questionText("system", IntentCategory.CHANGE).orElseThrow());
        assertEquals("Which system?", custom.questionText("system", IntentCategory.INCIDENT).orElseThrow());
        // neither category-specific nor general: first template for the field
        assertEquals("Who owns it?", custom.questionText("owner", IntentCategory.INCIDENT).orElseThrow());
        assertTrue(custom.questionText("nothing", IntentCategory.INCIDENT).isEmpty());
    }

    @Test
    void generateForIntentAsksForUncollectedRequiredFields() {
        CompletenessChecker checker =
            new CompletenessChecker(TABLES.completenessRules(), Map.of(), OpenTelemetry.noop());

        List<GeneratedQuestion> questions = generator.generateForIntent(IntentCategory.INCIDENT,
            Map.of("affected_system", "ETL"), checker);

        assertEquals(List.of("symptom_type", "urgency"),
            questions.stream().map(GeneratedQuestion::targetField).toList());
        assertTrue(generator.generateForIntent(IntentCategory.UNKNOWN, Map.of(), checker).isEmpty());
    }

    @Test
    void nonPositiveMaxFallsBackToDefault() {
        assertEquals(QuestionGenerator.DEFAULT_MAX_QUESTIONS, new QuestionGenerator(List.of(), 0).maxQuestions());
    }

    @Test
    void templateRequiresQuestionText() {
        assertThrows(IllegalArgumentException.class,
            () -> new QuestionTemplate("system", null, " ", 10, null, null));
    }
}
