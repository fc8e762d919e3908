package com.example.routing.classifier;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.routing.model.CompletenessInfo;
import com.example.routing.model.IntentCategory;
import com.example.routing.model.Scores;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Turns model output into a classification. Tries, in order: the whole text
 * as JSON (markdown fences stripped), the first balanced {...} object inside
 * it, and finally keyword inference over the raw text.
 */
class LlmResponseParser {

    private static final Logger log = LoggerFactory.getLogger(LlmResponseParser.class);
    private static final ObjectMapper mapper = new ObjectMapper();

    static final double UNSTRUCTURED_CONFIDENCE_CAP = 0.5;

    enum Strategy { STRICT, EMBEDDED, KEYWORD }

    record Parsed(LlmClassificationResult result, Strategy strategy) {}

    Parsed parse(String content) {
        String text = stripFences(content == null ? "" : content.strip());

        JsonNode root = readObject(text);
        if (root != null) {
            return new Parsed(fromJson(root), Strategy.STRICT);
        }

        String embedded = extractEmbeddedObject(text);
        if (embedded != null) {
            root = readObject(embedded);
            if (root != null) {
                return new Parsed(fromJson(root), Strategy.EMBEDDED);
            }
        }

        log.warn("LLM response was not structured, falling back to keyword inference");
        return new Parsed(fromKeywords(text), Strategy.KEYWORD);
    }

    static String stripFences(String content) {
        if (content.startsWith("```")) {
            return content.replaceAll("```(?:json)?\\s*", "").replaceAll("```\\s*$", "").strip();
        }
        return content;
    }

    private static JsonNode readObject(String text) {
        if (text.isEmpty() || text.charAt(0) != '{') {
            return null;
        }
        try {
            JsonNode node = mapper.readTree(text);
            return node != null && node.isObject() ? node : null;
        } catch (JsonProcessingException e) {
            log.debug("Candidate is not valid JSON: {}", e.getOriginalMessage());
            return null;
        }
    }

    /** First balanced top-level object, honouring string literals and escapes. */
    static String extractEmbeddedObject(String text) {
        int start = text.indexOf('{');
        while (start >= 0) {
            int depth = 0;
            boolean inString = false;
            boolean escaped = false;
            for (int i = start; i < text.length(); i++) {
                char c = text.charAt(i);
                if (inString) {
                    if (escaped) {
                        escaped = false;
                    } else if (c == '\\') {
                        escaped = true;
                    } else if (c == '"') {
                        inString = false;
                    }
                    continue;
                }
                if (c == '"') {
                    inString = true;
                } else if (c == '{') {
                    depth++;
                } else if (c == '}') {
                    depth--;
                    if (depth == 0) {
                        return text.substring(start, i + 1);
                    }
                }
            }
            start = text.indexOf('{', start + 1);
        }
        return null;
    }

    private static LlmClassificationResult fromJson(JsonNode root) {
        String rawCategory = firstText(root, "intent_category", "category", "intent");
        IntentCategory category = IntentCategory.fromString(rawCategory);
        String subIntent = firstText(root, "sub_intent", "subIntent", "sub_category");
        double confidence = root.has("confidence") ? root.get("confidence").asDouble(0.0) : 0.5;
        String reasoning = firstText(root, "reasoning", "reason");

        CompletenessInfo completeness = null;
        JsonNode block = root.get("completeness");
        if (block != null && block.isObject()) {
            completeness = new CompletenessInfo(
                block.path("is_complete").asBoolean(false),
                block.path("completeness_score").asDouble(0.0),
                textList(block.get("missing_fields")),
                textList(block.get("optional_missing")),
                textList(block.get("suggestions")));
        }

        return new LlmClassificationResult(category, blankToNull(subIntent), Scores.clamp(confidence),
            reasoning != null ? reasoning : "LLM classification", completeness, null, 0, 0, 0.0, null);
    }

    private static LlmClassificationResult fromKeywords(String raw) {
        KeywordIntentInference.Inference inference = KeywordIntentInference.infer(raw);
        IntentCategory category = inference.category();
        String subIntent = inference.subIntent();
        if (category == IntentCategory.UNKNOWN) {
            category = KeywordIntentInference.categoryMentioned(raw);
        }
        double confidence = category == IntentCategory.UNKNOWN
            ? 0.0
            : Math.min(UNSTRUCTURED_CONFIDENCE_CAP, Math.max(inference.confidence(), 0.3));
        return LlmClassificationResult.of(category, subIntent, confidence,
            "Inferred from unstructured LLM output");
    }

    private static String firstText(JsonNode root, String... keys) {
        for (String key : keys) {
            JsonNode node = root.get(key);
            if (node != null && !node.isNull()) {
                return node.asText();
            }
        }
        return null;
    }

    private static List<String> textList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node != null && node.isArray()) {
            for (JsonNode item : node) {
                values.add(item.asText());
            }
        }
        return values;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() || "null".equalsIgnoreCase(value) ? null : value;
    }
}
