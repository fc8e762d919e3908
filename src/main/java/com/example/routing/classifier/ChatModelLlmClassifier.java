package com.example.routing.classifier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.routing.llm.LlmResponse;
import com.example.routing.llm.LlmService;
import com.example.routing.llm.LlmUnavailableException;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

public class ChatModelLlmClassifier implements LlmClassifier {

    private static final Logger log = LoggerFactory.getLogger(ChatModelLlmClassifier.class);

    public static final String NAME = "chat_model";

    static final String SYSTEM_PROMPT = """
        You are an IT service management intent classifier. Classify the user's message.

        Respond ONLY with a JSON object (no markdown, no explanation):
        {
          "intent_category": "incident|request|change|query|unknown",
          "sub_intent": "snake_case sub-intent such as etl_failure, performance_issue, access_request",
          "confidence": 0.0-1.0,
          "reasoning": "one short sentence"
        }

        Category definitions:
        - incident: something is broken, failing, slow or unavailable
        - request: asking for something new (account, access, software, hardware)
        - change: modifying a system (deployment, configuration, database change)
        - query: asking for information or status
        - unknown: none of the above or too vague to tell
        """;

    static final String COMPLETENESS_ADDENDUM = """

        Also include a "completeness" object judging whether the message has enough detail to act on:
        "completeness": {"is_complete": true|false, "completeness_score": 0.0-1.0,
                         "missing_fields": ["..."], "suggestions": ["..."]}
        """;

    private final LlmService llmService;
    private final LlmResponseParser parser = new LlmResponseParser();
    private final Tracer tracer;

    public ChatModelLlmClassifier(LlmService llmService, OpenTelemetry openTelemetry) {
        this.llmService = llmService;
        this.tracer = openTelemetry.getTracer("itsm-intent-router");
    }

    @Override
    public LlmClassificationResult classify(String text, boolean includeCompleteness) {
        Span span = tracer.spanBuilder("llm_classify")
            .setAttribute("routing.stage", "llm")
            .setAttribute("routing.include_completeness", includeCompleteness)
            .startSpan();

        try (Scope ignored = span.makeCurrent()) {
            String systemPrompt = includeCompleteness ? SYSTEM_PROMPT + COMPLETENESS_ADDENDUM : SYSTEM_PROMPT;
            LlmResponse response = llmService.classify(systemPrompt, text);
            LlmClassificationResult result = parseResponse(response);

            span.setAttribute("routing.intent", result.category().value());
            span.setAttribute("routing.confidence", result.confidence());
            log.debug("LLM classified intent: {}/{} (confidence={})",
                result.category(), result.subIntent(), result.confidence());
            return result;

        } catch (LlmUnavailableException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            log.error("LLM classification failed ({}): {}", e.errorType(), e.getMessage());
            return LlmClassificationResult.failure(e.errorType(),
                "LLM classification failed (" + e.errorType() + "): " + rootMessage(e));

        } catch (Exception e) {
            span.setStatus(StatusCode.ERROR, String.valueOf(e.getMessage()));
            log.error("LLM classification failed, using fallback: {}", e.toString());
            return LlmClassificationResult.failure("unknown_error",
                "LLM classification failed (unknown_error): " + e);

        } finally {
            span.end();
        }
    }

    LlmClassificationResult parseResponse(LlmResponse response) {
        LlmResponseParser.Parsed parsed = parser.parse(response.content());
        return parsed.result().withUsage(response.model(), response.inputTokens(), response.outputTokens(),
            response.costUsd());
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }

    @Override
    public String name() {
        return NAME;
    }
}
