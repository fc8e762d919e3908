package com.example.routing.llm;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeoutException;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleCounter;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;

import com.example.routing.config.AppConfig;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Sends classification prompts to the configured chat model. Each provider
 * in the chain (primary, then the optional fallback) gets
 * {@code max-retries} attempts with jittered backoff, each bounded by the
 * configured timeout.
 */
public class LlmService {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    static final String STAGE = "classify";
    static final Set<String> PERMANENT_ERRORS = Set.of("auth_error", "invalid_request");

    private static final long BASE_BACKOFF_MS = 250;
    private static final long BACKOFF_CEILING_MS = 2000;

    private static final AttributeKey<String> PROVIDER = AttributeKey.stringKey("gen_ai.provider.name");
    private static final AttributeKey<String> MODEL = AttributeKey.stringKey("gen_ai.request.model");
    private static final AttributeKey<String> TOKEN_TYPE = AttributeKey.stringKey("gen_ai.token.type");
    private static final AttributeKey<String> ERROR_TYPE = AttributeKey.stringKey("error.type");

    /** One link of the provider chain. */
    record Provider(String name, String model, ChatModel chatModel) {}

    private final List<Provider> chain;
    private final AppConfig config;
    private final Pricing pricing;
    private final Tracer tracer;
    private final DoubleHistogram tokens;
    private final DoubleHistogram duration;
    private final DoubleCounter cost;
    private final LongCounter errors;

    public LlmService(ChatModel primary, ChatModel fallback, AppConfig config, Pricing pricing,
                      OpenTelemetry openTelemetry) {
        List<Provider> providers = new ArrayList<>();
        providers.add(new Provider(config.provider(), config.model(), primary));
        if (fallback != null) {
            String fallbackModel = config.fallbackModel() != null && !config.fallbackModel().isBlank()
                ? config.fallbackModel() : config.model();
            providers.add(new Provider(config.fallbackProvider(), fallbackModel, fallback));
        }
        this.chain = List.copyOf(providers);
        this.config = config;
        this.pricing = pricing;
        this.tracer = openTelemetry.getTracer("itsm-intent-router");

        Meter meter = openTelemetry.getMeter("itsm-intent-router");
        this.tokens = meter.histogramBuilder("gen_ai.client.token.usage").setUnit("{token}").build();
        this.duration = meter.histogramBuilder("gen_ai.client.operation.duration").setUnit("s").build();
        this.cost = meter.counterBuilder("gen_ai.client.cost").ofDoubles().setUnit("usd").build();
        this.errors = meter.counterBuilder("gen_ai.client.error.count").build();
    }

    /**
     * Classifies {@code text} under {@code systemPrompt}, walking the provider
     * chain until one answers.
     *
     * @throws LlmUnavailableException when every provider failed; carries the error bucket of the last failure
     */
    public LlmResponse classify(String systemPrompt, String text) {
        RuntimeException last = null;
        for (Provider provider : chain) {
            if (last != null) {
                if (Thread.currentThread().isInterrupted()) {
                    break;
                }
                log.warn("Falling back to LLM provider {} ({})", provider.name(), provider.model());
            }
            try {
                return withRetries(provider, systemPrompt, text);
            } catch (RuntimeException e) {
                last = e;
            }
        }
        throw new LlmUnavailableException(classifyError(last), last);
    }

    List<Provider> chain() {
        return chain;
    }

    private LlmResponse withRetries(Provider provider, String systemPrompt, String text) {
        int maxAttempts = Math.max(1, config.maxRetries());
        for (int attempt = 1; ; attempt++) {
            try {
                return call(provider, systemPrompt, text);
            } catch (RuntimeException e) {
                String bucket = classifyError(e);
                log.warn("LLM call {}/{} to {} failed: {}", attempt, maxAttempts, provider.name(), bucket);
                if (attempt >= maxAttempts || PERMANENT_ERRORS.contains(bucket) || !pause(backoff(attempt))) {
                    throw e;
                }
            }
        }
    }

    private LlmResponse call(Provider provider, String systemPrompt, String text) {
        Attributes attrs = Attributes.of(PROVIDER, provider.name(), MODEL, provider.model());
        Span span = tracer.spanBuilder("llm_chat")
            .setAttribute("routing.stage", STAGE)
            .setAllAttributes(attrs)
            .setAttribute("server.address", LlmConfig.PROVIDER_SERVERS.getOrDefault(provider.name(), "unknown"))
            .setAttribute("gen_ai.request.max_tokens", (long) config.maxTokens())
            .startSpan();
        long started = System.nanoTime();

        try (Scope ignored = span.makeCurrent()) {
            Prompt prompt = new Prompt(List.of(new SystemMessage(systemPrompt), new UserMessage(text)),
                ChatOptions.builder()
                    .model(provider.model())
                    .temperature(config.temperature())
                    .maxTokens(config.maxTokens())
                    .build());
            ChatResponse response = Mono.fromCallable(() -> provider.chatModel().call(prompt))
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(config.timeout())
                .block();
            if (response == null || response.getResult() == null) {
                throw new IllegalStateException("invalid response: no generation returned");
            }

            var usage = response.getMetadata().getUsage();
            int in = usage != null && usage.getPromptTokens() != null ? usage.getPromptTokens() : 0;
            int out = usage != null && usage.getCompletionTokens() != null ? usage.getCompletionTokens() : 0;
            String model = response.getMetadata().getModel();
            if (model == null || model.isEmpty()) {
                model = provider.model();
            }
            var generationMetadata = response.getResult().getMetadata();
            String finishReason = generationMetadata != null && generationMetadata.getFinishReason() != null
                ? generationMetadata.getFinishReason() : "";
            String content = response.getResult().getOutput().getText();
            double usd = pricing.calculateCost(model, in, out);
            double seconds = (System.nanoTime() - started) / 1e9;

            span.setAttribute("gen_ai.response.model", model);
            span.setAttribute("gen_ai.usage.input_tokens", (long) in);
            span.setAttribute("gen_ai.usage.output_tokens", (long) out);
            tokens.record(in, attrs.toBuilder().put(TOKEN_TYPE, "input").build());
            tokens.record(out, attrs.toBuilder().put(TOKEN_TYPE, "output").build());
            duration.record(seconds, attrs);
            cost.add(usd, attrs);

            return new LlmResponse(content != null ? content : "", model, provider.name(), in, out, usd,
                finishReason, seconds * 1000.0);
        } catch (RuntimeException e) {
            String bucket = classifyError(e);
            span.setStatus(StatusCode.ERROR, String.valueOf(e.getMessage()));
            span.setAttribute(ERROR_TYPE, bucket);
            errors.add(1, attrs.toBuilder().put(ERROR_TYPE, bucket).build());
            throw e;
        } finally {
            span.end();
        }
    }

    /** Maps a failure to one of the error buckets reported on classification results. */
    static String classifyError(Throwable e) {
        if (e == null) {
            return "unknown_error";
        }
        for (Throwable t = e; t != null && t.getCause() != t; t = t.getCause()) {
            if (t instanceof TimeoutException || t instanceof InterruptedException) {
                return "timeout";
            }
        }
        String msg = e.getMessage() == null ? "" : e.getMessage().toLowerCase(Locale.ROOT);
        if (containsAny(msg, "rate limit", "429")) {
            return "rate_limit";
        }
        if (containsAny(msg, "timeout", "timed out", "deadline", "did not observe")) {
            return "timeout";
        }
        if (containsAny(msg, "401", "403", "auth", "api key")) {
            return "auth_error";
        }
        if (containsAny(msg, "400", "422", "invalid")) {
            return "invalid_request";
        }
        if (containsAny(msg, "500", "502", "503", "server")) {
            return "server_error";
        }
        if (containsAny(msg, "connect", "dns", "network", "reset")) {
            return "network_error";
        }
        return "unknown_error";
    }

    private static boolean containsAny(String haystack, String... needles) {
        for (String needle : needles) {
            if (haystack.contains(needle)) {
                return true;
            }
        }
        return false;
    }

    static long backoff(int attempt) {
        long base = Math.min(BASE_BACKOFF_MS << (attempt - 1), BACKOFF_CEILING_MS);
        return base + ThreadLocalRandom.current().nextLong(base / 4 + 1);
    }

    private static boolean pause(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
