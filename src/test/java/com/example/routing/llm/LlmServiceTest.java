package com.example.routing.llm;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeoutException;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;

import com.example.routing.config.AppConfig;

import io.opentelemetry.api.OpenTelemetry;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class LlmServiceTest {

    private final ChatModel primary = mock(ChatModel.class);
    private final ChatModel fallback = mock(ChatModel.class);

    private static AppConfig config(String fallbackModel, int maxRetries) {
        return new AppConfig("openai", "gpt-4.1-mini", "anthropic", fallbackModel, 128, 0.0,
            Duration.ofSeconds(2), maxRetries, null);
    }

    private LlmService service(String fallbackModel, int maxRetries) {
        return new LlmService(primary, fallback, config(fallbackModel, maxRetries), Pricing.fallbackOnly(),
            OpenTelemetry.noop());
    }

    private static ChatResponse reply(String text) {
        return new ChatResponse(List.of(new Generation(new AssistantMessage(text))));
    }

    @Test
    void primaryAnswerSkipsFallback() {
        when(primary.call(any(Prompt.class))).thenReturn(reply("{\"intent_category\":\"incident\"}"));

        LlmResponse response = service("claude-3-5-haiku", 2).classify("system", "ETL 失敗");

        assertEquals("{\"intent_category\":\"incident\"}", response.content());
        assertEquals("openai", response.provider());
        assertEquals("gpt-4.1-mini", response.model());
        verifyNoInteractions(fallback);
    }

    @Test
    void transientFailureIsRetriedOnSameProvider() {
        when(primary.call(any(Prompt.class)))
            .thenThrow(new RuntimeException("503 service unavailable"))
            .thenReturn(reply("ok"));

        LlmResponse response = service("claude-3-5-haiku", 2).classify("system", "VPN 斷線");

        assertEquals("ok", response.content());
        verify(primary, times(2)).call(any(Prompt.class));
        verifyNoInteractions(fallback);
    }

    @Test
    void authFailureGoesStraightToFallback() {
        when(primary.call(any(Prompt.class))).thenThrow(new RuntimeException("401 unauthorized"));
        when(fallback.call(any(Prompt.class))).thenReturn(reply("ok"));

        LlmResponse response = service("claude-3-5-haiku", 3).classify("system", "VPN 斷線");

        assertEquals("anthropic", response.provider());
        assertEquals("claude-3-5-haiku", response.model());
        verify(primary, times(1)).call(any(Prompt.class));
    }

    @Test
    void exhaustedChainReportsLastBucket() {
        when(primary.call(any(Prompt.class))).thenThrow(new RuntimeException("503 service unavailable"));
        when(fallback.call(any(Prompt.class))).thenThrow(new RuntimeException("connection refused"));

        LlmUnavailableException e = assertThrows(LlmUnavailableException.class,
            () -> service("claude-3-5-haiku", 1).classify("system", "VPN 斷線"));

        assertEquals("network_error", e.errorType());
    }

    @Test
    void fallbackWithoutModelReusesPrimaryModel() {
        List<LlmService.Provider> chain = service("", 1).chain();

        assertEquals(List.of("openai", "anthropic"), chain.stream().map(LlmService.Provider::name).toList());
        assertEquals("gpt-4.1-mini", chain.get(1).model());
        assertEquals(1, new LlmService(primary, null, config(null, 1), Pricing.fallbackOnly(),
            OpenTelemetry.noop()).chain().size());
    }

    @ParameterizedTest
    @CsvSource({
        "'rate limit exceeded',          rate_limit",
        "'status 429: too many requests', rate_limit",
        "'context deadline exceeded',    timeout",
        "'request timed out',            timeout",
        "'401 unauthorized',             auth_error",
        "'403 forbidden',                auth_error",
        "'invalid api key',              auth_error",
        "'400 bad request',              invalid_request",
        "'invalid model name',           invalid_request",
        "'502 bad gateway',              server_error",
        "'503 service unavailable',      server_error",
        "'connection refused',           network_error",
        "'dns resolution failed',        network_error",
        "'something unexpected',         unknown_error",
    })
    void classifyErrorCategories(String message, String expected) {
        var error = new RuntimeException(message);
        assertEquals(expected, LlmService.classifyError(error),
            "classifyError(\"" + message + "\") should be " + expected);
    }

    @Test
    void timeoutAnywhereInTheCauseChainIsATimeout() {
        var error = new CompletionException("wrapped", new TimeoutException());
        assertEquals("timeout", LlmService.classifyError(error));
    }

    @Test
    void classifyErrorNull() {
        assertEquals("unknown_error", LlmService.classifyError(null));
    }

    @Test
    void unavailableExceptionCarriesBucketAndCause() {
        var cause = new RuntimeException("503 service unavailable");
        var e = new LlmUnavailableException("server_error", cause);

        assertEquals("server_error", e.errorType());
        assertSame(cause, e.getCause());
        assertTrue(e.getMessage().contains("503 service unavailable"));
    }
}
