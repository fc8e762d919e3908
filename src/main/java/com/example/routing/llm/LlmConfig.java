package com.example.routing.llm;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.example.routing.config.AppConfig;

import io.opentelemetry.api.OpenTelemetry;

@Configuration
public class LlmConfig {

    private static final Logger log = LoggerFactory.getLogger(LlmConfig.class);

    public static final Map<String, String> PROVIDER_SERVERS = Map.of(
        "openai", "api.openai.com",
        "anthropic", "api.anthropic.com",
        "ollama", "localhost"
    );

    // Spring AI registers its chat models under these bean names.
    private static final Map<String, String> PROVIDER_BEANS = Map.of(
        "openai", "openAiChatModel",
        "anthropic", "anthropicChatModel",
        "ollama", "ollamaChatModel"
    );

    @Bean
    Pricing pricing(AppConfig config) {
        return Pricing.load(config.pricingFile());
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.router", name = "llm-classifier", havingValue = "chat_model")
    LlmService llmService(
        AppConfig config,
        Map<String, ChatModel> chatModels,
        Pricing pricing,
        OpenTelemetry openTelemetry
    ) {
        ChatModel primary = resolveChatModel(config.provider(), chatModels);
        ChatModel fallback = config.fallbackProvider() == null || config.fallbackProvider().isBlank()
            ? null : resolveChatModel(config.fallbackProvider(), chatModels);
        log.info("LLM classifier model: {}/{}, fallback: {}/{}, timeout={}",
            config.provider(), config.model(), config.fallbackProvider(), config.fallbackModel(), config.timeout());
        return new LlmService(primary, fallback, config, pricing, openTelemetry);
    }

    static ChatModel resolveChatModel(String provider, Map<String, ChatModel> chatModels) {
        String beanName = PROVIDER_BEANS.get(provider);
        if (beanName == null) {
            throw new IllegalArgumentException("Unknown LLM provider: " + provider);
        }
        var model = chatModels.get(beanName);
        if (model == null) {
            throw new IllegalStateException(
                "ChatModel bean '" + beanName + "' not found. Available: " + chatModels.keySet());
        }
        return model;
    }
}
