package com.example.routing.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "app.llm")
public record AppConfig(
    String provider,
    String model,
    String fallbackProvider,
    String fallbackModel,
    @DefaultValue("512") int maxTokens,
    @DefaultValue("0.0") double temperature,
    @DefaultValue("10s") Duration timeout,
    @DefaultValue("2") int maxRetries,
    String pricingFile
) {}
