package com.example.routing.telemetry;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;

/**
 * Exposes the process-wide OpenTelemetry instance (installed by the Java
 * agent when present, otherwise a no-op) to the components that trace and
 * meter.
 */
@Configuration
public class TelemetryConfig {

    @Bean
    @ConditionalOnMissingBean
    OpenTelemetry openTelemetry() {
        return GlobalOpenTelemetry.get();
    }
}
