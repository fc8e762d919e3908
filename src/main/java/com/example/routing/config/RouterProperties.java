package com.example.routing.config;

import java.time.Duration;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "app.router")
public record RouterProperties(
    @DefaultValue("0.90") double patternThreshold,
    @DefaultValue("0.85") double semanticThreshold,
    @DefaultValue("true") boolean enableLlmFallback,
    @DefaultValue("true") boolean enableCompleteness,
    @DefaultValue("true") boolean trackLatency,
    @DefaultValue("lexical") String semanticBackend,
    @DefaultValue("keyword") String llmClassifier,
    @DefaultValue("5s") Duration encoderTimeout,
    @DefaultValue("2000") int maxInputLength,
    @DefaultValue("user") String defaultSource,
    @DefaultValue("false") boolean strictValidation,
    @DefaultValue("default") String riskPreset,
    @DefaultValue("1000") int auditBufferSize,
    @DefaultValue("1000") int metricsWindow,
    @DefaultValue("4h") Duration approvalTimeout,
    @DefaultValue Dialog dialog,
    @DefaultValue Tables tables,
    Map<String, Double> completenessThresholds
) {

    public RouterProperties {
        completenessThresholds = completenessThresholds == null ? Map.of() : Map.copyOf(completenessThresholds);
    }

    public record Dialog(
        @DefaultValue("5") int maxTurns,
        @DefaultValue("3") int maxQuestions,
        @DefaultValue("30m") Duration sessionTtl,
        @DefaultValue("1m") Duration sweepInterval
    ) {}

    /** Optional filesystem overrides for the bundled rule tables. */
    public record Tables(
        String patternRules,
        String semanticRoutes,
        String completenessRules,
        String riskPolicies,
        String refinementRules,
        String questionTemplates
    ) {}
}
