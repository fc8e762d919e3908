package com.example.routing.config;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.example.routing.approval.ApprovalGate;
import com.example.routing.approval.LoggingApprovalGate;
import com.example.routing.audit.AuditLogger;
import com.example.routing.classifier.ChatModelLlmClassifier;
import com.example.routing.classifier.KeywordLlmClassifier;
import com.example.routing.classifier.LlmClassifier;
import com.example.routing.completeness.CompletenessChecker;
import com.example.routing.dialog.DialogSessionManager;
import com.example.routing.dialog.GuidedDialogEngine;
import com.example.routing.dialog.QuestionGenerator;
import com.example.routing.dialog.RefinementRules;
import com.example.routing.filter.PiiFilter;
import com.example.routing.gateway.InputGateway;
import com.example.routing.gateway.PayloadValidator;
import com.example.routing.gateway.PrometheusHandler;
import com.example.routing.gateway.ServiceNowHandler;
import com.example.routing.gateway.SourceType;
import com.example.routing.gateway.UserInputHandler;
import com.example.routing.llm.LlmService;
import com.example.routing.model.IntentCategory;
import com.example.routing.pattern.PatternMatcher;
import com.example.routing.pipeline.TriagePipeline;
import com.example.routing.risk.RiskAssessor;
import com.example.routing.risk.RiskPolicies;
import com.example.routing.router.BusinessIntentRouter;
import com.example.routing.semantic.EmbeddingSemanticRouter;
import com.example.routing.semantic.LexicalSemanticRouter;
import com.example.routing.semantic.SemanticRouter;
import com.example.routing.semantic.SpringAiUtteranceEncoder;
import com.example.routing.telemetry.GatewayMetrics;
import com.example.routing.telemetry.RoutingMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.opentelemetry.api.OpenTelemetry;

@Configuration
public class RoutingConfig {

    private static final Logger log = LoggerFactory.getLogger(RoutingConfig.class);

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    RuleTables ruleTables(RouterProperties props) {
        return RuleTables.load(props.tables());
    }

    @Bean
    PatternMatcher patternMatcher(RuleTables tables, OpenTelemetry openTelemetry) {
        return new PatternMatcher(tables.patternRules(), openTelemetry);
    }

    @Bean
    SemanticRouter semanticRouter(RouterProperties props, RuleTables tables,
                                  ObjectProvider<EmbeddingModel> embeddingModel, OpenTelemetry openTelemetry) {
        if ("embedding".equalsIgnoreCase(props.semanticBackend())) {
            EmbeddingModel model = embeddingModel.getIfAvailable();
            if (model != null) {
                log.info("Semantic backend: embedding (timeout={})", props.encoderTimeout());
                return new EmbeddingSemanticRouter(tables.semanticRoutes(), props.semanticThreshold(),
                    new SpringAiUtteranceEncoder(model, props.encoderTimeout()), openTelemetry);
            }
            log.warn("Semantic backend 'embedding' requested but no EmbeddingModel is configured, using lexical");
        }
        log.info("Semantic backend: lexical");
        return new LexicalSemanticRouter(tables.semanticRoutes(), props.semanticThreshold(), openTelemetry);
    }

    @Bean
    LlmClassifier llmClassifier(RouterProperties props, ObjectProvider<LlmService> llmService,
                                OpenTelemetry openTelemetry) {
        if ("chat_model".equalsIgnoreCase(props.llmClassifier())) {
            LlmService service = llmService.getIfAvailable();
            if (service != null) {
                return new ChatModelLlmClassifier(service, openTelemetry);
            }
            log.warn("LLM classifier 'chat_model' requested but no LlmService is available, using keyword");
        }
        return new KeywordLlmClassifier();
    }

    @Bean
    CompletenessChecker completenessChecker(RouterProperties props, RuleTables tables,
                                            OpenTelemetry openTelemetry) {
        Map<IntentCategory, Double> overrides = new EnumMap<>(IntentCategory.class);
        props.completenessThresholds().forEach((category, threshold) -> {
            IntentCategory parsed = IntentCategory.fromString(category);
            if (parsed == IntentCategory.UNKNOWN && !"unknown".equalsIgnoreCase(category)) {
                log.warn("Ignoring completeness threshold for unknown category '{}'", category);
            } else {
                overrides.put(parsed, threshold);
            }
        });
        return new CompletenessChecker(tables.completenessRules(), overrides, openTelemetry);
    }

    @Bean
    RoutingMetrics routingMetrics(RouterProperties props, OpenTelemetry openTelemetry) {
        return new RoutingMetrics(openTelemetry, props.metricsWindow());
    }

    @Bean
    GatewayMetrics gatewayMetrics(RouterProperties props, OpenTelemetry openTelemetry) {
        return new GatewayMetrics(openTelemetry, props.metricsWindow());
    }

    @Bean
    AuditLogger auditLogger(PiiFilter piiFilter, ObjectMapper objectMapper, RouterProperties props) {
        return new AuditLogger(piiFilter, objectMapper, props.auditBufferSize());
    }

    @Bean
    BusinessIntentRouter businessIntentRouter(
        PatternMatcher patternMatcher,
        SemanticRouter semanticRouter,
        LlmClassifier llmClassifier,
        CompletenessChecker completenessChecker,
        RouterProperties props,
        RoutingMetrics metrics,
        AuditLogger auditLogger,
        OpenTelemetry openTelemetry
    ) {
        BusinessIntentRouter.Settings settings = BusinessIntentRouter.Settings.from(props);
        log.info("Router thresholds: pattern={}, semantic={}, llm_fallback={} ({}), completeness={}",
            settings.patternThreshold(), settings.semanticThreshold(), settings.enableLlmFallback(),
            llmClassifier.name(), settings.enableCompleteness());
        return new BusinessIntentRouter(patternMatcher, semanticRouter, llmClassifier, completenessChecker,
            settings, metrics, auditLogger, openTelemetry);
    }

    @Bean
    RiskPolicies riskPolicies(RuleTables tables, RouterProperties props) {
        return RiskPolicies.fromFile(tables.riskPolicies(), props.riskPreset());
    }

    @Bean
    RiskAssessor riskAssessor(RiskPolicies riskPolicies, OpenTelemetry openTelemetry) {
        return new RiskAssessor(riskPolicies, openTelemetry);
    }

    @Bean
    RefinementRules refinementRules(RuleTables tables) {
        return new RefinementRules(tables.refinementRules());
    }

    @Bean
    QuestionGenerator questionGenerator(RuleTables tables, RouterProperties props) {
        return new QuestionGenerator(tables.questionTemplates(), props.dialog().maxQuestions());
    }

    @Bean
    DialogSessionManager dialogSessionManager(
        BusinessIntentRouter router,
        RefinementRules refinementRules,
        QuestionGenerator questionGenerator,
        RoutingMetrics metrics,
        AuditLogger auditLogger,
        RouterProperties props,
        OpenTelemetry openTelemetry,
        Clock clock
    ) {
        return new DialogSessionManager(
            () -> new GuidedDialogEngine(router, refinementRules, questionGenerator, props.dialog().maxTurns(),
                metrics, auditLogger, openTelemetry, clock),
            props.dialog().sessionTtl(), clock);
    }

    @Bean
    InputGateway inputGateway(
        BusinessIntentRouter router,
        PatternMatcher patternMatcher,
        RouterProperties props,
        GatewayMetrics metrics,
        AuditLogger auditLogger,
        OpenTelemetry openTelemetry
    ) {
        PayloadValidator validator = new PayloadValidator(props.strictValidation());
        SourceType defaultSource = SourceType.fromString(props.defaultSource());
        if (defaultSource == SourceType.UNKNOWN || defaultSource.isMachineSource()) {
            log.warn("Default source '{}' cannot serve free text, using user", props.defaultSource());
            defaultSource = SourceType.USER;
        }
        return new InputGateway(List.of(
                new ServiceNowHandler(patternMatcher, validator),
                new PrometheusHandler(validator),
                new UserInputHandler(router, props.maxInputLength())),
            defaultSource, metrics, auditLogger, openTelemetry);
    }

    @Bean
    LoggingApprovalGate approvalGate(Clock clock) {
        return new LoggingApprovalGate(clock);
    }

    @Bean
    TriagePipeline triagePipeline(
        InputGateway gateway,
        RiskAssessor riskAssessor,
        ApprovalGate approvalGate,
        RoutingMetrics metrics,
        AuditLogger auditLogger,
        RouterProperties props,
        OpenTelemetry openTelemetry
    ) {
        return new TriagePipeline(gateway, riskAssessor, approvalGate, metrics, auditLogger,
            props.approvalTimeout(), openTelemetry);
    }

    @Bean
    RuleReloadService ruleReloadService(
        RouterProperties props,
        PatternMatcher patternMatcher,
        SemanticRouter semanticRouter,
        CompletenessChecker completenessChecker,
        RiskPolicies riskPolicies,
        RefinementRules refinementRules,
        QuestionGenerator questionGenerator
    ) {
        return new RuleReloadService(props, patternMatcher, semanticRouter, completenessChecker, riskPolicies,
            refinementRules, questionGenerator);
    }
}
