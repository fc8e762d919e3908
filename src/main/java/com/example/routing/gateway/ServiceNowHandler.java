package com.example.routing.gateway;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.routing.model.CompletenessInfo;
import com.example.routing.model.IntentCategory;
import com.example.routing.model.RiskLevel;
import com.example.routing.model.RoutingDecision;
import com.example.routing.model.RoutingLayer;
import com.example.routing.pattern.PatternMatchResult;
import com.example.routing.pattern.PatternMatcher;
import com.example.routing.router.BusinessIntentRouter;

/**
 * Fast path for ServiceNow webhooks. Resolution order: the static
 * (category, subcategory) table, then the pattern rules over
 * {@code short_description}, then a generic default for the category.
 */
public class ServiceNowHandler implements SourceHandler {

    private static final Logger log = LoggerFactory.getLogger(ServiceNowHandler.class);

    record Target(IntentCategory category, String subIntent) {}

    static final Map<String, Target> MAPPINGS = Map.ofEntries(
        entry("incident", "software", IntentCategory.INCIDENT, "software_issue"),
        entry("incident", "hardware", IntentCategory.INCIDENT, "hardware_failure"),
        entry("incident", "network", IntentCategory.INCIDENT, "network_failure"),
        entry("incident", "database", IntentCategory.INCIDENT, "database_issue"),
        entry("incident", "performance", IntentCategory.INCIDENT, "performance_issue"),
        entry("incident", "security", IntentCategory.INCIDENT, "security_incident"),
        entry("incident", "outage", IntentCategory.INCIDENT, "system_unavailable"),
        entry("incident", "system_down", IntentCategory.INCIDENT, "system_down"),
        entry("incident", "etl_failure", IntentCategory.INCIDENT, "etl_failure"),
        entry("incident", "etl", IntentCategory.INCIDENT, "etl_failure"),
        entry("request", "access", IntentCategory.REQUEST, "access_request"),
        entry("request", "account", IntentCategory.REQUEST, "account_request"),
        entry("request", "software", IntentCategory.REQUEST, "software_request"),
        entry("request", "hardware", IntentCategory.REQUEST, "hardware_request"),
        entry("request", "password", IntentCategory.REQUEST, "password_reset"),
        entry("change", "standard", IntentCategory.CHANGE, "standard_change"),
        entry("change", "normal", IntentCategory.CHANGE, "normal_change"),
        entry("change", "emergency", IntentCategory.CHANGE, "emergency_change"),
        entry("change", "deployment", IntentCategory.CHANGE, "release_deployment"),
        entry("change", "release", IntentCategory.CHANGE, "release_deployment"),
        entry("change", "database", IntentCategory.CHANGE, "database_change"),
        entry("change", "configuration", IntentCategory.CHANGE, "configuration_update"));

    private final PatternMatcher patternMatcher;
    private final PayloadValidator validator;

    public ServiceNowHandler(PatternMatcher patternMatcher, PayloadValidator validator) {
        this.patternMatcher = patternMatcher;
        this.validator = validator;
    }

    @Override
    public SourceType sourceType() {
        return SourceType.SERVICENOW;
    }

    @Override
    public boolean fastPath() {
        return true;
    }

    @Override
    public RoutingDecision process(IncomingRequest request) {
        long start = System.nanoTime();
        validator.enforce(SourceType.SERVICENOW, validator.validateServiceNow(request.data()));

        String category = request.field("category").map(v -> v.toLowerCase(Locale.ROOT)).orElse("");
        String subcategory = request.field("subcategory").map(v -> v.toLowerCase(Locale.ROOT)).orElse("");
        String shortDescription = request.field("short_description").orElse("");

        RoutingDecision.Builder builder = RoutingDecision.builder()
            .routingLayer(RoutingLayer.SERVICENOW_MAPPING)
            .completeness(CompletenessInfo.complete())
            .putMetadata("servicenow_category", category)
            .putMetadata("servicenow_subcategory", subcategory)
            .putMetadata("ticket_number", request.field("number").or(() -> request.field("incident_number"))
                .orElse(null));

        Target mapped = MAPPINGS.get(key(category, subcategory));
        IntentCategory intent;
        String subIntent;
        if (mapped != null) {
            intent = mapped.category();
            subIntent = mapped.subIntent();
            builder.confidence(1.0)
                .ruleId("servicenow:" + key(category, subcategory))
                .reasoning("ServiceNow mapping: " + category + "/" + subcategory);
        } else {
            PatternMatchResult match = shortDescription.isEmpty()
                ? PatternMatchResult.noMatch() : patternMatcher.match(shortDescription);
            if (match.matched()) {
                intent = match.category();
                subIntent = match.subIntent();
                builder.confidence(match.confidence())
                    .ruleId(match.ruleId())
                    .reasoning("ServiceNow pattern fallback: " + match.matchedPattern())
                    .putMetadata("fallback", "pattern");
            } else {
                intent = genericCategory(category);
                subIntent = "general_" + intent.value();
                builder.confidence(0.5)
                    .reasoning("ServiceNow default mapping for category '" + category + "'")
                    .putMetadata("fallback", "default");
            }
        }

        RiskLevel risk = priorityRisk(request.field("priority"))
            .orElseGet(() -> BusinessIntentRouter.riskFor(intent, shortDescription));
        RoutingDecision decision = builder
            .intentCategory(intent)
            .subIntent(subIntent)
            .workflowType(BusinessIntentRouter.workflowFor(intent, subIntent))
            .riskLevel(risk)
            .processingTimeMs((System.nanoTime() - start) / 1_000_000.0)
            .build();
        log.debug("ServiceNow {}/{} mapped to {}/{}", category, subcategory, intent.value(), subIntent);
        return decision;
    }

    /** "1".."5" or "P1".."P5", optionally followed by a label such as "1 - Critical". */
    static Optional<RiskLevel> priorityRisk(Optional<String> priority) {
        if (priority.isEmpty()) {
            return Optional.empty();
        }
        Matcher matcher = PayloadValidator.PRIORITY.matcher(priority.get().strip());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(switch (matcher.group(1)) {
            case "1" -> RiskLevel.CRITICAL;
            case "2" -> RiskLevel.HIGH;
            case "3" -> RiskLevel.MEDIUM;
            default -> RiskLevel.LOW;
        });
    }

    private static IntentCategory genericCategory(String category) {
        IntentCategory parsed = IntentCategory.fromString(category);
        return parsed == IntentCategory.UNKNOWN ? IntentCategory.INCIDENT : parsed;
    }

    private static String key(String category, String subcategory) {
        return category + "/" + subcategory;
    }

    private static Map.Entry<String, Target> entry(String category, String subcategory, IntentCategory intent,
                                                   String subIntent) {
        return Map.entry(key(category, subcategory), new Target(intent, subIntent));
    }
}
