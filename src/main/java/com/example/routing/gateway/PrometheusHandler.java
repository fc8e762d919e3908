package com.example.routing.gateway;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.routing.model.CompletenessInfo;
import com.example.routing.model.IntentCategory;
import com.example.routing.model.RiskLevel;
import com.example.routing.model.RoutingDecision;
import com.example.routing.model.RoutingLayer;
import com.example.routing.model.WorkflowType;

/**
 * Fast path for Alertmanager webhooks. The alert name is matched against an
 * ordered regex table; severity decides risk and workflow. Accepts both the
 * Alertmanager envelope ({@code alerts[]}) and a flat single-alert form.
 *
 * <p>Only firing alerts compete for the most severe one. A batch in which
 * every alert is resolved still routes, but at LOW risk on the simple
 * workflow and marked {@code resolved}.
 */
public class PrometheusHandler implements SourceHandler {

    private static final Logger log = LoggerFactory.getLogger(PrometheusHandler.class);

    record AlertMapping(Pattern pattern, String subIntent) {}

    record Alert(String name, String severity, String status, Map<String, Object> labels,
                 Map<String, Object> annotations) {

        boolean resolved() {
            return RESOLVED.equals(status);
        }
    }

    static final String FIRING = "firing";
    static final String RESOLVED = "resolved";

    static final List<AlertMapping> MAPPINGS = List.of(
        mapping("down|unreachable|targetmissing|absent", "service_down"),
        mapping("cpu|memory|mem|disk|filesystem|inode|swap", "resource_alert"),
        mapping("latency|slow|responsetime|duration", "performance_issue"),
        mapping("error|5xx|failure|failed", "error_rate_alert"),
        mapping("cert|ssl|tls", "certificate_alert"),
        mapping("etl|batch|cron|job", "etl_failure"),
        mapping("database|db|postgres|mysql|replication", "database_issue"),
        mapping("network|packet|dns", "network_failure"));

    static final String DEFAULT_SUB_INTENT = "monitoring_alert";

    private final PayloadValidator validator;

    public PrometheusHandler(PayloadValidator validator) {
        this.validator = validator;
    }

    @Override
    public SourceType sourceType() {
        return SourceType.PROMETHEUS;
    }

    @Override
    public boolean fastPath() {
        return true;
    }

    @Override
    public RoutingDecision process(IncomingRequest request) {
        long start = System.nanoTime();
        validator.enforce(SourceType.PROMETHEUS, validator.validateAlertmanager(request.data()));

        List<Alert> alerts = alerts(request.data());
        List<Alert> firing = alerts.stream().filter(a -> !a.resolved()).toList();
        boolean allResolved = firing.isEmpty();
        Alert alert = mostSevere(allResolved ? alerts : firing);
        String subIntent = subIntentFor(alert.name());
        RiskLevel risk = allResolved ? RiskLevel.LOW : riskFor(alert.severity());
        WorkflowType workflow = allResolved ? WorkflowType.SIMPLE : workflowFor(alert.severity());

        RoutingDecision.Builder builder = RoutingDecision.builder()
            .intentCategory(IntentCategory.INCIDENT)
            .subIntent(subIntent)
            .confidence(DEFAULT_SUB_INTENT.equals(subIntent) ? 0.7 : 1.0)
            .workflowType(workflow)
            .riskLevel(risk)
            .completeness(CompletenessInfo.complete())
            .routingLayer(RoutingLayer.PROMETHEUS_MAPPING)
            .ruleId("prometheus:" + subIntent)
            .reasoning((allResolved ? "Resolved Prometheus alert " : "Prometheus alert ")
                + alert.name() + " (" + alert.severity() + ")")
            .putMetadata("alert_name", alert.name())
            .putMetadata("severity", alert.severity())
            .putMetadata("status", alert.status())
            .putMetadata("alert_count", alerts.size())
            .putMetadata("firing_count", firing.size());
        if (allResolved) {
            builder.putMetadata("resolved", true);
        }
        putIfString(builder, "instance", alert.labels().get("instance"));
        putIfString(builder, "job", alert.labels().get("job"));
        putIfString(builder, "summary", alert.annotations().get("summary"));

        RoutingDecision decision = builder.processingTimeMs((System.nanoTime() - start) / 1_000_000.0).build();
        log.debug("Alert {} ({}) mapped to {}", alert.name(), alert.severity(), subIntent);
        return decision;
    }

    static String subIntentFor(String alertName) {
        for (AlertMapping mapping : MAPPINGS) {
            if (mapping.pattern().matcher(alertName).find()) {
                return mapping.subIntent();
            }
        }
        return DEFAULT_SUB_INTENT;
    }

    static RiskLevel riskFor(String severity) {
        return switch (severity) {
            case "critical", "page" -> RiskLevel.CRITICAL;
            case "warning", "error" -> RiskLevel.HIGH;
            case "info", "none" -> RiskLevel.LOW;
            default -> RiskLevel.MEDIUM;
        };
    }

    static WorkflowType workflowFor(String severity) {
        return switch (severity) {
            case "critical", "page" -> WorkflowType.MAGENTIC;
            case "info", "none" -> WorkflowType.SIMPLE;
            default -> WorkflowType.SEQUENTIAL;
        };
    }

    private static List<Alert> alerts(Map<String, Object> payload) {
        List<Alert> alerts = new ArrayList<>();
        String groupStatus = status(payload.get("status"), FIRING);
        if (payload.get("alerts") instanceof List<?> list) {
            for (Object item : list) {
                if (item instanceof Map<?, ?> raw) {
                    Map<String, Object> labels = asMap(raw.get("labels"));
                    alerts.add(new Alert(
                        PayloadValidator.string(labels.get("alertname")).orElse("unknown"),
                        severity(labels.get("severity")),
                        status(raw.get("status"), groupStatus),
                        labels,
                        asMap(raw.get("annotations"))));
                }
            }
        }
        if (alerts.isEmpty()) {
            Map<String, Object> labels = asMap(payload.get("labels"));
            String name = PayloadValidator.string(payload.get("alert_name"))
                .or(() -> PayloadValidator.string(payload.get("alertname")))
                .or(() -> PayloadValidator.string(labels.get("alertname")))
                .orElse("unknown");
            Object severity = payload.get("severity") != null ? payload.get("severity") : labels.get("severity");
            alerts.add(new Alert(name, severity(severity), groupStatus, labels,
                asMap(payload.get("annotations"))));
        }
        return alerts;
    }

    private static Alert mostSevere(List<Alert> alerts) {
        Alert worst = alerts.get(0);
        for (Alert alert : alerts) {
            if (riskFor(alert.severity()).ordinal() > riskFor(worst.severity()).ordinal()) {
                worst = alert;
            }
        }
        return worst;
    }

    private static String severity(Object raw) {
        return PayloadValidator.string(raw).map(s -> s.toLowerCase(Locale.ROOT)).orElse("unknown");
    }

    private static String status(Object raw, String fallback) {
        return PayloadValidator.string(raw).map(s -> s.toLowerCase(Locale.ROOT)).orElse(fallback);
    }

    private static Map<String, Object> asMap(Object value) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (value instanceof Map<?, ?> map) {
            map.forEach((k, v) -> result.put(String.valueOf(k), v));
        }
        return result;
    }

    private static void putIfString(RoutingDecision.Builder builder, String key, Object value) {
        PayloadValidator.string(value).ifPresent(v -> builder.putMetadata(key, v));
    }

    private static AlertMapping mapping(String regex, String subIntent) {
        return new AlertMapping(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), subIntent);
    }
}
