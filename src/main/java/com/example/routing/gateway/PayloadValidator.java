package com.example.routing.gateway;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.routing.gateway.SchemaValidationException.FieldError;

/**
 * Structural checks for machine payloads. Violations are logged and the
 * handler continues best-effort, unless strict mode is on, in which case
 * they are raised as a {@link SchemaValidationException}. Strict mode also
 * requires the ServiceNow identifiers and a status on every alert.
 */
public class PayloadValidator {

    private static final Logger log = LoggerFactory.getLogger(PayloadValidator.class);

    static final Pattern PRIORITY = Pattern.compile("^[Pp]?([1-5])(?:\\b.*)?$");

    static final List<String> STRICT_SERVICENOW_FIELDS = List.of("number", "category", "short_description");
    static final Set<String> ALERT_STATUSES = Set.of("firing", "resolved");

    private final boolean strict;

    public PayloadValidator(boolean strict) {
        this.strict = strict;
    }

    public boolean strict() {
        return strict;
    }

    public List<FieldError> validateServiceNow(Map<String, Object> payload) {
        List<FieldError> errors = new ArrayList<>();
        if (payload.isEmpty()) {
            errors.add(new FieldError("payload", "must not be empty"));
            return errors;
        }
        requireScalar(payload, "category", errors);
        requireScalar(payload, "subcategory", errors);
        requireScalar(payload, "short_description", errors);
        if (strict) {
            for (String field : STRICT_SERVICENOW_FIELDS) {
                boolean reported = errors.stream().anyMatch(e -> e.field().equals(field));
                if (!reported && string(payload.get(field)).isEmpty()) {
                    errors.add(new FieldError(field, "is required"));
                }
            }
        } else if (string(payload.get("category")).isEmpty() && string(payload.get("short_description")).isEmpty()) {
            errors.add(new FieldError("category", "category or short_description is required"));
        }
        Optional<String> priority = string(payload.get("priority"));
        if (priority.isPresent() && !PRIORITY.matcher(priority.get().strip()).matches()) {
            errors.add(new FieldError("priority", "must be 1-5 or P1-P5, was '" + priority.get() + "'"));
        }
        return errors;
    }

    public List<FieldError> validateAlertmanager(Map<String, Object> payload) {
        List<FieldError> errors = new ArrayList<>();
        if (payload.isEmpty()) {
            errors.add(new FieldError("payload", "must not be empty"));
            return errors;
        }
        Object alerts = payload.get("alerts");
        if (alerts == null) {
            if (string(payload.get("alert_name")).isEmpty() && string(payload.get("alertname")).isEmpty()) {
                errors.add(new FieldError("alerts", "alerts or alert_name is required"));
            }
            return errors;
        }
        if (!(alerts instanceof List<?> list)) {
            errors.add(new FieldError("alerts", "must be a list"));
            return errors;
        }
        if (list.isEmpty()) {
            errors.add(new FieldError("alerts", "must not be empty"));
        }
        for (int i = 0; i < list.size(); i++) {
            String path = "alerts[" + i + "]";
            if (!(list.get(i) instanceof Map<?, ?> alert)) {
                errors.add(new FieldError(path, "must be an object"));
                continue;
            }
            if (strict) {
                Optional<String> status = string(alert.get("status"));
                if (status.isEmpty()) {
                    errors.add(new FieldError(path + ".status", "is required"));
                } else if (!ALERT_STATUSES.contains(status.get().toLowerCase(Locale.ROOT))) {
                    errors.add(new FieldError(path + ".status",
                        "must be firing or resolved, was '" + status.get() + "'"));
                }
            }
            if (!(alert.get("labels") instanceof Map<?, ?> labels)) {
                errors.add(new FieldError(path + ".labels", "must be an object"));
                continue;
            }
            if (string(labels.get("alertname")).isEmpty()) {
                errors.add(new FieldError(path + ".labels.alertname", "is required"));
            }
        }
        return errors;
    }

    /** Logs or raises the collected errors depending on the validation mode. */
    public void enforce(SourceType source, List<FieldError> errors) {
        if (errors.isEmpty()) {
            return;
        }
        if (strict) {
            throw new SchemaValidationException(source, errors);
        }
        log.warn("Schema validation failed for {} payload ({} errors), continuing: {}",
            source.value(), errors.size(), errors);
    }

    static Optional<String> string(Object value) {
        if (value instanceof String s) {
            return s.isBlank() ? Optional.empty() : Optional.of(s.strip());
        }
        if (value instanceof Number || value instanceof Boolean) {
            return Optional.of(String.valueOf(value));
        }
        return Optional.empty();
    }

    private static void requireScalar(Map<String, Object> payload, String field, List<FieldError> errors) {
        Object value = payload.get(field);
        if (value instanceof Map<?, ?> || value instanceof List<?>) {
            errors.add(new FieldError(field, "must be a string"));
        }
    }
}
