package com.example.routing.filter;

import java.util.List;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;

/**
 * Redacts personal data from user text before it is written to audit records,
 * span events or LLM prompts captured for debugging.
 */
@Component
public class PiiFilter {

    private static final Logger log = LoggerFactory.getLogger(PiiFilter.class);

    private record PiiPattern(String name, Pattern pattern) {}

    // Order matters: national id and card numbers before the generic phone pattern.
    private static final List<PiiPattern> PATTERNS = List.of(
        new PiiPattern("email",
            Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b")),
        new PiiPattern("national_id",
            Pattern.compile("\\b[A-Z][12]\\d{8}\\b")),
        new PiiPattern("credit_card",
            Pattern.compile("\\b\\d{4}[- ]?\\d{4}[- ]?\\d{4}[- ]?\\d{4}\\b")),
        new PiiPattern("mobile",
            Pattern.compile("\\b09\\d{2}[- ]?\\d{3}[- ]?\\d{3}\\b")),
        new PiiPattern("phone",
            Pattern.compile("(?:\\+?\\d{1,3}[-. ]?)?\\(?\\d{2,4}\\)?[-. ]?\\d{3,4}[-. ]?\\d{4}\\b"))
    );

    public String scrub(String text) {
        if (text == null || text.isEmpty()) return text;

        String result = text;
        int redactions = 0;

        for (var pii : PATTERNS) {
            var matcher = pii.pattern().matcher(result);
            if (matcher.find()) {
                redactions++;
                log.debug("PII detected (type={}), redacting", pii.name());
                result = matcher.replaceAll("[" + pii.name().toUpperCase() + "]");
            }
        }

        if (redactions > 0) {
            Span.current().addEvent("routing.pii_redacted", Attributes.of(
                AttributeKey.longKey("routing.pii_types"), (long) redactions
            ));
        }

        return result;
    }

    /** Scrubs then cuts to {@code maxLength} characters, marking the cut with an ellipsis. */
    public String scrubAndTruncate(String text, int maxLength) {
        String scrubbed = scrub(text);
        if (scrubbed == null || scrubbed.length() <= maxLength) {
            return scrubbed;
        }
        return scrubbed.substring(0, maxLength) + "…";
    }

    public boolean containsPii(String text) {
        if (text == null || text.isEmpty()) return false;
        return PATTERNS.stream().anyMatch(p -> p.pattern().matcher(text).find());
    }
}
