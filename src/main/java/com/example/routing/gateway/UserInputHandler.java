package com.example.routing.gateway;

import java.util.regex.Pattern;

import com.example.routing.model.RoutingDecision;
import com.example.routing.router.BusinessIntentRouter;

/**
 * Human input: normalized and handed to the router unchanged in meaning. The
 * router's decision is only enriched, never reclassified.
 */
public class UserInputHandler implements SourceHandler {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final BusinessIntentRouter router;
    private final int maxInputLength;

    public UserInputHandler(BusinessIntentRouter router, int maxInputLength) {
        this.router = router;
        this.maxInputLength = maxInputLength;
    }

    @Override
    public SourceType sourceType() {
        return SourceType.USER;
    }

    @Override
    public boolean fastPath() {
        return false;
    }

    @Override
    public RoutingDecision process(IncomingRequest request) {
        String text = request.content();
        if (text.isBlank()) {
            text = request.field("text").or(() -> request.field("message")).orElse("");
        }
        String normalized = normalize(text);
        boolean truncated = normalized.codePointCount(0, normalized.length()) > maxInputLength;
        if (truncated) {
            normalized = truncate(normalized, maxInputLength);
        }

        RoutingDecision decision = router.route(normalized, request.requestId());
        return decision.toBuilder()
            .putMetadata("normalized_length", normalized.codePointCount(0, normalized.length()))
            .putMetadata("truncated", truncated)
            .build();
    }

    /** Cuts to at most {@code maxCodePoints} code points without splitting a surrogate pair. */
    static String truncate(String text, int maxCodePoints) {
        if (text.codePointCount(0, text.length()) <= maxCodePoints) {
            return text;
        }
        return text.substring(0, text.offsetByCodePoints(0, maxCodePoints));
    }

    static String normalize(String text) {
        return text == null ? "" : WHITESPACE.matcher(text).replaceAll(" ").strip();
    }
}
