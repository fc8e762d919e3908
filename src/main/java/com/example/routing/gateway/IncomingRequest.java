package com.example.routing.gateway;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A request as it arrives at the gateway. Headers and payload are copied on
 * construction; header lookups ignore case.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IncomingRequest(
    @JsonProperty("content") String content,
    @JsonProperty("source_type") SourceType sourceType,
    @JsonProperty("data") Map<String, Object> data,
    @JsonProperty("headers") Map<String, String> headers,
    @JsonProperty("request_id") String requestId,
    @JsonProperty("timestamp") Instant timestamp
) {

    public static final String SERVICENOW_HEADER = "x-servicenow-webhook";
    public static final String ALERTMANAGER_HEADER = "x-prometheus-alertmanager";

    public IncomingRequest {
        content = content != null ? content : "";
        sourceType = sourceType != null ? sourceType : SourceType.UNKNOWN;
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        requestId = requestId == null || requestId.isBlank() ? UUID.randomUUID().toString() : requestId;
        timestamp = timestamp != null ? timestamp : Instant.now();
    }

    public static IncomingRequest fromUser(String text) {
        return new IncomingRequest(text, SourceType.USER, null, null, null, null);
    }

    public static IncomingRequest fromServiceNow(Map<String, Object> payload) {
        return new IncomingRequest("", SourceType.SERVICENOW, payload, Map.of(SERVICENOW_HEADER, "true"), null, null);
    }

    public static IncomingRequest fromPrometheus(Map<String, Object> payload) {
        return new IncomingRequest("", SourceType.PROMETHEUS, payload, Map.of(ALERTMANAGER_HEADER, "true"), null,
            null);
    }

    public Optional<String> header(String name) {
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            if (entry.getKey() != null && entry.getKey().equalsIgnoreCase(name)) {
                return Optional.ofNullable(entry.getValue());
            }
        }
        return Optional.empty();
    }

    public boolean hasHeader(String name) {
        return header(name).isPresent();
    }

    /** String view of a payload field; blank and non-scalar values read as absent. */
    public Optional<String> field(String name) {
        return PayloadValidator.string(data.get(name));
    }
}
