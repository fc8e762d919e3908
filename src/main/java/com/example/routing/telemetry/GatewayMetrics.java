package com.example.routing.telemetry;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

import com.fasterxml.jackson.annotation.JsonProperty;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;

public class GatewayMetrics {

    private final LongCounter gatewayRequests;
    private final LongCounter gatewayErrors;
    private final DoubleHistogram gatewayLatency;

    private final Map<String, LongAdder> bySource = new ConcurrentHashMap<>();
    private final LongAdder fastPath = new LongAdder();
    private final LongAdder errors = new LongAdder();
    private final LatencyWindow latencies;

    public GatewayMetrics(OpenTelemetry openTelemetry, int windowSize) {
        Meter meter = openTelemetry.getMeter("itsm-intent-router");

        this.gatewayRequests = meter.counterBuilder("itsm.gateway.requests")
            .setDescription("Requests received by the input gateway")
            .build();

        this.gatewayErrors = meter.counterBuilder("itsm.gateway.errors")
            .setDescription("Gateway requests that ended in an error decision")
            .build();

        this.gatewayLatency = meter.histogramBuilder("itsm.gateway.latency")
            .setUnit("ms")
            .setDescription("Gateway processing latency")
            .build();

        this.latencies = new LatencyWindow(windowSize);
    }

    public void recordRequest(String source, boolean fastPathUsed, double latencyMs) {
        bySource.computeIfAbsent(source, s -> new LongAdder()).increment();
        if (fastPathUsed) {
            fastPath.increment();
        }
        latencies.record(latencyMs);
        Attributes attrs = Attributes.of(
            AttributeKey.stringKey("gateway.source"), source,
            AttributeKey.booleanKey("gateway.fast_path"), fastPathUsed
        );
        gatewayRequests.add(1, attrs);
        gatewayLatency.record(latencyMs, attrs);
    }

    public void recordError(String source, String errorType) {
        errors.increment();
        gatewayErrors.add(1, Attributes.of(
            AttributeKey.stringKey("gateway.source"), source,
            AttributeKey.stringKey("error.type"), errorType
        ));
    }

    public Snapshot snapshot() {
        Map<String, Long> sources = new LinkedHashMap<>();
        bySource.forEach((source, count) -> sources.put(source, count.sum()));
        LatencyWindow.Summary summary = latencies.summary();
        return new Snapshot(sources, fastPath.sum(), errors.sum(), summary.avgMs(), summary.p95Ms());
    }

    public void reset() {
        bySource.clear();
        fastPath.reset();
        errors.reset();
        latencies.clear();
    }

    public record Snapshot(
        @JsonProperty("by_source") Map<String, Long> bySource,
        @JsonProperty("fast_path_requests") long fastPathRequests,
        @JsonProperty("errors") long errors,
        @JsonProperty("avg_latency_ms") double avgLatencyMs,
        @JsonProperty("p95_latency_ms") double p95LatencyMs
    ) {}
}
