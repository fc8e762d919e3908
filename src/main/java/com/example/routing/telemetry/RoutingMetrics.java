package com.example.routing.telemetry;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

import com.example.routing.model.RoutingDecision;
import com.example.routing.model.RoutingLayer;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;

/**
 * Routing counters. OTel instruments feed the exporter; the in-process
 * counters and latency window back the metrics endpoint.
 */
public class RoutingMetrics {

    public static final int DEFAULT_WINDOW = 1000;

    private final DoubleHistogram routingLatency;
    private final DoubleHistogram routingConfidence;
    private final DoubleHistogram completenessScore;
    private final LongCounter routingRequests;
    private final LongCounter dialogRounds;
    private final LongCounter approvalRequests;

    private final LongAdder total = new LongAdder();
    private final Map<RoutingLayer, LongAdder> byLayer = new EnumMap<>(RoutingLayer.class);
    private final LongAdder dialogTurns = new LongAdder();
    private final LongAdder approvals = new LongAdder();
    private final LatencyWindow latencies;

    public RoutingMetrics(OpenTelemetry openTelemetry, int windowSize) {
        Meter meter = openTelemetry.getMeter("itsm-intent-router");

        this.routingLatency = meter.histogramBuilder("itsm.routing.latency")
            .setUnit("ms")
            .setDescription("End-to-end routing latency")
            .build();

        this.routingConfidence = meter.histogramBuilder("itsm.routing.confidence")
            .setDescription("Confidence of routing decisions")
            .build();

        this.completenessScore = meter.histogramBuilder("itsm.routing.completeness_score")
            .setDescription("Completeness score of routed requests")
            .build();

        this.routingRequests = meter.counterBuilder("itsm.routing.requests")
            .setDescription("Routing decisions produced")
            .build();

        this.dialogRounds = meter.counterBuilder("itsm.dialog.rounds")
            .setDescription("Guided dialog turns processed")
            .build();

        this.approvalRequests = meter.counterBuilder("itsm.routing.approval_requests")
            .setDescription("Decisions that required human approval")
            .build();

        for (RoutingLayer layer : RoutingLayer.values()) {
            byLayer.put(layer, new LongAdder());
        }
        this.latencies = new LatencyWindow(windowSize);
    }

    public void recordDecision(RoutingDecision decision) {
        RoutingLayer layer = decision.routingLayer();
        total.increment();
        byLayer.get(layer).increment();
        latencies.record(decision.processingTimeMs());

        Attributes layerAttrs = Attributes.of(
            AttributeKey.stringKey("routing.layer"), layer.value(),
            AttributeKey.stringKey("routing.intent"), decision.intentCategory().value()
        );
        routingRequests.add(1, layerAttrs);
        routingLatency.record(decision.processingTimeMs(), Attributes.of(
            AttributeKey.stringKey("routing.layer"), layer.value()
        ));
        Attributes intentAttrs = Attributes.of(
            AttributeKey.stringKey("routing.intent"), decision.intentCategory().value()
        );
        routingConfidence.record(decision.confidence(), intentAttrs);
        completenessScore.record(decision.completeness().completenessScore(), intentAttrs);
    }

    public void recordDialogTurn(String phase) {
        dialogTurns.increment();
        dialogRounds.add(1, Attributes.of(AttributeKey.stringKey("dialog.phase"), phase));
    }

    public void recordApprovalRequest(String riskLevel, String approvalType) {
        approvals.increment();
        approvalRequests.add(1, Attributes.of(
            AttributeKey.stringKey("routing.risk_level"), riskLevel,
            AttributeKey.stringKey("routing.approval_type"), approvalType
        ));
    }

    public Snapshot snapshot() {
        long totalCount = total.sum();
        Map<String, Long> layers = new LinkedHashMap<>();
        Map<String, Double> rates = new LinkedHashMap<>();
        for (Map.Entry<RoutingLayer, LongAdder> entry : byLayer.entrySet()) {
            long count = entry.getValue().sum();
            layers.put(entry.getKey().value(), count);
            rates.put(entry.getKey().value(), totalCount == 0 ? 0.0 : (double) count / totalCount);
        }
        LatencyWindow.Summary summary = latencies.summary();
        return new Snapshot(totalCount, layers, rates, summary.avgMs(), summary.p95Ms(), summary.maxMs(),
            dialogTurns.sum(), approvals.sum());
    }

    /** Clears the in-process counters; OTel instruments are cumulative and unaffected. */
    public void reset() {
        total.reset();
        byLayer.values().forEach(LongAdder::reset);
        dialogTurns.reset();
        approvals.reset();
        latencies.clear();
    }

    public record Snapshot(
        @JsonProperty("total_requests") long totalRequests,
        @JsonProperty("by_layer") Map<String, Long> byLayer,
        @JsonProperty("layer_rates") Map<String, Double> layerRates,
        @JsonProperty("avg_latency_ms") double avgLatencyMs,
        @JsonProperty("p95_latency_ms") double p95LatencyMs,
        @JsonProperty("max_latency_ms") double maxLatencyMs,
        @JsonProperty("dialog_turns") long dialogTurns,
        @JsonProperty("approval_requests") long approvalRequests
    ) {}
}
