package com.example.routing.telemetry;

import org.junit.jupiter.api.Test;

import com.example.routing.model.RoutingDecision;
import com.example.routing.model.RoutingLayer;

import io.opentelemetry.api.OpenTelemetry;

import static org.junit.jupiter.api.Assertions.*;

class RoutingMetricsTest {

    private static RoutingDecision decision(RoutingLayer layer, double latencyMs) {
        return RoutingDecision.builder().routingLayer(layer).processingTimeMs(latencyMs).build();
    }

    @Test
    void countsDecisionsPerLayer() {
        RoutingMetrics metrics = new RoutingMetrics(OpenTelemetry.noop(), 100);

        metrics.recordDecision(decision(RoutingLayer.PATTERN, 1.0));
        metrics.recordDecision(decision(RoutingLayer.PATTERN, 2.0));
        metrics.recordDecision(decision(RoutingLayer.SEMANTIC, 3.0));
        metrics.recordDecision(decision(RoutingLayer.LLM, 10.0));

        RoutingMetrics.Snapshot snapshot = metrics.snapshot();
        assertEquals(4, snapshot.totalRequests());
        assertEquals(Long.valueOf(2), snapshot.byLayer().get("pattern"));
        assertEquals(Long.valueOf(0), snapshot.byLayer().get("none"));
        assertEquals(0.5, snapshot.layerRates().get("pattern"), 1e-9);
        assertEquals(4.0, snapshot.avgLatencyMs(), 1e-9);
        assertEquals(10.0, snapshot.maxLatencyMs());
    }

    @Test
    void ratesAreZeroBeforeAnyTraffic() {
        RoutingMetrics.Snapshot snapshot = new RoutingMetrics(OpenTelemetry.noop(), 100).snapshot();

        assertEquals(0, snapshot.totalRequests());
        assertEquals(0.0, snapshot.layerRates().get("llm"));
    }

    @Test
    void tracksDialogTurnsAndApprovalsAndResets() {
        RoutingMetrics metrics = new RoutingMetrics(OpenTelemetry.noop(), 100);
        metrics.recordDialogTurn("gathering");
        metrics.recordDialogTurn("complete");
        metrics.recordApprovalRequest("high", "single");
        metrics.recordDecision(decision(RoutingLayer.DIALOG, 1.0));

        assertEquals(2, metrics.snapshot().dialogTurns());
        assertEquals(1, metrics.snapshot().approvalRequests());

        metrics.reset();

        RoutingMetrics.Snapshot cleared = metrics.snapshot();
        assertEquals(0, cleared.totalRequests());
        assertEquals(0, cleared.dialogTurns());
        assertEquals(0, cleared.approvalRequests());
        assertEquals(Long.valueOf(0), cleared.byLayer().get("dialog"));
    }
}
