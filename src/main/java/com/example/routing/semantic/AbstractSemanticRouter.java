package com.example.routing.semantic;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.routing.model.Scores;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

abstract class AbstractSemanticRouter implements SemanticRouter {

    private static final Logger log = LoggerFactory.getLogger(AbstractSemanticRouter.class);

    record Scored(SemanticRoute route, double similarity) {
        static Scored none() {
            return new Scored(null, 0.0);
        }
    }

    protected final AtomicReference<List<SemanticRoute>> routes = new AtomicReference<>(List.of());
    private final double threshold;
    private final Tracer tracer;

    protected AbstractSemanticRouter(List<SemanticRoute> routes, double threshold, OpenTelemetry openTelemetry) {
        this.threshold = Scores.clamp(threshold);
        this.tracer = openTelemetry.getTracer("itsm-intent-router");
        this.routes.set(validated(routes));
    }

    @Override
    public SemanticRouteResult route(String text) {
        if (text == null || text.isBlank()) {
            return SemanticRouteResult.noMatch(0.0, backend());
        }
        Span span = tracer.spanBuilder("semantic_route")
            .setAttribute("routing.stage", "semantic")
            .setAttribute("routing.semantic_backend", backend())
            .startSpan();

        try (Scope ignored = span.makeCurrent()) {
            Scored best = bestMatch(text, routes.get());
            double similarity = Scores.clamp(best.similarity());
            span.setAttribute("routing.similarity", similarity);

            if (best.route() != null && similarity >= threshold) {
                span.setAttribute("routing.route_name", best.route().name());
                log.debug("Semantic route {} matched (similarity={})", best.route().name(), similarity);
                return SemanticRouteResult.matched(best.route(), similarity, backend());
            }
            return SemanticRouteResult.noMatch(similarity, backend());

        } catch (Exception e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            log.warn("Semantic routing failed, treating as no-match: {}", e.getMessage());
            return SemanticRouteResult.noMatch(0.0, backend());

        } finally {
            span.end();
        }
    }

    /** Highest scoring route for the text, or {@link Scored#none()}. */
    protected abstract Scored bestMatch(String text, List<SemanticRoute> snapshot);

    @Override
    public List<SemanticRoute> routes() {
        return routes.get();
    }

    @Override
    public int reload(List<SemanticRoute> newRoutes) {
        List<SemanticRoute> snapshot = validated(newRoutes);
        routes.set(snapshot);
        log.info("Loaded {} semantic routes ({} backend)", snapshot.size(), backend());
        return snapshot.size();
    }

    private static List<SemanticRoute> validated(List<SemanticRoute> candidates) {
        List<SemanticRoute> valid = new ArrayList<>();
        for (SemanticRoute route : candidates == null ? List.<SemanticRoute>of() : candidates) {
            if (route == null || route.name() == null || route.utterances().isEmpty()) {
                log.warn("Skipping semantic route without name or utterances");
                continue;
            }
            valid.add(route);
        }
        return List.copyOf(valid);
    }

    @Override
    public double threshold() {
        return threshold;
    }
}
