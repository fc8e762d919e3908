package com.example.routing.semantic;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.opentelemetry.api.OpenTelemetry;

/**
 * Semantic router over an external encoder. The utterance index is built on
 * first use; if that build fails the router stays in no-match mode for the
 * current route table instead of retrying on every request.
 */
public class EmbeddingSemanticRouter extends AbstractSemanticRouter {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingSemanticRouter.class);

    public static final String BACKEND = "embedding";

    record IndexEntry(SemanticRoute route, float[] vector, double norm) {}

    record Index(List<SemanticRoute> source, List<IndexEntry> entries, boolean available) {}

    private final UtteranceEncoder encoder;
    private volatile Index index;

    public EmbeddingSemanticRouter(List<SemanticRoute> routes, double threshold,
                                   UtteranceEncoder encoder, OpenTelemetry openTelemetry) {
        super(routes, threshold, openTelemetry);
        this.encoder = encoder;
    }

    @Override
    protected Scored bestMatch(String text, List<SemanticRoute> snapshot) {
        Index current = indexFor(snapshot);
        if (!current.available() || current.entries().isEmpty()) {
            return Scored.none();
        }

        float[] query = encoder.encode(text);
        double queryNorm = norm(query);
        Scored best = Scored.none();
        for (IndexEntry entry : current.entries()) {
            double similarity = cosine(query, queryNorm, entry.vector(), entry.norm());
            if (similarity > best.similarity()) {
                best = new Scored(entry.route(), similarity);
            }
        }
        return best;
    }

    public boolean isAvailable() {
        Index current = index;
        return current == null || current.available();
    }

    private Index indexFor(List<SemanticRoute> snapshot) {
        Index current = index;
        if (current != null && current.source() == snapshot) {
            return current;
        }
        synchronized (this) {
            current = index;
            if (current != null && current.source() == snapshot) {
                return current;
            }
            current = build(snapshot);
            index = current;
            return current;
        }
    }

    private Index build(List<SemanticRoute> snapshot) {
        List<String> utterances = new ArrayList<>();
        List<SemanticRoute> owners = new ArrayList<>();
        for (SemanticRoute route : snapshot) {
            for (String utterance : route.utterances()) {
                utterances.add(utterance);
                owners.add(route);
            }
        }
        try {
            List<float[]> vectors = encoder.encode(utterances);
            List<IndexEntry> entries = new ArrayList<>(vectors.size());
            for (int i = 0; i < vectors.size(); i++) {
                entries.add(new IndexEntry(owners.get(i), vectors.get(i), norm(vectors.get(i))));
            }
            log.info("Built semantic index: {} utterances across {} routes", entries.size(), snapshot.size());
            return new Index(snapshot, List.copyOf(entries), true);
        } catch (Exception e) {
            log.error("Semantic index build failed, semantic layer disabled until next reload: {}", e.toString());
            return new Index(snapshot, List.of(), false);
        }
    }

    @Override
    public String backend() {
        return BACKEND;
    }

    static double norm(float[] v) {
        double sum = 0;
        for (float x : v) {
            sum += (double) x * x;
        }
        return Math.sqrt(sum);
    }

    /** Cosine similarity with negatives floored at 0. */
    static double cosine(float[] a, double normA, float[] b, double normB) {
        if (a.length != b.length || normA == 0 || normB == 0) {
            return 0.0;
        }
        double dot = 0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
        }
        return Math.max(0.0, dot / (normA * normB));
    }
}
