package com.example.routing.semantic;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import io.opentelemetry.api.OpenTelemetry;

/**
 * In-process fallback for environments without an embedding service.
 * Similarity is the higher of two Dice coefficients: over character bigrams
 * of the normalized texts, which works for CJK input without a tokenizer,
 * and over the sets of whitespace or punctuation separated tokens, which
 * tolerates reordered words.
 */
public class LexicalSemanticRouter extends AbstractSemanticRouter {

    public static final String BACKEND = "lexical";

    private static final Pattern NOISE = Pattern.compile("[\\s\\p{Punct}，。！？、；：「」（）]+");

    public LexicalSemanticRouter(List<SemanticRoute> routes, double threshold, OpenTelemetry openTelemetry) {
        super(routes, threshold, openTelemetry);
    }

    @Override
    protected Scored bestMatch(String text, List<SemanticRoute> snapshot) {
        Map<String, Integer> input = bigrams(text);
        Set<String> inputTokens = tokens(text);
        Scored best = Scored.none();
        for (SemanticRoute route : snapshot) {
            for (String utterance : route.utterances()) {
                double similarity = Math.max(dice(input, bigrams(utterance)),
                    tokenOverlap(inputTokens, tokens(utterance)));
                if (similarity > best.similarity()) {
                    best = new Scored(route, similarity);
                }
            }
        }
        return best;
    }

    @Override
    public String backend() {
        return BACKEND;
    }

    static double similarity(String a, String b) {
        return Math.max(dice(bigrams(a), bigrams(b)), tokenOverlap(tokens(a), tokens(b)));
    }

    static String normalize(String text) {
        return NOISE.matcher(text.toLowerCase(Locale.ROOT)).replaceAll("");
    }

    static Map<String, Integer> bigrams(String text) {
        String normalized = normalize(text);
        Map<String, Integer> grams = new HashMap<>();
        if (normalized.length() == 1) {
            grams.put(normalized, 1);
            return grams;
        }
        for (int i = 0; i + 1 < normalized.length(); i++) {
            grams.merge(normalized.substring(i, i + 2), 1, Integer::sum);
        }
        return grams;
    }

    static Set<String> tokens(String text) {
        Set<String> tokens = new HashSet<>();
        for (String token : NOISE.split(text.toLowerCase(Locale.ROOT))) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    static double tokenOverlap(Set<String> a, Set<String> b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        int shared = 0;
        for (String token : a) {
            if (b.contains(token)) {
                shared++;
            }
        }
        return (2.0 * shared) / (a.size() + b.size());
    }

    private static double dice(Map<String, Integer> a, Map<String, Integer> b) {
        int sizeA = a.values().stream().mapToInt(Integer::intValue).sum();
        int sizeB = b.values().stream().mapToInt(Integer::intValue).sum();
        if (sizeA == 0 || sizeB == 0) {
            return 0.0;
        }
        int overlap = 0;
        for (Map.Entry<String, Integer> gram : a.entrySet()) {
            Integer other = b.get(gram.getKey());
            if (other != null) {
                overlap += Math.min(gram.getValue(), other);
            }
        }
        return (2.0 * overlap) / (sizeA + sizeB);
    }
}
