package com.example.routing.semantic;

import java.util.List;

/**
 * Layer 2 of the cascade: similarity against labeled example utterances.
 * Implementations never throw from {@link #route(String)}; an unavailable
 * backend reports a no-match.
 */
public interface SemanticRouter {

    SemanticRouteResult route(String text);

    List<SemanticRoute> routes();

    /** Installs a new route table; readers see either the old or the new one. */
    int reload(List<SemanticRoute> routes);

    double threshold();

    String backend();
}
