package com.example.routing.gateway;

import com.example.routing.model.RoutingDecision;

public interface SourceHandler {

    SourceType sourceType();

    /** Whether this handler answers without the classifier cascade. */
    boolean fastPath();

    RoutingDecision process(IncomingRequest request);
}
