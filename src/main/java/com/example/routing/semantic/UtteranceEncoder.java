package com.example.routing.semantic;

import java.util.List;

/**
 * External embedding service, consumed as an opaque scoring function.
 * Implementations bound each call with a timeout and throw on failure.
 */
public interface UtteranceEncoder {

    List<float[]> encode(List<String> texts);

    default float[] encode(String text) {
        return encode(List.of(text)).get(0);
    }
}
