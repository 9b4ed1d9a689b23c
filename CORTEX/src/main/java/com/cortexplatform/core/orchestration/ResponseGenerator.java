package com.cortexplatform.core.orchestration;

import reactor.core.publisher.Flux;

/**
 * Produces the assistant reply for an input as a stream of text chunks.
 * The concatenation of all chunks is the complete reply.
 */
@FunctionalInterface
public interface ResponseGenerator {

    Flux<String> generate(GenerationRequest request);
}
