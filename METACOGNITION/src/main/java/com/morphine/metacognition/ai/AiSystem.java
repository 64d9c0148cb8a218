package com.morphine.metacognition.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.morphine.metacognition.domain.model.StreamingContext;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * A pluggable scorer consulted on every pipeline run before the context layer.
 */
public interface AiSystem {

    /**
     * Stable identifier; registering another system under the same id replaces this one.
     */
    String getSystemId();

    /**
     * Score a streaming context.
     *
     * @param context the context being decided on
     * @return evidence produced by this system
     */
    Mono<JsonNode> process(StreamingContext context);

    /**
     * Self-reported confidence in a piece of evidence this system produced.
     */
    double confidence(JsonNode evidence);

    /**
     * Typical processing time. Drives the per-call timeout and whether the call
     * is run on a glycolytic worker.
     */
    Duration getExpectedProcessingTime();
}
