package com.morphine.metacognition.layer;

import com.fasterxml.jackson.databind.JsonNode;
import com.morphine.metacognition.domain.model.StreamingContext;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Adapter for one of the three cognitive layers. Layer internals live outside this service;
 * the orchestrator treats every layer as an opaque scorer.
 */
public interface CognitiveLayer {

    /**
     * Which layer this adapter provides.
     *
     * @return layer type
     */
    LayerType getLayerType();

    /**
     * Produce an evidence blob for a context.
     * The blob should carry a numeric {@code confidence} field; anything else is layer-specific.
     *
     * @param context the context being decided on
     * @param collectedEvidence evidence gathered from registered AI systems, keyed by system ID
     * @param knowledgeBase read-only knowledge base
     * @return evidence blob
     */
    Mono<JsonNode> process(StreamingContext context,
                           Map<String, JsonNode> collectedEvidence,
                           KnowledgeBase knowledgeBase);
}
