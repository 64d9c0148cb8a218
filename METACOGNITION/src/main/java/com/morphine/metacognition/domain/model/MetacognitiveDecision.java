package com.morphine.metacognition.domain.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Output of one pipeline run. Read-only once created.
 */
@Value
@Builder
public class MetacognitiveDecision {

    public static final String EVIDENCE_CONTEXT = "context";
    public static final String EVIDENCE_REASONING = "reasoning";
    public static final String EVIDENCE_INTUITION = "intuition";

    /**
     * Unique decision ID, prefixed with the stream ID.
     */
    String decisionId;

    String streamId;

    DecisionType decisionType;

    /**
     * Fused confidence (0.0 - 1.0).
     */
    double confidence;

    /**
     * One evidence blob per cognitive layer.
     */
    Map<String, JsonNode> evidence;

    /**
     * Timestamp of the context this decision was made for; the clock's time when the context carried none.
     */
    Instant timestamp;

    LayerContributions layerContributions;

    /**
     * Resource allocation granted to the pipeline run.
     */
    @Builder.Default
    Map<String, Double> resourceAllocation = Map.of();
}
