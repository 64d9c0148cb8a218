package com.morphine.metacognition.domain.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * One unit of input on a stream. Immutable once submitted; owned by the pipeline run it triggers.
 */
@Value
@Builder(toBuilder = true)
public class StreamingContext {

    /**
     * ID of the stream this context belongs to.
     */
    String streamId;

    /**
     * When the caller observed this context.
     */
    @Builder.Default
    Instant timestamp = Instant.now();

    /**
     * Named partial data values (detections, odds, location fixes...).
     */
    @Builder.Default
    Map<String, JsonNode> partialData = Map.of();

    /**
     * Caller's confidence in the context (0.0 - 1.0).
     */
    double confidenceLevel;

    @Builder.Default
    ProcessingStage processingStage = ProcessingStage.CONTEXT;
}
