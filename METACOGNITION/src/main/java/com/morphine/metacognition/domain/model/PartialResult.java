package com.morphine.metacognition.domain.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Lactate cache entry for a low-confidence decision.
 */
@Value
@Builder
public class PartialResult {

    String resultId;

    /**
     * ID of the decision (or task) this entry was produced from.
     */
    String taskId;

    /**
     * Confidence x 100.
     */
    double completionPercentage;

    double confidence;

    /**
     * Snapshot of the decision evidence.
     */
    JsonNode payload;

    Instant createdAt;
    Duration ttl;

    public boolean isExpired(Instant now) {
        return Duration.between(createdAt, now).compareTo(ttl) >= 0;
    }
}
