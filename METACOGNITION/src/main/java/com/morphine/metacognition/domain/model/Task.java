package com.morphine.metacognition.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Unit of schedulable work for the glycolytic cycle. Consumed exactly once by a worker.
 */
@Value
@Builder
public class Task {

    String taskId;

    /**
     * Stream that caused this work, if any.
     */
    String streamId;

    /**
     * Relative cost; must be positive.
     */
    @Builder.Default
    double complexity = 1.0;

    @Builder.Default
    double priority = 1.0;

    /**
     * Share of a worker's resources the task occupies.
     */
    double resourceRequirement;

    @Builder.Default
    Duration estimatedTime = Duration.ofMillis(100);

    @Builder.Default
    Instant createdAt = Instant.now();

    /**
     * Scheduling rank: higher runs first.
     */
    public double schedulingRatio() {
        return priority / complexity;
    }
}
