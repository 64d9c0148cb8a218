package com.morphine.metacognition.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Aggregate scheduler metrics, recomputed every balance cycle.
 */
@Value
@Builder(toBuilder = true)
public class PerformanceMetrics {

    /**
     * Mean worker performance score.
     */
    double throughput;

    /**
     * Moving average of task processing time in milliseconds.
     */
    double averageLatency;

    double resourceEfficiency;

    /**
     * Failed tasks / finished tasks.
     */
    double errorRate;

    long completedTasks;
    long failedTasks;

    public static PerformanceMetrics empty() {
        return PerformanceMetrics.builder().build();
    }
}
