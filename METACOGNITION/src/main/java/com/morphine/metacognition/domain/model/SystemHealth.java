package com.morphine.metacognition.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Read-only health snapshot of the orchestrator. Values are eventually consistent.
 */
@Value
@Builder
public class SystemHealth {

    MetabolicState metabolicState;
    int activeStreamCount;
    int registeredSystemCount;

    int workerCount;
    int pendingTaskCount;
    int partialResultCount;
    int patternCount;
    PerformanceMetrics schedulerMetrics;
}
