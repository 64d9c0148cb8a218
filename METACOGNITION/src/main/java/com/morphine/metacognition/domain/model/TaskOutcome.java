package com.morphine.metacognition.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Published when a worker finishes a task, successfully or not.
 */
@Value
@Builder
public class TaskOutcome {

    String taskId;
    String workerId;
    Duration processingTime;
    boolean success;
    String errorMessage;
}
