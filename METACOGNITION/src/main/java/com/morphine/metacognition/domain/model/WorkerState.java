package com.morphine.metacognition.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * State of a single glycolytic worker. Owned by the scheduler; others only see copies.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class WorkerState {

    private String workerId;
    private boolean busy;

    /**
     * ID of the task in progress, null when idle.
     */
    private String currentTaskId;

    /**
     * Exponential moving average of 1 / processing seconds.
     */
    @Builder.Default
    private double performanceScore = 1.0;

    private double resourceUsage;

    public static WorkerState idle(String workerId) {
        return WorkerState.builder()
                .workerId(workerId)
                .busy(false)
                .performanceScore(1.0)
                .build();
    }

    public void assign(Task task) {
        this.busy = true;
        this.currentTaskId = task.getTaskId();
        this.resourceUsage = task.getResourceRequirement();
    }

    /**
     * Frees the worker and folds the processing time into its score.
     */
    public void release(double processingSeconds) {
        this.busy = false;
        this.currentTaskId = null;
        this.resourceUsage = 0.0;
        this.performanceScore = performanceScore * 0.9 + 0.1 / processingSeconds;
    }
}
