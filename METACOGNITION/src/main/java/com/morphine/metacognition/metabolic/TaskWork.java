package com.morphine.metacognition.metabolic;

import com.morphine.metacognition.domain.model.Task;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * What a glycolytic worker does with a task that carries no work of its own.
 */
@FunctionalInterface
public interface TaskWork {

    /**
     * Execute a task.
     *
     * @param task the task
     * @param processingTime jittered processing time the worker budgets for the task
     * @return completes when the worker may be released
     */
    Mono<Void> execute(Task task, Duration processingTime);

    /**
     * Default strategy: hold the worker for the processing time.
     */
    static TaskWork simulated() {
        return (task, processingTime) -> Mono.delay(processingTime).then();
    }
}
