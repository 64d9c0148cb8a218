package com.morphine.metacognition.metabolic;

import com.morphine.metacognition.config.MetacognitionProperties;
import com.morphine.metacognition.domain.model.MetabolicState;
import com.morphine.metacognition.domain.model.PerformanceMetrics;
import com.morphine.metacognition.domain.model.StreamingContext;
import com.morphine.metacognition.domain.model.Task;
import com.morphine.metacognition.domain.model.TaskOutcome;
import com.morphine.metacognition.domain.model.WorkerState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SignalType;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.ListIterator;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Glycolytic cycle: a self-scaling worker pool for scheduler-mediated work.
 *
 * <p>Every balance interval the cycle:
 * <ol>
 *   <li>assigns pending tasks to idle workers, highest priority/complexity ratio first</li>
 *   <li>recomputes load (busy / total workers) and throughput (mean worker score)</li>
 *   <li>adds one worker above the scale-up threshold, or retires one idle worker below the
 *       scale-down threshold, staying within [initial, max] workers</li>
 * </ol>
 *
 * <p>The worker list is only resized by the cycle itself. Workers are released from whichever
 * thread finishes their task, under the same write lock.
 */
@Component
@Slf4j
public class GlycolyticCycle {

    public static final String RESOURCE_CPU = "cpu";
    public static final String RESOURCE_MEMORY = "memory";
    public static final String RESOURCE_IO = "io";

    private static final double MEMORY_RATIO = 0.8;
    private static final double IO_RATIO = 0.6;
    private static final double MIN_PROCESSING_SECONDS = 0.001;

    private static final Comparator<QueuedTask> SCHEDULING_ORDER = Comparator
            .comparingDouble((QueuedTask queued) -> queued.task().schedulingRatio())
            .reversed()
            .thenComparingLong(QueuedTask::sequence);

    private final MetacognitionProperties.GlycolyticProperties config;
    private final TaskWork taskWork;
    private final int minWorkers;
    private final int maxWorkers;

    private final List<WorkerState> workers = new ArrayList<>();
    private final ReentrantReadWriteLock poolLock = new ReentrantReadWriteLock();
    private final List<QueuedTask> pendingTasks = new ArrayList<>();
    private final AtomicLong submissionSequence = new AtomicLong();
    private final AtomicInteger workerSequence = new AtomicInteger();

    private volatile double currentLoad = 0.0;
    private volatile Map<String, Double> resourceAllocation = Map.of();
    private volatile PerformanceMetrics performanceMetrics = PerformanceMetrics.empty();
    private volatile double averageLatencyMs = 0.0;

    private final AtomicLong completedTasks = new AtomicLong();
    private final AtomicLong failedTasks = new AtomicLong();

    private final Counter tasksCompletedCounter;
    private final Counter tasksFailedCounter;
    private final Timer taskDurationTimer;

    public GlycolyticCycle(MetacognitionProperties properties,
                           TaskWork taskWork,
                           MeterRegistry meterRegistry) {
        this.config = properties.getGlycolytic();
        this.taskWork = taskWork;

        if (config.getInitialWorkers() < 0) {
            throw new IllegalArgumentException("glycolytic.initial-workers must not be negative");
        }
        if (config.getMaxWorkers() < 1) {
            throw new IllegalArgumentException("glycolytic.max-workers must be at least 1");
        }
        if (config.getMaxJitter() < 0.0) {
            throw new IllegalArgumentException("glycolytic.max-jitter must not be negative");
        }
        int initial = config.getInitialWorkers() == 0
                ? Math.min(Runtime.getRuntime().availableProcessors(), config.getMaxWorkers())
                : config.getInitialWorkers();
        if (initial > config.getMaxWorkers()) {
            throw new IllegalArgumentException("glycolytic.initial-workers (" + initial
                    + ") exceeds max-workers (" + config.getMaxWorkers() + ")");
        }
        this.minWorkers = initial;
        this.maxWorkers = config.getMaxWorkers();

        for (int i = 0; i < initial; i++) {
            workers.add(WorkerState.idle(nextWorkerId()));
        }

        this.tasksCompletedCounter = Counter.builder("morphine.glycolytic.tasks.completed")
                .description("Tasks finished successfully by glycolytic workers")
                .register(meterRegistry);
        this.tasksFailedCounter = Counter.builder("morphine.glycolytic.tasks.failed")
                .description("Tasks that failed on glycolytic workers")
                .register(meterRegistry);
        this.taskDurationTimer = Timer.builder("morphine.glycolytic.task.duration")
                .description("Glycolytic task processing time")
                .register(meterRegistry);
        Gauge.builder("morphine.glycolytic.load", this, GlycolyticCycle::getCurrentLoad)
                .register(meterRegistry);
        Gauge.builder("morphine.glycolytic.workers", this, GlycolyticCycle::getWorkerCount)
                .register(meterRegistry);
        Gauge.builder("morphine.glycolytic.pending", this, GlycolyticCycle::getPendingTaskCount)
                .register(meterRegistry);

        log.info("Initialized GlycolyticCycle with {} workers (max {})", minWorkers, maxWorkers);
    }

    // --------------------------------------------------------------------------------------------
    // Submission
    // --------------------------------------------------------------------------------------------

    /**
     * Queue a task whose execution is delegated to the configured {@link TaskWork}.
     *
     * @param task the task
     * @return completes with the outcome once a worker has finished the task
     */
    public Mono<TaskOutcome> submitTask(Task task) {
        validate(task);
        Sinks.One<TaskOutcome> outcome = Sinks.one();
        enqueue(new QueuedTask(task, null, outcome, submissionSequence.incrementAndGet(), Disposables.swap()));
        return outcome.asMono();
    }

    /**
     * Queue a task that runs the given work on a worker instead of the simulation.
     * The worker is released whether the work succeeds, fails or is cancelled.
     *
     * <p>Cancelling the returned Mono withdraws the task: a queued task is removed from the
     * pending list and a running one is cancelled, freeing its worker.
     *
     * @param task scheduling metadata
     * @param work the actual work
     * @return the work's result, relayed once a worker has run it
     */
    public <T> Mono<T> execute(Task task, Mono<T> work) {
        validate(task);
        Sinks.One<T> result = Sinks.one();
        Mono<Void> wrapped = Mono.defer(() -> work)
                .doOnSuccess(value -> {
                    if (value != null) {
                        result.tryEmitValue(value);
                    } else {
                        result.tryEmitEmpty();
                    }
                })
                .doOnError(result::tryEmitError)
                .doOnCancel(() -> result.tryEmitError(
                        new CancellationException("Task cancelled: " + task.getTaskId())))
                .then();
        QueuedTask queued = new QueuedTask(task, wrapped, null, submissionSequence.incrementAndGet(),
                Disposables.swap());
        enqueue(queued);
        return result.asMono().doOnCancel(() -> withdraw(queued));
    }

    private void enqueue(QueuedTask queued) {
        synchronized (pendingTasks) {
            pendingTasks.add(queued);
        }
        log.debug("Queued task {} (stream: {}, ratio: {})",
                queued.task().getTaskId(), queued.task().getStreamId(), queued.task().schedulingRatio());
    }

    private void withdraw(QueuedTask queued) {
        boolean removed;
        synchronized (pendingTasks) {
            removed = pendingTasks.remove(queued);
        }
        if (removed) {
            log.debug("Withdrew queued task {}", queued.task().getTaskId());
        } else {
            // already assigned; a subscription installed later is disposed on arrival
            queued.execution().dispose();
        }
    }

    private void validate(Task task) {
        if (task == null || task.getTaskId() == null) {
            throw new IllegalArgumentException("Task and task ID are required");
        }
        if (!(task.getComplexity() > 0.0) || !Double.isFinite(task.getComplexity())) {
            throw new IllegalArgumentException("Task complexity must be positive: " + task.getTaskId());
        }
        if (task.getEstimatedTime() == null || task.getEstimatedTime().isNegative()) {
            throw new IllegalArgumentException("Task estimated time must not be negative: " + task.getTaskId());
        }
    }

    // --------------------------------------------------------------------------------------------
    // Balance cycle
    // --------------------------------------------------------------------------------------------

    /**
     * One scheduler tick: balance, update metrics, auto-scale.
     */
    @Scheduled(fixedRateString = "${morphine.metacognition.glycolytic.balance-interval:PT0.1S}")
    public void runCycle() {
        balanceLoad();
        updateMetrics();
        scaleWorkers();
    }

    void balanceLoad() {
        List<Assignment> assignments = new ArrayList<>();

        poolLock.writeLock().lock();
        try {
            synchronized (pendingTasks) {
                if (pendingTasks.isEmpty()) {
                    return;
                }
                pendingTasks.sort(SCHEDULING_ORDER);
                Iterator<QueuedTask> next = pendingTasks.iterator();
                for (WorkerState worker : workers) {
                    if (!next.hasNext()) {
                        break;
                    }
                    if (!worker.isBusy()) {
                        QueuedTask queued = next.next();
                        next.remove();
                        worker.assign(queued.task());
                        assignments.add(new Assignment(worker.getWorkerId(), queued));
                    }
                }
            }
        } finally {
            poolLock.writeLock().unlock();
        }

        assignments.forEach(this::dispatch);
    }

    private void dispatch(Assignment assignment) {
        QueuedTask queued = assignment.queued();
        Task task = queued.task();
        boolean simulated = queued.work() == null;
        Duration plannedTime = jittered(task.getEstimatedTime());
        long startNanos = System.nanoTime();
        AtomicReference<Throwable> failure = new AtomicReference<>();

        Mono<Void> execution = simulated
                ? Mono.defer(() -> taskWork.execute(task, plannedTime))
                : queued.work();

        Disposable subscription = execution
                .doOnError(failure::set)
                .onErrorResume(e -> Mono.empty())
                .doFinally(signal -> {
                    Duration processingTime = simulated
                            ? plannedTime
                            : Duration.ofNanos(System.nanoTime() - startNanos);
                    Throwable error = failure.get();
                    if (error == null && signal == SignalType.CANCEL) {
                        error = new CancellationException("Worker execution cancelled");
                    }
                    release(assignment.workerId(), queued, processingTime, error);
                })
                .subscribe();
        queued.execution().update(subscription);
    }

    private void release(String workerId, QueuedTask queued, Duration processingTime, Throwable error) {
        double seconds = Math.max(processingTime.toNanos() / 1_000_000_000.0, MIN_PROCESSING_SECONDS);
        double latencyMs = processingTime.toNanos() / 1_000_000.0;

        poolLock.writeLock().lock();
        try {
            for (WorkerState worker : workers) {
                if (worker.getWorkerId().equals(workerId)) {
                    worker.release(seconds);
                    break;
                }
            }
            averageLatencyMs = averageLatencyMs == 0.0 ? latencyMs : averageLatencyMs * 0.9 + latencyMs * 0.1;
        } finally {
            poolLock.writeLock().unlock();
        }

        taskDurationTimer.record(processingTime);
        boolean success = error == null;
        if (success) {
            completedTasks.incrementAndGet();
            tasksCompletedCounter.increment();
        } else {
            failedTasks.incrementAndGet();
            tasksFailedCounter.increment();
            log.warn("Task {} failed on worker {}: {}", queued.task().getTaskId(), workerId, error.getMessage());
        }

        if (queued.outcome() != null) {
            queued.outcome().tryEmitValue(TaskOutcome.builder()
                    .taskId(queued.task().getTaskId())
                    .workerId(workerId)
                    .processingTime(processingTime)
                    .success(success)
                    .errorMessage(success ? null : error.getMessage())
                    .build());
        }
    }

    void updateMetrics() {
        poolLock.readLock().lock();
        try {
            int total = workers.size();
            long busy = workers.stream().filter(WorkerState::isBusy).count();
            double load = total == 0 ? 0.0 : (double) busy / total;
            double throughput = workers.stream()
                    .mapToDouble(WorkerState::getPerformanceScore)
                    .average()
                    .orElse(0.0);

            long completed = completedTasks.get();
            long failed = failedTasks.get();
            long finished = completed + failed;

            currentLoad = load;
            performanceMetrics = PerformanceMetrics.builder()
                    .throughput(throughput)
                    .averageLatency(averageLatencyMs)
                    .resourceEfficiency(load)
                    .errorRate(finished == 0 ? 0.0 : (double) failed / finished)
                    .completedTasks(completed)
                    .failedTasks(failed)
                    .build();
        } finally {
            poolLock.readLock().unlock();
        }
    }

    void scaleWorkers() {
        double load = currentLoad;

        poolLock.writeLock().lock();
        try {
            if (load > config.getScaleUpThreshold() && workers.size() < maxWorkers) {
                WorkerState worker = WorkerState.idle(nextWorkerId());
                workers.add(worker);
                log.debug("Scaled up to {} workers (load {})", workers.size(), load);
            } else if (load < config.getScaleDownThreshold() && workers.size() > minWorkers) {
                ListIterator<WorkerState> candidates = workers.listIterator(workers.size());
                while (candidates.hasPrevious()) {
                    WorkerState worker = candidates.previous();
                    if (!worker.isBusy()) {
                        candidates.remove();
                        log.debug("Retired worker {}, {} remaining (load {})",
                                worker.getWorkerId(), workers.size(), load);
                        break;
                    }
                }
            }
        } finally {
            poolLock.writeLock().unlock();
        }
    }

    // --------------------------------------------------------------------------------------------
    // Resource allocation
    // --------------------------------------------------------------------------------------------

    /**
     * Resource shares for a context under the given metabolic state.
     * Pure apart from remembering the result as the current allocation.
     */
    public Map<String, Double> allocateResources(StreamingContext context, MetabolicState metabolicState) {
        double base = 1.0 / (1.0 + metabolicState.getGlycolyticLoad());
        double priorityMultiplier = 1.0 + context.getConfidenceLevel();

        Map<String, Double> allocation = new LinkedHashMap<>();
        allocation.put(RESOURCE_CPU, base * priorityMultiplier);
        allocation.put(RESOURCE_MEMORY, base * MEMORY_RATIO);
        allocation.put(RESOURCE_IO, base * IO_RATIO);

        Map<String, Double> snapshot = Collections.unmodifiableMap(allocation);
        this.resourceAllocation = snapshot;
        return snapshot;
    }

    // --------------------------------------------------------------------------------------------
    // Read accessors
    // --------------------------------------------------------------------------------------------

    public double getCurrentLoad() {
        return currentLoad;
    }

    public Map<String, Double> getResourceAllocation() {
        return resourceAllocation;
    }

    public PerformanceMetrics getPerformanceMetrics() {
        return performanceMetrics;
    }

    public int getWorkerCount() {
        poolLock.readLock().lock();
        try {
            return workers.size();
        } finally {
            poolLock.readLock().unlock();
        }
    }

    public int getBusyWorkerCount() {
        poolLock.readLock().lock();
        try {
            return (int) workers.stream().filter(WorkerState::isBusy).count();
        } finally {
            poolLock.readLock().unlock();
        }
    }

    /**
     * Copies of the current workers.
     */
    public List<WorkerState> getWorkers() {
        poolLock.readLock().lock();
        try {
            return workers.stream().map(worker -> worker.toBuilder().build()).toList();
        } finally {
            poolLock.readLock().unlock();
        }
    }

    public int getPendingTaskCount() {
        synchronized (pendingTasks) {
            return pendingTasks.size();
        }
    }

    public int getMinWorkers() {
        return minWorkers;
    }

    public int getMaxWorkers() {
        return maxWorkers;
    }

    // --------------------------------------------------------------------------------------------
    // Internal helpers
    // --------------------------------------------------------------------------------------------

    private Duration jittered(Duration estimatedTime) {
        double jitter = ThreadLocalRandom.current().nextDouble() * config.getMaxJitter();
        return Duration.ofNanos((long) (estimatedTime.toNanos() * (1.0 + jitter)));
    }

    private String nextWorkerId() {
        return "worker-" + workerSequence.getAndIncrement();
    }

    private record QueuedTask(Task task, Mono<Void> work, Sinks.One<TaskOutcome> outcome, long sequence,
                              Disposable.Swap execution) {
    }

    private record Assignment(String workerId, QueuedTask queued) {
    }
}
