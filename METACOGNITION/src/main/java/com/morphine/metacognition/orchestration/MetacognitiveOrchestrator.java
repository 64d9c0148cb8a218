package com.morphine.metacognition.orchestration;

import com.fasterxml.jackson.databind.JsonNode;
import com.morphine.metacognition.ai.AiSystem;
import com.morphine.metacognition.domain.model.DreamPattern;
import com.morphine.metacognition.domain.model.MetacognitiveDecision;
import com.morphine.metacognition.domain.model.PartialResult;
import com.morphine.metacognition.domain.model.SystemHealth;
import com.morphine.metacognition.domain.model.Task;
import com.morphine.metacognition.domain.model.TaskOutcome;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Set;

/**
 * Core interface for metacognitive stream orchestration.
 * Turns streams of contexts into streams of fused decisions.
 */
public interface MetacognitiveOrchestrator {

    // --------------------------------------------------------------------------------------------
    // Streams
    // --------------------------------------------------------------------------------------------

    /**
     * Open a stream and start its decision pipeline.
     * If the stream is already open the existing handle is returned and no second pipeline starts.
     *
     * @param streamId the stream ID
     * @return the stream's input sender and decision flux
     */
    StreamHandle createStream(String streamId);

    /**
     * Close a stream's input. Queued contexts are still processed before the
     * decision flux completes.
     *
     * @param streamId the stream ID
     * @return true if the stream was open
     */
    boolean closeStream(String streamId);

    /**
     * IDs of streams whose pipeline is running.
     */
    Set<String> getActiveStreamIds();

    /**
     * Recent decisions produced on a stream, oldest first.
     */
    List<MetacognitiveDecision> getStreamingDecisions(String streamId);

    // --------------------------------------------------------------------------------------------
    // AI systems and scheduling
    // --------------------------------------------------------------------------------------------

    /**
     * Register an AI system, replacing any system with the same ID.
     *
     * @param system the system
     * @param weight trust weight, finite and non-negative
     */
    void registerAiSystem(AiSystem system, double weight);

    /**
     * Run a task on the glycolytic worker pool.
     */
    Mono<TaskOutcome> submitTask(Task task);

    // --------------------------------------------------------------------------------------------
    // Introspection
    // --------------------------------------------------------------------------------------------

    /**
     * Snapshot of the live metabolic state and registry sizes. Never blocks pipeline runs.
     */
    SystemHealth getSystemHealth();

    List<DreamPattern> getDiscoveredPatterns();

    List<JsonNode> getNovelDiscoveries();

    /**
     * Archived low-confidence decisions for a stream (approximate stream-id match).
     */
    List<PartialResult> recoverIncomplete(String streamId);
}
