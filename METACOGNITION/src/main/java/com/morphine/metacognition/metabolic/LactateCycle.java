package com.morphine.metacognition.metabolic;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.morphine.metacognition.config.MetacognitionProperties;
import com.morphine.metacognition.domain.model.MetacognitiveDecision;
import com.morphine.metacognition.domain.model.PartialResult;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Lactate cycle: holds low-confidence decisions as partial results until their TTL runs out.
 * <p>
 * The lactate level summarises the backlog as
 * {@code count / (1 + mean completion percentage)} and is refreshed by each sweep.
 */
@Slf4j
@Component
public class LactateCycle {

    private final Map<String, PartialResult> partialResults = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    private volatile double lactateLevel = 0.0;

    public LactateCycle(MetacognitionProperties properties, Clock clock, MeterRegistry meterRegistry) {
        this.ttl = properties.getLactate().getTtl();
        this.clock = clock;

        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("lactate.ttl must be positive: " + ttl);
        }

        Gauge.builder("morphine.lactate.level", this, LactateCycle::getLactateLevel)
                .register(meterRegistry);
        Gauge.builder("morphine.lactate.entries", this, LactateCycle::size)
                .register(meterRegistry);

        log.info("Initialized lactate cycle: ttl={}", ttl);
    }

    // ========== Archival ==========

    /**
     * Archive a decision as a partial result. Every call creates a new entry.
     *
     * @return the stored entry
     */
    public PartialResult storePartialResult(MetacognitiveDecision decision) {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.put("decisionId", decision.getDecisionId());
        payload.put("streamId", decision.getStreamId());
        payload.put("decisionType", String.valueOf(decision.getDecisionType()));
        payload.put("confidence", decision.getConfidence());
        ObjectNode evidence = payload.putObject("evidence");
        if (decision.getEvidence() != null) {
            decision.getEvidence().forEach((key, value) -> {
                if (value != null) {
                    evidence.set(key, value.deepCopy());
                }
            });
        }

        PartialResult result = PartialResult.builder()
                .resultId(UUID.randomUUID().toString())
                .taskId(decision.getDecisionId())
                .completionPercentage(decision.getConfidence() * 100.0)
                .confidence(decision.getConfidence())
                .payload(payload)
                .createdAt(clock.instant())
                .ttl(ttl)
                .build();

        partialResults.put(result.getResultId(), result);
        log.debug("Archived partial result {} for decision {} (confidence {})",
                result.getResultId(), decision.getDecisionId(), decision.getConfidence());
        return result;
    }

    // ========== Lookup ==========

    /**
     * First partial result recorded for a task or decision id.
     */
    public Optional<PartialResult> retrievePartialResult(String taskId) {
        if (taskId == null) {
            return Optional.empty();
        }
        return partialResults.values().stream()
                .filter(result -> taskId.equals(result.getTaskId()))
                .findFirst();
    }

    /**
     * Partial results whose task id contains the stream id.
     * Approximate: a stream id that is a substring of another stream's id matches both.
     */
    public List<PartialResult> recoveryFromIncomplete(String streamId) {
        if (streamId == null || streamId.isEmpty()) {
            return List.of();
        }
        return partialResults.values().stream()
                .filter(result -> result.getTaskId() != null && result.getTaskId().contains(streamId))
                .toList();
    }

    // ========== Sweep ==========

    /**
     * Purge expired entries and recompute the lactate level.
     */
    @Scheduled(fixedRateString = "${morphine.metacognition.lactate.sweep-interval:PT30S}")
    public void sweep() {
        Instant now = clock.instant();
        int before = partialResults.size();
        partialResults.values().removeIf(result -> result.isExpired(now));
        int removed = before - partialResults.size();

        List<PartialResult> remaining = List.copyOf(partialResults.values());
        if (remaining.isEmpty()) {
            lactateLevel = 0.0;
        } else {
            double meanCompletion = remaining.stream()
                    .mapToDouble(PartialResult::getCompletionPercentage)
                    .average()
                    .orElse(0.0);
            lactateLevel = remaining.size() / (1.0 + meanCompletion);
        }

        if (removed > 0) {
            log.debug("Lactate sweep removed {} expired results, level now {}", removed, lactateLevel);
        }
    }

    public double getLactateLevel() {
        return lactateLevel;
    }

    public int size() {
        return partialResults.size();
    }

    public Duration getTtl() {
        return ttl;
    }
}
