package com.morphine.metacognition.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.morphine.metacognition.config.MetacognitionProperties;
import com.morphine.metacognition.domain.model.StreamingContext;
import com.morphine.metacognition.domain.model.Task;
import com.morphine.metacognition.layer.ConfidenceExtractor;
import com.morphine.metacognition.metabolic.GlycolyticCycle;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for AI systems.
 * Holds each system together with its trust weight and circuit breaker, and fans
 * pipeline contexts out to all of them.
 */
@Component
@Slf4j
public class AiSystemRegistry {

    public static final String FIELD_SYSTEM_ID = "systemId";
    public static final String FIELD_WEIGHT = "weight";
    public static final String FIELD_CONFIDENCE = ConfidenceExtractor.CONFIDENCE_FIELD;
    public static final String FIELD_RESULT = "result";

    private static final String CIRCUIT_BREAKER_PREFIX = "ai-system-";

    private final Map<String, RegisteredSystem> systems = new ConcurrentHashMap<>();
    private final MetacognitionProperties.AiSystemProperties config;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final GlycolyticCycle glycolyticCycle;
    private final MeterRegistry meterRegistry;

    public AiSystemRegistry(MetacognitionProperties properties,
                            CircuitBreakerRegistry circuitBreakerRegistry,
                            GlycolyticCycle glycolyticCycle,
                            MeterRegistry meterRegistry) {
        this.config = properties.getAiSystems();
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.glycolyticCycle = glycolyticCycle;
        this.meterRegistry = meterRegistry;

        if (!(config.getTimeoutMultiplier() > 0.0)) {
            throw new IllegalArgumentException("ai-systems.timeout-multiplier must be positive");
        }
    }

    /**
     * Register a system, replacing any system already registered under the same id.
     *
     * @param system the system
     * @param weight trust weight, finite and non-negative
     * @throws IllegalArgumentException if the system has no id or the weight is invalid
     */
    public void register(AiSystem system, double weight) {
        if (system == null || system.getSystemId() == null || system.getSystemId().isBlank()) {
            throw new IllegalArgumentException("AI system and system ID are required");
        }
        if (!Double.isFinite(weight) || weight < 0.0) {
            throw new IllegalArgumentException("AI system weight must be finite and non-negative: " + weight);
        }

        String systemId = system.getSystemId();
        CircuitBreaker circuitBreaker = circuitBreakerRegistry.circuitBreaker(CIRCUIT_BREAKER_PREFIX + systemId);
        RegisteredSystem previous = systems.put(systemId, new RegisteredSystem(system, weight, circuitBreaker));

        if (previous == null) {
            log.info("Registered AI system: {} (weight {})", systemId, weight);
        } else {
            log.info("Replaced AI system: {} (weight {} -> {})", systemId, previous.weight(), weight);
        }
    }

    /**
     * Remove a system.
     *
     * @return true if a system was registered under the id
     */
    public boolean unregister(String systemId) {
        RegisteredSystem removed = systems.remove(systemId);
        if (removed == null) {
            return false;
        }
        circuitBreakerRegistry.remove(CIRCUIT_BREAKER_PREFIX + systemId);
        log.info("Unregistered AI system: {}", systemId);
        return true;
    }

    public Optional<Double> getWeight(String systemId) {
        RegisteredSystem registered = systems.get(systemId);
        return registered != null ? Optional.of(registered.weight()) : Optional.empty();
    }

    public Set<String> getSystemIds() {
        return Set.copyOf(systems.keySet());
    }

    public int size() {
        return systems.size();
    }

    /**
     * Consult every registered system concurrently.
     * Systems that fail, time out or are short-circuited are left out of the result.
     *
     * @param context the context being decided on
     * @param allocation resource allocation granted to this pipeline run
     * @return evidence keyed by system id
     */
    public Mono<Map<String, JsonNode>> collectEvidence(StreamingContext context, Map<String, Double> allocation) {
        List<RegisteredSystem> snapshot = List.copyOf(systems.values());
        if (snapshot.isEmpty()) {
            return Mono.just(Map.of());
        }

        return Flux.fromIterable(snapshot)
                .flatMap(registered -> invoke(registered, context, allocation)
                        .map(evidence -> Map.entry(registered.system().getSystemId(), evidence)))
                .collectMap(Map.Entry::getKey, Map.Entry::getValue);
    }

    private Mono<JsonNode> invoke(RegisteredSystem registered,
                                  StreamingContext context,
                                  Map<String, Double> allocation) {
        AiSystem system = registered.system();
        String systemId = system.getSystemId();
        Duration expected = expectedTime(system);
        Duration timeout = timeoutFor(expected);

        Mono<JsonNode> call = Mono.defer(() -> system.process(context)).timeout(timeout);

        if (expected.compareTo(config.getOffloadThreshold()) > 0) {
            Task task = Task.builder()
                    .taskId(systemId + ":" + UUID.randomUUID())
                    .streamId(context.getStreamId())
                    .complexity(Math.max(expected.toMillis() / 1000.0, 0.001))
                    .priority(1.0 + context.getConfidenceLevel())
                    .resourceRequirement(allocation.getOrDefault(GlycolyticCycle.RESOURCE_CPU, 0.0))
                    .estimatedTime(expected)
                    .build();
            log.debug("Offloading AI system {} to glycolytic task {}", systemId, task.getTaskId());
            call = glycolyticCycle.execute(task, call).timeout(timeout);
        }

        return call
                .transformDeferred(CircuitBreakerOperator.of(registered.circuitBreaker()))
                .map(result -> toEvidence(registered, result))
                .onErrorResume(e -> {
                    meterRegistry.counter("morphine.ai.failures", "system", systemId).increment();
                    if (e instanceof CallNotPermittedException) {
                        log.debug("AI system {} short-circuited", systemId);
                    } else {
                        log.warn("AI system {} failed for stream {}: {}",
                                systemId, context.getStreamId(), e.toString());
                    }
                    return Mono.empty();
                });
    }

    private JsonNode toEvidence(RegisteredSystem registered, JsonNode result) {
        ObjectNode entry = JsonNodeFactory.instance.objectNode();
        entry.put(FIELD_SYSTEM_ID, registered.system().getSystemId());
        entry.put(FIELD_WEIGHT, registered.weight());
        entry.put(FIELD_CONFIDENCE, confidenceOf(registered.system(), result));
        entry.set(FIELD_RESULT, result);
        return entry;
    }

    private double confidenceOf(AiSystem system, JsonNode result) {
        try {
            double confidence = system.confidence(result);
            return Double.isFinite(confidence)
                    ? ConfidenceExtractor.clamp(confidence)
                    : ConfidenceExtractor.extract(result);
        } catch (RuntimeException e) {
            log.warn("AI system {} could not report confidence: {}", system.getSystemId(), e.getMessage());
            return ConfidenceExtractor.extract(result);
        }
    }

    private Duration expectedTime(AiSystem system) {
        Duration expected = system.getExpectedProcessingTime();
        return expected == null || expected.isNegative() ? Duration.ZERO : expected;
    }

    Duration timeoutFor(Duration expected) {
        Duration scaled = Duration.ofNanos((long) (expected.toNanos() * config.getTimeoutMultiplier()));
        return scaled.compareTo(config.getMinTimeout()) < 0 ? config.getMinTimeout() : scaled;
    }

    private record RegisteredSystem(AiSystem system, double weight, CircuitBreaker circuitBreaker) {
    }
}
