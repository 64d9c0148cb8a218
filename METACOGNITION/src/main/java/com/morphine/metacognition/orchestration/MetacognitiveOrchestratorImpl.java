package com.morphine.metacognition.orchestration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.morphine.metacognition.ai.AiSystem;
import com.morphine.metacognition.ai.AiSystemRegistry;
import com.morphine.metacognition.config.MetacognitionProperties;
import com.morphine.metacognition.domain.model.DecisionType;
import com.morphine.metacognition.domain.model.DreamPattern;
import com.morphine.metacognition.domain.model.LayerContributions;
import com.morphine.metacognition.domain.model.MetabolicState;
import com.morphine.metacognition.domain.model.MetacognitiveDecision;
import com.morphine.metacognition.domain.model.PartialResult;
import com.morphine.metacognition.domain.model.StreamingContext;
import com.morphine.metacognition.domain.model.SystemHealth;
import com.morphine.metacognition.domain.model.Task;
import com.morphine.metacognition.domain.model.TaskOutcome;
import com.morphine.metacognition.layer.CognitiveLayer;
import com.morphine.metacognition.layer.ConfidenceExtractor;
import com.morphine.metacognition.layer.KnowledgeBase;
import com.morphine.metacognition.layer.LayerType;
import com.morphine.metacognition.metabolic.DreamingModule;
import com.morphine.metacognition.metabolic.GlycolyticCycle;
import com.morphine.metacognition.metabolic.LactateCycle;
import com.morphine.metacognition.observability.DecisionLogger;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Implementation of the MetacognitiveOrchestrator interface.
 *
 * <p>Each open stream owns a bounded input sink, a bounded output sink and one pipeline
 * subscription that processes contexts strictly in submission order. A pipeline run:
 * <ol>
 *   <li>snapshots the metabolic state and requests a resource allocation</li>
 *   <li>invokes the context (after AI evidence collection), reasoning and intuition layers concurrently</li>
 *   <li>weights each layer by its confidence and fuses them into a decision</li>
 *   <li>archives low-confidence decisions and feeds every decision to the dreaming module</li>
 *   <li>emits the decision, dropping it if the output channel is full or gone</li>
 * </ol>
 */
@Service
@Slf4j
public class MetacognitiveOrchestratorImpl implements MetacognitiveOrchestrator {

    public static final String FIELD_DEGRADED = "degraded";
    public static final String FIELD_LAYER = "layer";
    public static final String FIELD_REASON = "reason";

    private static final Map<String, JsonNode> NO_EVIDENCE = Map.of();

    private final AiSystemRegistry aiSystemRegistry;
    private final GlycolyticCycle glycolyticCycle;
    private final LactateCycle lactateCycle;
    private final DreamingModule dreamingModule;
    private final DecisionClassifier decisionClassifier;
    private final DecisionLogger decisionLogger;
    private final KnowledgeBase knowledgeBase;
    private final Clock clock;
    private final Map<LayerType, CognitiveLayer> layers;

    private final int channelCapacity;
    private final Duration layerTimeout;
    private final double archiveThreshold;

    private final Map<String, StreamRegistration> streams = new ConcurrentHashMap<>();
    private final Cache<String, MetacognitiveDecision> recentDecisions;

    private final Counter decisionsProducedCounter;
    private final Counter decisionsArchivedCounter;
    private final Counter decisionsDroppedCounter;
    private final Map<LayerType, Counter> layerDegradedCounters;
    private final Timer pipelineTimer;

    @Autowired
    public MetacognitiveOrchestratorImpl(
            AiSystemRegistry aiSystemRegistry,
            GlycolyticCycle glycolyticCycle,
            LactateCycle lactateCycle,
            DreamingModule dreamingModule,
            DecisionClassifier decisionClassifier,
            DecisionLogger decisionLogger,
            KnowledgeBase knowledgeBase,
            ObjectProvider<CognitiveLayer> cognitiveLayers,
            MetacognitionProperties properties,
            Clock clock,
            MeterRegistry meterRegistry) {
        this(aiSystemRegistry, glycolyticCycle, lactateCycle, dreamingModule, decisionClassifier,
                decisionLogger, knowledgeBase, cognitiveLayers.orderedStream().toList(),
                properties, clock, meterRegistry);
    }

    public MetacognitiveOrchestratorImpl(
            AiSystemRegistry aiSystemRegistry,
            GlycolyticCycle glycolyticCycle,
            LactateCycle lactateCycle,
            DreamingModule dreamingModule,
            DecisionClassifier decisionClassifier,
            DecisionLogger decisionLogger,
            KnowledgeBase knowledgeBase,
            List<CognitiveLayer> cognitiveLayers,
            MetacognitionProperties properties,
            Clock clock,
            MeterRegistry meterRegistry) {
        this.aiSystemRegistry = aiSystemRegistry;
        this.glycolyticCycle = glycolyticCycle;
        this.lactateCycle = lactateCycle;
        this.dreamingModule = dreamingModule;
        this.decisionClassifier = decisionClassifier;
        this.decisionLogger = decisionLogger;
        this.knowledgeBase = knowledgeBase;
        this.clock = clock;

        MetacognitionProperties.StreamProperties streamConfig = properties.getStream();
        this.channelCapacity = streamConfig.getChannelCapacity();
        this.layerTimeout = properties.getPipeline().getLayerTimeout();
        this.archiveThreshold = properties.getPipeline().getArchiveThreshold();
        if (channelCapacity < 1) {
            throw new IllegalArgumentException("stream.channel-capacity must be at least 1");
        }
        if (layerTimeout == null || layerTimeout.isZero() || layerTimeout.isNegative()) {
            throw new IllegalArgumentException("pipeline.layer-timeout must be positive");
        }

        this.layers = new EnumMap<>(LayerType.class);
        for (CognitiveLayer layer : cognitiveLayers) {
            CognitiveLayer previous = layers.put(layer.getLayerType(), layer);
            if (previous != null) {
                log.warn("Replacing {} layer {} with {}", layer.getLayerType(),
                        previous.getClass().getSimpleName(), layer.getClass().getSimpleName());
            }
        }
        for (LayerType type : LayerType.values()) {
            if (!layers.containsKey(type)) {
                log.warn("No {} layer registered; it will contribute neutral confidence", type);
            }
        }

        this.recentDecisions = Caffeine.newBuilder()
                .maximumSize(streamConfig.getDecisionHistorySize())
                .expireAfterWrite(streamConfig.getDecisionHistoryTtl())
                .build();

        this.decisionsProducedCounter = Counter.builder("morphine.decisions.produced")
                .description("Decisions synthesized by stream pipelines")
                .register(meterRegistry);
        this.decisionsArchivedCounter = Counter.builder("morphine.decisions.archived")
                .description("Low-confidence decisions archived to the lactate cycle")
                .register(meterRegistry);
        this.decisionsDroppedCounter = Counter.builder("morphine.decisions.dropped")
                .description("Decisions dropped because the output channel was full or closed")
                .register(meterRegistry);
        this.layerDegradedCounters = new EnumMap<>(LayerType.class);
        for (LayerType type : LayerType.values()) {
            layerDegradedCounters.put(type, Counter.builder("morphine.layers.degraded")
                    .tag("layer", type.getEvidenceKey())
                    .register(meterRegistry));
        }
        this.pipelineTimer = Timer.builder("morphine.pipeline.latency")
                .description("Time from context receipt to decision synthesis")
                .register(meterRegistry);
        Gauge.builder("morphine.streams.active", streams, Map::size)
                .register(meterRegistry);

        log.info("Initialized MetacognitiveOrchestrator with {} cognitive layers (channel capacity {}, layer timeout {})",
                layers.size(), channelCapacity, layerTimeout);
    }

    // --------------------------------------------------------------------------------------------
    // Streams
    // --------------------------------------------------------------------------------------------

    @Override
    public StreamHandle createStream(String streamId) {
        if (streamId == null || streamId.isBlank()) {
            throw new IllegalArgumentException("Stream ID is required");
        }

        Sinks.Many<StreamingContext> input = Sinks.many().unicast()
                .onBackpressureBuffer(new ArrayBlockingQueue<>(channelCapacity));
        Sinks.Many<MetacognitiveDecision> output = Sinks.many().unicast()
                .onBackpressureBuffer(new ArrayBlockingQueue<>(channelCapacity));
        StreamHandle handle = new StreamHandle(streamId, new ContextSender(streamId, input), output.asFlux());
        StreamRegistration registration = new StreamRegistration(handle, output);

        StreamRegistration existing = streams.putIfAbsent(streamId, registration);
        if (existing != null) {
            log.debug("Stream {} already open, returning existing handle", streamId);
            return existing.handle();
        }

        startPipeline(registration, input);
        decisionLogger.logStreamOpened(streamId, channelCapacity);
        return handle;
    }

    private void startPipeline(StreamRegistration registration, Sinks.Many<StreamingContext> input) {
        String streamId = registration.handle().streamId();

        input.asFlux()
                .publishOn(Schedulers.boundedElastic(), 1)
                .concatMap(context -> processContext(context)
                        .onErrorResume(e -> {
                            log.error("Pipeline run failed on stream {}: {}", streamId, e.getMessage(), e);
                            return Mono.empty();
                        }), 1)
                .doFinally(signal -> {
                    streams.remove(streamId, registration);
                    registration.output().tryEmitComplete();
                    decisionLogger.logStreamClosed(streamId, signal.toString());
                })
                .subscribe(
                        decision -> emit(registration, decision),
                        error -> log.error("Pipeline for stream {} terminated: {}", streamId, error.getMessage(), error));
    }

    private void emit(StreamRegistration registration, MetacognitiveDecision decision) {
        Sinks.EmitResult result = registration.output().tryEmitNext(decision);
        if (result.isFailure()) {
            decisionsDroppedCounter.increment();
            decisionLogger.logDecisionDropped(decision, result.name());
            log.warn("Dropped decision {} on stream {}: {}", decision.getDecisionId(), decision.getStreamId(), result);
        }
    }

    @Override
    public boolean closeStream(String streamId) {
        StreamRegistration registration = streamId != null ? streams.get(streamId) : null;
        if (registration == null) {
            return false;
        }
        registration.handle().input().close();
        log.info("Closing stream {}", streamId);
        return true;
    }

    @Override
    public Set<String> getActiveStreamIds() {
        return Set.copyOf(streams.keySet());
    }

    @Override
    public List<MetacognitiveDecision> getStreamingDecisions(String streamId) {
        if (streamId == null) {
            return List.of();
        }
        return recentDecisions.asMap().values().stream()
                .filter(decision -> streamId.equals(decision.getStreamId()))
                .sorted(Comparator.comparing(MetacognitiveDecision::getTimestamp))
                .toList();
    }

    @PreDestroy
    public void shutdown() {
        log.info("Closing {} open streams", streams.size());
        streams.values().forEach(registration -> registration.handle().input().close());
    }

    // --------------------------------------------------------------------------------------------
    // Pipeline
    // --------------------------------------------------------------------------------------------

    /**
     * One pipeline run for a context.
     */
    Mono<MetacognitiveDecision> processContext(StreamingContext context) {
        return Mono.defer(() -> {
            long startNanos = System.nanoTime();
            MetabolicState metabolicState = assessMetabolicState();
            Map<String, Double> allocation = glycolyticCycle.allocateResources(context, metabolicState);

            Mono<JsonNode> contextLayer = aiSystemRegistry.collectEvidence(context, allocation)
                    .onErrorResume(e -> {
                        log.warn("Evidence collection failed on stream {}: {}", context.getStreamId(), e.getMessage());
                        return Mono.just(NO_EVIDENCE);
                    })
                    .defaultIfEmpty(NO_EVIDENCE)
                    .flatMap(evidence -> invokeLayer(LayerType.CONTEXT, context, evidence));
            Mono<JsonNode> reasoningLayer = invokeLayer(LayerType.REASONING, context, NO_EVIDENCE);
            Mono<JsonNode> intuitionLayer = invokeLayer(LayerType.INTUITION, context, NO_EVIDENCE);

            return Mono.zip(contextLayer, reasoningLayer, intuitionLayer)
                    .map(results -> synthesizeDecision(context, metabolicState, allocation,
                            results.getT1(), results.getT2(), results.getT3()))
                    .doOnNext(decision -> recordDecision(decision, System.nanoTime() - startNanos));
        });
    }

    MetabolicState assessMetabolicState() {
        return MetabolicState.builder()
                .glycolyticLoad(glycolyticCycle.getCurrentLoad())
                .lactateLevel(lactateCycle.getLactateLevel())
                .dreamingActive(dreamingModule.isActive())
                .resourceAllocation(glycolyticCycle.getResourceAllocation())
                .build();
    }

    private Mono<JsonNode> invokeLayer(LayerType type, StreamingContext context, Map<String, JsonNode> evidence) {
        CognitiveLayer layer = layers.get(type);
        if (layer == null) {
            return Mono.just(degraded(type, context, "layer not registered"));
        }
        return Mono.defer(() -> layer.process(context, evidence, knowledgeBase))
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(layerTimeout)
                .switchIfEmpty(Mono.fromSupplier(() -> degraded(type, context, "empty result")))
                .onErrorResume(e -> Mono.just(degraded(type, context, describe(e))));
    }

    private JsonNode degraded(LayerType type, StreamingContext context, String reason) {
        layerDegradedCounters.get(type).increment();
        decisionLogger.logLayerDegraded(context.getStreamId(), type.getEvidenceKey(), reason);

        ObjectNode placeholder = JsonNodeFactory.instance.objectNode();
        placeholder.put(ConfidenceExtractor.CONFIDENCE_FIELD, ConfidenceExtractor.NEUTRAL_CONFIDENCE);
        placeholder.put(FIELD_DEGRADED, true);
        placeholder.put(FIELD_LAYER, type.getEvidenceKey());
        placeholder.put(FIELD_REASON, reason);
        return placeholder;
    }

    private String describe(Throwable e) {
        if (e instanceof TimeoutException) {
            return "timed out after " + layerTimeout;
        }
        return e.getMessage() != null ? e.getClass().getSimpleName() + ": " + e.getMessage()
                : e.getClass().getSimpleName();
    }

    private MetacognitiveDecision synthesizeDecision(StreamingContext context,
                                                     MetabolicState metabolicState,
                                                     Map<String, Double> allocation,
                                                     JsonNode contextResult,
                                                     JsonNode reasoningResult,
                                                     JsonNode intuitionResult) {
        double contextConfidence = ConfidenceExtractor.extract(contextResult);
        double reasoningConfidence = ConfidenceExtractor.extract(reasoningResult);
        double intuitionConfidence = ConfidenceExtractor.extract(intuitionResult);

        LayerWeighting weighting = LayerWeighting.of(contextConfidence, reasoningConfidence, intuitionConfidence);
        double confidence = ConfidenceExtractor.clamp(
                weighting.combine(contextConfidence, reasoningConfidence, intuitionConfidence));

        Map<String, JsonNode> evidence = new LinkedHashMap<>();
        evidence.put(MetacognitiveDecision.EVIDENCE_CONTEXT, contextResult);
        evidence.put(MetacognitiveDecision.EVIDENCE_REASONING, reasoningResult);
        evidence.put(MetacognitiveDecision.EVIDENCE_INTUITION, intuitionResult);

        DecisionType decisionType = decisionClassifier.classify(context, evidence);

        return MetacognitiveDecision.builder()
                .decisionId(context.getStreamId() + ":" + UUID.randomUUID())
                .streamId(context.getStreamId())
                .decisionType(decisionType)
                .confidence(confidence)
                .evidence(Collections.unmodifiableMap(evidence))
                .timestamp(context.getTimestamp() != null ? context.getTimestamp() : clock.instant())
                .layerContributions(LayerContributions.builder()
                        .contextWeight(weighting.context())
                        .reasoningWeight(weighting.reasoning())
                        .intuitionWeight(weighting.intuition())
                        .metabolicState(metabolicState)
                        .build())
                .resourceAllocation(allocation)
                .build();
    }

    private void recordDecision(MetacognitiveDecision decision, long elapsedNanos) {
        boolean archived = decision.getConfidence() < archiveThreshold;
        if (archived) {
            lactateCycle.storePartialResult(decision);
            decisionsArchivedCounter.increment();
        }
        dreamingModule.incorporateExperience(decision);
        recentDecisions.put(decision.getDecisionId(), decision);

        decisionsProducedCounter.increment();
        pipelineTimer.record(elapsedNanos, TimeUnit.NANOSECONDS);
        decisionLogger.logDecision(decision, archived, TimeUnit.NANOSECONDS.toMillis(elapsedNanos));
    }

    // --------------------------------------------------------------------------------------------
    // AI systems and scheduling
    // --------------------------------------------------------------------------------------------

    @Override
    public void registerAiSystem(AiSystem system, double weight) {
        aiSystemRegistry.register(system, weight);
    }

    @Override
    public Mono<TaskOutcome> submitTask(Task task) {
        return glycolyticCycle.submitTask(task);
    }

    // --------------------------------------------------------------------------------------------
    // Introspection
    // --------------------------------------------------------------------------------------------

    @Override
    public SystemHealth getSystemHealth() {
        return SystemHealth.builder()
                .metabolicState(assessMetabolicState())
                .activeStreamCount(streams.size())
                .registeredSystemCount(aiSystemRegistry.size())
                .workerCount(glycolyticCycle.getWorkerCount())
                .pendingTaskCount(glycolyticCycle.getPendingTaskCount())
                .partialResultCount(lactateCycle.size())
                .patternCount(dreamingModule.getPatternCount())
                .schedulerMetrics(glycolyticCycle.getPerformanceMetrics())
                .build();
    }

    @Override
    public List<DreamPattern> getDiscoveredPatterns() {
        return dreamingModule.getDiscoveredPatterns();
    }

    @Override
    public List<JsonNode> getNovelDiscoveries() {
        return dreamingModule.getNovelDiscoveries();
    }

    @Override
    public List<PartialResult> recoverIncomplete(String streamId) {
        return lactateCycle.recoveryFromIncomplete(streamId);
    }

    private record StreamRegistration(StreamHandle handle, Sinks.Many<MetacognitiveDecision> output) {
    }
}
