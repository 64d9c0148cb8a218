package com.morphine.metacognition.orchestration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.morphine.metacognition.ai.AiSystemRegistry;
import com.morphine.metacognition.config.MetacognitionProperties;
import com.morphine.metacognition.domain.model.DecisionType;
import com.morphine.metacognition.domain.model.MetacognitiveDecision;
import com.morphine.metacognition.domain.model.StreamingContext;
import com.morphine.metacognition.domain.model.SystemHealth;
import com.morphine.metacognition.layer.CognitiveLayer;
import com.morphine.metacognition.layer.InMemoryKnowledgeBase;
import com.morphine.metacognition.layer.LayerType;
import com.morphine.metacognition.metabolic.DreamingModule;
import com.morphine.metacognition.metabolic.GlycolyticCycle;
import com.morphine.metacognition.metabolic.LactateCycle;
import com.morphine.metacognition.metabolic.TaskWork;
import com.morphine.metacognition.observability.DecisionLogger;
import com.morphine.metacognition.support.StubAiSystem;
import com.morphine.metacognition.support.StubLayer;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.awaitility.Awaitility.await;

/**
 * Tests for {@link MetacognitiveOrchestratorImpl} wired with real metabolic subsystems.
 */
class MetacognitiveOrchestratorTest {

    private static final Duration VERIFY_TIMEOUT = Duration.ofSeconds(5);

    private final JsonNodeFactory factory = JsonNodeFactory.instance;

    private MetacognitionProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private GlycolyticCycle glycolyticCycle;
    private LactateCycle lactateCycle;
    private DreamingModule dreamingModule;
    private AiSystemRegistry aiSystemRegistry;
    private MetacognitiveOrchestratorImpl orchestrator;

    @BeforeEach
    void setUp() {
        properties = new MetacognitionProperties();
        properties.getGlycolytic().setInitialWorkers(2);
        properties.getPipeline().setLayerTimeout(Duration.ofMillis(200));
        meterRegistry = new SimpleMeterRegistry();

        Clock clock = Clock.systemUTC();
        glycolyticCycle = new GlycolyticCycle(properties, TaskWork.simulated(), meterRegistry);
        lactateCycle = new LactateCycle(properties, clock, meterRegistry);
        dreamingModule = new DreamingModule(properties, clock, meterRegistry);
        aiSystemRegistry = new AiSystemRegistry(properties, CircuitBreakerRegistry.ofDefaults(),
                glycolyticCycle, meterRegistry);
    }

    @AfterEach
    void tearDown() {
        if (orchestrator != null) {
            orchestrator.shutdown();
        }
    }

    private MetacognitiveOrchestratorImpl orchestrator(CognitiveLayer... layers) {
        orchestrator = new MetacognitiveOrchestratorImpl(
                aiSystemRegistry,
                glycolyticCycle,
                lactateCycle,
                dreamingModule,
                new DecisionClassifier(),
                new DecisionLogger(new ObjectMapper()),
                InMemoryKnowledgeBase.fromStrings(Map.of()),
                List.of(layers),
                properties,
                Clock.systemUTC(),
                meterRegistry);
        return orchestrator;
    }

    private MetacognitiveOrchestratorImpl fixedOrchestrator(double context, double reasoning, double intuition) {
        return orchestrator(
                StubLayer.fixed(LayerType.CONTEXT, context),
                StubLayer.fixed(LayerType.REASONING, reasoning),
                StubLayer.fixed(LayerType.INTUITION, intuition));
    }

    private static StreamingContext context(String streamId, double confidenceLevel) {
        return StreamingContext.builder()
                .streamId(streamId)
                .confidenceLevel(confidenceLevel)
                .build();
    }

    private MetacognitiveDecision firstDecision(StreamHandle handle) {
        return handle.decisions().blockFirst(VERIFY_TIMEOUT);
    }

    @Nested
    @DisplayName("Decision synthesis")
    class DecisionSynthesisTests {

        @Test
        @DisplayName("should weight layers by confidence and keep a confident decision out of the cache")
        void weightsLayersByConfidence() {
            // Given
            StreamHandle handle = fixedOrchestrator(0.9, 0.8, 0.7).createStream("s1");

            // When
            assertThat(handle.input().submit(context("s1", 0.9))).isTrue();
            MetacognitiveDecision decision = firstDecision(handle);

            // Then
            assertThat(decision.getStreamId()).isEqualTo("s1");
            assertThat(decision.getDecisionId()).startsWith("s1:");
            assertThat(decision.getLayerContributions().getContextWeight()).isCloseTo(0.375, within(1e-3));
            assertThat(decision.getLayerContributions().getReasoningWeight()).isCloseTo(0.333, within(1e-3));
            assertThat(decision.getLayerContributions().getIntuitionWeight()).isCloseTo(0.292, within(1e-3));
            assertThat(decision.getLayerContributions().totalWeight()).isCloseTo(1.0, within(1e-9));
            assertThat(decision.getConfidence()).isCloseTo(0.9 * 0.375 + 0.8 * (0.8 / 2.4) + 0.7 * (0.7 / 2.4),
                    within(1e-9));
            assertThat(decision.getEvidence()).containsOnlyKeys("context", "reasoning", "intuition");
            assertThat(decision.getResourceAllocation()).containsKeys("cpu", "memory", "io");
            assertThat(decision.getLayerContributions().getMetabolicState()).isNotNull();

            // 0.8083 is above the archive threshold
            assertThat(lactateCycle.size()).isZero();
            assertThat(dreamingModule.getExperienceBufferSize()).isEqualTo(1);
        }

        @Test
        @DisplayName("a 0.95 decision is fed to dreaming but not archived")
        void highConfidenceNotArchived() {
            StreamHandle handle = fixedOrchestrator(0.95, 0.95, 0.95).createStream("s1");

            handle.input().submit(context("s1", 0.5));
            MetacognitiveDecision decision = firstDecision(handle);

            assertThat(decision.getConfidence()).isCloseTo(0.95, within(1e-9));
            assertThat(lactateCycle.size()).isZero();
            assertThat(dreamingModule.getRecentExperiences())
                    .extracting(MetacognitiveDecision::getDecisionId)
                    .containsExactly(decision.getDecisionId());
            assertThat(orchestrator.getStreamingDecisions("s1")).hasSize(1);
        }

        @Test
        @DisplayName("a low-confidence decision is archived and recoverable by stream")
        void lowConfidenceArchived() {
            StreamHandle handle = fixedOrchestrator(0.5, 0.5, 0.5).createStream("s1");

            handle.input().submit(context("s1", 0.5));
            MetacognitiveDecision decision = firstDecision(handle);

            assertThat(orchestrator.recoverIncomplete("s1"))
                    .singleElement()
                    .satisfies(result -> {
                        assertThat(result.getTaskId()).isEqualTo(decision.getDecisionId());
                        assertThat(result.getCompletionPercentage()).isCloseTo(50.0, within(1e-9));
                    });
            assertThat(meterRegistry.get("morphine.decisions.archived").counter().count()).isEqualTo(1.0);
            assertThat(dreamingModule.getExperienceBufferSize()).isEqualTo(1);
        }

        @Test
        @DisplayName("should classify from partial data")
        void classifiesDecision() {
            StreamHandle handle = fixedOrchestrator(0.9, 0.9, 0.9).createStream("s1");

            handle.input().submit(StreamingContext.builder()
                    .streamId("s1")
                    .partialData(Map.of("odds", factory.numberNode(2.25)))
                    .confidenceLevel(0.7)
                    .build());

            assertThat(firstDecision(handle).getDecisionType()).isEqualTo(DecisionType.BETTING_OPPORTUNITY);
        }

        @Test
        @DisplayName("AI evidence should reach only the context layer")
        void passesAiEvidenceToContextLayer() {
            StubLayer contextLayer = StubLayer.fixed(LayerType.CONTEXT, 0.9);
            StubLayer reasoningLayer = StubLayer.fixed(LayerType.REASONING, 0.9);
            orchestrator(contextLayer, reasoningLayer, StubLayer.fixed(LayerType.INTUITION, 0.9));
            orchestrator.registerAiSystem(StubAiSystem.scoring("vision", 0.7), 1.0);
            StreamHandle handle = orchestrator.createStream("s1");

            handle.input().submit(context("s1", 0.5));
            firstDecision(handle);

            assertThat(contextLayer.getReceivedEvidence()).singleElement()
                    .satisfies(evidence -> assertThat(evidence).containsOnlyKeys("vision"));
            assertThat(reasoningLayer.getReceivedEvidence()).singleElement()
                    .satisfies(evidence -> assertThat(evidence).isEmpty());
        }
    }

    @Nested
    @DisplayName("Degraded layers")
    class DegradedLayerTests {

        @Test
        @DisplayName("a failing layer contributes a neutral placeholder")
        void failingLayerYieldsPlaceholder() {
            orchestrator(
                    StubLayer.fixed(LayerType.CONTEXT, 0.9),
                    new StubLayer(LayerType.REASONING,
                            (ctx, evidence) -> Mono.error(new IllegalStateException("model offline"))),
                    StubLayer.fixed(LayerType.INTUITION, 0.7));
            StreamHandle handle = orchestrator.createStream("s1");

            handle.input().submit(context("s1", 0.5));
            MetacognitiveDecision decision = firstDecision(handle);

            JsonNode reasoning = decision.getEvidence().get("reasoning");
            assertThat(reasoning.get("confidence").asDouble()).isEqualTo(0.5);
            assertThat(reasoning.get("degraded").asBoolean()).isTrue();
            assertThat(reasoning.get("layer").asText()).isEqualTo("reasoning");
            assertThat(reasoning.get("reason").asText()).contains("model offline");
            assertThat(decision.getLayerContributions().getReasoningWeight()).isCloseTo(0.5 / 2.1, within(1e-9));
            assertThat(meterRegistry.get("morphine.layers.degraded").tag("layer", "reasoning").counter().count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("a layer that never answers is cut off by the timeout")
        void slowLayerTimesOut() {
            orchestrator(
                    StubLayer.fixed(LayerType.CONTEXT, 0.9),
                    StubLayer.fixed(LayerType.REASONING, 0.9),
                    new StubLayer(LayerType.INTUITION, (ctx, evidence) -> Mono.never()));
            StreamHandle handle = orchestrator.createStream("s1");

            handle.input().submit(context("s1", 0.5));
            MetacognitiveDecision decision = firstDecision(handle);

            assertThat(decision.getEvidence().get("intuition").get("reason").asText()).contains("timed out");
        }

        @Test
        @DisplayName("a missing layer is replaced by a placeholder")
        void missingLayerYieldsPlaceholder() {
            orchestrator(StubLayer.fixed(LayerType.CONTEXT, 0.9), StubLayer.fixed(LayerType.REASONING, 0.9));
            StreamHandle handle = orchestrator.createStream("s1");

            handle.input().submit(context("s1", 0.5));
            MetacognitiveDecision decision = firstDecision(handle);

            assertThat(decision.getEvidence().get("intuition").get("reason").asText())
                    .isEqualTo("layer not registered");
            assertThat(decision.getConfidence()).isCloseTo((0.81 + 0.81 + 0.25) / 2.3, within(1e-9));
        }
    }

    @Nested
    @DisplayName("Streams")
    class StreamTests {

        @Test
        @DisplayName("decisions are emitted in submission order")
        void preservesOrder() {
            orchestrator(
                    new StubLayer(LayerType.CONTEXT, (ctx, evidence) -> {
                        ObjectNode node = factory.objectNode();
                        node.put("confidence", 0.9);
                        node.set("seq", ctx.getPartialData().get("seq"));
                        return Mono.just(node);
                    }),
                    new StubLayer(LayerType.REASONING, (ctx, evidence) ->
                            Mono.delay(Duration.ofMillis(ThreadLocalRandom.current().nextInt(4)))
                                    .thenReturn(factory.objectNode().put("confidence", 0.8))),
                    StubLayer.fixed(LayerType.INTUITION, 0.7));
            StreamHandle handle = orchestrator.createStream("s1");

            for (int i = 0; i < 50; i++) {
                assertThat(handle.input().submit(StreamingContext.builder()
                        .streamId("s1")
                        .partialData(Map.of("seq", IntNode.valueOf(i)))
                        .confidenceLevel(0.5)
                        .build())).isTrue();
            }

            List<Integer> order = handle.decisions()
                    .take(50)
                    .map(decision -> decision.getEvidence().get("context").get("seq").asInt())
                    .collectList()
                    .block(VERIFY_TIMEOUT);

            assertThat(order).containsExactlyElementsOf(IntStream.range(0, 50).boxed().toList());
        }

        @Test
        @DisplayName("concurrent creation of the same stream keeps one registration")
        void concurrentCreateKeepsOneRegistration() throws Exception {
            fixedOrchestrator(0.9, 0.9, 0.9);
            ExecutorService pool = Executors.newFixedThreadPool(2);
            CountDownLatch start = new CountDownLatch(1);
            Callable<StreamHandle> create = () -> {
                start.await();
                return orchestrator.createStream("s2");
            };

            try {
                Future<StreamHandle> first = pool.submit(create);
                Future<StreamHandle> second = pool.submit(create);
                start.countDown();
                StreamHandle a = first.get(5, TimeUnit.SECONDS);
                StreamHandle b = second.get(5, TimeUnit.SECONDS);

                assertThat(a).isSameAs(b);
                assertThat(orchestrator.getActiveStreamIds()).containsExactly("s2");

                a.input().submit(context("s2", 0.5));
                a.input().close();
                StepVerifier.create(a.decisions())
                        .expectNextCount(1)
                        .expectComplete()
                        .verify(VERIFY_TIMEOUT);
            } finally {
                pool.shutdownNow();
            }
        }

        @Test
        @DisplayName("closing a stream drains it and deregisters it")
        void closeDrainsAndDeregisters() {
            fixedOrchestrator(0.9, 0.9, 0.9);
            StreamHandle handle = orchestrator.createStream("s3");
            handle.input().submit(context("s3", 0.5));
            handle.input().submit(context("s3", 0.5));

            assertThat(orchestrator.closeStream("s3")).isTrue();

            StepVerifier.create(handle.decisions())
                    .expectNextCount(2)
                    .expectComplete()
                    .verify(VERIFY_TIMEOUT);
            await().atMost(VERIFY_TIMEOUT)
                    .untilAsserted(() -> assertThat(orchestrator.getActiveStreamIds()).doesNotContain("s3"));
            assertThat(handle.input().submit(context("s3", 0.5))).isFalse();
            assertThat(orchestrator.closeStream("unknown")).isFalse();
        }

        @Test
        @DisplayName("decisions nobody can receive are dropped and counted; the stream keeps running")
        void dropsUndeliverableDecisions() {
            fixedOrchestrator(0.9, 0.9, 0.9);
            StreamHandle handle = orchestrator.createStream("s1");

            StepVerifier.create(handle.decisions().take(1))
                    .then(() -> handle.input().submit(context("s1", 0.5)))
                    .expectNextCount(1)
                    .expectComplete()
                    .verify(VERIFY_TIMEOUT);

            handle.input().submit(context("s1", 0.5));
            handle.input().submit(context("s1", 0.5));

            await().atMost(VERIFY_TIMEOUT).untilAsserted(() ->
                    assertThat(meterRegistry.get("morphine.decisions.dropped").counter().count()).isEqualTo(2.0));
            assertThat(orchestrator.getActiveStreamIds()).contains("s1");
            assertThat(orchestrator.getStreamingDecisions("s1")).hasSize(3);
        }

        @Test
        @DisplayName("decisions beyond a full output buffer are dropped and counted; the stream keeps running")
        void dropsDecisionsWhenOutputBufferFull() {
            // Given
            properties.getStream().setChannelCapacity(2);
            fixedOrchestrator(0.9, 0.9, 0.9);
            StreamHandle handle = orchestrator.createStream("s1");
            Counter produced = meterRegistry.get("morphine.decisions.produced").counter();
            Counter dropped = meterRegistry.get("morphine.decisions.dropped").counter();

            // When
            for (int i = 0; i < 5; i++) {
                assertThat(handle.input().submit(context("s1", 0.5))).isTrue();
                double expected = i + 1;
                await().atMost(VERIFY_TIMEOUT).untilAsserted(() ->
                        assertThat(produced.count()).isEqualTo(expected));
            }

            // Then
            await().atMost(VERIFY_TIMEOUT).untilAsserted(() -> assertThat(dropped.count()).isEqualTo(3.0));
            assertThat(orchestrator.getActiveStreamIds()).contains("s1");

            StepVerifier.create(handle.decisions())
                    .expectNextCount(2)
                    .then(() -> handle.input().submit(context("s1", 0.5)))
                    .expectNextCount(1)
                    .thenCancel()
                    .verify(VERIFY_TIMEOUT);
            assertThat(dropped.count()).isEqualTo(3.0);
        }

        @Test
        @DisplayName("should carry the context timestamp onto the decision")
        void keepsContextTimestamp() {
            fixedOrchestrator(0.9, 0.9, 0.9);
            StreamHandle handle = orchestrator.createStream("s1");
            Instant observedAt = Instant.parse("2024-03-01T12:00:00Z");

            handle.input().submit(StreamingContext.builder()
                    .streamId("s1")
                    .timestamp(observedAt)
                    .confidenceLevel(0.5)
                    .build());

            assertThat(firstDecision(handle).getTimestamp()).isEqualTo(observedAt);
        }

        @Test
        @DisplayName("should stamp or reject contexts by stream id")
        void validatesContextStream() {
            fixedOrchestrator(0.9, 0.9, 0.9);
            StreamHandle handle = orchestrator.createStream("s1");

            assertThatThrownBy(() -> handle.input().submit(context("other", 0.5)))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThat(handle.input().submit(StreamingContext.builder().confidenceLevel(0.5).build())).isTrue();
            assertThat(firstDecision(handle).getStreamId()).isEqualTo("s1");
            assertThatThrownBy(() -> orchestrator.createStream(" "))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("health snapshot reflects streams, systems and the worker pool")
    void reportsSystemHealth() {
        fixedOrchestrator(0.9, 0.9, 0.9);
        orchestrator.registerAiSystem(StubAiSystem.scoring("vision", 0.7), 1.0);
        orchestrator.createStream("s1");

        SystemHealth health = orchestrator.getSystemHealth();

        assertThat(health.getActiveStreamCount()).isEqualTo(1);
        assertThat(health.getRegisteredSystemCount()).isEqualTo(1);
        assertThat(health.getWorkerCount()).isEqualTo(2);
        assertThat(health.getPartialResultCount()).isZero();
        assertThat(health.getMetabolicState().getLactateLevel()).isZero();
        assertThat(health.getMetabolicState().isDreamingActive()).isFalse();
    }
}
