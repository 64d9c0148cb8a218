package com.morphine.metacognition.metabolic;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.morphine.metacognition.config.MetacognitionProperties;
import com.morphine.metacognition.domain.model.DreamPattern;
import com.morphine.metacognition.domain.model.MetacognitiveDecision;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Dreaming module: mines recent decisions for recurring patterns while the platform is idle.
 *
 * <p>A dreaming cycle runs three phases:
 * <ol>
 *   <li>consolidate - group buffered decisions by signature, reinforcing known patterns</li>
 *   <li>generate - synthesise a novel scenario for every pattern stronger than the threshold</li>
 *   <li>decay - weaken every pattern and drop the ones that fade out</li>
 * </ol>
 *
 * <p>The experience buffer is not drained by a cycle, so decisions still buffered keep
 * reinforcing their patterns on later cycles.
 */
@Slf4j
@Component
public class DreamingModule {

    private static final String SCENARIO_TYPE = "novel_edge_case";
    private static final List<String> UNEXPECTED_CONDITIONS = List.of(
            "extreme_weather", "network_anomaly", "behavioral_outlier", "technical_malfunction");
    private static final List<String> EDGE_CASES = List.of(
            "simultaneous_events", "rapid_state_changes", "multi_factor_interactions");
    private static final long SECONDS_PER_HOUR = 3600;

    private final MetacognitionProperties.DreamingProperties config;
    private final Clock clock;

    private final Deque<MetacognitiveDecision> experienceBuffer = new ArrayDeque<>();
    private final Map<String, DreamPattern> patterns = new HashMap<>();
    private final ReentrantReadWriteLock patternLock = new ReentrantReadWriteLock();
    private final Deque<JsonNode> discoveries = new ArrayDeque<>();
    private final AtomicBoolean active = new AtomicBoolean(false);

    private final Counter cyclesCounter;
    private final Counter scenariosCounter;

    public DreamingModule(MetacognitionProperties properties, Clock clock, MeterRegistry meterRegistry) {
        this.config = properties.getDreaming();
        this.clock = clock;

        if (config.getBufferCapacity() < 1) {
            throw new IllegalArgumentException("dreaming.buffer-capacity must be at least 1");
        }
        if (config.getMaxDiscoveries() < 1) {
            throw new IllegalArgumentException("dreaming.max-discoveries must be at least 1");
        }
        if (!(config.getDecay() > 0.0) || config.getDecay() >= 1.0) {
            throw new IllegalArgumentException("dreaming.decay must be in (0, 1): " + config.getDecay());
        }

        this.cyclesCounter = Counter.builder("morphine.dreaming.cycles")
                .description("Completed dreaming cycles")
                .register(meterRegistry);
        this.scenariosCounter = Counter.builder("morphine.dreaming.scenarios")
                .description("Novel scenarios generated")
                .register(meterRegistry);
        Gauge.builder("morphine.dreaming.patterns", this, DreamingModule::getPatternCount)
                .register(meterRegistry);
        Gauge.builder("morphine.dreaming.buffer", this, DreamingModule::getExperienceBufferSize)
                .register(meterRegistry);
    }

    // ========== Experience intake ==========

    /**
     * Append a decision to the experience buffer, evicting the oldest when full.
     */
    public void incorporateExperience(MetacognitiveDecision decision) {
        synchronized (experienceBuffer) {
            experienceBuffer.addLast(decision);
            while (experienceBuffer.size() > config.getBufferCapacity()) {
                experienceBuffer.pollFirst();
            }
        }
    }

    // ========== Cycle ==========

    @Scheduled(fixedRateString = "${morphine.metacognition.dreaming.cycle-interval:PT5M}",
            initialDelayString = "${morphine.metacognition.dreaming.cycle-interval:PT5M}")
    public void runDreamingCycle() {
        if (shouldActivate()) {
            dream();
        }
    }

    /**
     * Enough experience has accumulated and the clock is inside the idle window
     * at the start of each hour.
     */
    public boolean shouldActivate() {
        if (getExperienceBufferSize() <= config.getMinExperiences()) {
            return false;
        }
        long secondsIntoHour = Math.floorMod(clock.instant().getEpochSecond(), SECONDS_PER_HOUR);
        return secondsIntoHour < config.getIdleWindow().getSeconds();
    }

    /**
     * Run one full cycle regardless of the activation heuristic.
     */
    public void dream() {
        if (!active.compareAndSet(false, true)) {
            log.debug("Dreaming cycle already running");
            return;
        }
        try {
            List<MetacognitiveDecision> experiences = getRecentExperiences();
            int consolidated = consolidatePatterns(experiences);
            int generated = generateNovelScenarios();
            int extinguished = decayPatterns();
            cyclesCounter.increment();
            log.info("Dreaming cycle finished: experiences={}, patternsTouched={}, scenarios={}, extinguished={}",
                    experiences.size(), consolidated, generated, extinguished);
        } finally {
            active.set(false);
        }
    }

    int consolidatePatterns(List<MetacognitiveDecision> experiences) {
        Map<String, DreamPattern> touched = new HashMap<>();
        patternLock.writeLock().lock();
        try {
            for (MetacognitiveDecision decision : experiences) {
                String signature = patternSignature(decision);
                DreamPattern pattern = patterns.get(signature);
                if (pattern == null) {
                    pattern = DreamPattern.builder()
                            .patternId(signature)
                            .patternType(String.valueOf(decision.getDecisionType()))
                            .strength(1.0)
                            .frequency(1.0)
                            .build();
                    patterns.put(signature, pattern);
                } else {
                    pattern.setStrength(pattern.getStrength() * config.getReinforcement());
                    pattern.setFrequency(pattern.getFrequency() + 1.0);
                }
                if (decision.getStreamId() != null) {
                    pattern.getAssociations().merge(decision.getStreamId(), 1.0, Double::sum);
                }
                touched.put(signature, pattern);
            }
        } finally {
            patternLock.writeLock().unlock();
        }
        return touched.size();
    }

    int generateNovelScenarios() {
        List<JsonNode> generated = new ArrayList<>();
        patternLock.writeLock().lock();
        try {
            for (DreamPattern pattern : patterns.values()) {
                if (pattern.getStrength() > config.getScenarioThreshold()) {
                    JsonNode scenario = createNovelScenario(pattern);
                    List<JsonNode> scenarios = pattern.getGeneratedScenarios();
                    scenarios.add(scenario);
                    while (scenarios.size() > config.getMaxScenariosPerPattern()) {
                        scenarios.remove(0);
                    }
                    generated.add(scenario);
                }
            }
        } finally {
            patternLock.writeLock().unlock();
        }

        synchronized (discoveries) {
            for (JsonNode scenario : generated) {
                discoveries.addLast(scenario);
                while (discoveries.size() > config.getMaxDiscoveries()) {
                    discoveries.pollFirst();
                }
            }
        }
        scenariosCounter.increment(generated.size());
        return generated.size();
    }

    int decayPatterns() {
        patternLock.writeLock().lock();
        try {
            for (DreamPattern pattern : patterns.values()) {
                double decayed = pattern.getStrength() * config.getDecay();
                pattern.setStrength(decayed < config.getExtinctionThreshold() ? 0.0 : decayed);
            }
            int before = patterns.size();
            patterns.values().removeIf(pattern -> pattern.getStrength() <= 0.0);
            return before - patterns.size();
        } finally {
            patternLock.writeLock().unlock();
        }
    }

    private JsonNode createNovelScenario(DreamPattern pattern) {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        JsonNodeFactory factory = JsonNodeFactory.instance;

        ObjectNode scenario = factory.objectNode();
        scenario.put("scenarioId", UUID.randomUUID().toString());
        scenario.put("basedOnPattern", pattern.getPatternId());
        scenario.put("scenarioType", SCENARIO_TYPE);
        scenario.put("generatedAt", clock.instant().getEpochSecond());
        scenario.put("diversityScore", random.nextDouble());

        ObjectNode data = scenario.putObject("scenarioData");
        data.put("patternType", pattern.getPatternType());
        data.put("strength", pattern.getStrength());

        ObjectNode elements = data.putObject("novelElements");
        UNEXPECTED_CONDITIONS.forEach(elements.putArray("unexpectedConditions")::add);
        EDGE_CASES.forEach(elements.putArray("edgeCases")::add);
        ObjectNode diversity = elements.putObject("diversityParameters");
        diversity.put("temporalVariation", random.nextDouble());
        diversity.put("spatialVariation", random.nextDouble());
        diversity.put("behavioralVariation", random.nextDouble());
        return scenario;
    }

    /**
     * Pattern signature: decision type, confidence and context weight, the latter two
     * rounded to two decimals. Distinct decisions may share a signature.
     */
    public static String patternSignature(MetacognitiveDecision decision) {
        double contextWeight = decision.getLayerContributions() != null
                ? decision.getLayerContributions().getContextWeight()
                : 0.0;
        return String.format(Locale.ROOT, "%s_%.2f_%.2f",
                decision.getDecisionType(), decision.getConfidence(), contextWeight);
    }

    // ========== Read accessors ==========

    public boolean isActive() {
        return active.get();
    }

    /**
     * Copies of the current patterns.
     */
    public List<DreamPattern> getDiscoveredPatterns() {
        patternLock.readLock().lock();
        try {
            return patterns.values().stream().map(DreamPattern::snapshot).toList();
        } finally {
            patternLock.readLock().unlock();
        }
    }

    public int getPatternCount() {
        patternLock.readLock().lock();
        try {
            return patterns.size();
        } finally {
            patternLock.readLock().unlock();
        }
    }

    public List<JsonNode> getNovelDiscoveries() {
        synchronized (discoveries) {
            return List.copyOf(discoveries);
        }
    }

    public int getExperienceBufferSize() {
        synchronized (experienceBuffer) {
            return experienceBuffer.size();
        }
    }

    /**
     * Buffered decisions, oldest first.
     */
    public List<MetacognitiveDecision> getRecentExperiences() {
        synchronized (experienceBuffer) {
            return List.copyOf(experienceBuffer);
        }
    }
}
