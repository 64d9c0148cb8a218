package com.morphine.metacognition.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Configuration properties for the METACOGNITION service.
 */
@Data
@Component
@ConfigurationProperties(prefix = "morphine.metacognition")
public class MetacognitionProperties {

    private StreamProperties stream = new StreamProperties();
    private PipelineProperties pipeline = new PipelineProperties();
    private AiSystemProperties aiSystems = new AiSystemProperties();
    private GlycolyticProperties glycolytic = new GlycolyticProperties();
    private LactateProperties lactate = new LactateProperties();
    private DreamingProperties dreaming = new DreamingProperties();
    private KnowledgeProperties knowledge = new KnowledgeProperties();
    private HealthProperties health = new HealthProperties();

    @Data
    public static class StreamProperties {
        /**
         * Capacity of each stream's input and output buffers.
         */
        private int channelCapacity = 1000;

        /**
         * Maximum number of recent decisions kept for streaming lookups.
         */
        private int decisionHistorySize = 10_000;

        /**
         * How long a decision stays visible to streaming lookups.
         */
        private Duration decisionHistoryTtl = Duration.ofMinutes(10);
    }

    @Data
    public static class PipelineProperties {
        /**
         * Upper bound on a single cognitive layer invocation.
         */
        private Duration layerTimeout = Duration.ofSeconds(2);

        /**
         * Decisions below this confidence are archived to the lactate cycle.
         */
        private double archiveThreshold = 0.8;
    }

    @Data
    public static class AiSystemProperties {
        /**
         * Timeout = expected processing time x multiplier.
         */
        private double timeoutMultiplier = 3.0;

        /**
         * Floor for the per-call timeout.
         */
        private Duration minTimeout = Duration.ofMillis(250);

        /**
         * Systems slower than this run as scheduler-mediated tasks.
         */
        private Duration offloadThreshold = Duration.ofMillis(500);

        private CircuitBreakerProperties circuitBreaker = new CircuitBreakerProperties();

        @Data
        public static class CircuitBreakerProperties {
            private float failureRateThreshold = 50.0f;
            private int slidingWindowSize = 20;
            private int minimumNumberOfCalls = 10;
            private Duration waitDurationInOpenState = Duration.ofSeconds(30);
        }
    }

    @Data
    public static class GlycolyticProperties {
        /**
         * Initial (and minimum) worker count; 0 means host CPU count.
         */
        private int initialWorkers = 0;

        private int maxWorkers = 32;
        private double scaleUpThreshold = 0.8;
        private double scaleDownThreshold = 0.3;

        /**
         * Upper bound of the random processing-time perturbation (0.2 = up to +20%).
         */
        private double maxJitter = 0.2;

        private Duration balanceInterval = Duration.ofMillis(100);
    }

    @Data
    public static class LactateProperties {
        private Duration ttl = Duration.ofHours(1);
        private Duration sweepInterval = Duration.ofSeconds(30);
    }

    @Data
    public static class DreamingProperties {
        private Duration cycleInterval = Duration.ofMinutes(5);
        private int minExperiences = 10;
        private int bufferCapacity = 1000;

        /**
         * Dreaming may only start within this many minutes past the top of each hour.
         */
        private Duration idleWindow = Duration.ofMinutes(5);

        private double scenarioThreshold = 2.0;
        private double reinforcement = 1.1;
        private double decay = 0.95;

        /**
         * Patterns decayed below this strength are extinguished.
         */
        private double extinctionThreshold = 0.1;

        private int maxDiscoveries = 500;
        private int maxScenariosPerPattern = 10;
    }

    @Data
    public static class KnowledgeProperties {
        /**
         * Static facts exposed to the cognitive layers as a read-only knowledge base.
         */
        private Map<String, String> entries = new HashMap<>();
    }

    @Data
    public static class HealthProperties {
        /**
         * Lactate level above which the service reports DEGRADED.
         */
        private double lactateDegradedThreshold = 100.0;
    }
}
