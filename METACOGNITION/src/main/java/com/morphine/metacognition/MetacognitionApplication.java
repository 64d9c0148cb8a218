package com.morphine.metacognition;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * METACOGNITION - streaming decision orchestrator for the Morphine platform.
 *
 * <p>METACOGNITION provides:
 * <ul>
 *   <li>Per-stream pipelines - one sequential decision pipeline per live stream</li>
 *   <li>Layer fusion - context, reasoning and intuition layers fused by confidence</li>
 *   <li>AI system registry - pluggable scorers with trust weights and circuit breakers</li>
 *   <li>Glycolytic cycle - self-scaling worker pool for heavy sub-tasks</li>
 *   <li>Lactate cycle - TTL cache of low-confidence decisions</li>
 *   <li>Dreaming module - idle-time pattern mining and scenario synthesis</li>
 * </ul>
 *
 * <p>Decisions are handed back to callers on the stream's decision channel. Transport,
 * settlement and persistence live in other Morphine services.
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties
public class MetacognitionApplication {

    public static void main(String[] args) {
        SpringApplication.run(MetacognitionApplication.class, args);
    }
}
