package com.morphine.metacognition.health;

import com.morphine.metacognition.config.MetacognitionProperties;
import com.morphine.metacognition.domain.model.SystemHealth;
import com.morphine.metacognition.orchestration.MetacognitiveOrchestrator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Health indicator for the METACOGNITION service.
 * Reports the metabolic state and registry sizes; a lactate backlog above the
 * configured threshold reports DEGRADED.
 */
@Component
@Slf4j
public class MetacognitionHealthIndicator implements ReactiveHealthIndicator {

    public static final Status DEGRADED = new Status("DEGRADED", "Lactate backlog above threshold");

    private final MetacognitiveOrchestrator orchestrator;
    private final MetacognitionProperties properties;

    public MetacognitionHealthIndicator(MetacognitiveOrchestrator orchestrator,
                                        MetacognitionProperties properties) {
        this.orchestrator = orchestrator;
        this.properties = properties;
    }

    @Override
    public Mono<Health> health() {
        return Mono.fromSupplier(orchestrator::getSystemHealth)
                .map(snapshot -> {
                    double lactateLevel = snapshot.getMetabolicState().getLactateLevel();
                    Health.Builder builder = lactateLevel > properties.getHealth().getLactateDegradedThreshold()
                            ? Health.status(DEGRADED)
                            : Health.up();
                    return withDetails(builder, snapshot).build();
                })
                .onErrorResume(e -> {
                    log.error("Health check failed", e);
                    return Mono.just(Health.down()
                            .withDetail("error", String.valueOf(e.getMessage()))
                            .build());
                });
    }

    private Health.Builder withDetails(Health.Builder builder, SystemHealth snapshot) {
        builder.withDetail("activeStreams", snapshot.getActiveStreamCount());
        builder.withDetail("registeredAiSystems", snapshot.getRegisteredSystemCount());
        builder.withDetail("glycolyticLoad", snapshot.getMetabolicState().getGlycolyticLoad());
        builder.withDetail("lactateLevel", snapshot.getMetabolicState().getLactateLevel());
        builder.withDetail("dreamingActive", snapshot.getMetabolicState().isDreamingActive());
        builder.withDetail("workers", snapshot.getWorkerCount());
        builder.withDetail("pendingTasks", snapshot.getPendingTaskCount());
        builder.withDetail("partialResults", snapshot.getPartialResultCount());
        builder.withDetail("dreamPatterns", snapshot.getPatternCount());
        if (snapshot.getSchedulerMetrics() != null) {
            builder.withDetail("schedulerErrorRate", snapshot.getSchedulerMetrics().getErrorRate());
            builder.withDetail("schedulerThroughput", snapshot.getSchedulerMetrics().getThroughput());
        }
        return builder;
    }
}
