package com.morphine.metacognition.config;

import com.morphine.metacognition.layer.InMemoryKnowledgeBase;
import com.morphine.metacognition.layer.KnowledgeBase;
import com.morphine.metacognition.metabolic.TaskWork;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Infrastructure beans for the metabolic subsystems.
 */
@Configuration
public class MetabolicConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // ==================== Cognition ====================

    @Bean
    @ConditionalOnMissingBean
    public KnowledgeBase knowledgeBase(MetacognitionProperties properties) {
        return InMemoryKnowledgeBase.fromStrings(properties.getKnowledge().getEntries());
    }

    // ==================== Scheduling ====================

    @Bean
    @ConditionalOnMissingBean
    public TaskWork taskWork() {
        return TaskWork.simulated();
    }

    // ==================== Resilience ====================

    @Bean
    @ConditionalOnMissingBean
    public CircuitBreakerRegistry circuitBreakerRegistry(MetacognitionProperties properties) {
        MetacognitionProperties.AiSystemProperties.CircuitBreakerProperties circuitBreaker =
                properties.getAiSystems().getCircuitBreaker();
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(circuitBreaker.getFailureRateThreshold())
                .slidingWindowSize(circuitBreaker.getSlidingWindowSize())
                .minimumNumberOfCalls(circuitBreaker.getMinimumNumberOfCalls())
                .waitDurationInOpenState(circuitBreaker.getWaitDurationInOpenState())
                .build();
        return CircuitBreakerRegistry.of(config);
    }
}
