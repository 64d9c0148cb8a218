package com.morphine.metacognition.orchestration;

import com.morphine.metacognition.domain.model.MetacognitiveDecision;
import reactor.core.publisher.Flux;

/**
 * The two ends of an open stream.
 * The decision flux accepts a single subscriber.
 */
public record StreamHandle(String streamId, ContextSender input, Flux<MetacognitiveDecision> decisions) {
}
