package com.morphine.metacognition.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Relative weight of each cognitive layer in a fused decision. The three weights sum to 1.0.
 */
@Value
@Builder
public class LayerContributions {

    double contextWeight;
    double reasoningWeight;
    double intuitionWeight;

    /**
     * Metabolic state the decision was made under.
     */
    MetabolicState metabolicState;

    public double totalWeight() {
        return contextWeight + reasoningWeight + intuitionWeight;
    }
}
