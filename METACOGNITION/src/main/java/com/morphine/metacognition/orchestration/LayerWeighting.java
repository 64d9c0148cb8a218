package com.morphine.metacognition.orchestration;

/**
 * Per-layer weights proportional to each layer's confidence.
 * The three weights always sum to 1; when the confidences sum to zero each layer gets a third.
 */
public record LayerWeighting(double context, double reasoning, double intuition) {

    private static final double EVEN_SPLIT = 1.0 / 3.0;

    public static LayerWeighting of(double contextConfidence,
                                    double reasoningConfidence,
                                    double intuitionConfidence) {
        double total = contextConfidence + reasoningConfidence + intuitionConfidence;
        if (!(total > 0.0) || !Double.isFinite(total)) {
            return new LayerWeighting(EVEN_SPLIT, EVEN_SPLIT, EVEN_SPLIT);
        }
        return new LayerWeighting(
                contextConfidence / total,
                reasoningConfidence / total,
                intuitionConfidence / total);
    }

    /**
     * Weighted sum of the layer confidences.
     */
    public double combine(double contextConfidence, double reasoningConfidence, double intuitionConfidence) {
        return context * contextConfidence
                + reasoning * reasoningConfidence
                + intuition * intuitionConfidence;
    }

    public double total() {
        return context + reasoning + intuition;
    }
}
