package com.morphine.metacognition.layer;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Reads the confidence a layer or AI system attached to its evidence.
 */
public final class ConfidenceExtractor {

    public static final String CONFIDENCE_FIELD = "confidence";
    public static final double NEUTRAL_CONFIDENCE = 0.5;

    private ConfidenceExtractor() {
    }

    /**
     * Numeric {@code confidence} field clamped to [0, 1], or 0.5 when absent or malformed.
     * Never throws.
     */
    public static double extract(JsonNode evidence) {
        if (evidence == null || !evidence.isObject()) {
            return NEUTRAL_CONFIDENCE;
        }
        JsonNode field = evidence.get(CONFIDENCE_FIELD);
        if (field == null || !field.isNumber()) {
            return NEUTRAL_CONFIDENCE;
        }
        double value = field.asDouble();
        if (!Double.isFinite(value)) {
            return NEUTRAL_CONFIDENCE;
        }
        return clamp(value);
    }

    public static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
