package com.morphine.metacognition.domain.model;

/**
 * Classification of a metacognitive decision.
 */
public enum DecisionType {
    /**
     * A wager can be offered on the stream.
     */
    BETTING_OPPORTUNITY,

    /**
     * A viewer or event location needs confirming.
     */
    LOCATION_VERIFICATION,

    /**
     * A pending transaction needs validating.
     */
    TRANSACTION_VALIDATION,

    /**
     * General-purpose analysis of stream content.
     */
    STREAM_ANALYSIS,

    /**
     * Something anomalous was flagged by a layer.
     */
    ALERT_GENERATION;

    /**
     * Lenient lookup used for caller-supplied hints.
     *
     * @param value enum name in any case, with '-' or ' ' accepted for '_'
     * @return the matching type or null
     */
    public static DecisionType fromHint(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toUpperCase().replace('-', '_').replace(' ', '_');
        for (DecisionType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        return null;
    }
}
