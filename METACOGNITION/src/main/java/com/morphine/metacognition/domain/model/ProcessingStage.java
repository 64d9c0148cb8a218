package com.morphine.metacognition.domain.model;

/**
 * Stage a streaming context has reached when it is submitted.
 */
public enum ProcessingStage {
    CONTEXT,
    REASONING,
    INTUITION,
    COMPLETE
}
