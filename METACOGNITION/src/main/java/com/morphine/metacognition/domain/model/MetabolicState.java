package com.morphine.metacognition.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Point-in-time snapshot of system load, cache pressure and idle-synthesis activity.
 */
@Value
@Builder
public class MetabolicState {

    /**
     * Fraction of busy workers in the glycolytic cycle (0.0 - 1.0).
     */
    double glycolyticLoad;

    /**
     * Pressure signal derived from the incomplete-result backlog.
     */
    double lactateLevel;

    boolean dreamingActive;

    /**
     * Last allocation vector computed by the scheduler (cpu/memory/io shares).
     */
    @Builder.Default
    Map<String, Double> resourceAllocation = Map.of();
}
