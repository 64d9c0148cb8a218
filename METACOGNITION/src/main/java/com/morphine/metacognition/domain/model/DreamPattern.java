package com.morphine.metacognition.domain.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A recurring regularity mined from recent decisions by the dreaming module.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DreamPattern {

    /**
     * Signature of decision type, rounded confidence and rounded context weight.
     */
    private String patternId;

    /**
     * Decision type the pattern was mined from.
     */
    private String patternType;

    /**
     * Reinforced on repeat, decayed every cycle. Never negative.
     */
    private double strength;

    private double frequency;

    /**
     * Occurrence counts per stream ID.
     */
    @Builder.Default
    private Map<String, Double> associations = new HashMap<>();

    @Builder.Default
    private List<JsonNode> generatedScenarios = new ArrayList<>();

    /**
     * Deep-enough copy for handing out to readers.
     */
    public DreamPattern snapshot() {
        return toBuilder()
                .associations(new HashMap<>(associations))
                .generatedScenarios(new ArrayList<>(generatedScenarios))
                .build();
    }
}
