package com.morphine.metacognition.layer;

import com.morphine.metacognition.domain.model.MetacognitiveDecision;

/**
 * The three evidence-producing cognitive layers.
 */
public enum LayerType {
    CONTEXT(MetacognitiveDecision.EVIDENCE_CONTEXT),
    REASONING(MetacognitiveDecision.EVIDENCE_REASONING),
    INTUITION(MetacognitiveDecision.EVIDENCE_INTUITION);

    private final String evidenceKey;

    LayerType(String evidenceKey) {
        this.evidenceKey = evidenceKey;
    }

    /**
     * Key under which this layer's output is stored in a decision's evidence map.
     */
    public String getEvidenceKey() {
        return evidenceKey;
    }
}
