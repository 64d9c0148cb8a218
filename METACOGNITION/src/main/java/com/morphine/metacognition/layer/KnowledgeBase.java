package com.morphine.metacognition.layer;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;
import java.util.Set;

/**
 * Knowledge shared by the cognitive layers. Read-only during a pipeline run.
 */
public interface KnowledgeBase {

    Optional<JsonNode> lookup(String key);

    Set<String> keys();

    default int size() {
        return keys().size();
    }
}
