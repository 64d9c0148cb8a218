package com.morphine.metacognition.layer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable knowledge base backed by a map. Values are deep-copied on the way in and out.
 */
public class InMemoryKnowledgeBase implements KnowledgeBase {

    private final Map<String, JsonNode> entries;

    public InMemoryKnowledgeBase(Map<String, JsonNode> entries) {
        Map<String, JsonNode> copy = new HashMap<>();
        if (entries != null) {
            entries.forEach((key, value) -> {
                if (key != null && value != null) {
                    copy.put(key, value.deepCopy());
                }
            });
        }
        this.entries = Collections.unmodifiableMap(copy);
    }

    /**
     * Build from plain string facts, as bound from configuration.
     */
    public static InMemoryKnowledgeBase fromStrings(Map<String, String> facts) {
        Map<String, JsonNode> nodes = new HashMap<>();
        if (facts != null) {
            facts.forEach((key, value) -> nodes.put(key, TextNode.valueOf(value)));
        }
        return new InMemoryKnowledgeBase(nodes);
    }

    @Override
    public Optional<JsonNode> lookup(String key) {
        if (key == null) {
            return Optional.empty();
        }
        JsonNode value = entries.get(key);
        return value != null ? Optional.of(value.deepCopy()) : Optional.empty();
    }

    @Override
    public Set<String> keys() {
        return entries.keySet();
    }
}
