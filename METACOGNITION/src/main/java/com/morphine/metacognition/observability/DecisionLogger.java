package com.morphine.metacognition.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.morphine.metacognition.domain.model.MetacognitiveDecision;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Structured logging for the decision pipeline.
 * Emits one JSON line per pipeline event with stream and decision context.
 */
@Component
@Slf4j
public class DecisionLogger {

    public static final String MDC_STREAM_ID = "streamId";
    public static final String MDC_DECISION_ID = "decisionId";

    private final ObjectMapper objectMapper;

    public DecisionLogger(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Set MDC context for a decision.
     */
    public void setDecisionContext(String streamId, String decisionId) {
        if (streamId != null) MDC.put(MDC_STREAM_ID, streamId);
        if (decisionId != null) MDC.put(MDC_DECISION_ID, decisionId);
    }

    /**
     * Clear MDC context.
     */
    public void clearContext() {
        MDC.remove(MDC_STREAM_ID);
        MDC.remove(MDC_DECISION_ID);
    }

    public void logStreamOpened(String streamId, int channelCapacity) {
        logEvent("stream_opened", Map.of(
                "streamId", streamId,
                "channelCapacity", channelCapacity
        ));
    }

    public void logStreamClosed(String streamId, String signal) {
        logEvent("stream_closed", Map.of(
                "streamId", streamId,
                "signal", signal
        ));
    }

    /**
     * Log a synthesized decision.
     */
    public void logDecision(MetacognitiveDecision decision, boolean archived, long durationMs) {
        setDecisionContext(decision.getStreamId(), decision.getDecisionId());
        try {
            Map<String, Object> data = new HashMap<>();
            data.put("decisionType", String.valueOf(decision.getDecisionType()));
            data.put("confidence", decision.getConfidence());
            data.put("archived", archived);
            data.put("durationMs", durationMs);
            if (decision.getLayerContributions() != null) {
                data.put("contextWeight", decision.getLayerContributions().getContextWeight());
                data.put("reasoningWeight", decision.getLayerContributions().getReasoningWeight());
                data.put("intuitionWeight", decision.getLayerContributions().getIntuitionWeight());
            }
            logEvent("decision", data);
        } finally {
            clearContext();
        }
    }

    public void logLayerDegraded(String streamId, String layer, String reason) {
        Map<String, Object> data = new HashMap<>();
        data.put("streamId", streamId);
        data.put("layer", layer);
        data.put("reason", reason != null ? reason : "unknown");
        logEvent("layer_degraded", data);
    }

    public void logDecisionDropped(MetacognitiveDecision decision, String emitResult) {
        logEvent("decision_dropped", Map.of(
                "streamId", decision.getStreamId(),
                "decisionId", decision.getDecisionId(),
                "emitResult", emitResult
        ));
    }

    private void logEvent(String eventType, Map<String, Object> data) {
        Map<String, Object> event = new HashMap<>(data);
        event.put("event", eventType);
        event.put("timestamp", Instant.now().toString());
        event.put("service", "metacognition");

        String streamId = MDC.get(MDC_STREAM_ID);
        if (streamId != null) event.putIfAbsent("streamId", streamId);

        String decisionId = MDC.get(MDC_DECISION_ID);
        if (decisionId != null) event.put("decisionId", decisionId);

        try {
            String json = objectMapper.writeValueAsString(event);
            log.info(json);
        } catch (JsonProcessingException e) {
            log.info("event={} data={}", eventType, data);
        }
    }
}
