package com.morphine.metacognition.orchestration;

import com.fasterxml.jackson.databind.JsonNode;
import com.morphine.metacognition.domain.model.DecisionType;
import com.morphine.metacognition.domain.model.StreamingContext;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * Assigns a decision type from the context's partial data and the fused evidence.
 *
 * <p>First matching rule wins:
 * <ol>
 *   <li>an explicit {@code decision_type} hint in the partial data</li>
 *   <li>any evidence blob flagged {@code alert: true}</li>
 *   <li>partial-data keys starting with {@code transaction}</li>
 *   <li>partial-data keys starting with {@code location} or {@code gps}</li>
 *   <li>partial-data keys starting with {@code bet} or {@code odds}</li>
 * </ol>
 * Anything else is a stream analysis.
 */
@Component
public class DecisionClassifier {

    public static final String DECISION_TYPE_HINT = "decision_type";
    public static final String ALERT_FLAG = "alert";

    public DecisionType classify(StreamingContext context, Map<String, JsonNode> evidence) {
        Map<String, JsonNode> partialData = context.getPartialData() != null ? context.getPartialData() : Map.of();

        JsonNode hint = partialData.get(DECISION_TYPE_HINT);
        if (hint != null && hint.isTextual()) {
            DecisionType hinted = DecisionType.fromHint(hint.asText());
            if (hinted != null) {
                return hinted;
            }
        }

        if (evidence != null && evidence.values().stream().anyMatch(DecisionClassifier::isAlert)) {
            return DecisionType.ALERT_GENERATION;
        }

        if (hasKeyWithPrefix(partialData, "transaction")) {
            return DecisionType.TRANSACTION_VALIDATION;
        }
        if (hasKeyWithPrefix(partialData, "location", "gps")) {
            return DecisionType.LOCATION_VERIFICATION;
        }
        if (hasKeyWithPrefix(partialData, "bet", "odds")) {
            return DecisionType.BETTING_OPPORTUNITY;
        }
        return DecisionType.STREAM_ANALYSIS;
    }

    private static boolean isAlert(JsonNode blob) {
        return blob != null && blob.path(ALERT_FLAG).asBoolean(false);
    }

    private static boolean hasKeyWithPrefix(Map<String, JsonNode> partialData, String... prefixes) {
        for (String key : partialData.keySet()) {
            String normalized = key.toLowerCase(Locale.ROOT);
            for (String prefix : prefixes) {
                if (normalized.startsWith(prefix)) {
                    return true;
                }
            }
        }
        return false;
    }
}
