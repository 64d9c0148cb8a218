package com.morphine.metacognition.orchestration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.TextNode;
import com.morphine.metacognition.domain.model.DecisionType;
import com.morphine.metacognition.domain.model.StreamingContext;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link DecisionClassifier}.
 */
class DecisionClassifierTest {

    private final DecisionClassifier classifier = new DecisionClassifier();
    private final JsonNodeFactory factory = JsonNodeFactory.instance;

    @Test
    void explicitHintWins() {
        StreamingContext context = context(Map.of(
                "decision_type", TextNode.valueOf("location-verification"),
                "odds", factory.numberNode(2.5)));
        Map<String, JsonNode> evidence = Map.of("context", factory.objectNode().put("alert", true));

        assertThat(classifier.classify(context, evidence)).isEqualTo(DecisionType.LOCATION_VERIFICATION);
    }

    @Test
    void alertEvidenceRaisesAlert() {
        StreamingContext context = context(Map.of("bet_amount", factory.numberNode(10)));
        Map<String, JsonNode> evidence = Map.of(
                "context", factory.objectNode().put("confidence", 0.4),
                "intuition", factory.objectNode().put("alert", true));

        assertThat(classifier.classify(context, evidence)).isEqualTo(DecisionType.ALERT_GENERATION);
    }

    @Test
    void partialDataKeysSelectType() {
        assertThat(classifier.classify(context(Map.of("transactionId", TextNode.valueOf("tx-1"))), Map.of()))
                .isEqualTo(DecisionType.TRANSACTION_VALIDATION);
        assertThat(classifier.classify(context(Map.of("gps_fix", factory.numberNode(3))), Map.of()))
                .isEqualTo(DecisionType.LOCATION_VERIFICATION);
        assertThat(classifier.classify(context(Map.of("odds", factory.numberNode(1.8))), Map.of()))
                .isEqualTo(DecisionType.BETTING_OPPORTUNITY);
        assertThat(classifier.classify(context(Map.of("frame", factory.numberNode(12))), Map.of()))
                .isEqualTo(DecisionType.STREAM_ANALYSIS);
    }

    @Test
    void unknownHintFallsThrough() {
        StreamingContext context = context(Map.of("decision_type", TextNode.valueOf("lottery")));

        assertThat(classifier.classify(context, Map.of())).isEqualTo(DecisionType.STREAM_ANALYSIS);
    }

    private StreamingContext context(Map<String, JsonNode> partialData) {
        return StreamingContext.builder()
                .streamId("s1")
                .partialData(partialData)
                .confidenceLevel(0.5)
                .build();
    }
}
