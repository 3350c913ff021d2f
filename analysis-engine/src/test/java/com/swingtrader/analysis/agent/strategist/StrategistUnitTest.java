package com.swingtrader.analysis.agent.strategist;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.swingtrader.analysis.reasoning.ReasoningClient;
import com.swingtrader.analysis.trade.PaperTradeExecutor;
import com.swingtrader.common.json.StructuredResponseParser;
import com.swingtrader.common.unit.ErrorKind;
import com.swingtrader.common.unit.UnitOutcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StrategistUnitTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final StructuredResponseParser PARSER = new StructuredResponseParser(MAPPER);

    record FixedReasoning(String reply) implements ReasoningClient {
        @Override public boolean isConfigured() { return reply != null; }
        @Override public String complete(String prompt) { return reply; }
    }

    private final PaperTradeExecutor executor = new PaperTradeExecutor();

    private StrategistUnit unit(String reasoningReply, double minConfidence) {
        DecisionMaker maker = new DecisionMaker(new FixedReasoning(reasoningReply), PARSER, MAPPER,
            minConfidence, 10_000);
        return new StrategistUnit("strategist", maker, executor, minConfidence, MAPPER);
    }

    private static Map<String, Object> technical(String symbol, String trend, double strength, double price) {
        Map<String, Object> m = new HashMap<>();
        m.put("symbol", symbol);
        m.put("name", symbol + " Ltd");
        m.put("current_price", price);
        m.put("trend", trend);
        m.put("strength", strength);
        m.put("signals", List.of());
        m.put("recommendation", "hold");
        return m;
    }

    private static Map<String, Object> sentiment(String symbol, String label, double score, boolean lowConfidence) {
        Map<String, Object> m = new HashMap<>();
        m.put("symbol", symbol);
        m.put("name", symbol + " Ltd");
        m.put("overall_sentiment", label);
        m.put("sentiment_score", score);
        m.put("confidence", 0.6);
        m.put("low_confidence", lowConfidence);
        return m;
    }

    private static Map<String, Object> input() {
        return Map.of(
            "technical", Map.of("analyzed_stocks", List.of(
                technical("AAA.NS", "bullish", 90, 100.0),
                technical("BBB.NS", "bearish", 20, 50.0))),
            "sentiment", Map.of("analyzed_stocks", List.of(
                sentiment("AAA.NS", "very_positive", 0.8, false),
                sentiment("CCC.NS", "neutral", 0.0, true))));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> decision(UnitOutcome outcome, String symbol) {
        return ((List<Map<String, Object>>) outcome.output().get("decisions")).stream()
            .filter(d -> symbol.equals(d.get("symbol"))).findFirst().orElseThrow();
    }

    @Nested
    @DisplayName("weighted rule")
    class WeightedTests {

        @Test
        @DisplayName("one decision per symbol across both inputs")
        void unionOfSymbols() {
            UnitOutcome outcome = unit(null, 0.75).execute(input());

            assertTrue(outcome.isSuccess());
            assertEquals(3, ((List<?>) outcome.output().get("decisions")).size());
            assertEquals("buy", decision(outcome, "AAA.NS").get("action"));
            assertEquals("sell", decision(outcome, "BBB.NS").get("action"));
            assertEquals("hold", decision(outcome, "CCC.NS").get("action"));
        }

        @Test
        @DisplayName("confident buy is sized and paper-traded")
        @SuppressWarnings("unchecked")
        void executesTopPick() {
            UnitOutcome outcome = unit(null, 0.75).execute(input());

            Map<String, Object> aaa = decision(outcome, "AAA.NS");
            assertEquals(0.9, (Double) aaa.get("confidence"), 1e-9);
            assertEquals(100, aaa.get("quantity"));
            assertEquals(97.0, aaa.get("stop_loss"));
            assertEquals(106.0, aaa.get("target_price"));

            assertEquals(true, outcome.output().get("order_executed"));
            assertEquals("AAA.NS", ((Map<String, Object>) outcome.output().get("top_pick")).get("symbol"));
            assertEquals("PAPER_AAA.NS_100", ((Map<String, Object>) outcome.output().get("order_details")).get("order_id"));
            assertEquals("High confidence (0.90) buy signal for AAA.NS", outcome.output().get("execution_reason"));
            assertEquals(1, executor.placedOrders().size());
        }

        @Test
        @DisplayName("no buy at or above the threshold places no order")
        void belowThreshold() {
            UnitOutcome outcome = unit(null, 0.95).execute(input());

            assertEquals(false, outcome.output().get("order_executed"));
            assertNull(outcome.output().get("top_pick"));
            assertTrue(((String) outcome.output().get("execution_reason")).contains("0.95"));
            assertTrue(executor.placedOrders().isEmpty());
        }
    }

    @Nested
    @DisplayName("reasoning path")
    class ReasoningTests {

        @Test
        @DisplayName("reasoned buy without a quantity is not executed")
        void invalidQuantity() {
            String reply = """
                {"decisions": [{"symbol": "AAA.NS", "name": "Alpha", "action": "buy", "confidence": 0.8,
                  "reasoning": "strong setup", "combined_score": 80}]}""";
            UnitOutcome outcome = unit(reply, 0.75).execute(input());

            assertEquals("strong setup", decision(outcome, "AAA.NS").get("reasoning"));
            assertEquals(false, outcome.output().get("order_executed"));
            assertEquals("Order not executed: Invalid quantity", outcome.output().get("execution_reason"));
            assertTrue(executor.placedOrders().isEmpty());
        }

        @Test
        @DisplayName("symbols the reply omits are decided by the weighted rule")
        void fillsGaps() {
            String reply = "{\"decisions\": [{\"symbol\": \"BBB.NS\", \"action\": \"hold\", \"confidence\": 0.5}]}";
            UnitOutcome outcome = unit(reply, 0.75).execute(input());

            assertEquals("hold", decision(outcome, "BBB.NS").get("action"));
            assertEquals("buy", decision(outcome, "AAA.NS").get("action"));
            assertEquals(3, ((List<?>) outcome.output().get("decisions")).size());
        }
    }

    @Test
    @DisplayName("missing sentiment input is a validation failure")
    void validation() {
        UnitOutcome outcome = unit(null, 0.75).execute(Map.of("technical", Map.of("analyzed_stocks", List.of())));
        assertEquals(ErrorKind.VALIDATION, outcome.errorKind());
        assertTrue(outcome.message().contains("sentiment"));
    }
}
