package com.swingtrader.analysis.agent.sentiment;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.swingtrader.analysis.agent.StockRef;
import com.swingtrader.analysis.reasoning.ReasoningClient;
import com.swingtrader.analysis.sufficiency.AdaptiveSufficiencyLoop;
import com.swingtrader.analysis.sufficiency.EvidenceItem;
import com.swingtrader.analysis.sufficiency.SufficiencyPolicy;
import com.swingtrader.analysis.sufficiency.ThresholdSufficiencyEvaluator;
import com.swingtrader.analysis.tool.ParameterType;
import com.swingtrader.analysis.tool.SourceTier;
import com.swingtrader.analysis.tool.ToolDescriptor;
import com.swingtrader.analysis.tool.ToolParameter;
import com.swingtrader.analysis.tool.ToolRegistry;
import com.swingtrader.common.cache.InMemoryResultCache;
import com.swingtrader.common.json.StructuredResponseParser;
import com.swingtrader.common.unit.ErrorKind;
import com.swingtrader.common.unit.UnitOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SentimentUnitTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final StructuredResponseParser PARSER = new StructuredResponseParser(MAPPER);

    private static final List<ToolParameter> PARAMS = List.of(
        ToolParameter.required("symbol", ParameterType.STRING, "ticker"),
        ToolParameter.required("company_name", ParameterType.STRING, "name"),
        ToolParameter.optional("days", ParameterType.INTEGER, 2, "lookback"),
        ToolParameter.optional("max_results", ParameterType.INTEGER, 50, "limit"));

    record FixedReasoning(String reply) implements ReasoningClient {
        @Override public boolean isConfigured() { return reply != null; }
        @Override public String complete(String prompt) { return reply; }
    }

    private final AtomicInteger toolCalls = new AtomicInteger();
    private InMemoryResultCache cache;
    private AdaptiveSufficiencyLoop loop;

    private static List<EvidenceItem> headlines(String template, int count) {
        List<EvidenceItem> out = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            out.add(new EvidenceItem(template + " #" + i, null, null, "wire", null));
        }
        return out;
    }

    @BeforeEach
    void setUp() {
        ToolRegistry registry = new ToolRegistry();
        registry.register(new ToolDescriptor("fetch_news", "news", SourceTier.PRIMARY, PARAMS, true, args -> {
            toolCalls.incrementAndGet();
            return switch ((String) args.get("symbol")) {
                case "AAA.NS" -> headlines("Alpha shares surge on record profit", 6);
                case "BBB.NS" -> headlines("Beta shares plunge after loss and probe", 6);
                default -> List.of();
            };
        }));
        cache = new InMemoryResultCache(Duration.ofHours(3));
        loop = new AdaptiveSufficiencyLoop(registry, new ThresholdSufficiencyEvaluator(),
            SufficiencyPolicy.defaults(), cache);
    }

    private SentimentUnit unit(String reasoningReply) {
        return new SentimentUnit("sentiment", loop, new SentimentAnalyzer(new FixedReasoning(reasoningReply), PARSER),
            cache, MAPPER);
    }

    private static Map<String, Object> stock(String symbol, String name) {
        return Map.of("symbol", symbol, "name", name, "current_price", 100.0);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> entry(UnitOutcome outcome, String symbol) {
        List<Map<String, Object>> stocks = (List<Map<String, Object>>) outcome.output().get("analyzed_stocks");
        return stocks.stream().filter(s -> symbol.equals(s.get("symbol"))).findFirst().orElseThrow();
    }

    @Nested
    @DisplayName("keyword fallback")
    class LexiconTests {

        @Test
        @DisplayName("every stock gets an entry; thin coverage is flagged low confidence")
        void everyStock() {
            UnitOutcome outcome = unit(null).execute(Map.of("stocks", List.of(
                stock("AAA.NS", "Alpha"), stock("BBB.NS", "Beta"), stock("CCC.NS", "Quiet Co"))));

            assertTrue(outcome.isSuccess());
            assertEquals(3, outcome.output().get("total_analyzed"));
            assertEquals(1, outcome.output().get("positive_count"));
            assertEquals(1, outcome.output().get("negative_count"));
            assertEquals(1, outcome.output().get("neutral_count"));

            Map<String, Object> alpha = entry(outcome, "AAA.NS");
            assertEquals("very_positive", alpha.get("overall_sentiment"));
            assertEquals(false, alpha.get("low_confidence"));
            assertEquals(6, alpha.get("evidence_count"));
            assertEquals(List.of("fetch_news"), alpha.get("sources_used"));

            Map<String, Object> beta = entry(outcome, "BBB.NS");
            assertEquals("very_negative", beta.get("overall_sentiment"));

            Map<String, Object> quiet = entry(outcome, "CCC.NS");
            assertEquals("neutral", quiet.get("overall_sentiment"));
            assertEquals(true, quiet.get("low_confidence"));
            assertEquals(0, quiet.get("evidence_count"));
            assertEquals(180, quiet.get("window_days"));
        }

        @Test
        @DisplayName("unparseable reasoning reply falls back to keywords")
        void unparseableReply() {
            UnitOutcome outcome = unit("no json here").execute(Map.of("stocks", List.of(stock("AAA.NS", "Alpha"))));
            assertEquals("very_positive", entry(outcome, "AAA.NS").get("overall_sentiment"));
        }
    }

    @Test
    @DisplayName("reasoning reply drives the verdict when configured")
    void reasoningReply() {
        String reply = """
            {"summary_points": ["steady demand"], "overall_sentiment": "positive", "sentiment_score": 0.4,
             "confidence": 0.7, "key_insights": ["margin expansion"], "recommendation": "buy"}""";
        UnitOutcome outcome = unit(reply).execute(Map.of("stocks", List.of(stock("BBB.NS", "Beta"))));

        Map<String, Object> beta = entry(outcome, "BBB.NS");
        assertEquals("positive", beta.get("overall_sentiment"));
        assertEquals(0.4, beta.get("sentiment_score"));
        assertEquals(List.of("margin expansion"), beta.get("key_insights"));
    }

    @Nested
    @DisplayName("unit-level cache")
    class CacheTests {

        @Test
        @DisplayName("key depends only on the set of symbols")
        void keyOrderInsensitive() {
            String ab = SentimentUnit.cacheKey(List.of(new StockRef("AAA.NS", "Alpha", 10.0), new StockRef("BBB.NS", null, 5.0)));
            String ba = SentimentUnit.cacheKey(List.of(new StockRef("BBB.NS", "Beta", 7.0), new StockRef("AAA.NS", "A", 1.0)));
            assertEquals(ab, ba);
            assertNotEquals(ab, SentimentUnit.cacheKey(List.of(new StockRef("AAA.NS", "Alpha", 10.0))));
        }

        @Test
        @DisplayName("same shortlist in another order is served from cache")
        void reused() {
            SentimentUnit unit = unit(null);
            UnitOutcome first = unit.execute(Map.of("stocks", List.of(stock("AAA.NS", "Alpha"), stock("BBB.NS", "Beta"))));
            int callsAfterFirst = toolCalls.get();
            int entriesAfterFirst = cache.size();

            UnitOutcome second = unit.execute(Map.of("stocks", List.of(stock("BBB.NS", "Beta"), stock("AAA.NS", "Alpha"))));

            assertEquals(first.output(), second.output());
            assertEquals(callsAfterFirst, toolCalls.get());
            assertEquals(entriesAfterFirst, cache.size());
        }
    }

    @Test
    @DisplayName("missing symbol is a validation failure")
    void validation() {
        UnitOutcome outcome = unit(null).execute(Map.of("stocks", List.of(Map.of("name", "Anonymous"))));
        assertEquals(ErrorKind.VALIDATION, outcome.errorKind());
        assertTrue(outcome.message().contains("stocks[0].symbol"));
    }
}
