package com.swingtrader.analysis.sufficiency;

import com.swingtrader.analysis.tool.DataFetchStrategy;
import com.swingtrader.analysis.tool.ParameterType;
import com.swingtrader.analysis.tool.SourceTier;
import com.swingtrader.analysis.tool.ToolDescriptor;
import com.swingtrader.analysis.tool.ToolParameter;
import com.swingtrader.analysis.tool.ToolRegistry;
import com.swingtrader.common.cache.InMemoryResultCache;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntFunction;

import static org.junit.jupiter.api.Assertions.*;

class AdaptiveSufficiencyLoopTest {

    private static final List<ToolParameter> PARAMS = List.of(
        ToolParameter.required("symbol", ParameterType.STRING, "ticker"),
        ToolParameter.required("company_name", ParameterType.STRING, "name"),
        ToolParameter.optional("days", ParameterType.INTEGER, 2, "lookback"),
        ToolParameter.optional("max_results", ParameterType.INTEGER, 50, "limit"));

    private final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();
    private final Map<String, List<Integer>> windowsSeen = new ConcurrentHashMap<>();
    private ToolRegistry registry;
    private InMemoryResultCache cache;

    @BeforeEach
    void setUp() {
        registry = new ToolRegistry();
        cache = new InMemoryResultCache(Duration.ofHours(3));
    }

    /** Registers a tool whose result depends only on the requested window. */
    private void tool(String name, SourceTier tier, IntFunction<List<EvidenceItem>> byDays) {
        calls.put(name, new AtomicInteger());
        windowsSeen.put(name, new ArrayList<>());
        DataFetchStrategy strategy = args -> {
            calls.get(name).incrementAndGet();
            int days = (Integer) args.get("days");
            windowsSeen.get(name).add(days);
            return byDays.apply(days);
        };
        registry.register(new ToolDescriptor(name, name, tier, PARAMS, true, strategy));
    }

    private static List<EvidenceItem> items(String prefix, int count) {
        List<EvidenceItem> out = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            out.add(new EvidenceItem(prefix + " headline " + i, "body", Instant.parse("2024-05-01T00:00:00Z"),
                "wire", null));
        }
        return out;
    }

    private AdaptiveSufficiencyLoop loop(SufficiencyPolicy policy) {
        return new AdaptiveSufficiencyLoop(registry, new ThresholdSufficiencyEvaluator(), policy, cache);
    }

    private int callsTo(String name) {
        return calls.get(name).get();
    }

    @Nested
    @DisplayName("escalation")
    class EscalationTests {

        @Test
        @DisplayName("enough items from the primary source in the first window ends after one round")
        void satisfiedImmediately() {
            tool("news", SourceTier.PRIMARY, days -> items("n", 6));
            tool("gnews", SourceTier.ALTERNATE, days -> items("g", 6));

            CollectionResult result = loop(SufficiencyPolicy.defaults()).collect("TCS.NS", "Tata Consultancy");

            assertEquals(Verdict.SUFFICIENT, result.verdict());
            assertFalse(result.lowConfidence());
            assertEquals(1, result.rounds());
            assertEquals(2, result.windowDays());
            assertEquals(List.of("news"), result.sourcesUsed());
            assertEquals(0, callsTo("gnews"));
            assertTrue(result.evidence().stream().allMatch(i -> "news".equals(i.sourceTool())));
        }

        @Test
        @DisplayName("short count widens the window along the ladder with the primary source")
        void widensWindow() {
            tool("news", SourceTier.PRIMARY, days -> days >= 90 ? items("n", 7) : items("n", 1));
            tool("gnews", SourceTier.ALTERNATE, days -> List.of());

            CollectionResult result = loop(SufficiencyPolicy.defaults()).collect("INFY.NS", "Infosys");

            assertEquals(Verdict.SUFFICIENT, result.verdict());
            assertEquals(90, result.windowDays());
            assertEquals(List.of(2, 90), windowsSeen.get("news"));
            assertEquals(0, callsTo("gnews"));
        }

        @Test
        @DisplayName("missing diversity tries an alternate source in the same window")
        void diversityFirst() {
            tool("news", SourceTier.PRIMARY, days -> items("n", 6));
            tool("gnews", SourceTier.ALTERNATE, days -> items("g", 1));

            SufficiencyPolicy policy = new SufficiencyPolicy(5, List.of(2, 90, 180), 50, 2, 0, 0);
            CollectionResult result = loop(policy).collect("TCS.NS", "Tata Consultancy");

            assertEquals(Verdict.SUFFICIENT, result.verdict());
            assertEquals(2, result.windowDays());
            assertEquals(List.of("news", "gnews"), result.sourcesUsed());
        }

        @Test
        @DisplayName("duplicate titles across sources count once")
        void dedup() {
            tool("news", SourceTier.PRIMARY, days -> items("x", 3));
            tool("gnews", SourceTier.ALTERNATE, days -> {
                List<EvidenceItem> mixed = new ArrayList<>();
                items("X", 3).forEach(i -> mixed.add(new EvidenceItem("  " + i.title().toUpperCase() + " ",
                    null, null, "other", null)));
                mixed.addAll(items("fresh", 2));
                return mixed;
            });

            SufficiencyPolicy policy = new SufficiencyPolicy(5, List.of(7), 50, 1, 0, 0);
            CollectionResult result = loop(policy).collect("WIPRO.NS", "Wipro");

            assertEquals(Verdict.SUFFICIENT, result.verdict());
            assertEquals(5, result.evidenceCount());
            assertEquals(List.of("news", "gnews"), result.sourcesUsed());
        }
    }

    @Nested
    @DisplayName("termination")
    class TerminationTests {

        @Test
        @DisplayName("no evidence anywhere ends exhausted within ladder × tools rounds")
        void exhaustedWithinCap() {
            tool("news", SourceTier.PRIMARY, days -> List.of());
            tool("gnews", SourceTier.ALTERNATE, days -> List.of());
            tool("reddit", SourceTier.SUPPLEMENTARY, days -> List.of());

            AdaptiveSufficiencyLoop loop = loop(SufficiencyPolicy.defaults());
            CollectionResult result = loop.collect("ZZZ.NS", "Nobody Ltd");

            assertEquals(Verdict.EXHAUSTED, result.verdict());
            assertTrue(result.lowConfidence());
            assertEquals(0, result.evidenceCount());
            assertTrue(result.rounds() <= loop.roundCap(3));
            assertEquals(180, result.windowDays());
            assertEquals(1, callsTo("gnews"));
            assertEquals(1, callsTo("reddit"));
        }

        @Test
        @DisplayName("explicit policy round cap stops the loop early")
        void policyCap() {
            tool("news", SourceTier.PRIMARY, days -> List.of());
            tool("gnews", SourceTier.ALTERNATE, days -> List.of());

            SufficiencyPolicy policy = new SufficiencyPolicy(5, List.of(2, 90, 180), 50, 1, 0, 2);
            CollectionResult result = loop(policy).collect("ZZZ.NS", "Nobody Ltd");

            assertEquals(Verdict.EXHAUSTED, result.verdict());
            assertEquals(2, result.rounds());
        }

        @Test
        @DisplayName("no tools at all is exhausted in zero rounds")
        void noTools() {
            CollectionResult result = loop(SufficiencyPolicy.defaults()).collect("TCS.NS", "Tata Consultancy");
            assertEquals(Verdict.EXHAUSTED, result.verdict());
            assertEquals(0, result.rounds());
        }
    }

    @Nested
    @DisplayName("degraded sources")
    class DegradedTests {

        @Test
        @DisplayName("unavailable tool is recorded and never called")
        void unavailableSkipped() {
            tool("news", SourceTier.PRIMARY, days -> items("n", 6));
            AtomicInteger twitterCalls = new AtomicInteger();
            registry.register(new ToolDescriptor("twitter", "social", SourceTier.SUPPLEMENTARY, PARAMS, false,
                args -> { twitterCalls.incrementAndGet(); return List.of(); }));

            CollectionResult result = loop(SufficiencyPolicy.defaults()).collect("TCS.NS", "Tata Consultancy");

            assertEquals(Verdict.SUFFICIENT, result.verdict());
            assertEquals(List.of("twitter"), result.degradedSources());
            assertEquals(0, twitterCalls.get());
        }

        @Test
        @DisplayName("failing primary falls back to the alternate source")
        void failureFallsBack() {
            registry.register(new ToolDescriptor("news", "down", SourceTier.PRIMARY, PARAMS, true,
                args -> { throw new IllegalStateException("HTTP 503"); }));
            tool("gnews", SourceTier.ALTERNATE, days -> items("g", 5));

            CollectionResult result = loop(SufficiencyPolicy.defaults()).collect("TCS.NS", "Tata Consultancy");

            assertEquals(Verdict.SUFFICIENT, result.verdict());
            assertEquals(List.of("gnews"), result.sourcesUsed());
            assertEquals(4, result.rounds());
            assertFalse(result.toolsCalled().contains("news"));
        }
    }

    @Nested
    @DisplayName("tool-call cache")
    class CacheTests {

        @Test
        @DisplayName("identical tool call within TTL is served from cache")
        void reusesToolCalls() {
            tool("news", SourceTier.PRIMARY, days -> items("n", 6));
            AdaptiveSufficiencyLoop loop = loop(SufficiencyPolicy.defaults());

            CollectionResult first = loop.collect("TCS.NS", "Tata Consultancy");
            CollectionResult second = loop.collect("TCS.NS", "Tata Consultancy");

            assertEquals(1, callsTo("news"));
            assertEquals(first.evidence(), second.evidence());
        }

        @Test
        @DisplayName("different subject is not served another subject's result")
        void keyedBySubject() {
            tool("news", SourceTier.PRIMARY, days -> items("n", 6));
            AdaptiveSufficiencyLoop loop = loop(SufficiencyPolicy.defaults());

            loop.collect("TCS.NS", "Tata Consultancy");
            loop.collect("INFY.NS", "Infosys");

            assertEquals(2, callsTo("news"));
        }
    }
}
