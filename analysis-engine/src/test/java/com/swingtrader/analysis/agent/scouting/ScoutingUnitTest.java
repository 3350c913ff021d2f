package com.swingtrader.analysis.agent.scouting;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.swingtrader.analysis.market.FakeStockDataProvider;
import com.swingtrader.analysis.market.PriceHistories;
import com.swingtrader.analysis.market.StockListing;
import com.swingtrader.common.unit.ErrorKind;
import com.swingtrader.common.unit.UnitOutcome;
import com.swingtrader.common.unit.UnitStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ScoutingUnitTest {

    private static final List<StockListing> UNIVERSE = List.of(
        new StockListing("AAA.NS", "Alpha"),
        new StockListing("BBB.NS", "Beta"),
        new StockListing("CCC.NS", "Gamma"),
        new StockListing("DDD.NS", "Delta"),
        new StockListing("EEE.NS", "Epsilon"),
        new StockListing("FFF.NS", "Phi"));

    // ATR% = 2 × range: AAA 3.0, BBB 3.5, CCC 4.0, DDD 2.5, EEE 0.5 (too calm); FFF has no data
    private final FakeStockDataProvider provider = new FakeStockDataProvider()
        .with(PriceHistories.linear("AAA.NS", 40, 100, 0, 0.015, 1_000_000))
        .with(PriceHistories.linear("BBB.NS", 40, 100, 0, 0.0175, 1_000_000))
        .with(PriceHistories.linear("CCC.NS", 40, 100, 0, 0.02, 1_000_000))
        .with(PriceHistories.linear("DDD.NS", 40, 100, 0, 0.0125, 1_000_000))
        .with(PriceHistories.linear("EEE.NS", 40, 100, 0, 0.0025, 1_000_000));

    private final ScoutingUnit unit = new ScoutingUnit("scouting", provider, UNIVERSE, new ObjectMapper());

    @Nested
    @DisplayName("screening")
    class ScreeningTests {

        @Test
        @DisplayName("top_n=3 shortlists the three best qualifying stocks")
        @SuppressWarnings("unchecked")
        void shortlistsTopN() {
            UnitOutcome outcome = unit.execute(Map.of("top_n", 3));

            assertEquals(UnitStatus.SUCCEEDED, outcome.status());
            List<Map<String, Object>> shortlisted = (List<Map<String, Object>>) outcome.output().get("shortlisted_stocks");
            assertEquals(3, shortlisted.size());
            assertEquals("BBB.NS", shortlisted.get(0).get("symbol"));
            assertFalse(shortlisted.stream().anyMatch(s -> "EEE.NS".equals(s.get("symbol"))));
            assertFalse(shortlisted.stream().anyMatch(s -> "DDD.NS".equals(s.get("symbol"))));
            assertEquals(5, outcome.output().get("total_screened"));
            assertEquals(4, outcome.output().get("qualifying_count"));
            assertNotNull(outcome.output().get("criteria"));
        }

        @Test
        @DisplayName("fewer qualifying than requested falls back to score ranking")
        @SuppressWarnings("unchecked")
        void scoreFallback() {
            UnitOutcome outcome = unit.execute(Map.of("top_n", 5));

            List<Map<String, Object>> shortlisted = (List<Map<String, Object>>) outcome.output().get("shortlisted_stocks");
            assertEquals(5, shortlisted.size());
            assertEquals("EEE.NS", shortlisted.get(4).get("symbol"));
            assertTrue(shortlisted.stream().allMatch(s -> s.get("score") != null));
        }

        @Test
        @DisplayName("top_n defaults to 10")
        void defaultTopN() {
            UnitOutcome outcome = unit.execute(Map.of());
            assertTrue(outcome.isSuccess());
            assertEquals(5, ((List<?>) outcome.output().get("shortlisted_stocks")).size());
        }
    }

    @Nested
    @DisplayName("failures")
    class FailureTests {

        @Test
        @DisplayName("top_n outside 1..50 is a validation failure")
        void outOfRange() {
            UnitOutcome outcome = unit.execute(Map.of("top_n", 0));
            assertEquals(ErrorKind.VALIDATION, outcome.errorKind());
            assertTrue(outcome.message().contains("top_n"));
            assertEquals(0, provider.fetchCount());
        }

        @Test
        @DisplayName("nothing screenable is an execution failure")
        void nothingScreenable() {
            ScoutingUnit empty = new ScoutingUnit("scouting", new FakeStockDataProvider(), UNIVERSE, new ObjectMapper());
            UnitOutcome outcome = empty.execute(Map.of("top_n", 3));
            assertEquals(UnitStatus.FAILED, outcome.status());
            assertEquals(ErrorKind.UNIT_EXECUTION, outcome.errorKind());
        }
    }

    @Test
    @DisplayName("score favours ATR near the ideal band centre")
    void scoreIdeal() {
        ScreeningResult ideal = StockScreener.screen("BBB.NS", "Beta", PriceHistories.linear("BBB.NS", 40, 100, 0, 0.0175, 1_000_000));
        ScreeningResult edge = StockScreener.screen("DDD.NS", "Delta", PriceHistories.linear("DDD.NS", 40, 100, 0, 0.0125, 1_000_000));
        assertTrue(StockScreener.score(ideal) > StockScreener.score(edge));
        assertNull(StockScreener.screen("X", "X", PriceHistories.linear("X", 10, 100, 0, 0.02, 1_000_000)));
    }
}
