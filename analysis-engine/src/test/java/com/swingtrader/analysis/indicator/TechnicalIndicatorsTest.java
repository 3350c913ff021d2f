package com.swingtrader.analysis.indicator;

import com.swingtrader.analysis.market.PriceHistories;
import com.swingtrader.analysis.market.PriceHistory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TechnicalIndicatorsTest {

    /** newest-first series of {@code n} prices rising by 1 per day up to {@code latest}. */
    private static List<Double> rising(int n, double latest) {
        List<Double> prices = new ArrayList<>();
        for (int i = 0; i < n; i++) prices.add(latest - i);
        return prices;
    }

    @Nested
    @DisplayName("RSI")
    class RsiTests {

        @Test
        @DisplayName("only gains → 100")
        void allGains() {
            assertEquals(100.0, TechnicalIndicators.rsi(rising(30, 130), 14), 1e-9);
        }

        @Test
        @DisplayName("only losses → 0")
        void allLosses() {
            List<Double> falling = new ArrayList<>();
            for (int i = 0; i < 30; i++) falling.add(100.0 + i);
            assertEquals(0.0, TechnicalIndicators.rsi(falling, 14), 1e-9);
        }

        @Test
        @DisplayName("insufficient data → NaN")
        void insufficient() {
            assertTrue(Double.isNaN(TechnicalIndicators.rsi(rising(14, 100), 14)));
        }
    }

    @Nested
    @DisplayName("moving averages")
    class AverageTests {

        @Test
        @DisplayName("SMA averages the most recent prices")
        void sma() {
            assertEquals(99.0, TechnicalIndicators.sma(rising(50, 100), 3), 1e-9);
        }

        @Test
        @DisplayName("EMA of a constant series is the constant")
        void emaConstant() {
            assertEquals(42.0, TechnicalIndicators.ema(List.of(42.0, 42.0, 42.0, 42.0, 42.0), 3), 1e-9);
        }

        @Test
        @DisplayName("EMA lags a rising series")
        void emaLags() {
            double ema = TechnicalIndicators.ema(rising(40, 140), 12);
            assertTrue(ema < 140 && ema > 120);
        }
    }

    @Nested
    @DisplayName("MACD")
    class MacdTests {

        @Test
        @DisplayName("rising series has a positive MACD line")
        void positive() {
            TechnicalIndicators.Macd macd = TechnicalIndicators.macd(rising(60, 160), 12, 26, 9);
            assertTrue(macd.isAvailable());
            assertTrue(macd.line() > 0);
        }

        @Test
        @DisplayName("needs slow + signal prices")
        void insufficient() {
            assertFalse(TechnicalIndicators.macd(rising(34, 100), 12, 26, 9).isAvailable());
        }
    }

    @Nested
    @DisplayName("ATR")
    class AtrTests {

        @Test
        @DisplayName("constant close with ±2% range → ATR% ≈ 4")
        void atrPercentage() {
            PriceHistory flat = PriceHistories.linear("X", 30, 100, 0, 0.02, 1_000_000);
            assertEquals(4.0, TechnicalIndicators.atrPercentage(flat.bars(), 14), 1e-9);
        }

        @Test
        @DisplayName("insufficient bars → NaN")
        void insufficient() {
            PriceHistory shortHistory = PriceHistories.linear("X", 10, 100, 0, 0.02, 1_000_000);
            assertTrue(Double.isNaN(TechnicalIndicators.atr(shortHistory.bars(), 14)));
        }
    }

    @Test
    @DisplayName("standard deviation of a constant series is zero")
    void stdDev() {
        assertEquals(0.0, TechnicalIndicators.stdDev(List.of(5.0, 5.0, 5.0), 3), 1e-12);
    }
}
