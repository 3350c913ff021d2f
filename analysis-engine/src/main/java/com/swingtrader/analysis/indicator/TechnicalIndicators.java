package com.swingtrader.analysis.indicator;

import com.swingtrader.analysis.market.PriceBar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Pure calculation utilities for technical indicators.
 * Input series are expected newest-first (index 0 = most recent session).
 * Every method returns NaN when the series is too short.
 */
public final class TechnicalIndicators {

    private TechnicalIndicators() {}

    public record Macd(double line, double signal, double histogram) {
        static final Macd UNAVAILABLE = new Macd(Double.NaN, Double.NaN, Double.NaN);

        public boolean isAvailable() {
            return !Double.isNaN(line) && !Double.isNaN(signal);
        }
    }

    // ── RSI ─────────────────────────────────────────────────────────────────

    /**
     * RSI using Wilder's smoothed moving average.
     * @param prices  closing prices, newest-first
     * @param period  lookback period (typically 14)
     * @return RSI value 0–100, or NaN if insufficient data
     */
    public static double rsi(List<Double> prices, int period) {
        if (prices == null || prices.size() < period + 1) return Double.NaN;

        List<Double> oldest = oldestFirst(prices);
        int n = oldest.size();

        double avgGain = 0;
        double avgLoss = 0;

        for (int i = 1; i <= period; i++) {
            double change = oldest.get(i) - oldest.get(i - 1);
            if (change > 0) avgGain += change;
            else avgLoss += Math.abs(change);
        }
        avgGain /= period;
        avgLoss /= period;

        for (int i = period + 1; i < n; i++) {
            double change = oldest.get(i) - oldest.get(i - 1);
            double gain = Math.max(change, 0);
            double loss = Math.max(-change, 0);
            avgGain = (avgGain * (period - 1) + gain) / period;
            avgLoss = (avgLoss * (period - 1) + loss) / period;
        }

        if (avgLoss == 0) return 100.0;
        double rs = avgGain / avgLoss;
        return 100.0 - (100.0 / (1.0 + rs));
    }

    // ── Moving averages ─────────────────────────────────────────────────────

    public static double sma(List<Double> prices, int period) {
        if (prices == null || prices.size() < period) return Double.NaN;
        double sum = 0;
        for (int i = 0; i < period; i++) sum += prices.get(i);
        return sum / period;
    }

    /** Most recent EMA value, seeded with the oldest price. */
    public static double ema(List<Double> prices, int period) {
        if (prices == null || prices.size() < period) return Double.NaN;
        List<Double> series = emaSeries(oldestFirst(prices), period);
        return series.get(series.size() - 1);
    }

    // ── MACD ────────────────────────────────────────────────────────────────

    /**
     * MACD line = EMA(fast) - EMA(slow); signal = EMA(signalPeriod) of the line.
     * Needs at least {@code slow + signalPeriod} prices.
     */
    public static Macd macd(List<Double> prices, int fast, int slow, int signalPeriod) {
        if (prices == null || prices.size() < slow + signalPeriod) return Macd.UNAVAILABLE;
        List<Double> oldest = oldestFirst(prices);
        List<Double> fastSeries = emaSeries(oldest, fast);
        List<Double> slowSeries = emaSeries(oldest, slow);
        List<Double> line = new ArrayList<>(oldest.size());
        for (int i = 0; i < oldest.size(); i++) {
            line.add(fastSeries.get(i) - slowSeries.get(i));
        }
        List<Double> signalSeries = emaSeries(line, signalPeriod);
        double lastLine   = line.get(line.size() - 1);
        double lastSignal = signalSeries.get(signalSeries.size() - 1);
        return new Macd(lastLine, lastSignal, lastLine - lastSignal);
    }

    // ── Volatility ──────────────────────────────────────────────────────────

    /**
     * Average True Range: mean of the last {@code period} true ranges.
     * @param bars daily bars, newest-first
     */
    public static double atr(List<PriceBar> bars, int period) {
        if (bars == null || bars.size() < period + 1) return Double.NaN;
        double sum = 0;
        for (int i = 0; i < period; i++) {
            PriceBar today = bars.get(i);
            double prevClose = bars.get(i + 1).close();
            double trueRange = Math.max(today.high() - today.low(),
                Math.max(Math.abs(today.high() - prevClose), Math.abs(today.low() - prevClose)));
            sum += trueRange;
        }
        return sum / period;
    }

    /** ATR as a percentage of the latest close. */
    public static double atrPercentage(List<PriceBar> bars, int period) {
        double atr = atr(bars, period);
        if (Double.isNaN(atr)) return Double.NaN;
        double close = bars.get(0).close();
        if (close == 0) return Double.NaN;
        return atr / close * 100.0;
    }

    public static double stdDev(List<Double> prices, int period) {
        if (prices == null || prices.size() < period) return Double.NaN;
        double mean = sma(prices, period);
        double variance = 0;
        for (int i = 0; i < period; i++) {
            double diff = prices.get(i) - mean;
            variance += diff * diff;
        }
        return Math.sqrt(variance / period);
    }

    // ── helpers ─────────────────────────────────────────────────────────────

    private static List<Double> emaSeries(List<Double> oldest, int period) {
        double k = 2.0 / (period + 1);
        List<Double> out = new ArrayList<>(oldest.size());
        double ema = oldest.get(0);
        out.add(ema);
        for (int i = 1; i < oldest.size(); i++) {
            ema = oldest.get(i) * k + ema * (1 - k);
            out.add(ema);
        }
        return out;
    }

    private static List<Double> oldestFirst(List<Double> newestFirst) {
        List<Double> copy = new ArrayList<>(newestFirst);
        Collections.reverse(copy);
        return copy;
    }
}
