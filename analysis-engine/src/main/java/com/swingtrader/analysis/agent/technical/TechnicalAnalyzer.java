package com.swingtrader.analysis.agent.technical;

import com.swingtrader.analysis.indicator.TechnicalIndicators;
import com.swingtrader.analysis.market.PriceHistory;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns price history into trend, signals, a 0–100 strength score and a recommendation.
 */
public final class TechnicalAnalyzer {

    public static final String BULLISH = "bullish";
    public static final String BEARISH = "bearish";
    public static final String NEUTRAL = "neutral";

    public static final int MIN_BARS = 50;

    private TechnicalAnalyzer() {}

    /**
     * @return the analysis, or {@code null} when fewer than {@link #MIN_BARS} bars are available
     */
    public static TechnicalAnalysis analyze(String symbol, String name, double currentPrice, PriceHistory history) {
        if (history == null || history.size() < MIN_BARS) {
            return null;
        }
        List<Double> closes = history.closes();
        double rsi = TechnicalIndicators.rsi(closes, 14);
        TechnicalIndicators.Macd macd = TechnicalIndicators.macd(closes, 12, 26, 9);
        double sma20 = TechnicalIndicators.sma(closes, 20);
        double sma50 = TechnicalIndicators.sma(closes, 50);

        IndicatorSnapshot indicators = new IndicatorSnapshot(
            orNull(rsi), orNull(macd.line()), orNull(macd.signal()), orNull(macd.histogram()),
            orNull(sma20), orNull(sma50),
            orNull(TechnicalIndicators.ema(closes, 12)), orNull(TechnicalIndicators.ema(closes, 26)));

        String trend = trend(currentPrice, sma20, sma50);
        double strength = strength(rsi, macd.histogram(), trend);
        return new TechnicalAnalysis(symbol, name, currentPrice, indicators, trend, strength,
            signals(rsi, macd, trend), recommendation(strength));
    }

    public static String trend(double price, double sma20, double sma50) {
        if (Double.isNaN(sma20) || Double.isNaN(sma50)) return NEUTRAL;
        if (price > sma20 && sma20 > sma50) return BULLISH;
        if (price < sma20 && sma20 < sma50) return BEARISH;
        return NEUTRAL;
    }

    public static List<String> signals(double rsi, TechnicalIndicators.Macd macd, String trend) {
        List<String> signals = new ArrayList<>();
        if (!Double.isNaN(rsi)) {
            if (rsi < 30) signals.add("RSI Oversold (<30)");
            else if (rsi > 70) signals.add("RSI Overbought (>70)");
            else if (rsi >= 40 && rsi <= 60) signals.add("RSI Neutral");
        }
        if (macd.isAvailable()) {
            signals.add(macd.line() > macd.signal() ? "MACD Bullish (above signal)" : "MACD Bearish (below signal)");
        }
        signals.add("Trend: " + Character.toUpperCase(trend.charAt(0)) + trend.substring(1));
        return signals;
    }

    /** Starts at 50; RSI ±20, MACD histogram ±15, trend ±15; clamped to 0–100. */
    public static double strength(double rsi, double macdHistogram, String trend) {
        double score = 50.0;
        if (!Double.isNaN(rsi)) {
            if (rsi < 30) score += 20;
            else if (rsi > 70) score -= 20;
            else if (rsi >= 40 && rsi <= 60) score += 5;
        }
        if (!Double.isNaN(macdHistogram)) {
            double contribution = Math.min(15, Math.abs(macdHistogram) * 10);
            score += macdHistogram > 0 ? contribution : -contribution;
        }
        if (BULLISH.equals(trend)) score += 15;
        else if (BEARISH.equals(trend)) score -= 15;
        return Math.max(0, Math.min(100, score));
    }

    public static String recommendation(double strength) {
        if (strength >= 70) return "strong_buy";
        if (strength >= 55) return "buy";
        if (strength >= 45) return "hold";
        if (strength >= 30) return "sell";
        return "strong_sell";
    }

    private static Double orNull(double v) {
        return Double.isNaN(v) ? null : v;
    }
}
