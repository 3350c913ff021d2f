package com.swingtrader.analysis.agent.scouting;

import com.swingtrader.analysis.indicator.TechnicalIndicators;
import com.swingtrader.analysis.market.PriceHistory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Pure screening rules for swing-trade candidates: volatility in a tradable band and
 * enough, currently active, liquidity.
 */
public final class StockScreener {

    public static final int    ATR_PERIOD        = 14;
    public static final double MIN_ATR_PCT       = 2.0;
    public static final double MAX_ATR_PCT       = 5.0;
    public static final double IDEAL_ATR_PCT     = 3.5;
    public static final double MIN_VOLUME_RATIO  = 0.8;
    public static final double MIN_AVG_VOLUME    = 100_000;
    public static final int    RECENT_SESSIONS   = 5;
    public static final int    MIN_BARS          = 20;

    private StockScreener() {}

    public static Map<String, Object> criteria() {
        Map<String, Object> c = new LinkedHashMap<>();
        c.put("atr_range", MIN_ATR_PCT + "-" + MAX_ATR_PCT + "%");
        c.put("min_volume_ratio", MIN_VOLUME_RATIO);
        c.put("min_avg_volume", (long) MIN_AVG_VOLUME);
        return c;
    }

    /**
     * @return the screening result, or {@code null} when the history is too short to judge
     */
    public static ScreeningResult screen(String symbol, String name, PriceHistory history) {
        if (history == null || history.size() < MIN_BARS) {
            return null;
        }
        double currentPrice = history.latestClose();
        double atrPct = TechnicalIndicators.atrPercentage(history.bars(), ATR_PERIOD);

        List<Long> volumes = history.volumes();
        double avgVolume = volumes.stream().mapToLong(Long::longValue).average().orElse(0);
        int recentCount = Math.min(RECENT_SESSIONS, volumes.size());
        double recentVolume = volumes.subList(0, recentCount).stream().mapToLong(Long::longValue).average().orElse(0);
        double volumeRatio = avgVolume > 0 ? recentVolume / avgVolume : 0;

        boolean meets = true;
        List<String> details = new ArrayList<>();
        if (Double.isNaN(atrPct)) {
            meets = false;
            details.add("ATR calculation failed");
        } else if (atrPct < MIN_ATR_PCT) {
            meets = false;
            details.add(String.format(Locale.ROOT, "ATR too low: %.2f%%", atrPct));
        } else if (atrPct > MAX_ATR_PCT) {
            meets = false;
            details.add(String.format(Locale.ROOT, "ATR too high: %.2f%%", atrPct));
        } else {
            details.add(String.format(Locale.ROOT, "ATR OK: %.2f%%", atrPct));
        }
        if (volumeRatio < MIN_VOLUME_RATIO) {
            meets = false;
            details.add(String.format(Locale.ROOT, "Volume ratio low: %.2f", volumeRatio));
        } else {
            details.add(String.format(Locale.ROOT, "Volume ratio OK: %.2f", volumeRatio));
        }
        if (avgVolume < MIN_AVG_VOLUME) {
            meets = false;
            details.add(String.format(Locale.ROOT, "Avg volume too low: %.0f", avgVolume));
        } else {
            details.add(String.format(Locale.ROOT, "Avg volume OK: %.0f", avgVolume));
        }

        return new ScreeningResult(symbol, name, currentPrice, Double.isNaN(atrPct) ? null : atrPct,
            avgVolume, recentVolume, volumeRatio, meets, List.copyOf(details), null);
    }

    /** Higher is better. ATR closest to the ideal band centre scores most. */
    public static double score(ScreeningResult stock) {
        double score = 0;
        Double atr = stock.atrPercentage();
        if (atr != null) {
            if (atr >= MIN_ATR_PCT && atr <= MAX_ATR_PCT) {
                score += 50.0 - Math.abs(atr - IDEAL_ATR_PCT) * 10.0;
            } else {
                score -= 20.0;
            }
        }
        score += stock.volumeRatio() * 30.0;
        score += Math.min(stock.avgVolume() / 1_000_000.0, 1.0) * 20.0;
        return score;
    }

    /**
     * Top {@code topN} candidates. When enough stocks meet every criterion they are ranked by
     * volume ratio, then ATR closeness to ideal; otherwise all screened stocks are ranked by
     * {@link #score}.
     */
    public static List<ScreeningResult> shortlist(List<ScreeningResult> results, int topN) {
        List<ScreeningResult> qualifying = results.stream().filter(ScreeningResult::meetsCriteria).toList();
        if (qualifying.size() >= topN) {
            Comparator<ScreeningResult> byRatio = Comparator.comparingDouble(ScreeningResult::volumeRatio);
            Comparator<ScreeningResult> byAtrFit = Comparator.comparingDouble(
                r -> r.atrPercentage() == null ? 0.0 : -Math.abs(r.atrPercentage() - IDEAL_ATR_PCT));
            return qualifying.stream()
                .sorted(byRatio.thenComparing(byAtrFit).reversed())
                .limit(topN)
                .toList();
        }
        return results.stream()
            .map(r -> r.withScore(score(r)))
            .sorted(Comparator.comparingDouble(ScreeningResult::score).reversed())
            .limit(topN)
            .toList();
    }
}
