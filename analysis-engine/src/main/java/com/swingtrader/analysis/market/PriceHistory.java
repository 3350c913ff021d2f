package com.swingtrader.analysis.market;

import java.util.List;

/**
 * Daily bars for one symbol, newest-first (index 0 = most recent session).
 */
public record PriceHistory(String symbol, List<PriceBar> bars) {

    public PriceHistory {
        bars = List.copyOf(bars);
    }

    public int size() {
        return bars.size();
    }

    public boolean isEmpty() {
        return bars.isEmpty();
    }

    public double latestClose() {
        return bars.get(0).close();
    }

    public List<Double> closes() {
        return bars.stream().map(PriceBar::close).toList();
    }

    public List<Long> volumes() {
        return bars.stream().map(PriceBar::volume).toList();
    }
}
