package com.swingtrader.analysis.market;

/**
 * Source of daily price history. Implementations block the calling thread; units run on
 * {@code boundedElastic} workers so blocking here is expected.
 */
public interface StockDataProvider {

    /**
     * @return bars newest-first
     * @throws MarketDataException if the provider returned nothing usable
     */
    PriceHistory fetchHistory(String symbol);
}
