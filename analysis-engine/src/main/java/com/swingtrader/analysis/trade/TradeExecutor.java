package com.swingtrader.analysis.trade;

/**
 * Places market buy orders. Implementations report failures through {@link OrderResult}
 * rather than by throwing.
 */
public interface TradeExecutor {

    OrderResult placeMarketBuy(String symbol, int quantity);

    boolean isPaperTrading();
}
