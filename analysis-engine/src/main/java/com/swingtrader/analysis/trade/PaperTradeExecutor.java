package com.swingtrader.analysis.trade;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Simulated broker. Every valid order succeeds with a {@code PAPER_<symbol>_<qty>} id and is
 * remembered for inspection.
 */
public class PaperTradeExecutor implements TradeExecutor {

    private static final Logger log = LoggerFactory.getLogger(PaperTradeExecutor.class);

    private final List<OrderResult> placed = new CopyOnWriteArrayList<>();

    @Override
    public OrderResult placeMarketBuy(String symbol, int quantity) {
        if (symbol == null || symbol.isBlank()) {
            return OrderResult.error("Symbol is required");
        }
        if (quantity <= 0) {
            return OrderResult.error("Invalid quantity");
        }
        log.info("[PAPER] Simulating BUY order. symbol={} quantity={} type=MARKET", symbol, quantity);
        OrderResult result = new OrderResult(OrderResult.SUCCESS, "PAPER_" + symbol + "_" + quantity,
            symbol, quantity, "MARKET", "BUY", true, "Order simulated (paper trading mode)", null, null);
        placed.add(result);
        return result;
    }

    @Override
    public boolean isPaperTrading() {
        return true;
    }

    public List<OrderResult> placedOrders() {
        return List.copyOf(placed);
    }
}
