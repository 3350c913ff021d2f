package com.swingtrader.analysis.agent.strategist;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.swingtrader.analysis.trade.OrderResult;
import com.swingtrader.analysis.trade.TradeExecutor;
import com.swingtrader.common.unit.AbstractAgentUnit;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Sink unit: turns technical and sentiment results into decisions and places at most one
 * order, for the most confident buy at or above the confidence threshold.
 */
public class StrategistUnit extends AbstractAgentUnit<StrategistInput> {

    public static final String TYPE = "strategist";
    public static final double DEFAULT_MIN_CONFIDENCE = 0.75;

    private final DecisionMaker decisionMaker;
    private final TradeExecutor tradeExecutor;
    private final double minConfidence;

    public StrategistUnit(String unitId, DecisionMaker decisionMaker, TradeExecutor tradeExecutor,
                          double minConfidence, ObjectMapper objectMapper) {
        super(unitId, StrategistInput.class, objectMapper);
        this.decisionMaker = decisionMaker;
        this.tradeExecutor = tradeExecutor;
        this.minConfidence = minConfidence;
    }

    /** Places orders, so a stored output must never stand in for a run. */
    @Override
    public boolean cacheable() {
        return false;
    }

    @Override
    protected void collectViolations(StrategistInput input, List<String> violations) {
        if (input.technical() == null || input.technical().analyzedStocks() == null) {
            violations.add("technical.analyzed_stocks is required");
        }
        if (input.sentiment() == null || input.sentiment().analyzedStocks() == null) {
            violations.add("sentiment.analyzed_stocks is required");
        }
    }

    @Override
    protected StrategistOutput run(StrategistInput input) {
        List<TradingDecision> decisions = decisionMaker.decide(
            input.technical().analyzedStocks(), input.sentiment().analyzedStocks());
        if (decisions.isEmpty()) {
            log.warn("[{}] No trading decisions made.", unitName());
            return new StrategistOutput(List.of(), null, false, null, null);
        }

        Optional<TradingDecision> topPick = decisions.stream()
            .filter(d -> d.isBuy() && d.confidence() >= minConfidence)
            .max(Comparator.comparingDouble(TradingDecision::confidence)
                .thenComparingDouble(TradingDecision::combinedScore));

        if (topPick.isEmpty()) {
            log.info("[{}] Strategy complete without order. decisions={}", unitName(), decisions.size());
            return new StrategistOutput(decisions, null, false, null,
                String.format(Locale.ROOT, "No buy decision at or above confidence threshold %.2f", minConfidence));
        }

        TradingDecision pick = topPick.get();
        log.info("[{}] Top pick selected. symbol={} confidence={} paper={}",
            unitName(), pick.symbol(), pick.confidence(), tradeExecutor.isPaperTrading());
        OrderResult order = pick.quantity() == null || pick.quantity() <= 0
            ? OrderResult.error("Invalid quantity")
            : tradeExecutor.placeMarketBuy(pick.symbol(), pick.quantity());

        if (order.isSuccess()) {
            log.info("[{}] Order executed. orderId={}", unitName(), order.orderId());
            return new StrategistOutput(decisions, pick, true, order,
                String.format(Locale.ROOT, "High confidence (%.2f) buy signal for %s", pick.confidence(), pick.symbol()));
        }
        log.warn("[{}] Order not executed. symbol={} reason={}", unitName(), pick.symbol(), order.explanation());
        return new StrategistOutput(decisions, pick, false, order, "Order not executed: " + order.explanation());
    }
}
