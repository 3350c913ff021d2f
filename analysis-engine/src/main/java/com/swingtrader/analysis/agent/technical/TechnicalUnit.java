package com.swingtrader.analysis.agent.technical;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.swingtrader.analysis.agent.StockRef;
import com.swingtrader.analysis.market.MarketDataException;
import com.swingtrader.analysis.market.StockDataProvider;
import com.swingtrader.common.unit.AbstractAgentUnit;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes indicators for each shortlisted stock. A stock whose history cannot be fetched
 * or is too short is left out of the output rather than failing the unit.
 */
public class TechnicalUnit extends AbstractAgentUnit<TechnicalInput> {

    public static final String TYPE = "technical";

    private final StockDataProvider dataProvider;

    public TechnicalUnit(String unitId, StockDataProvider dataProvider, ObjectMapper objectMapper) {
        super(unitId, TechnicalInput.class, objectMapper);
        this.dataProvider = dataProvider;
    }

    @Override
    protected void collectViolations(TechnicalInput input, List<String> violations) {
        if (input.stocks() == null || input.stocks().isEmpty()) {
            violations.add("stocks must be a non-empty list");
            return;
        }
        for (int i = 0; i < input.stocks().size(); i++) {
            StockRef stock = input.stocks().get(i);
            if (stock == null || stock.symbol() == null || stock.symbol().isBlank()) {
                violations.add("stocks[" + i + "].symbol is required");
            }
            if (stock == null || stock.currentPrice() == null || stock.currentPrice() <= 0) {
                violations.add("stocks[" + i + "].current_price must be positive");
            }
        }
    }

    @Override
    protected TechnicalOutput run(TechnicalInput input) {
        List<TechnicalAnalysis> analyzed = new ArrayList<>();
        for (StockRef stock : input.stocks()) {
            try {
                TechnicalAnalysis analysis = TechnicalAnalyzer.analyze(stock.symbol(), stock.displayName(),
                    stock.currentPrice(), dataProvider.fetchHistory(stock.symbol()));
                if (analysis == null) {
                    log.warn("[{}] Insufficient history, skipping. symbol={}", unitName(), stock.symbol());
                    continue;
                }
                log.info("[{}] Analyzed. symbol={} trend={} strength={} recommendation={}",
                    unitName(), stock.symbol(), analysis.trend(), analysis.strength(), analysis.recommendation());
                analyzed.add(analysis);
            } catch (MarketDataException e) {
                log.warn("[{}] Price history unavailable, skipping. symbol={} error={}",
                    unitName(), stock.symbol(), e.getMessage());
            }
        }
        int bullish = count(analyzed, TechnicalAnalyzer.BULLISH);
        int bearish = count(analyzed, TechnicalAnalyzer.BEARISH);
        return new TechnicalOutput(analyzed, analyzed.size(), bullish, bearish, analyzed.size() - bullish - bearish);
    }

    private static int count(List<TechnicalAnalysis> analyzed, String trend) {
        return (int) analyzed.stream().filter(a -> trend.equals(a.trend())).count();
    }
}
