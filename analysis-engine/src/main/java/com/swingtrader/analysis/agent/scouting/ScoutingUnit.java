package com.swingtrader.analysis.agent.scouting;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.swingtrader.analysis.market.MarketDataException;
import com.swingtrader.analysis.market.PriceHistory;
import com.swingtrader.analysis.market.StockDataProvider;
import com.swingtrader.analysis.market.StockListing;
import com.swingtrader.common.exception.UnitExecutionException;
import com.swingtrader.common.unit.AbstractAgentUnit;

import java.util.ArrayList;
import java.util.List;

/**
 * Root unit: screens the configured universe and shortlists the best swing candidates.
 */
public class ScoutingUnit extends AbstractAgentUnit<ScoutingInput> {

    public static final String TYPE = "scouting";

    private final StockDataProvider dataProvider;
    private final List<StockListing> universe;

    public ScoutingUnit(String unitId, StockDataProvider dataProvider, List<StockListing> universe,
                        ObjectMapper objectMapper) {
        super(unitId, ScoutingInput.class, objectMapper);
        this.dataProvider = dataProvider;
        this.universe     = List.copyOf(universe);
    }

    @Override
    protected void collectViolations(ScoutingInput input, List<String> violations) {
        int topN = input.topNOrDefault();
        if (topN < 1 || topN > 50) {
            violations.add("top_n must be between 1 and 50, got " + topN);
        }
    }

    @Override
    protected ScoutingOutput run(ScoutingInput input) {
        int topN = input.topNOrDefault();
        log.info("[{}] Screening universe. symbols={} topN={}", unitName(), universe.size(), topN);

        List<ScreeningResult> screened = new ArrayList<>();
        for (StockListing listing : universe) {
            try {
                PriceHistory history = dataProvider.fetchHistory(listing.symbol());
                ScreeningResult result = StockScreener.screen(listing.symbol(), listing.name(), history);
                if (result == null) {
                    log.warn("[{}] Insufficient history, skipping. symbol={}", unitName(), listing.symbol());
                } else {
                    screened.add(result);
                }
            } catch (MarketDataException e) {
                log.warn("[{}] Price history unavailable, skipping. symbol={} error={}",
                    unitName(), listing.symbol(), e.getMessage());
            }
        }
        if (screened.isEmpty()) {
            throw new UnitExecutionException(unitName(), "no symbol in the universe could be screened");
        }

        List<ScreeningResult> shortlist = StockScreener.shortlist(screened, topN);
        int qualifying = (int) screened.stream().filter(ScreeningResult::meetsCriteria).count();
        log.info("[{}] Screening complete. screened={} qualifying={} shortlisted={}",
            unitName(), screened.size(), qualifying, shortlist.size());
        return new ScoutingOutput(shortlist, screened.size(), qualifying, StockScreener.criteria());
    }
}
