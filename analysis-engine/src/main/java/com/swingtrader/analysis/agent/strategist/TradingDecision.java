package com.swingtrader.analysis.agent.strategist;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Final call on one symbol. Sizing fields are only populated for buys.
 *
 * @param technicalScore technical strength, 0 to 100
 * @param sentimentScore sentiment score, -1 to 1
 * @param combinedScore  blended score, 0 to 100
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record TradingDecision(
    @JsonProperty("symbol") String symbol,
    @JsonProperty("name") String name,
    @JsonProperty("action") String action,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("reasoning") String reasoning,
    @JsonProperty("technical_score") double technicalScore,
    @JsonProperty("sentiment_score") double sentimentScore,
    @JsonProperty("combined_score") double combinedScore,
    @JsonProperty("quantity") Integer quantity,
    @JsonProperty("stop_loss") Double stopLoss,
    @JsonProperty("target_price") Double targetPrice
) {
    public static final String BUY  = "buy";
    public static final String HOLD = "hold";
    public static final String SELL = "sell";

    public boolean isBuy() {
        return BUY.equals(action);
    }
}
