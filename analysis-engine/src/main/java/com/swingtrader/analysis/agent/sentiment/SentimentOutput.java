package com.swingtrader.analysis.agent.sentiment;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SentimentOutput(
    @JsonProperty("analyzed_stocks") List<StockSentiment> analyzedStocks,
    @JsonProperty("total_analyzed") int totalAnalyzed,
    @JsonProperty("positive_count") int positiveCount,
    @JsonProperty("negative_count") int negativeCount,
    @JsonProperty("neutral_count") int neutralCount
) {}
