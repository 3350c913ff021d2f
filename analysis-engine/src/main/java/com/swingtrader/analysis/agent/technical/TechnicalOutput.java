package com.swingtrader.analysis.agent.technical;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TechnicalOutput(
    @JsonProperty("analyzed_stocks") List<TechnicalAnalysis> analyzedStocks,
    @JsonProperty("total_analyzed") int totalAnalyzed,
    @JsonProperty("bullish_count") int bullishCount,
    @JsonProperty("bearish_count") int bearishCount,
    @JsonProperty("neutral_count") int neutralCount
) {}
