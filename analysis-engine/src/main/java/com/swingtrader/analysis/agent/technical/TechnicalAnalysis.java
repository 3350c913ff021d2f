package com.swingtrader.analysis.agent.technical;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TechnicalAnalysis(
    @JsonProperty("symbol") String symbol,
    @JsonProperty("name") String name,
    @JsonProperty("current_price") double currentPrice,
    @JsonProperty("indicators") IndicatorSnapshot indicators,
    @JsonProperty("trend") String trend,
    @JsonProperty("strength") double strength,
    @JsonProperty("signals") List<String> signals,
    @JsonProperty("recommendation") String recommendation
) {}
