package com.swingtrader.analysis.agent.scouting;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScreeningResult(
    @JsonProperty("symbol") String symbol,
    @JsonProperty("name") String name,
    @JsonProperty("current_price") double currentPrice,
    @JsonProperty("atr_percentage") Double atrPercentage,
    @JsonProperty("avg_volume") double avgVolume,
    @JsonProperty("recent_volume") double recentVolume,
    @JsonProperty("volume_ratio") double volumeRatio,
    @JsonProperty("meets_criteria") boolean meetsCriteria,
    @JsonProperty("criteria_details") List<String> criteriaDetails,
    @JsonProperty("score") Double score
) {
    ScreeningResult withScore(double value) {
        return new ScreeningResult(symbol, name, currentPrice, atrPercentage, avgVolume, recentVolume,
            volumeRatio, meetsCriteria, criteriaDetails, value);
    }
}
