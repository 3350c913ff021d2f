package com.swingtrader.analysis.agent;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The part of a shortlisted stock that downstream units read. Extra fields sent by the
 * producer are ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StockRef(
    @JsonProperty("symbol") String symbol,
    @JsonProperty("name") String name,
    @JsonProperty("current_price") Double currentPrice
) {
    public String displayName() {
        return name == null || name.isBlank() ? symbol : name;
    }
}
