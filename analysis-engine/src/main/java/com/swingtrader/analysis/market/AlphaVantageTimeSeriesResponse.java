package com.swingtrader.analysis.market;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AlphaVantageTimeSeriesResponse(
    @JsonProperty("Time Series (Daily)") Map<String, DailyBar> timeSeriesDaily,
    @JsonProperty("Note") String note,
    @JsonProperty("Information") String information,
    @JsonProperty("Error Message") String errorMessage
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DailyBar(
        @JsonProperty("1. open") String open,
        @JsonProperty("2. high") String high,
        @JsonProperty("3. low") String low,
        @JsonProperty("4. close") String close,
        @JsonProperty("5. volume") String volume
    ) {}

    /** Rate-limit notes and error messages arrive with HTTP 200, so they are surfaced here. */
    public String problem() {
        if (errorMessage != null) return errorMessage;
        if (note != null) return note;
        return information;
    }
}
