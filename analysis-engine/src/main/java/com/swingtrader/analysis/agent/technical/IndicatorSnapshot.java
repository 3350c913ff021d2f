package com.swingtrader.analysis.agent.technical;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Indicator values; {@code null} where history was too short. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IndicatorSnapshot(
    @JsonProperty("rsi") Double rsi,
    @JsonProperty("macd") Double macd,
    @JsonProperty("macd_signal") Double macdSignal,
    @JsonProperty("macd_histogram") Double macdHistogram,
    @JsonProperty("sma_20") Double sma20,
    @JsonProperty("sma_50") Double sma50,
    @JsonProperty("ema_12") Double ema12,
    @JsonProperty("ema_26") Double ema26
) {}
