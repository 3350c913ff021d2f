package com.swingtrader.analysis.agent.strategist;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.swingtrader.analysis.agent.sentiment.SentimentOutput;
import com.swingtrader.analysis.agent.technical.TechnicalOutput;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StrategistInput(
    @JsonProperty("technical") TechnicalOutput technical,
    @JsonProperty("sentiment") SentimentOutput sentiment
) {}
