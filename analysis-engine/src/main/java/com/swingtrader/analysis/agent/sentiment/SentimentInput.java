package com.swingtrader.analysis.agent.sentiment;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.swingtrader.analysis.agent.StockRef;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SentimentInput(@JsonProperty("stocks") List<StockRef> stocks) {}
