package com.swingtrader.analysis.agent.technical;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.swingtrader.analysis.agent.StockRef;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TechnicalInput(@JsonProperty("stocks") List<StockRef> stocks) {}
