package com.swingtrader.analysis.agent.strategist;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.swingtrader.analysis.trade.OrderResult;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StrategistOutput(
    @JsonProperty("decisions") List<TradingDecision> decisions,
    @JsonProperty("top_pick") TradingDecision topPick,
    @JsonProperty("order_executed") boolean orderExecuted,
    @JsonProperty("order_details") OrderResult orderDetails,
    @JsonProperty("execution_reason") String executionReason
) {}
