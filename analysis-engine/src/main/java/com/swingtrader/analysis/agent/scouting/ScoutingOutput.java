package com.swingtrader.analysis.agent.scouting;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

public record ScoutingOutput(
    @JsonProperty("shortlisted_stocks") List<ScreeningResult> shortlistedStocks,
    @JsonProperty("total_screened") int totalScreened,
    @JsonProperty("qualifying_count") int qualifyingCount,
    @JsonProperty("criteria") Map<String, Object> criteria
) {}
