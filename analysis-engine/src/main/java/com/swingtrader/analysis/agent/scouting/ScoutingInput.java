package com.swingtrader.analysis.agent.scouting;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ScoutingInput(@JsonProperty("top_n") Integer topN) {

    public static final int DEFAULT_TOP_N = 10;

    public int topNOrDefault() {
        return topN == null ? DEFAULT_TOP_N : topN;
    }
}
