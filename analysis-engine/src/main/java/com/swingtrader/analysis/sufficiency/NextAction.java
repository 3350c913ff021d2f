package com.swingtrader.analysis.sufficiency;

public enum NextAction {
    PROCEED,
    EXPAND_TIMEFRAME,
    TRY_ALTERNATE_SOURCE,
    EXHAUSTED
}
