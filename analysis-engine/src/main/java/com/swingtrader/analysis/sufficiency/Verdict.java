package com.swingtrader.analysis.sufficiency;

public enum Verdict {
    SUFFICIENT,
    INSUFFICIENT,
    EXHAUSTED
}
