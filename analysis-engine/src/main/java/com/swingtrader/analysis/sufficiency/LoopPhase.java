package com.swingtrader.analysis.sufficiency;

public enum LoopPhase {
    INIT,
    SELECTING,
    FETCHING,
    EVALUATING,
    EXPANDING,
    SATISFIED,
    EXHAUSTED;

    public boolean isTerminal() {
        return this == SATISFIED || this == EXHAUSTED;
    }
}
