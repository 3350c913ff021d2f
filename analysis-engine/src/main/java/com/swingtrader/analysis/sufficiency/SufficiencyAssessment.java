package com.swingtrader.analysis.sufficiency;

/**
 * Verdict of one evaluation round plus, when insufficient, what to try next.
 *
 * @param recommendedWindowDays window to expand to; {@code null} means the next ladder rung
 */
public record SufficiencyAssessment(
    Verdict verdict,
    NextAction nextAction,
    Integer recommendedWindowDays,
    String reasoning
) {
    public static SufficiencyAssessment sufficient(String reasoning) {
        return new SufficiencyAssessment(Verdict.SUFFICIENT, NextAction.PROCEED, null, reasoning);
    }

    public static SufficiencyAssessment insufficient(NextAction next, Integer windowDays, String reasoning) {
        return new SufficiencyAssessment(Verdict.INSUFFICIENT, next, windowDays, reasoning);
    }

    public boolean isSufficient() {
        return verdict == Verdict.SUFFICIENT;
    }
}
