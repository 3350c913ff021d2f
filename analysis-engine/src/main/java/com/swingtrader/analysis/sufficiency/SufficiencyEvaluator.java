package com.swingtrader.analysis.sufficiency;

/**
 * Decides whether the evidence gathered so far is adequate and, if not, what to try next.
 */
public interface SufficiencyEvaluator {

    SufficiencyAssessment evaluate(SufficiencyState state, SufficiencyPolicy policy);
}
