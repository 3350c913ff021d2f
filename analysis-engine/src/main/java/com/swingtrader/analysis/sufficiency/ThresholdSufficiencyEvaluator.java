package com.swingtrader.analysis.sufficiency;

import java.util.ArrayList;
import java.util.List;

/**
 * Rule-based evaluator: item count, distinct contributing sources and time coverage.
 *
 * <p>A short count or a narrow time span is answered by widening the window first (the
 * primary source at a wider window is the preferred path), then by alternate sources once
 * the ladder is at its widest. Missing source diversity is answered by alternates first.
 */
public class ThresholdSufficiencyEvaluator implements SufficiencyEvaluator {

    @Override
    public SufficiencyAssessment evaluate(SufficiencyState state, SufficiencyPolicy policy) {
        int count   = state.uniqueItemCount();
        int sources = state.contributingSources().size();
        long span   = state.coverageDays();

        List<String> shortfalls = new ArrayList<>();
        boolean volumeShort = count < policy.minItems();
        boolean spanShort   = policy.minCoverageDays() > 0 && span < policy.minCoverageDays();
        boolean sourceShort = sources < policy.minDistinctSources();
        if (volumeShort) shortfalls.add("items " + count + "/" + policy.minItems());
        if (spanShort)   shortfalls.add("coverage " + span + "d/" + policy.minCoverageDays() + "d");
        if (sourceShort) shortfalls.add("sources " + sources + "/" + policy.minDistinctSources());

        if (shortfalls.isEmpty()) {
            return SufficiencyAssessment.sufficient(
                count + " items from " + sources + " source(s) over " + state.windowDays() + "d meets policy");
        }
        String reasoning = "below policy: " + String.join(", ", shortfalls);
        NextAction next = recommend(state, sourceShort && !volumeShort && !spanShort);
        Integer window = next == NextAction.EXPAND_TIMEFRAME ? state.nextWindowDays() : null;
        return SufficiencyAssessment.insufficient(next, window, reasoning);
    }

    /**
     * Next action when evidence is insufficient.
     *
     * @param diversityOnly true when only source diversity is missing
     */
    static NextAction recommend(SufficiencyState state, boolean diversityOnly) {
        if (diversityOnly) {
            if (state.hasUntriedCandidate()) return NextAction.TRY_ALTERNATE_SOURCE;
            return state.canExpand() ? NextAction.EXPAND_TIMEFRAME : NextAction.EXHAUSTED;
        }
        if (state.canExpand()) return NextAction.EXPAND_TIMEFRAME;
        if (state.hasUntriedCandidate()) return NextAction.TRY_ALTERNATE_SOURCE;
        return NextAction.EXHAUSTED;
    }
}
