package com.swingtrader.analysis.sufficiency;

import java.util.List;

/**
 * Tunable rules for deciding when collected evidence is adequate.
 *
 * @param minItems             minimum number of unique items
 * @param escalationLadderDays lookback windows tried in order, narrowest first
 * @param maxResults           per-call result limit passed to tools
 * @param minDistinctSources   minimum number of tools that contributed items
 * @param minCoverageDays      minimum span in days between oldest and newest item; 0 disables
 * @param maxRounds            explicit round cap; 0 derives it from ladder × tools
 */
public record SufficiencyPolicy(
    int minItems,
    List<Integer> escalationLadderDays,
    int maxResults,
    int minDistinctSources,
    int minCoverageDays,
    int maxRounds
) {
    public SufficiencyPolicy {
        if (escalationLadderDays == null || escalationLadderDays.isEmpty()) {
            throw new IllegalArgumentException("escalation ladder must not be empty");
        }
        for (int i = 1; i < escalationLadderDays.size(); i++) {
            if (escalationLadderDays.get(i) <= escalationLadderDays.get(i - 1)) {
                throw new IllegalArgumentException("escalation ladder must be strictly increasing: " + escalationLadderDays);
            }
        }
        escalationLadderDays = List.copyOf(escalationLadderDays);
        minItems           = Math.max(1, minItems);
        minDistinctSources = Math.max(1, minDistinctSources);
    }

    public static SufficiencyPolicy defaults() {
        return new SufficiencyPolicy(5, List.of(2, 90, 180), 50, 1, 0, 0);
    }
}
