package com.swingtrader.analysis.sufficiency;

import java.util.List;

/**
 * Final output of one collection run. {@code lowConfidence} is set when the run ended
 * exhausted rather than satisfied; downstream analysis still proceeds on {@code evidence}.
 */
public record CollectionResult(
    String symbol,
    String companyName,
    List<EvidenceItem> evidence,
    List<String> sourcesUsed,
    List<String> toolsCalled,
    List<String> degradedSources,
    int rounds,
    int windowDays,
    Verdict verdict,
    String reasoning
) {
    public int evidenceCount() {
        return evidence.size();
    }

    public boolean lowConfidence() {
        return verdict != Verdict.SUFFICIENT;
    }
}
