package com.swingtrader.analysis.sufficiency;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Mutable working state of one collection run. Created per subject, never shared
 * between threads, discarded once the run reaches a terminal phase.
 */
public class SufficiencyState {

    private final String symbol;
    private final String companyName;
    private final List<Integer> ladder;
    private final List<String> candidates;

    private final Map<String, List<EvidenceItem>> evidenceBySource = new LinkedHashMap<>();
    private final Set<String> triedInScope = new HashSet<>();
    private final Set<String> toolsCalled = new LinkedHashSet<>();
    private final Set<String> degradedTools = new LinkedHashSet<>();

    private int scopeIndex;
    private int rounds;
    private LoopPhase phase = LoopPhase.INIT;
    private Verdict verdict = Verdict.INSUFFICIENT;
    private String lastReasoning;

    public SufficiencyState(String symbol, String companyName, List<Integer> ladder, List<String> candidates) {
        this.symbol      = symbol;
        this.companyName = companyName;
        this.ladder      = List.copyOf(ladder);
        this.candidates  = List.copyOf(candidates);
    }

    // ── scope ───────────────────────────────────────────────────────────────

    public int windowDays() {
        return ladder.get(scopeIndex);
    }

    public boolean canExpand() {
        return scopeIndex < ladder.size() - 1;
    }

    public Integer nextWindowDays() {
        return canExpand() ? ladder.get(scopeIndex + 1) : null;
    }

    /**
     * Moves to the narrowest rung that is at least {@code targetDays} and wider than the
     * current one. A {@code null} or too-small target moves one rung. Clears the set of
     * tools tried in scope.
     */
    void expandTo(Integer targetDays) {
        int next = scopeIndex + 1;
        if (targetDays != null) {
            while (next < ladder.size() - 1 && ladder.get(next) < targetDays) {
                next++;
            }
        }
        scopeIndex = Math.min(next, ladder.size() - 1);
        triedInScope.clear();
    }

    // ── candidates ──────────────────────────────────────────────────────────

    /** First candidate not yet tried in the current scope, or null. */
    String nextUntriedCandidate() {
        for (String c : candidates) {
            if (!triedInScope.contains(c)) return c;
        }
        return null;
    }

    public boolean hasUntriedCandidate() {
        return nextUntriedCandidate() != null;
    }

    void markTried(String tool) {
        triedInScope.add(tool);
    }

    // ── evidence ────────────────────────────────────────────────────────────

    void recordFetch(String tool, List<EvidenceItem> items) {
        rounds++;
        toolsCalled.add(tool);
        if (!items.isEmpty()) {
            evidenceBySource.computeIfAbsent(tool, k -> new ArrayList<>()).addAll(items);
        }
    }

    void recordFailedFetch() {
        rounds++;
    }

    void recordDegraded(String tool) {
        degradedTools.add(tool);
    }

    /** Items across all sources, first occurrence of each normalized title kept. */
    public List<EvidenceItem> uniqueItems() {
        Set<String> seen = new HashSet<>();
        List<EvidenceItem> unique = new ArrayList<>();
        evidenceBySource.values().forEach(items -> items.forEach(item -> {
            String key = item.normalizedTitle();
            if (key == null || seen.add(key)) {
                unique.add(item);
            }
        }));
        return unique;
    }

    public int uniqueItemCount() {
        return uniqueItems().size();
    }

    /** Tools that contributed at least one item. */
    public List<String> contributingSources() {
        return List.copyOf(evidenceBySource.keySet());
    }

    /** Days between the oldest and newest dated item; 0 when fewer than two are dated. */
    public long coverageDays() {
        List<Instant> dates = uniqueItems().stream()
            .map(EvidenceItem::publishedAt)
            .filter(Objects::nonNull)
            .toList();
        if (dates.size() < 2) return 0;
        Instant min = Collections.min(dates);
        Instant max = Collections.max(dates);
        return Duration.between(min, max).toDays();
    }

    // ── accessors ───────────────────────────────────────────────────────────

    public String symbol()              { return symbol; }
    public String companyName()         { return companyName; }
    public int rounds()                 { return rounds; }
    public LoopPhase phase()            { return phase; }
    public Verdict verdict()            { return verdict; }
    public String lastReasoning()       { return lastReasoning; }
    public List<String> toolsCalled()   { return List.copyOf(toolsCalled); }
    public List<String> degradedTools() { return List.copyOf(degradedTools); }
    public List<String> candidates()    { return candidates; }

    void setPhase(LoopPhase phase)       { this.phase = phase; }
    void setVerdict(Verdict verdict)     { this.verdict = verdict; }
    void setLastReasoning(String reason) { this.lastReasoning = reason; }
}
