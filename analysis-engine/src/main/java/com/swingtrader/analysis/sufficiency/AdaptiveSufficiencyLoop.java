package com.swingtrader.analysis.sufficiency;

import com.swingtrader.analysis.tool.SourceTier;
import com.swingtrader.analysis.tool.ToolException;
import com.swingtrader.analysis.tool.ToolMetadata;
import com.swingtrader.analysis.tool.ToolRegistry;
import com.swingtrader.common.cache.CacheKeys;
import com.swingtrader.common.cache.ResultCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Multi-round evidence collection for one subject.
 *
 * <pre>
 *   INIT → SELECTING → FETCHING → EVALUATING ─┬→ SATISFIED
 *              ▲                              ├→ EXPANDING → SELECTING
 *              └──────────────────────────────┼→ SELECTING (alternate source)
 *                                             └→ EXHAUSTED
 * </pre>
 *
 * <p>Candidates are the available tools ordered by {@link SourceTier}, then registration
 * order. Each round consumes one untried (window, tool) pair, so the loop ends after at most
 * {@code ladder × candidates} rounds whatever the evaluator says. Tool failures are logged
 * and count as an empty round; the next candidate is tried.
 *
 * <p>Each tool call is cached under (tool, arguments), independently of any cache entry the
 * calling unit keeps for its own result.
 *
 * <p>One instance serves many concurrent runs: all per-run state lives in
 * {@link SufficiencyState}, created inside {@link #collect}.
 */
public class AdaptiveSufficiencyLoop {

    private static final Logger log = LoggerFactory.getLogger(AdaptiveSufficiencyLoop.class);

    private static final String TOOL_CACHE_PREFIX = "tool:";

    private final ToolRegistry toolRegistry;
    private final SufficiencyEvaluator evaluator;
    private final SufficiencyPolicy policy;
    private final ResultCache cache;

    public AdaptiveSufficiencyLoop(ToolRegistry toolRegistry, SufficiencyEvaluator evaluator,
                                   SufficiencyPolicy policy, ResultCache cache) {
        this.toolRegistry = toolRegistry;
        this.evaluator    = evaluator;
        this.policy       = policy;
        this.cache        = cache;
    }

    public CollectionResult collect(String symbol, String companyName) {
        List<String> candidates = new ArrayList<>();
        List<String> unavailable = new ArrayList<>();
        orderedTools().forEach(tool -> (tool.available() ? candidates : unavailable).add(tool.name()));

        SufficiencyState state = new SufficiencyState(symbol, companyName, policy.escalationLadderDays(), candidates);
        unavailable.forEach(name -> {
            log.warn("Source unavailable, skipping. symbol={} tool={}", symbol, name);
            state.recordDegraded(name);
        });

        int maxRounds = roundCap(candidates.size());
        log.info("Collection started. symbol={} candidates={} window={}d maxRounds={}",
            symbol, candidates, state.windowDays(), maxRounds);

        transition(state, LoopPhase.SELECTING);
        SufficiencyAssessment assessment = null;
        String chosen = null;

        while (!state.phase().isTerminal()) {
            switch (state.phase()) {
                case SELECTING -> {
                    if (state.rounds() >= maxRounds) {
                        transition(state, LoopPhase.EXHAUSTED);
                        break;
                    }
                    chosen = state.nextUntriedCandidate();
                    if (chosen != null) {
                        transition(state, LoopPhase.FETCHING);
                    } else if (state.canExpand()) {
                        assessment = null;
                        transition(state, LoopPhase.EXPANDING);
                    } else {
                        transition(state, LoopPhase.EXHAUSTED);
                    }
                }
                case FETCHING -> {
                    state.markTried(chosen);
                    fetch(state, chosen);
                    transition(state, LoopPhase.EVALUATING);
                }
                case EVALUATING -> {
                    assessment = evaluator.evaluate(state, policy);
                    state.setLastReasoning(assessment.reasoning());
                    log.info("Sufficiency evaluated. symbol={} round={} items={} window={}d verdict={} next={} reason={}",
                        symbol, state.rounds(), state.uniqueItemCount(), state.windowDays(),
                        assessment.verdict(), assessment.nextAction(), assessment.reasoning());
                    transition(state, afterEvaluation(state, assessment));
                }
                case EXPANDING -> {
                    int from = state.windowDays();
                    state.expandTo(assessment == null ? null : assessment.recommendedWindowDays());
                    log.info("Scope expanded. symbol={} window={}d→{}d", symbol, from, state.windowDays());
                    transition(state, LoopPhase.SELECTING);
                }
                default -> throw new IllegalStateException("Unexpected phase " + state.phase());
            }
        }

        state.setVerdict(state.phase() == LoopPhase.SATISFIED ? Verdict.SUFFICIENT : Verdict.EXHAUSTED);
        List<EvidenceItem> evidence = state.uniqueItems();
        log.info("Collection finished. symbol={} verdict={} items={} rounds={} sources={} window={}d",
            symbol, state.verdict(), evidence.size(), state.rounds(), state.contributingSources(), state.windowDays());

        return new CollectionResult(symbol, companyName, evidence,
            state.contributingSources(), state.toolsCalled(), state.degradedTools(),
            state.rounds(), state.windowDays(), state.verdict(), state.lastReasoning());
    }

    /** Hard cap on rounds: every (window, tool) pair at most once, tightened by an explicit policy cap. */
    int roundCap(int candidateCount) {
        int derived = policy.escalationLadderDays().size() * Math.max(candidateCount, 0);
        return policy.maxRounds() > 0 ? Math.min(policy.maxRounds(), derived) : derived;
    }

    private LoopPhase afterEvaluation(SufficiencyState state, SufficiencyAssessment assessment) {
        if (assessment.isSufficient()) {
            return LoopPhase.SATISFIED;
        }
        return switch (assessment.nextAction()) {
            case EXPAND_TIMEFRAME -> state.canExpand() ? LoopPhase.EXPANDING
                : state.hasUntriedCandidate() ? LoopPhase.SELECTING : LoopPhase.EXHAUSTED;
            case TRY_ALTERNATE_SOURCE -> state.hasUntriedCandidate() ? LoopPhase.SELECTING
                : state.canExpand() ? LoopPhase.EXPANDING : LoopPhase.EXHAUSTED;
            case PROCEED, EXHAUSTED -> LoopPhase.EXHAUSTED;
        };
    }

    private void fetch(SufficiencyState state, String tool) {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("symbol", state.symbol());
        args.put("company_name", state.companyName());
        args.put("days", state.windowDays());
        args.put("max_results", policy.maxResults());

        String key = CacheKeys.generateKey(TOOL_CACHE_PREFIX + tool, args);
        List<EvidenceItem> cached = cachedItems(key);
        if (cached != null) {
            log.info("Tool result served from cache. symbol={} tool={} items={}", state.symbol(), tool, cached.size());
            state.recordFetch(tool, cached);
            return;
        }
        try {
            List<EvidenceItem> items = toolRegistry.call(tool, args).stream()
                .map(item -> item.withSourceTool(tool))
                .toList();
            state.recordFetch(tool, items);
            storeItems(key, items);
        } catch (ToolException e) {
            log.warn("Tool call failed, falling back to next source. symbol={} tool={} kind={} error={}",
                state.symbol(), tool, e.getKind(), e.getMessage());
            state.recordFailedFetch();
        }
    }

    @SuppressWarnings("unchecked")
    private List<EvidenceItem> cachedItems(String key) {
        try {
            Object hit = cache.get(key);
            return hit instanceof List<?> list ? (List<EvidenceItem>) list : null;
        } catch (RuntimeException e) {
            log.warn("Cache read failed, treating as miss. key={} error={}", key, e.getMessage());
            return null;
        }
    }

    private void storeItems(String key, List<EvidenceItem> items) {
        try {
            cache.set(key, items);
        } catch (RuntimeException e) {
            log.warn("Cache write failed, continuing. key={} error={}", key, e.getMessage());
        }
    }

    private List<ToolMetadata> orderedTools() {
        List<ToolMetadata> tools = new ArrayList<>(toolRegistry.list());
        // stable sort keeps registration order inside a tier
        tools.sort(Comparator.comparing(ToolMetadata::tier));
        return tools;
    }

    private static void transition(SufficiencyState state, LoopPhase next) {
        log.debug("Loop phase. symbol={} {}→{}", state.symbol(), state.phase(), next);
        state.setPhase(next);
    }
}
