package com.swingtrader.analysis.sufficiency;

import com.fasterxml.jackson.databind.JsonNode;
import com.swingtrader.analysis.reasoning.ReasoningClient;
import com.swingtrader.common.json.StructuredResponseParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Asks a language model whether the evidence is adequate.
 *
 * <p>The model must answer with {@code {"sufficient", "reasoning", "plan": {"action",
 * "parameters": {"days"}}}}. When no client is configured the rule-based evaluator decides
 * instead. When the call fails or the reply cannot be parsed the verdict is
 * {@link Verdict#INSUFFICIENT} and the next action comes from the escalation rules, so a bad
 * reply can only make the loop gather more, never stop it early or crash it.
 */
public class ReasoningSufficiencyEvaluator implements SufficiencyEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ReasoningSufficiencyEvaluator.class);

    private final ReasoningClient reasoningClient;
    private final StructuredResponseParser parser;
    private final ThresholdSufficiencyEvaluator rules;

    public ReasoningSufficiencyEvaluator(ReasoningClient reasoningClient, StructuredResponseParser parser) {
        this.reasoningClient = reasoningClient;
        this.parser          = parser;
        this.rules           = new ThresholdSufficiencyEvaluator();
    }

    @Override
    public SufficiencyAssessment evaluate(SufficiencyState state, SufficiencyPolicy policy) {
        if (!reasoningClient.isConfigured()) {
            return rules.evaluate(state, policy);
        }
        Optional<JsonNode> reply;
        try {
            reply = parser.parseObject(reasoningClient.complete(buildPrompt(state, policy)));
        } catch (RuntimeException e) {
            log.warn("Sufficiency reasoning failed, treating as insufficient. symbol={} error={}",
                state.symbol(), e.getMessage());
            reply = Optional.empty();
        }
        if (reply.isEmpty()) {
            NextAction next = ThresholdSufficiencyEvaluator.recommend(state, false);
            return SufficiencyAssessment.insufficient(next, null, "reasoning unavailable, gathering more evidence");
        }
        return interpret(reply.get(), state);
    }

    SufficiencyAssessment interpret(JsonNode json, SufficiencyState state) {
        String reasoning = json.path("reasoning").asText("no reasoning provided");
        if (json.path("sufficient").asBoolean(false) && state.uniqueItemCount() > 0) {
            return SufficiencyAssessment.sufficient(reasoning);
        }
        JsonNode plan = json.path("plan");
        String action = plan.path("action").asText("");
        Integer days = plan.path("parameters").hasNonNull("days")
            ? plan.path("parameters").path("days").asInt() : null;

        NextAction next = switch (action) {
            case "expand_search" -> state.canExpand()
                ? NextAction.EXPAND_TIMEFRAME
                : ThresholdSufficiencyEvaluator.recommend(state, false);
            case "use_alternative", "check_social_media", "combine_sources" -> state.hasUntriedCandidate()
                ? NextAction.TRY_ALTERNATE_SOURCE
                : ThresholdSufficiencyEvaluator.recommend(state, false);
            default -> ThresholdSufficiencyEvaluator.recommend(state, false);
        };
        Integer window = next == NextAction.EXPAND_TIMEFRAME ? days : null;
        return SufficiencyAssessment.insufficient(next, window, reasoning);
    }

    private String buildPrompt(SufficiencyState state, SufficiencyPolicy policy) {
        return """
            You review evidence for a risk-sensitive swing trading system. Prefer gathering more
            data over deciding on a thin, recent-only or single-source sample.

            Company: %s (%s)
            Unique items collected: %d
            Lookback window: last %d days
            Sources that contributed: %s
            Minimum items: %d, minimum distinct sources: %d
            Wider window available: %s
            Untried sources in this window: %s

            Respond ONLY with JSON:
            {"sufficient": true|false,
             "reasoning": "<one or two sentences>",
             "plan": {"action": "proceed|expand_search|use_alternative|check_social_media",
                      "parameters": {"days": <int>}}}
            """.formatted(
                state.companyName(), state.symbol(),
                state.uniqueItemCount(), state.windowDays(),
                state.contributingSources(),
                policy.minItems(), policy.minDistinctSources(),
                state.canExpand() ? state.nextWindowDays() + " days" : "no",
                state.hasUntriedCandidate() ? "yes" : "no");
    }
}
