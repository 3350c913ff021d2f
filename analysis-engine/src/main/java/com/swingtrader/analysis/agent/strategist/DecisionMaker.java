package com.swingtrader.analysis.agent.strategist;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.swingtrader.analysis.agent.sentiment.StockSentiment;
import com.swingtrader.analysis.agent.technical.TechnicalAnalysis;
import com.swingtrader.analysis.agent.technical.TechnicalAnalyzer;
import com.swingtrader.analysis.reasoning.ReasoningClient;
import com.swingtrader.common.json.StructuredResponseParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Combines technical and sentiment views into one {@link TradingDecision} per symbol.
 *
 * <p>The reasoning client is asked first. Symbols it leaves out, or every symbol when it is
 * unconfigured or its reply is unusable, are decided by a weighted rule: 60% technical
 * strength and 40% sentiment, both normalised to 0..1. Without a technical view the rule
 * never leaves {@code hold}.
 */
public class DecisionMaker {

    private static final Logger log = LoggerFactory.getLogger(DecisionMaker.class);

    static final double TECHNICAL_WEIGHT = 0.6;
    static final double SENTIMENT_WEIGHT = 0.4;
    static final double BUY_THRESHOLD    = 0.65;
    static final double SELL_THRESHOLD   = 0.35;
    static final double STOP_LOSS_PCT    = 0.03;
    // 1:2 risk-reward
    static final double TARGET_PCT       = 0.06;
    static final double LOW_CONFIDENCE_PENALTY = 0.8;

    private final ReasoningClient reasoningClient;
    private final StructuredResponseParser parser;
    private final ObjectMapper objectMapper;
    private final double minConfidence;
    private final double maxPositionValue;

    public DecisionMaker(ReasoningClient reasoningClient, StructuredResponseParser parser, ObjectMapper objectMapper,
                         double minConfidence, double maxPositionValue) {
        this.reasoningClient  = reasoningClient;
        this.parser           = parser;
        this.objectMapper     = objectMapper;
        this.minConfidence    = minConfidence;
        this.maxPositionValue = maxPositionValue;
    }

    public List<TradingDecision> decide(List<TechnicalAnalysis> technical, List<StockSentiment> sentiment) {
        Map<String, TechnicalAnalysis> techBySymbol = new LinkedHashMap<>();
        technical.forEach(t -> techBySymbol.put(t.symbol(), t));
        Map<String, StockSentiment> sentBySymbol = new LinkedHashMap<>();
        sentiment.forEach(s -> sentBySymbol.put(s.symbol(), s));

        List<String> symbols = new ArrayList<>(techBySymbol.keySet());
        sentBySymbol.keySet().stream().filter(s -> !techBySymbol.containsKey(s)).forEach(symbols::add);
        if (symbols.isEmpty()) {
            return List.of();
        }

        Map<String, TradingDecision> reasoned = reasoningClient.isConfigured()
            ? reason(symbols, techBySymbol, sentBySymbol)
            : Map.of();

        List<TradingDecision> decisions = new ArrayList<>();
        for (String symbol : symbols) {
            TradingDecision decision = reasoned.get(symbol);
            if (decision == null) {
                decision = weighted(symbol, techBySymbol.get(symbol), sentBySymbol.get(symbol));
            }
            decisions.add(decision);
        }
        return decisions;
    }

    TradingDecision weighted(String symbol, TechnicalAnalysis tech, StockSentiment sent) {
        String name = tech != null && tech.name() != null ? tech.name()
            : sent != null && sent.name() != null ? sent.name() : symbol;
        double strength  = tech == null ? 0.0 : tech.strength();
        double sentScore = sent == null ? 0.0 : sent.sentimentScore();
        double combined  = (strength / 100.0) * TECHNICAL_WEIGHT + ((sentScore + 1.0) / 2.0) * SENTIMENT_WEIGHT;

        String action;
        double confidence;
        boolean bullish = tech != null && TechnicalAnalyzer.BULLISH.equals(tech.trend());
        if (combined >= BUY_THRESHOLD && bullish && sentScore > 0) {
            action     = TradingDecision.BUY;
            confidence = combined;
        } else if (tech != null && combined <= SELL_THRESHOLD) {
            action     = TradingDecision.SELL;
            confidence = 1.0 - combined;
        } else {
            action     = TradingDecision.HOLD;
            confidence = 0.5;
        }
        if (sent == null || sent.lowConfidence()) {
            confidence *= LOW_CONFIDENCE_PENALTY;
        }

        StringBuilder why = new StringBuilder()
            .append("Technical ").append(tech == null ? "unavailable" : tech.trend() + " (strength " + round(strength) + ")")
            .append(", sentiment ").append(sent == null ? "unavailable" : sent.overallSentiment() + " (" + round(sentScore) + ")");
        if (sent != null && sent.lowConfidence()) {
            why.append(", thin evidence");
        }

        Integer quantity = null;
        Double stopLoss  = null;
        Double target    = null;
        double price = tech == null ? 0.0 : tech.currentPrice();
        if (TradingDecision.BUY.equals(action) && price > 0) {
            quantity = Math.max(1, (int) Math.floor(maxPositionValue / price));
            stopLoss = round(price * (1 - STOP_LOSS_PCT));
            target   = round(price * (1 + TARGET_PCT));
        }
        return new TradingDecision(symbol, name, action, round(confidence), why.toString(), round(strength),
            round(sentScore), round(combined * 100), quantity, stopLoss, target);
    }

    private Map<String, TradingDecision> reason(List<String> symbols, Map<String, TechnicalAnalysis> tech,
                                                Map<String, StockSentiment> sent) {
        Map<String, TradingDecision> bySymbol = new LinkedHashMap<>();
        try {
            Optional<JsonNode> reply = parser.parseObject(reasoningClient.complete(buildPrompt(symbols, tech, sent)));
            if (reply.isEmpty()) {
                log.warn("Unparseable strategist reply, using weighted rule.");
                return bySymbol;
            }
            for (JsonNode node : reply.get().path("decisions")) {
                String symbol = node.path("symbol").asText("");
                if (!symbols.contains(symbol) || bySymbol.containsKey(symbol)) {
                    continue;
                }
                bySymbol.put(symbol, fromJson(symbol, node, tech.get(symbol), sent.get(symbol)));
            }
        } catch (RuntimeException e) {
            log.warn("Strategist reasoning failed, using weighted rule. error={}", e.getMessage());
        }
        return bySymbol;
    }

    private TradingDecision fromJson(String symbol, JsonNode node, TechnicalAnalysis tech, StockSentiment sent) {
        String action = node.path("action").asText(TradingDecision.HOLD).toLowerCase(Locale.ROOT);
        if (!List.of(TradingDecision.BUY, TradingDecision.HOLD, TradingDecision.SELL).contains(action)) {
            action = TradingDecision.HOLD;
        }
        String fallbackName = tech != null ? tech.name() : sent != null ? sent.name() : symbol;
        return new TradingDecision(
            symbol,
            node.path("name").asText(fallbackName),
            action,
            Math.max(0.0, Math.min(1.0, node.path("confidence").asDouble(0.0))),
            node.path("reasoning").asText(""),
            node.path("technical_score").asDouble(tech == null ? 0.0 : tech.strength()),
            node.path("sentiment_score").asDouble(sent == null ? 0.0 : sent.sentimentScore()),
            node.path("combined_score").asDouble(0.0),
            node.hasNonNull("quantity") ? node.get("quantity").asInt() : null,
            node.hasNonNull("stop_loss") ? node.get("stop_loss").asDouble() : null,
            node.hasNonNull("target_price") ? node.get("target_price").asDouble() : null);
    }

    private String buildPrompt(List<String> symbols, Map<String, TechnicalAnalysis> tech,
                               Map<String, StockSentiment> sent) {
        List<Map<String, Object>> combined = new ArrayList<>();
        for (String symbol : symbols) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("symbol", symbol);
            entry.put("technical", tech.get(symbol));
            entry.put("sentiment", sent.get(symbol));
            combined.add(entry);
        }
        String stocks;
        try {
            stocks = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(combined);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to serialise strategist prompt", e);
        }
        return """
            You are a senior trading strategist making buy/sell/hold decisions for a swing trading system.
            Only recommend buy when both technical and sentiment views are strongly positive, and only
            with confidence above %s. Aim for a 1:2 risk-reward ratio.

            Stocks to analyze:
            %s

            Respond ONLY with JSON:
            {"decisions": [{"symbol": "...", "name": "...", "action": "buy|hold|sell", "confidence": 0.0,
              "reasoning": "...", "technical_score": 0, "sentiment_score": 0.0, "combined_score": 0,
              "quantity": 0, "stop_loss": 0.0, "target_price": 0.0}]}
            """.formatted(minConfidence, stocks);
    }

    private static double round(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
