package com.swingtrader.analysis.agent.sentiment;

import com.fasterxml.jackson.databind.JsonNode;
import com.swingtrader.analysis.reasoning.ReasoningClient;
import com.swingtrader.analysis.sufficiency.CollectionResult;
import com.swingtrader.analysis.sufficiency.EvidenceItem;
import com.swingtrader.common.json.StructuredResponseParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Scores collected evidence. Uses the reasoning client when configured; otherwise, or when
 * its reply cannot be parsed, counts positive and negative keywords in titles and
 * descriptions.
 */
public class SentimentAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(SentimentAnalyzer.class);

    static final Set<String> POSITIVE = Set.of(
        "surge", "surges", "gain", "gains", "rally", "rallies", "beat", "beats", "growth", "profit",
        "upgrade", "upgraded", "record", "strong", "bullish", "outperform", "expands", "wins", "order", "rises");
    static final Set<String> NEGATIVE = Set.of(
        "fall", "falls", "drop", "drops", "loss", "losses", "miss", "misses", "downgrade", "downgraded",
        "weak", "bearish", "plunge", "plunges", "probe", "penalty", "fraud", "decline", "declines", "slump");

    private static final int MAX_ITEMS_IN_PROMPT = 40;

    private final ReasoningClient reasoningClient;
    private final StructuredResponseParser parser;

    public SentimentAnalyzer(ReasoningClient reasoningClient, StructuredResponseParser parser) {
        this.reasoningClient = reasoningClient;
        this.parser          = parser;
    }

    public StockSentiment analyze(CollectionResult collection) {
        if (collection.evidence().isEmpty()) {
            return build(collection, "neutral", 0.0, 0.0, List.of("No news or social coverage found"),
                List.of(), "hold");
        }
        if (reasoningClient.isConfigured()) {
            Optional<StockSentiment> reasoned = reason(collection);
            if (reasoned.isPresent()) {
                return reasoned.get();
            }
        }
        return lexicon(collection);
    }

    private Optional<StockSentiment> reason(CollectionResult collection) {
        try {
            Optional<JsonNode> reply = parser.parseObject(reasoningClient.complete(buildPrompt(collection)));
            if (reply.isEmpty()) {
                log.warn("Unparseable sentiment reply, using lexicon fallback. symbol={}", collection.symbol());
                return Optional.empty();
            }
            JsonNode json = reply.get();
            double score = clamp(json.path("sentiment_score").asDouble(0.0), -1.0, 1.0);
            return Optional.of(build(collection,
                json.path("overall_sentiment").asText(label(score)),
                score,
                clamp(json.path("confidence").asDouble(0.5), 0.0, 1.0),
                strings(json.path("summary_points")),
                strings(json.path("key_insights")),
                json.path("recommendation").asText(recommendation(score))));
        } catch (RuntimeException e) {
            log.warn("Sentiment reasoning failed, using lexicon fallback. symbol={} error={}",
                collection.symbol(), e.getMessage());
            return Optional.empty();
        }
    }

    StockSentiment lexicon(CollectionResult collection) {
        int positive = 0;
        int negative = 0;
        for (EvidenceItem item : collection.evidence()) {
            String text = ((item.title() == null ? "" : item.title()) + " "
                + (item.description() == null ? "" : item.description())).toLowerCase(Locale.ROOT);
            for (String token : text.split("[^a-z]+")) {
                if (POSITIVE.contains(token)) positive++;
                else if (NEGATIVE.contains(token)) negative++;
            }
        }
        int total = positive + negative;
        double score = total == 0 ? 0.0 : (double) (positive - negative) / total;
        // keyword counting is crude; never report more than moderate confidence
        double confidence = Math.min(0.6, total / 20.0);
        List<String> summary = collection.evidence().stream().limit(5).map(EvidenceItem::title).toList();
        return build(collection, label(score), score, confidence, summary,
            List.of(positive + " positive / " + negative + " negative keyword hits"), recommendation(score));
    }

    private StockSentiment build(CollectionResult c, String overall, double score, double confidence,
                                 List<String> summary, List<String> insights, String recommendation) {
        return new StockSentiment(c.symbol(), c.companyName(), overall, score, confidence, summary, insights,
            recommendation, c.evidenceCount(), c.sourcesUsed(), c.rounds(), c.windowDays(), c.lowConfidence());
    }

    private String buildPrompt(CollectionResult collection) {
        StringBuilder items = new StringBuilder();
        collection.evidence().stream().limit(MAX_ITEMS_IN_PROMPT).forEach(item -> {
            items.append("Title: ").append(item.title()).append('\n');
            if (item.description() != null) items.append("Description: ").append(item.description()).append('\n');
            if (item.publishedAt() != null) items.append("Date: ").append(item.publishedAt()).append('\n');
            items.append("---\n");
        });
        return """
            You are a financial sentiment analyst. Assess the coverage of %s (%s) below.

            %s
            Respond ONLY with JSON:
            {"summary_points": ["..."], "overall_sentiment": "very_positive|positive|neutral|negative|very_negative",
             "sentiment_score": <-1.0..1.0>, "confidence": <0.0..1.0>, "key_insights": ["..."],
             "recommendation": "strong_buy|buy|hold|sell|strong_sell"}
            """.formatted(collection.companyName(), collection.symbol(), items);
    }

    static String label(double score) {
        if (score >= 0.6) return "very_positive";
        if (score >= 0.2) return "positive";
        if (score > -0.2) return "neutral";
        if (score > -0.6) return "negative";
        return "very_negative";
    }

    static String recommendation(double score) {
        if (score >= 0.6) return "strong_buy";
        if (score >= 0.2) return "buy";
        if (score > -0.2) return "hold";
        if (score > -0.6) return "sell";
        return "strong_sell";
    }

    private static List<String> strings(JsonNode array) {
        List<String> out = new ArrayList<>();
        if (array.isArray()) array.forEach(n -> out.add(n.asText()));
        return out;
    }

    private static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }
}
