package com.swingtrader.analysis.agent.sentiment;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.swingtrader.analysis.agent.StockRef;
import com.swingtrader.analysis.sufficiency.AdaptiveSufficiencyLoop;
import com.swingtrader.analysis.sufficiency.CollectionResult;
import com.swingtrader.common.cache.CacheKeys;
import com.swingtrader.common.cache.ResultCache;
import com.swingtrader.common.unit.AbstractAgentUnit;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Gathers news and social evidence per stock through the adaptive collection loop, then
 * scores it. Every input stock gets an entry; stocks whose collection ended exhausted are
 * flagged {@code low_confidence}.
 *
 * <p>The whole result is also cached under the sorted symbol list, so the same shortlist
 * presented with different prices or ordering is served once.
 */
public class SentimentUnit extends AbstractAgentUnit<SentimentInput> {

    public static final String TYPE = "sentiment";

    private static final Set<String> POSITIVE_LABELS = Set.of("positive", "very_positive");
    private static final Set<String> NEGATIVE_LABELS = Set.of("negative", "very_negative");

    private final AdaptiveSufficiencyLoop collectionLoop;
    private final SentimentAnalyzer analyzer;
    private final ResultCache cache;

    public SentimentUnit(String unitId, AdaptiveSufficiencyLoop collectionLoop, SentimentAnalyzer analyzer,
                         ResultCache cache, ObjectMapper objectMapper) {
        super(unitId, SentimentInput.class, objectMapper);
        this.collectionLoop = collectionLoop;
        this.analyzer       = analyzer;
        this.cache          = cache;
    }

    @Override
    protected void collectViolations(SentimentInput input, List<String> violations) {
        if (input.stocks() == null || input.stocks().isEmpty()) {
            violations.add("stocks must be a non-empty list");
            return;
        }
        for (int i = 0; i < input.stocks().size(); i++) {
            StockRef stock = input.stocks().get(i);
            if (stock == null || stock.symbol() == null || stock.symbol().isBlank()) {
                violations.add("stocks[" + i + "].symbol is required");
            }
        }
    }

    @Override
    protected Object run(SentimentInput input) {
        String key = cacheKey(input.stocks());
        Object cached = readCache(key);
        if (cached != null) {
            log.info("[{}] Sentiment served from cache. key={}", unitName(), key);
            return cached;
        }

        List<StockSentiment> analyzed = new ArrayList<>();
        for (StockRef stock : input.stocks()) {
            CollectionResult collection = collectionLoop.collect(stock.symbol(), stock.displayName());
            StockSentiment sentiment = analyzer.analyze(collection);
            log.info("[{}] Sentiment analyzed. symbol={} sentiment={} score={} evidence={} sources={} lowConfidence={}",
                unitName(), stock.symbol(), sentiment.overallSentiment(), sentiment.sentimentScore(),
                sentiment.evidenceCount(), sentiment.sourcesUsed(), sentiment.lowConfidence());
            analyzed.add(sentiment);
        }

        int positive = (int) analyzed.stream().filter(s -> POSITIVE_LABELS.contains(s.overallSentiment())).count();
        int negative = (int) analyzed.stream().filter(s -> NEGATIVE_LABELS.contains(s.overallSentiment())).count();
        SentimentOutput output = new SentimentOutput(analyzed, analyzed.size(), positive, negative,
            analyzed.size() - positive - negative);

        Map<String, Object> asMap = toOutputMap(output);
        writeCache(key, asMap);
        return asMap;
    }

    static String cacheKey(List<StockRef> stocks) {
        String symbols = String.join(",", stocks.stream()
            .map(StockRef::symbol)
            .filter(Objects::nonNull)
            .sorted()
            .toList());
        return CacheKeys.generateKey(TYPE, Map.of("stocks", symbols));
    }

    private Object readCache(String key) {
        try {
            return cache.get(key);
        } catch (RuntimeException e) {
            log.warn("[{}] Cache read failed, treating as miss. error={}", unitName(), e.getMessage());
            return null;
        }
    }

    private void writeCache(String key, Map<String, Object> value) {
        try {
            cache.set(key, value);
        } catch (RuntimeException e) {
            log.warn("[{}] Cache write failed, continuing. error={}", unitName(), e.getMessage());
        }
    }
}
