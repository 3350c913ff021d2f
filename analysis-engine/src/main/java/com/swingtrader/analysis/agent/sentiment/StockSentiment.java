package com.swingtrader.analysis.agent.sentiment;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Sentiment verdict for one stock plus how its evidence was gathered.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StockSentiment(
    @JsonProperty("symbol") String symbol,
    @JsonProperty("name") String name,
    @JsonProperty("overall_sentiment") String overallSentiment,
    @JsonProperty("sentiment_score") double sentimentScore,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("summary_points") List<String> summaryPoints,
    @JsonProperty("key_insights") List<String> keyInsights,
    @JsonProperty("recommendation") String recommendation,
    @JsonProperty("evidence_count") int evidenceCount,
    @JsonProperty("sources_used") List<String> sourcesUsed,
    @JsonProperty("collection_rounds") int collectionRounds,
    @JsonProperty("window_days") int windowDays,
    @JsonProperty("low_confidence") boolean lowConfidence
) {}
