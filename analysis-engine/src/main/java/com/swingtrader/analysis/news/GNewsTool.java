package com.swingtrader.analysis.news;

import com.fasterxml.jackson.databind.JsonNode;
import com.swingtrader.analysis.sufficiency.EvidenceItem;
import com.swingtrader.analysis.tool.DataFetchStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Alternate news source: GNews {@code /api/v4/search}.
 */
public class GNewsTool implements DataFetchStrategy {

    private static final Logger log = LoggerFactory.getLogger(GNewsTool.class);

    private final WebClient webClient;
    private final String apiKey;
    private final Duration timeout;
    private final Clock clock;

    public GNewsTool(WebClient gnewsWebClient, String apiKey, Duration timeout, Clock clock) {
        this.webClient = gnewsWebClient;
        this.apiKey    = apiKey;
        this.timeout   = timeout;
        this.clock     = clock;
    }

    @Override
    public List<EvidenceItem> fetch(Map<String, Object> args) {
        String symbol      = (String) args.get("symbol");
        String companyName = (String) args.get("company_name");
        int days       = (Integer) args.get("days");
        int maxResults = (Integer) args.get("max_results");

        if (apiKey == null || apiKey.isBlank()) {
            log.warn("GNews API key not configured, returning no articles. symbol={}", symbol);
            return List.of();
        }
        Instant from = clock.instant().minus(days, ChronoUnit.DAYS).truncatedTo(ChronoUnit.SECONDS);

        log.info("Fetching news. provider=GNews symbol={} days={}", symbol, days);
        JsonNode root = webClient.get()
            .uri(uriBuilder -> uriBuilder
                .path("/api/v4/search")
                .queryParam("q", companyName + " " + symbol)
                .queryParam("token", apiKey)
                .queryParam("lang", "en")
                .queryParam("max", Math.min(maxResults, 100))
                .queryParam("from", from.toString())
                .queryParam("sortby", "publishedAt")
                .build())
            .retrieve()
            .bodyToMono(JsonNode.class)
            .block(timeout);
        return parse(root);
    }

    static List<EvidenceItem> parse(JsonNode root) {
        List<EvidenceItem> items = new ArrayList<>();
        if (root == null) return items;
        for (JsonNode article : root.path("articles")) {
            String title = NewsJson.text(article, "title");
            if (title == null || title.isBlank()) continue;
            String publisher = NewsJson.text(article.path("source"), "name");
            items.add(new EvidenceItem(
                title,
                NewsJson.text(article, "description"),
                NewsJson.instant(NewsJson.text(article, "publishedAt")),
                publisher != null ? publisher : "GNews",
                null));
        }
        return items;
    }
}
