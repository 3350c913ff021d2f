package com.swingtrader.analysis.news;

import com.fasterxml.jackson.databind.JsonNode;
import com.swingtrader.analysis.sufficiency.EvidenceItem;
import com.swingtrader.analysis.tool.DataFetchStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Primary news source: Event Registry {@code article/getArticles}, searched by company name.
 */
public class EventRegistryNewsTool implements DataFetchStrategy {

    private static final Logger log = LoggerFactory.getLogger(EventRegistryNewsTool.class);

    private final WebClient webClient;
    private final String apiKey;
    private final Duration timeout;
    private final Clock clock;

    public EventRegistryNewsTool(WebClient eventRegistryWebClient, String apiKey, Duration timeout, Clock clock) {
        this.webClient = eventRegistryWebClient;
        this.apiKey    = apiKey;
        this.timeout   = timeout;
        this.clock     = clock;
    }

    @Override
    public List<EvidenceItem> fetch(Map<String, Object> args) {
        String companyName = (String) args.get("company_name");
        int days       = (Integer) args.get("days");
        int maxResults = (Integer) args.get("max_results");

        if (apiKey == null || apiKey.isBlank()) {
            log.warn("Event Registry API key not configured, returning no articles. company={}", companyName);
            return List.of();
        }
        LocalDate end   = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        LocalDate start = end.minusDays(days);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("action", "getArticles");
        body.put("keyword", companyName);
        body.put("sourceLocationUri", List.of("http://en.wikipedia.org/wiki/India"));
        body.put("ignoreSourceGroupUri", "paywall/paywalled_sources");
        body.put("articlesPage", 1);
        body.put("articlesCount", Math.min(maxResults, 100));
        body.put("articlesSortBy", "date");
        body.put("articlesSortByAsc", false);
        body.put("dataType", List.of("news", "pr"));
        body.put("forceMaxDataTimeWindow", days);
        body.put("resultType", "articles");
        body.put("dateStart", start.toString());
        body.put("dateEnd", end.toString());
        body.put("includeSourceTitle", true);
        body.put("apiKey", apiKey);

        log.info("Fetching news. provider=EventRegistry company={} days={}", companyName, days);
        JsonNode root = webClient.post()
            .uri("/api/v1/article/getArticles")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(body)
            .retrieve()
            .bodyToMono(JsonNode.class)
            .block(timeout);
        return parse(root);
    }

    static List<EvidenceItem> parse(JsonNode root) {
        List<EvidenceItem> items = new ArrayList<>();
        if (root == null) return items;
        for (JsonNode article : root.path("articles").path("results")) {
            String title = NewsJson.text(article, "title");
            if (title == null || title.isBlank()) continue;
            items.add(new EvidenceItem(
                title,
                NewsJson.truncate(NewsJson.text(article, "body"), 500),
                NewsJson.instant(NewsJson.text(article, "dateTimePub")),
                NewsJson.text(article.path("source"), "title"),
                null));
        }
        return items;
    }
}
