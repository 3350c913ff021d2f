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
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Supplementary social source: Reddit search across investing subreddits. Read-only
 * search needs no credentials. A failing subreddit is skipped; the others still count.
 */
public class RedditMentionsTool implements DataFetchStrategy {

    private static final Logger log = LoggerFactory.getLogger(RedditMentionsTool.class);

    static final List<String> SUBREDDITS = List.of("stocks", "investing", "StockMarket", "IndianStockMarket");

    private final WebClient webClient;
    private final Duration timeout;
    private final Clock clock;

    public RedditMentionsTool(WebClient redditWebClient, Duration timeout, Clock clock) {
        this.webClient = redditWebClient;
        this.timeout   = timeout;
        this.clock     = clock;
    }

    @Override
    public List<EvidenceItem> fetch(Map<String, Object> args) {
        String symbol      = (String) args.get("symbol");
        String companyName = (String) args.get("company_name");
        int days       = (Integer) args.get("days");
        int maxResults = (Integer) args.get("max_results");
        int perSub     = Math.max(1, Math.min(25, maxResults / SUBREDDITS.size()));

        List<EvidenceItem> mentions = new ArrayList<>();
        for (String subreddit : SUBREDDITS) {
            if (mentions.size() >= maxResults) break;
            try {
                JsonNode root = webClient.get()
                    .uri(uriBuilder -> uriBuilder
                        .path("/r/{subreddit}/search.json")
                        .queryParam("q", companyName + " OR " + symbol)
                        .queryParam("restrict_sr", "true")
                        .queryParam("limit", perSub)
                        .queryParam("sort", "relevance")
                        .queryParam("t", days <= 30 ? "month" : "year")
                        .build(subreddit))
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block(timeout);
                mentions.addAll(parse(root, subreddit, days, clock.instant()));
            } catch (RuntimeException e) {
                log.warn("Reddit search failed, skipping subreddit. subreddit={} symbol={} error={}",
                    subreddit, symbol, e.getMessage());
            }
        }
        log.info("Fetched social mentions. provider=Reddit symbol={} count={}", symbol, mentions.size());
        return mentions.size() > maxResults ? List.copyOf(mentions.subList(0, maxResults)) : mentions;
    }

    static List<EvidenceItem> parse(JsonNode root, String subreddit, int days, Instant now) {
        List<EvidenceItem> items = new ArrayList<>();
        if (root == null) return items;
        Instant cutoff = now.minus(Duration.ofDays(days));
        for (JsonNode child : root.path("data").path("children")) {
            JsonNode post = child.path("data");
            String title = NewsJson.text(post, "title");
            if (title == null || title.isBlank()) continue;
            Instant created = Instant.ofEpochSecond(post.path("created_utc").asLong(0));
            if (created.isBefore(cutoff)) continue;
            items.add(new EvidenceItem(
                title,
                NewsJson.truncate(NewsJson.text(post, "selftext"), 500),
                created,
                "reddit/r/" + subreddit,
                null));
        }
        return items;
    }
}
