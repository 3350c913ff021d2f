package com.swingtrader.analysis.market;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Daily OHLCV history from Alpha Vantage {@code TIME_SERIES_DAILY}.
 */
public class AlphaVantageStockDataProvider implements StockDataProvider {

    private static final Logger log = LoggerFactory.getLogger(AlphaVantageStockDataProvider.class);

    private final WebClient webClient;
    private final String apiKey;
    private final Duration timeout;

    public AlphaVantageStockDataProvider(WebClient marketDataWebClient, String apiKey, Duration timeout) {
        this.webClient = marketDataWebClient;
        this.apiKey    = apiKey;
        this.timeout   = timeout;
    }

    @Override
    public PriceHistory fetchHistory(String symbol) {
        log.info("Fetching price history. provider=AlphaVantage symbol={}", symbol);
        AlphaVantageTimeSeriesResponse response = webClient.get()
            .uri(uriBuilder -> uriBuilder
                .path("/query")
                .queryParam("function", "TIME_SERIES_DAILY")
                .queryParam("symbol", symbol)
                .queryParam("outputsize", "compact")
                .queryParam("apikey", apiKey)
                .build())
            .retrieve()
            .bodyToMono(AlphaVantageTimeSeriesResponse.class)
            .doOnError(e -> log.error("Alpha Vantage fetch failed. symbol={}", symbol, e))
            .block(timeout);
        PriceHistory history = toHistory(symbol, response);
        log.info("Price history fetched. symbol={} bars={} latestClose={}",
            symbol, history.size(), history.latestClose());
        return history;
    }

    static PriceHistory toHistory(String symbol, AlphaVantageTimeSeriesResponse response) {
        if (response == null) {
            throw new MarketDataException("Empty response from Alpha Vantage for symbol: " + symbol);
        }
        Map<String, AlphaVantageTimeSeriesResponse.DailyBar> series = response.timeSeriesDaily();
        if (series == null || series.isEmpty()) {
            String problem = response.problem();
            throw new MarketDataException("No daily series from Alpha Vantage for symbol: " + symbol
                + (problem != null ? " (" + problem + ")" : ""));
        }
        // ISO dates sort lexicographically; reverse order gives newest-first
        TreeMap<String, AlphaVantageTimeSeriesResponse.DailyBar> sorted = new TreeMap<>((a, b) -> b.compareTo(a));
        sorted.putAll(series);
        List<PriceBar> bars = new ArrayList<>(sorted.size());
        sorted.forEach((date, bar) -> bars.add(new PriceBar(
            LocalDate.parse(date),
            Double.parseDouble(bar.open()),
            Double.parseDouble(bar.high()),
            Double.parseDouble(bar.low()),
            Double.parseDouble(bar.close()),
            Long.parseLong(bar.volume()))));
        return new PriceHistory(symbol, bars);
    }
}
