package com.swingtrader.orchestrator.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * One WebClient per upstream, all sharing connect/read timeouts, a 5xx filter and a
 * request logger that masks credentials.
 */
@Configuration
public class WebClientConfig {

    private static final Logger log = LoggerFactory.getLogger(WebClientConfig.class);

    private static final int MAX_IN_MEMORY_BYTES = 4 * 1024 * 1024;

    @Value("${alpha-vantage.base-url:https://www.alphavantage.co}")
    private String alphaVantageBaseUrl;

    @Value("${event-registry.base-url:https://eventregistry.org}")
    private String eventRegistryBaseUrl;

    @Value("${gnews.base-url:https://gnews.io}")
    private String gnewsBaseUrl;

    @Value("${reddit.base-url:https://www.reddit.com}")
    private String redditBaseUrl;

    @Value("${reddit.user-agent:swing-trader/1.0}")
    private String redditUserAgent;

    @Value("${anthropic.base-url:https://api.anthropic.com}")
    private String anthropicBaseUrl;

    @Value("${anthropic.version:2023-06-01}")
    private String anthropicVersion;

    @Bean
    public WebClient marketDataWebClient(WebClient.Builder builder) {
        return configured(builder, alphaVantageBaseUrl, "Market data").build();
    }

    @Bean
    public WebClient eventRegistryWebClient(WebClient.Builder builder) {
        return configured(builder, eventRegistryBaseUrl, "News").build();
    }

    @Bean
    public WebClient gnewsWebClient(WebClient.Builder builder) {
        return configured(builder, gnewsBaseUrl, "GNews").build();
    }

    @Bean
    public WebClient redditWebClient(WebClient.Builder builder) {
        return configured(builder, redditBaseUrl, "Reddit")
            .defaultHeader("User-Agent", redditUserAgent)
            .build();
    }

    @Bean
    public WebClient anthropicWebClient(WebClient.Builder builder) {
        return configured(builder, anthropicBaseUrl, "Anthropic")
            .defaultHeader("anthropic-version", anthropicVersion)
            .defaultHeader("content-type", "application/json")
            .build();
    }

    private WebClient.Builder configured(WebClient.Builder builder, String baseUrl, String upstream) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
            .responseTimeout(Duration.ofSeconds(30))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(30, TimeUnit.SECONDS))
            );

        // builder is a prototype bean; clone so headers do not leak between clients
        return builder.clone()
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .codecs(c -> c.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_BYTES))
            .filter(serverErrorFilter(upstream))
            .filter(loggingFilter());
    }

    private ExchangeFilterFunction serverErrorFilter(String upstream) {
        return ExchangeFilterFunction.ofResponseProcessor(clientResponse -> {
            if (clientResponse.statusCode().is5xxServerError()) {
                return Mono.error(new RuntimeException(upstream + " server error: " + clientResponse.statusCode()));
            }
            return Mono.just(clientResponse);
        });
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            String sanitized = clientRequest.url().toString()
                .replaceAll("(?i)(apikey|token)=[^&]+", "$1=***");
            log.debug("Outbound request: {} {}", clientRequest.method(), sanitized);
            return Mono.just(clientRequest);
        });
    }
}
