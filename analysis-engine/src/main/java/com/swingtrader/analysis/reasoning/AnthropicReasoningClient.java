package com.swingtrader.analysis.reasoning;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * {@link ReasoningClient} backed by the Anthropic Messages API.
 *
 * <p>The request is composed as a {@code Mono} chain and blocked once at the end, because
 * callers are units already running on {@code boundedElastic} workers.
 */
public class AnthropicReasoningClient implements ReasoningClient {

    private static final Logger log = LoggerFactory.getLogger(AnthropicReasoningClient.class);

    private final WebClient anthropicClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final String model;
    private final int maxTokens;
    private final Duration timeout;

    public AnthropicReasoningClient(WebClient anthropicClient, ObjectMapper objectMapper,
                                    String apiKey, String model, int maxTokens, Duration timeout) {
        this.anthropicClient = anthropicClient;
        this.objectMapper    = objectMapper;
        this.apiKey          = apiKey;
        this.model           = model;
        this.maxTokens       = maxTokens;
        this.timeout         = timeout;
    }

    @Override
    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public String complete(String prompt) {
        if (!isConfigured()) {
            throw new ReasoningException("No Anthropic API key configured");
        }
        Map<String, Object> requestBody = Map.of(
            "model", model,
            "max_tokens", maxTokens,
            "messages", List.of(Map.of("role", "user", "content", prompt))
        );
        try {
            String text = Mono.fromCallable(() -> objectMapper.writeValueAsString(requestBody))
                .flatMap(bodyJson -> anthropicClient.post()
                    .uri("/v1/messages")
                    .header("x-api-key", apiKey)
                    .bodyValue(bodyJson)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout))
                .map(this::extractText)
                .block();
            log.debug("Reasoning call completed. model={} chars={}", model, text == null ? 0 : text.length());
            return text;
        } catch (ReasoningException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ReasoningException("Anthropic call failed: " + e.getMessage(), e);
        }
    }

    private String extractText(String response) {
        try {
            JsonNode root = objectMapper.readTree(response);
            JsonNode content = root.path("content");
            if (!content.isArray() || content.isEmpty()) {
                throw new ReasoningException("Anthropic response has no content blocks");
            }
            return content.get(0).path("text").asText();
        } catch (com.fasterxml.jackson.core.JsonProcessingException e) {
            throw new ReasoningException("Failed to extract text from Anthropic response", e);
        }
    }
}
