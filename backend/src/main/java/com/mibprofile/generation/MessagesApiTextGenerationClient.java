package com.mibprofile.generation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mibprofile.generation.config.GenerationProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Text generation over a messages-style HTTP API (POST /v1/messages, x-api-key auth). Failures are logged and
 * reported as no answer.
 */
@Slf4j
public class MessagesApiTextGenerationClient implements TextGenerationClient {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final GenerationProperties properties;
    private final WebClient webClient;

    public MessagesApiTextGenerationClient(GenerationProperties properties, WebClient.Builder builder) {
        this.properties = properties;
        this.webClient = builder
                .baseUrl(properties.getBaseUrl())
                .defaultHeader("x-api-key", properties.getApiKey())
                .defaultHeader("anthropic-version", properties.getApiVersion())
                .build();
    }

    @Override
    public Optional<String> complete(String prompt) {
        if (prompt == null || prompt.isBlank()) {
            return Optional.empty();
        }
        Map<String, Object> body = Map.of(
                "model", properties.getModel(),
                "max_tokens", properties.getMaxTokens(),
                "messages", List.of(Map.of("role", "user", "content", prompt)));
        try {
            String response = webClient.post()
                    .uri("/v1/messages")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofMillis(properties.getTimeoutMs()))
                    .block();
            return extractText(response);
        } catch (WebClientResponseException e) {
            log.warn("Generation call failed: {} {}", e.getStatusCode(), e.getMessage());
            return Optional.empty();
        } catch (Exception e) {
            log.warn("Generation call error: {}", e.getMessage());
            return Optional.empty();
        }
    }

    static Optional<String> extractText(String json) {
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode content = MAPPER.readTree(json).path("content");
            if (!content.isArray()) {
                return Optional.empty();
            }
            StringBuilder text = new StringBuilder();
            for (JsonNode block : content) {
                if ("text".equals(block.path("type").asText()) && block.path("text").isTextual()) {
                    text.append(block.path("text").asText());
                }
            }
            return text.isEmpty() ? Optional.empty() : Optional.of(text.toString());
        } catch (Exception e) {
            log.warn("Generation response unreadable: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
