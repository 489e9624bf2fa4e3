package com.agentrelay.orchestrator.llm;

import com.agentrelay.orchestrator.config.AgentRelayProperties;
import com.agentrelay.orchestrator.pool.ResourcePool;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.Map;

/**
 * {@link LlmClient} over the Anthropic Messages API.
 *
 * HTTP clients are borrowed from a {@link ResourcePool} so that concurrent
 * fan-out stages do not share one connection pool and a burst of stages
 * cannot open an unbounded number of clients.
 */
@Component
public class ClaudeClient implements LlmClient {

    private static final Logger log = LoggerFactory.getLogger(ClaudeClient.class);

    // -------------------------------------------------------------------------
    // Wire records
    // -------------------------------------------------------------------------

    public record Message(String role, String content) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MessagesResponse(List<ContentBlock> content) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        public record ContentBlock(String type, String text) {}

        public String firstText() {
            if (content == null) {
                throw new LlmException(200, "Response has no content blocks");
            }
            return content.stream()
                    .filter(b -> "text".equals(b.type()))
                    .map(ContentBlock::text)
                    .findFirst()
                    .orElseThrow(() -> new LlmException(200, "No text block in response"));
        }
    }

    // -------------------------------------------------------------------------
    // Fields
    // -------------------------------------------------------------------------

    private static final String API_VER = "2023-06-01";

    private final AgentRelayProperties.Llm settings;
    private final ObjectMapper             json;
    private final ResourcePool<HttpClient> clients;

    public ClaudeClient(AgentRelayProperties properties, ObjectMapper objectMapper) {
        this.settings = properties.llm();
        this.json     = objectMapper;
        this.clients  = new ResourcePool<>("anthropic-http",
                () -> HttpClient.newBuilder().connectTimeout(settings.connectTimeout()).build(),
                client -> log.debug("Discarding pooled HTTP client {}", client),
                settings.poolMinSize(),
                settings.poolMaxSize());
        if (settings.apiKey() == null || settings.apiKey().isBlank()) {
            log.warn("agentrelay.llm.api-key is not set; LLM-backed agents will fail");
        }
    }

    // -------------------------------------------------------------------------
    // Public API
    // -------------------------------------------------------------------------

    /**
     * One request/response round trip.
     *
     * Request shape: {@code { model, max_tokens, temperature, system, messages: [{role, content}] }}
     */
    @Override
    public String complete(String systemPrompt, String userPrompt, double temperature) {
        String body;
        try {
            body = json.writeValueAsString(Map.of(
                    "model",       settings.model(),
                    "max_tokens",  settings.maxTokens(),
                    "temperature", temperature,
                    "system",      systemPrompt,
                    "messages",    List.of(new Message("user", userPrompt))));
        } catch (JsonProcessingException e) {
            throw new LlmException("Could not encode request", e);
        }

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(settings.apiUrl()))
                .timeout(settings.requestTimeout())
                .header("content-type",      "application/json")
                .header("x-api-key",         settings.apiKey())
                .header("anthropic-version", API_VER)
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        HttpResponse<String> response = clients.withHandle(http -> send(http, request));
        if (response.statusCode() != 200) {
            throw new LlmException(response.statusCode(),
                    "Claude API error %d: %s".formatted(response.statusCode(), response.body()));
        }
        try {
            return json.readValue(response.body(), MessagesResponse.class).firstText();
        } catch (JsonProcessingException e) {
            throw new LlmException("Could not decode response", e);
        }
    }

    public ResourcePool.PoolStats poolStats() {
        return clients.stats();
    }

    @PreDestroy
    public void shutdown() {
        clients.close();
    }

    private static HttpResponse<String> send(HttpClient http, HttpRequest request) {
        try {
            return http.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new LlmException("Claude API call failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmException("Claude API call interrupted", e);
        }
    }
}
