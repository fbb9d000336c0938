package com.socialfeed.ingest.service.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.socialfeed.ingest.config.IngestionSettings;
import com.socialfeed.ingest.service.EnrichmentTransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

/**
 * Chat-completions client for OpenAI-compatible endpoints.
 */
@Service
@ConditionalOnProperty(name = "app.enrichment.provider", havingValue = "openai", matchIfMissing = true)
public class OpenAiChatClient implements TextGenerationClient {

    private static final Logger logger = LoggerFactory.getLogger(OpenAiChatClient.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final IngestionSettings.EnrichmentSettings settings;

    public OpenAiChatClient(HttpClient httpClient, ObjectMapper objectMapper, IngestionSettings ingestionSettings) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.settings = ingestionSettings.getEnrichment();
        logger.info("OpenAiChatClient initialized with base URL: {} and model: {}", settings.baseUrl(), settings.model());
    }

    @Override
    public String complete(String systemInstruction, String prompt, double temperature) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("model", settings.model());
        ArrayNode messages = payload.putArray("messages");
        messages.addObject().put("role", "system").put("content", systemInstruction);
        messages.addObject().put("role", "user").put("content", prompt);
        payload.put("temperature", temperature);

        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                    .uri(URI.create(settings.baseUrl() + "/chat/completions"))
                    .timeout(settings.requestTimeout())
                    .header("Authorization", "Bearer " + settings.apiKey())
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(payload)))
                    .build();
        } catch (IOException e) {
            throw new EnrichmentTransportException("Could not serialize chat request", e);
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new EnrichmentTransportException("Chat completion call failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EnrichmentTransportException("Interrupted during chat completion call", e);
        }

        if (response.statusCode() != 200) {
            throw new EnrichmentTransportException("Chat completion returned status " + response.statusCode()
                    + ": " + response.body());
        }

        JsonNode content;
        try {
            content = objectMapper.readTree(response.body()).path("choices").path(0).path("message").path("content");
        } catch (IOException e) {
            throw new EnrichmentTransportException("Malformed chat completion response", e);
        }
        if (!content.isTextual()) {
            throw new EnrichmentTransportException("Chat completion response has no message content");
        }
        return content.asText();
    }
}
