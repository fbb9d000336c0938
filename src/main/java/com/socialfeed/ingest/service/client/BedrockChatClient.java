package com.socialfeed.ingest.service.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.socialfeed.ingest.config.IngestionSettings;
import com.socialfeed.ingest.service.EnrichmentTransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;
import software.amazon.awssdk.services.bedrockruntime.model.BedrockRuntimeException;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelRequest;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelResponse;

import java.io.IOException;

/**
 * Text generation through an Anthropic model hosted on Amazon Bedrock.
 */
@Service
@ConditionalOnProperty(name = "app.enrichment.provider", havingValue = "bedrock")
public class BedrockChatClient implements TextGenerationClient {

    private static final Logger logger = LoggerFactory.getLogger(BedrockChatClient.class);
    static final String ANTHROPIC_VERSION = "bedrock-2023-05-31";

    private final BedrockRuntimeClient bedrockClient;
    private final ObjectMapper objectMapper;
    private final String modelId;
    private final int maxTokens;

    public BedrockChatClient(BedrockRuntimeClient bedrockClient,
                             ObjectMapper objectMapper,
                             IngestionSettings settings,
                             @Value("${app.enrichment.bedrock.max-tokens:1024}") int maxTokens) {
        this.bedrockClient = bedrockClient;
        this.objectMapper = objectMapper;
        this.modelId = settings.getEnrichment().model();
        this.maxTokens = Math.max(128, maxTokens);
        logger.info("BedrockChatClient initialized with model ID: {}", modelId);
    }

    @Override
    public String complete(String systemInstruction, String prompt, double temperature) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("anthropic_version", ANTHROPIC_VERSION);
        payload.put("max_tokens", maxTokens);
        payload.put("system", systemInstruction);
        payload.put("temperature", temperature);
        payload.putArray("messages").addObject()
                .put("role", "user")
                .put("content", prompt);

        InvokeModelResponse response;
        try {
            InvokeModelRequest request = InvokeModelRequest.builder()
                    .modelId(modelId)
                    .contentType("application/json")
                    .accept("application/json")
                    .body(SdkBytes.fromUtf8String(objectMapper.writeValueAsString(payload)))
                    .build();
            response = bedrockClient.invokeModel(request);
        } catch (BedrockRuntimeException e) {
            String detail = e.awsErrorDetails() != null ? e.awsErrorDetails().errorMessage() : e.getMessage();
            throw new EnrichmentTransportException("Bedrock API error for model " + modelId + ": " + detail, e);
        } catch (SdkException | IOException e) {
            throw new EnrichmentTransportException("Bedrock call failed for model " + modelId + ": " + e.getMessage(), e);
        }

        JsonNode contentBlock;
        try {
            contentBlock = objectMapper.readTree(response.body().asUtf8String()).path("content");
        } catch (IOException e) {
            throw new EnrichmentTransportException("Malformed Bedrock response", e);
        }
        if (!contentBlock.isArray() || contentBlock.isEmpty() || !contentBlock.get(0).path("text").isTextual()) {
            throw new EnrichmentTransportException("Bedrock response does not contain a text content block");
        }
        return contentBlock.get(0).path("text").asText();
    }
}
