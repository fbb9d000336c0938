package com.socialfeed.ingest.service;

import com.google.common.util.concurrent.RateLimiter;
import com.socialfeed.ingest.config.IngestionSettings;
import com.socialfeed.ingest.model.EnrichmentText;
import com.socialfeed.ingest.model.ScrapedPost;
import com.socialfeed.ingest.service.client.TextGenerationClient;
import com.socialfeed.ingest.service.source.ContentSourceAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Generates a localized title and summary for one stored post. Failures are soft: the caller
 * gets an empty result and the post keeps empty enrichment fields.
 */
@Service
public class PostEnrichmentService {

    private static final Logger logger = LoggerFactory.getLogger(PostEnrichmentService.class);

    static final String SYSTEM_INSTRUCTION = "You are ChatGPT-4. You are a helpful assistant.";

    private final TextGenerationClient client;
    private final RateLimiter rateLimiter;
    private final boolean enabled;

    public PostEnrichmentService(ObjectProvider<TextGenerationClient> clientProvider,
                                 @Qualifier("enrichmentRateLimiter") RateLimiter rateLimiter,
                                 IngestionSettings settings) {
        this.client = clientProvider.getIfAvailable();
        this.rateLimiter = rateLimiter;
        this.enabled = client != null && settings.getEnrichment().isConfigured();
        if (!enabled) {
            logger.warn("Text generation is not configured (provider={}); enrichment will be skipped.",
                    settings.getEnrichment().provider());
        }
    }

    /**
     * False when no credential or client is configured; the whole enrichment phase is then skipped.
     */
    public boolean isEnabled() {
        return enabled;
    }

    @SuppressWarnings("UnstableApiUsage")
    public Optional<EnrichmentText> enrich(ScrapedPost post, String languageCode,
                                           ContentSourceAdapter adapter, String fallbackAuthor) {
        if (!enabled) {
            return Optional.empty();
        }
        String prompt = adapter.buildPrompt(post, LanguageNames.displayName(languageCode), fallbackAuthor);
        try {
            rateLimiter.acquire();
            String reply = client.complete(SYSTEM_INSTRUCTION, prompt, adapter.temperature());
            EnrichmentText text = adapter.parseReply(reply);
            if (text.summary() == null || text.summary().isBlank()) {
                logger.warn("Empty enrichment reply for {} post {}", post.getSource(), post.getNativeId());
                return Optional.empty();
            }
            return Optional.of(text);
        } catch (EnrichmentTransportException e) {
            logger.warn("Enrichment failed for {} post {}: {}", post.getSource(), post.getNativeId(), e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            logger.error("Unexpected error enriching {} post {}", post.getSource(), post.getNativeId(), e);
            return Optional.empty();
        }
    }
}
