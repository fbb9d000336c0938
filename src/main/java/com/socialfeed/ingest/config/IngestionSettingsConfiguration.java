package com.socialfeed.ingest.config;

import com.socialfeed.ingest.model.ContentSource;
import com.socialfeed.ingest.model.QueryMode;
import com.socialfeed.ingest.service.MissingConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Configuration
public class IngestionSettingsConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(IngestionSettingsConfiguration.class);

    @Value("${apify.token:}")
    private String apifyToken;

    @Value("${apify.base-url:https://api.apify.com/v2}")
    private String apifyBaseUrl;

    @Value("${apify.run-timeout:0s}")
    private Duration runTimeout;

    @Value("${apify.poll-wait-seconds:60}")
    private int pollWaitSeconds;

    @Value("${app.sources.twitter.actor-id:apidojo/tweet-scraper}")
    private String twitterActorId;

    @Value("${app.sources.twitter.query-mode:DIRECT_TARGETS}")
    private QueryMode twitterQueryMode;

    @Value("${app.sources.twitter.lookback-days:7}")
    private int twitterLookbackDays;

    @Value("${app.sources.twitter.max-items:250}")
    private int twitterMaxItems;

    @Value("${app.sources.twitter.extra-query:}")
    private String twitterExtraQuery;

    @Value("${app.sources.facebook.actor-id:apify/facebook-posts-scraper}")
    private String facebookActorId;

    @Value("${app.sources.facebook.lookback-days:1}")
    private int facebookLookbackDays;

    @Value("${app.sources.facebook.max-items:3}")
    private int facebookMaxItems;

    @Value("${app.sources.facebook.proxy-groups:RESIDENTIAL}")
    private List<String> facebookProxyGroups;

    @Value("${app.enrichment.provider:openai}")
    private String enrichmentProvider;

    @Value("${app.enrichment.openai.api-key:}")
    private String openAiApiKey;

    @Value("${app.enrichment.openai.base-url:https://api.openai.com/v1}")
    private String openAiBaseUrl;

    @Value("${app.enrichment.model:gpt-4-turbo}")
    private String enrichmentModel;

    @Value("${app.enrichment.request-timeout:60s}")
    private Duration enrichmentTimeout;

    /**
     * Builds the settings value. Fails startup when the actor credential is missing.
     */
    @Bean
    public IngestionSettings ingestionSettings() {
        if (apifyToken == null || apifyToken.isBlank()) {
            throw new MissingConfigurationException("apify.token");
        }
        Map<ContentSource, IngestionSettings.SourceSettings> sources = new EnumMap<>(ContentSource.class);
        sources.put(ContentSource.TWITTER, new IngestionSettings.SourceSettings(
                twitterActorId, twitterQueryMode, twitterLookbackDays, twitterMaxItems, twitterExtraQuery, List.of()));
        // The page actor only understands structured start URLs.
        sources.put(ContentSource.FACEBOOK, new IngestionSettings.SourceSettings(
                facebookActorId, QueryMode.DIRECT_TARGETS, facebookLookbackDays, facebookMaxItems, "", facebookProxyGroups));

        IngestionSettings.EnrichmentSettings enrichment = new IngestionSettings.EnrichmentSettings(
                enrichmentProvider, openAiApiKey, openAiBaseUrl, enrichmentModel, enrichmentTimeout);

        IngestionSettings settings = new IngestionSettings(apifyToken, apifyBaseUrl, runTimeout, pollWaitSeconds, sources, enrichment);
        logger.info("Ingestion settings loaded: twitter actor={} mode={} lookback={}d maxItems={}, facebook actor={} lookback={}d maxItems={}, enrichment provider={} configured={}",
                twitterActorId, twitterQueryMode, twitterLookbackDays, twitterMaxItems,
                facebookActorId, facebookLookbackDays, facebookMaxItems,
                enrichmentProvider, enrichment.isConfigured());
        return settings;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
