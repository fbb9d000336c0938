package com.socialfeed.ingest.config;

import com.socialfeed.ingest.model.ContentSource;
import com.socialfeed.ingest.model.QueryMode;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Process-wide ingestion settings, resolved once at startup and shared by every invocation.
 */
public final class IngestionSettings {

    private final String apifyToken;
    private final String apifyBaseUrl;
    private final Duration runTimeout;
    private final int pollWaitSeconds;
    private final Map<ContentSource, SourceSettings> sources;
    private final EnrichmentSettings enrichment;

    public IngestionSettings(String apifyToken,
                             String apifyBaseUrl,
                             Duration runTimeout,
                             int pollWaitSeconds,
                             Map<ContentSource, SourceSettings> sources,
                             EnrichmentSettings enrichment) {
        this.apifyToken = apifyToken;
        this.apifyBaseUrl = stripTrailingSlash(apifyBaseUrl);
        this.runTimeout = runTimeout == null ? Duration.ZERO : runTimeout;
        this.pollWaitSeconds = Math.max(1, Math.min(pollWaitSeconds, 60));
        Map<ContentSource, SourceSettings> copy = new EnumMap<>(ContentSource.class);
        copy.putAll(sources);
        this.sources = Collections.unmodifiableMap(copy);
        this.enrichment = enrichment;
    }

    public String getApifyToken() {
        return apifyToken;
    }

    public String getApifyBaseUrl() {
        return apifyBaseUrl;
    }

    /**
     * Deadline for waiting on a run. {@link Duration#ZERO} waits until the run is terminal.
     */
    public Duration getRunTimeout() {
        return runTimeout;
    }

    public int getPollWaitSeconds() {
        return pollWaitSeconds;
    }

    public SourceSettings source(ContentSource source) {
        SourceSettings settings = sources.get(source);
        if (settings == null) {
            throw new IllegalArgumentException("No settings configured for content source " + source);
        }
        return settings;
    }

    public EnrichmentSettings getEnrichment() {
        return enrichment;
    }

    private static String stripTrailingSlash(String url) {
        if (url == null) return null;
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    /**
     * Per-source actor settings.
     *
     * @param actorId      actor to run, in {@code owner/name} form
     * @param queryMode    how targets are passed to the actor
     * @param lookbackDays window length in calendar days, ending at the start of tomorrow
     * @param maxItems     result cap handed to the actor
     * @param extraQuery   token appended to every search term, may be empty
     * @param proxyGroups  proxy groups for actors that scrape through a proxy
     */
    public record SourceSettings(String actorId,
                                 QueryMode queryMode,
                                 int lookbackDays,
                                 int maxItems,
                                 String extraQuery,
                                 List<String> proxyGroups) {
        public SourceSettings {
            extraQuery = extraQuery == null ? "" : extraQuery.trim();
            proxyGroups = proxyGroups == null ? List.of() : List.copyOf(proxyGroups);
        }
    }

    /**
     * Text-generation settings. An empty api key disables enrichment for the openai provider.
     */
    public record EnrichmentSettings(String provider,
                                     String apiKey,
                                     String baseUrl,
                                     String model,
                                     Duration requestTimeout) {

        public static final String PROVIDER_OPENAI = "openai";
        public static final String PROVIDER_BEDROCK = "bedrock";

        public boolean isConfigured() {
            if (PROVIDER_BEDROCK.equalsIgnoreCase(provider)) {
                return model != null && !model.isBlank();
            }
            return apiKey != null && !apiKey.isBlank();
        }
    }
}
