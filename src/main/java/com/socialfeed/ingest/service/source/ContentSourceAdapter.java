package com.socialfeed.ingest.service.source;

import com.socialfeed.ingest.config.IngestionSettings;
import com.socialfeed.ingest.model.ActorQuery;
import com.socialfeed.ingest.model.ContentSource;
import com.socialfeed.ingest.model.EnrichmentText;
import com.socialfeed.ingest.model.IngestWindow;
import com.socialfeed.ingest.model.ScrapedPost;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Everything that differs between content sources: how references are normalized, how the
 * actor is queried, where fields live in a dataset item, and how enrichment prompts and replies
 * look. The pipeline itself is source-agnostic.
 */
public interface ContentSourceAdapter {

    ContentSource source();

    /**
     * Canonical identifier for a user-declared reference, or empty if it is unusable.
     */
    Optional<String> normalizeReference(String raw);

    /**
     * Builds the actor run input for the given canonical identifiers.
     */
    ActorQuery buildQuery(List<String> identifiers, IngestWindow window, IngestionSettings.SourceSettings settings);

    /**
     * Type tag that content items carry, or {@code null} when this source does not tag items.
     */
    String expectedType();

    Optional<String> extractNativeId(Map<String, Object> item);

    Optional<String> extractRawTimestamp(Map<String, Object> item);

    /**
     * Copies source-specific fields from the item onto the record. Must not throw for
     * malformed nested structures; missing values become empty strings or zero.
     */
    void extractFields(Map<String, Object> item, ScrapedPost target);

    /**
     * Deterministic instruction for the text-generation service.
     *
     * @param fallbackAuthor name to use when the record has no author of its own
     */
    String buildPrompt(ScrapedPost post, String languageName, String fallbackAuthor);

    /**
     * Splits a reply into title and summary. Replies without the expected marker become
     * an {@link EnrichmentText#UNTITLED} title with the whole reply as summary.
     */
    EnrichmentText parseReply(String reply);

    double temperature();
}
