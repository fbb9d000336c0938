package com.socialfeed.ingest.service;

import com.socialfeed.ingest.config.IngestionSettings;
import com.socialfeed.ingest.dto.IngestionOutcome;
import com.socialfeed.ingest.model.AcceptedItem;
import com.socialfeed.ingest.model.ActorQuery;
import com.socialfeed.ingest.model.ActorRun;
import com.socialfeed.ingest.model.AppUser;
import com.socialfeed.ingest.model.ContentSource;
import com.socialfeed.ingest.model.EnrichmentText;
import com.socialfeed.ingest.model.FilterResult;
import com.socialfeed.ingest.model.IngestWindow;
import com.socialfeed.ingest.model.PipelineState;
import com.socialfeed.ingest.model.ScrapedPost;
import com.socialfeed.ingest.service.client.ApifyActorClient;
import com.socialfeed.ingest.service.source.ContentSourceAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Runs one ingestion for a (user, content source) pair:
 * fetch, filter, insert (commit 1), enrich each new post, update (commit 2).
 *
 * Failures are confined to the pair. Updating the user's last-scraped time is left to the caller.
 */
@Service
public class IngestionPipelineService {

    private static final Logger logger = LoggerFactory.getLogger(IngestionPipelineService.class);

    private final Map<ContentSource, ContentSourceAdapter> adapters = new EnumMap<>(ContentSource.class);
    private final ApifyActorClient actorClient;
    private final WindowDedupFilter filter;
    private final RecordMapper recordMapper;
    private final ScrapedPostStore store;
    private final PostEnrichmentService enrichmentService;
    private final IngestionSettings settings;
    private final Clock clock;

    public IngestionPipelineService(List<ContentSourceAdapter> adapters,
                                    ApifyActorClient actorClient,
                                    WindowDedupFilter filter,
                                    RecordMapper recordMapper,
                                    ScrapedPostStore store,
                                    PostEnrichmentService enrichmentService,
                                    IngestionSettings settings,
                                    Clock clock) {
        for (ContentSourceAdapter adapter : adapters) {
            this.adapters.put(adapter.source(), adapter);
        }
        this.actorClient = actorClient;
        this.filter = filter;
        this.recordMapper = recordMapper;
        this.store = store;
        this.enrichmentService = enrichmentService;
        this.settings = settings;
        this.clock = clock;
    }

    public IngestionOutcome ingest(AppUser user, ContentSource source) {
        IngestionOutcome outcome = new IngestionOutcome(user.getId(), source);
        ContentSourceAdapter adapter = adapters.get(source);
        if (adapter == null) {
            outcome.fail("No adapter registered for " + source);
            logger.error("User {} {}: {}", user.getId(), source, outcome.getAbortReason());
            return outcome;
        }

        List<String> identifiers = normalizeReferences(user, adapter);
        if (identifiers.isEmpty()) {
            outcome.abort("no valid " + source.getReferenceKind() + " references");
            logger.info("User {} {}: IDLE -> ABORTED ({})", user.getId(), source, outcome.getAbortReason());
            return outcome;
        }

        IngestionSettings.SourceSettings sourceSettings = settings.source(source);
        IngestWindow window = IngestWindow.endingTomorrow(clock.instant(), sourceSettings.lookbackDays());

        // Fetching
        transition(outcome, PipelineState.FETCHING);
        List<Map<String, Object>> items;
        try {
            ActorQuery query = adapter.buildQuery(identifiers, window, sourceSettings);
            logger.info("User {} {}: running actor {} for {} reference(s), window {}",
                    user.getId(), source, sourceSettings.actorId(), identifiers.size(), window);
            ActorRun run = actorClient.runAndWait(sourceSettings.actorId(), query);
            items = actorClient.fetchItems(run.datasetId());
        } catch (IngestionException e) {
            outcome.fail(e.getMessage());
            logger.error("User {} {}: FETCHING -> ABORTED: {}", user.getId(), source, e.getMessage(), e);
            return outcome;
        }
        outcome.setFetched(items.size());

        // Filtering
        transition(outcome, PipelineState.FILTERING);
        FilterResult result = filter.filter(items, adapter, window,
                nativeId -> store.exists(user.getId(), source, nativeId));
        outcome.setAccepted(result.getAccepted().size());
        outcome.setDiscards(result.getDiscards());
        logger.info("User {} {}: fetched={} accepted={} discards={}",
                user.getId(), source, items.size(), result.getAccepted().size(), result.getDiscards());

        if (result.getAccepted().isEmpty()) {
            transition(outcome, PipelineState.DONE);
            return outcome;
        }

        // Inserting
        transition(outcome, PipelineState.INSERTING);
        List<ScrapedPost> mapped = new ArrayList<>(result.getAccepted().size());
        for (AcceptedItem item : result.getAccepted()) {
            mapped.add(recordMapper.map(item, user.getId(), adapter));
        }
        List<ScrapedPost> inserted;
        try {
            inserted = store.insertAll(mapped);
        } catch (DataAccessException e) {
            outcome.fail("insert failed: " + e.getMostSpecificCause().getMessage());
            logger.error("User {} {}: INSERTING -> ABORTED, no records stored", user.getId(), source, e);
            return outcome;
        }
        outcome.setInserted(inserted.size());

        if (!enrichmentService.isEnabled()) {
            logger.info("User {} {}: enrichment not configured, skipping", user.getId(), source);
            transition(outcome, PipelineState.DONE);
            return outcome;
        }

        // Enriching
        transition(outcome, PipelineState.ENRICHING);
        String language = user.languageFor(source);
        Map<Long, EnrichmentText> enrichments = new LinkedHashMap<>();
        for (ScrapedPost post : inserted) {
            Optional<EnrichmentText> text = enrichmentService.enrich(post, language, adapter, user.displayName());
            text.ifPresent(t -> enrichments.put(post.getId(), t));
        }
        try {
            outcome.setEnriched(store.applyEnrichments(enrichments));
        } catch (DataAccessException e) {
            logger.error("User {} {}: enrichment update failed, {} post(s) left unenriched",
                    user.getId(), source, enrichments.size(), e);
        }
        if (outcome.getEnriched() < inserted.size()) {
            logger.warn("User {} {}: enriched {} of {} inserted post(s)",
                    user.getId(), source, outcome.getEnriched(), inserted.size());
        }

        transition(outcome, PipelineState.DONE);
        return outcome;
    }

    private List<String> normalizeReferences(AppUser user, ContentSourceAdapter adapter) {
        Set<String> identifiers = new LinkedHashSet<>();
        for (String raw : user.referencesFor(adapter.source())) {
            Optional<String> normalized = adapter.normalizeReference(raw);
            if (normalized.isPresent()) {
                identifiers.add(normalized.get());
            } else {
                logger.debug("User {} {}: ignoring unusable reference '{}'", user.getId(), adapter.source(), raw);
            }
        }
        return new ArrayList<>(identifiers);
    }

    private void transition(IngestionOutcome outcome, PipelineState next) {
        logger.info("User {} {}: {} -> {}", outcome.getUserId(), outcome.getSource(), outcome.getState(), next);
        outcome.setState(next);
    }
}
