package com.socialfeed.ingest.service;

import com.socialfeed.ingest.model.ContentSource;
import com.socialfeed.ingest.model.EnrichmentText;
import com.socialfeed.ingest.model.ScrapedPost;
import com.socialfeed.ingest.repository.ScrapedPostRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

/**
 * Owns the two commit points of an ingestion run: the bulk insert and the enrichment update.
 */
@Service
public class ScrapedPostStore {

    private static final Logger logger = LoggerFactory.getLogger(ScrapedPostStore.class);

    private final ScrapedPostRepository scrapedPostRepository;
    private final Clock clock;

    public ScrapedPostStore(ScrapedPostRepository scrapedPostRepository, Clock clock) {
        this.scrapedPostRepository = scrapedPostRepository;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public boolean exists(Long userId, ContentSource source, String nativeId) {
        return scrapedPostRepository.existsByUserIdAndSourceAndNativeId(userId, source, nativeId);
    }

    /**
     * Stored posts of a user, newest first, optionally restricted to one source.
     */
    @Transactional(readOnly = true)
    public List<ScrapedPost> listPosts(Long userId, ContentSource source) {
        if (source == null) {
            return scrapedPostRepository.findAllByUserIdOrderByPostedAtDesc(userId);
        }
        return scrapedPostRepository.findAllByUserIdAndSourceOrderByPostedAtDesc(userId, source);
    }

    /**
     * Inserts every record in one transaction. Either all are stored or none.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<ScrapedPost> insertAll(List<ScrapedPost> posts) {
        if (posts.isEmpty()) {
            return List.of();
        }
        List<ScrapedPost> saved = scrapedPostRepository.saveAll(posts);
        logger.info("Inserted {} scraped posts", saved.size());
        return saved;
    }

    /**
     * Writes generated titles and summaries keyed by post id, in one transaction.
     * Posts that were removed in the meantime are skipped.
     *
     * @return number of posts updated
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int applyEnrichments(Map<Long, EnrichmentText> enrichments) {
        if (enrichments.isEmpty()) {
            return 0;
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        int updated = 0;
        for (ScrapedPost post : scrapedPostRepository.findAllById(enrichments.keySet())) {
            EnrichmentText text = enrichments.get(post.getId());
            post.setGeneratedTitle(text.title());
            post.setGeneratedSummary(text.summary());
            post.setEnrichedAt(now);
            updated++;
        }
        scrapedPostRepository.flush();
        logger.info("Applied enrichment to {} of {} scraped posts", updated, enrichments.size());
        return updated;
    }
}
