package com.socialfeed.ingest.service;

import com.socialfeed.ingest.dto.IngestionOutcome;
import com.socialfeed.ingest.dto.UserIngestionReport;
import com.socialfeed.ingest.model.AppUser;
import com.socialfeed.ingest.model.ContentSource;
import com.socialfeed.ingest.repository.AppUserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Sequences the pipeline over every content source of a user and records the scrape time once
 * all sources are through. Also hosts the scheduled sweep over users that are due.
 *
 * Every entry point runs a user only while holding that user's slot in {@link UserRunRegistry};
 * a user whose run is already in flight is skipped.
 */
@Service
public class UserIngestionService {

    private static final Logger logger = LoggerFactory.getLogger(UserIngestionService.class);
    static final int DEFAULT_INTERVAL_MINUTES = 60;

    private final AppUserRepository appUserRepository;
    private final IngestionPipelineService pipelineService;
    private final UserRunRegistry runRegistry;
    private final Clock clock;
    private final boolean sweepEnabled;
    private final AtomicBoolean sweeping = new AtomicBoolean(false);

    public UserIngestionService(AppUserRepository appUserRepository,
                                IngestionPipelineService pipelineService,
                                UserRunRegistry runRegistry,
                                Clock clock,
                                @Value("${app.ingestion.sweep.enabled:true}") boolean sweepEnabled) {
        this.appUserRepository = appUserRepository;
        this.pipelineService = pipelineService;
        this.runRegistry = runRegistry;
        this.clock = clock;
        this.sweepEnabled = sweepEnabled;
    }

    /**
     * Ingests every content source for one user.
     *
     * @return the report, or empty when a run for the user is already in flight
     * @throws UserNotFoundException if no such user exists
     */
    public Optional<UserIngestionReport> ingest(Long userId) {
        return ingestIfIdle(findUser(userId));
    }

    /**
     * Same as {@link #ingest(Long)} for a caller that already holds the user's run slot.
     *
     * @throws UserNotFoundException if no such user exists
     */
    public UserIngestionReport ingestClaimed(Long userId) {
        return ingest(findUser(userId));
    }

    Optional<UserIngestionReport> ingestIfIdle(AppUser user) {
        if (!runRegistry.tryClaim(user.getId())) {
            logger.info("Ingestion for user {} already in flight; skipped", user.getId());
            return Optional.empty();
        }
        try {
            return Optional.of(ingest(user));
        } finally {
            runRegistry.release(user.getId());
        }
    }

    private AppUser findUser(Long userId) {
        return appUserRepository.findById(userId)
                .orElseThrow(() -> new UserNotFoundException(userId));
    }

    UserIngestionReport ingest(AppUser user) {
        UserIngestionReport report = new UserIngestionReport(user.getId());
        for (ContentSource source : ContentSource.values()) {
            IngestionOutcome outcome;
            try {
                outcome = pipelineService.ingest(user, source);
            } catch (RuntimeException e) {
                logger.error("Ingestion for user {} {} failed unexpectedly", user.getId(), source, e);
                outcome = new IngestionOutcome(user.getId(), source);
                outcome.fail(e.getMessage());
            }
            report.add(outcome);
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        report.setCompletedAt(now);
        if (report.getOutcomes().stream().noneMatch(IngestionOutcome::isFailed)) {
            appUserRepository.updateLastScrapedAt(user.getId(), now);
            user.setLastScrapedAt(now);
        } else {
            logger.warn("User {}: at least one source failed; last scraped time left at {}",
                    user.getId(), user.getLastScrapedAt());
        }
        logger.info("User {}: ingestion finished, inserted={} enriched={}",
                user.getId(), report.getTotalInserted(), report.getTotalEnriched());
        return report;
    }

    /**
     * Batch mode: ingests every user regardless of interval, skipping users already in flight.
     */
    public List<UserIngestionReport> ingestAllUsers() {
        List<UserIngestionReport> reports = new ArrayList<>();
        for (AppUser user : appUserRepository.findAll()) {
            ingestIfIdle(user).ifPresent(reports::add);
        }
        return reports;
    }

    /**
     * Scheduled entry point that ingests users whose scrape interval has elapsed.
     */
    @Scheduled(fixedDelayString = "${app.ingestion.sweep.delay-ms:60000}")
    public void sweepDueUsers() {
        if (!sweepEnabled) {
            return;
        }
        if (!sweeping.compareAndSet(false, true)) {
            logger.debug("Ingestion sweep already running; skipping tick.");
            return;
        }
        try {
            OffsetDateTime now = OffsetDateTime.now(clock);
            int processed = 0;
            for (AppUser user : appUserRepository.findAll()) {
                if (isDue(user, now) && ingestIfIdle(user).isPresent()) {
                    processed++;
                }
            }
            if (processed > 0) {
                logger.info("Ingestion sweep processed {} due user(s)", processed);
            }
        } catch (Exception e) {
            logger.error("Ingestion sweep failed: {}", e.getMessage(), e);
        } finally {
            sweeping.set(false);
        }
    }

    static boolean isDue(AppUser user, OffsetDateTime now) {
        if (user.getLastScrapedAt() == null) {
            return true;
        }
        int interval = user.getScraperInterval() != null && user.getScraperInterval() > 0
                ? user.getScraperInterval()
                : DEFAULT_INTERVAL_MINUTES;
        return !user.getLastScrapedAt().plusMinutes(interval).isAfter(now);
    }
}
