package com.socialfeed.ingest.service;

import com.socialfeed.ingest.dto.UserIngestionReport;
import com.socialfeed.ingest.repository.AppUserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.RejectedExecutionException;

/**
 * Queues user-triggered runs on the bounded ingestion pool, at most one in flight per user.
 */
@Service
public class IngestionTriggerService {

    private static final Logger logger = LoggerFactory.getLogger(IngestionTriggerService.class);

    public enum TriggerResult { QUEUED, ALREADY_RUNNING, REJECTED }

    private final UserIngestionService userIngestionService;
    private final AppUserRepository appUserRepository;
    private final UserRunRegistry runRegistry;
    private final TaskExecutor ingestionExecutor;

    public IngestionTriggerService(UserIngestionService userIngestionService,
                                   AppUserRepository appUserRepository,
                                   UserRunRegistry runRegistry,
                                   @Qualifier("ingestionExecutor") TaskExecutor ingestionExecutor) {
        this.userIngestionService = userIngestionService;
        this.appUserRepository = appUserRepository;
        this.runRegistry = runRegistry;
        this.ingestionExecutor = ingestionExecutor;
    }

    /**
     * @throws UserNotFoundException if no such user exists
     */
    public TriggerResult trigger(Long userId) {
        if (!appUserRepository.existsById(userId)) {
            throw new UserNotFoundException(userId);
        }
        if (!runRegistry.tryClaim(userId)) {
            logger.info("Ingestion for user {} already in flight; trigger ignored", userId);
            return TriggerResult.ALREADY_RUNNING;
        }
        try {
            ingestionExecutor.execute(() -> {
                try {
                    userIngestionService.ingestClaimed(userId);
                } catch (Exception e) {
                    logger.error("Triggered ingestion for user {} failed: {}", userId, e.getMessage(), e);
                } finally {
                    runRegistry.release(userId);
                }
            });
        } catch (RejectedExecutionException e) {
            runRegistry.release(userId);
            logger.warn("Ingestion pool is full; trigger for user {} rejected", userId);
            return TriggerResult.REJECTED;
        }
        logger.info("Ingestion for user {} queued", userId);
        return TriggerResult.QUEUED;
    }

    /**
     * Runs inline on the calling thread, unless a run for the user is already in flight.
     *
     * @throws UserNotFoundException if no such user exists
     */
    public Optional<UserIngestionReport> runNow(Long userId) {
        if (!runRegistry.tryClaim(userId)) {
            logger.info("Ingestion for user {} already in flight; inline run refused", userId);
            return Optional.empty();
        }
        try {
            return Optional.of(userIngestionService.ingestClaimed(userId));
        } finally {
            runRegistry.release(userId);
        }
    }

    public boolean isRunning(Long userId) {
        return runRegistry.isRunning(userId);
    }
}
