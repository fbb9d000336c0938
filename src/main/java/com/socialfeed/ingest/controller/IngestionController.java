package com.socialfeed.ingest.controller;

import com.socialfeed.ingest.dto.ScrapedPostView;
import com.socialfeed.ingest.dto.UserIngestionReport;
import com.socialfeed.ingest.model.ContentSource;
import com.socialfeed.ingest.repository.AppUserRepository;
import com.socialfeed.ingest.service.IngestionTriggerService;
import com.socialfeed.ingest.service.ScrapedPostStore;
import com.socialfeed.ingest.service.UserNotFoundException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/users/{userId}")
public class IngestionController {

    private static final Logger logger = LoggerFactory.getLogger(IngestionController.class);

    private final IngestionTriggerService triggerService;
    private final ScrapedPostStore scrapedPostStore;
    private final AppUserRepository appUserRepository;

    public IngestionController(IngestionTriggerService triggerService,
                               ScrapedPostStore scrapedPostStore,
                               AppUserRepository appUserRepository) {
        this.triggerService = triggerService;
        this.scrapedPostStore = scrapedPostStore;
        this.appUserRepository = appUserRepository;
    }

    /**
     * Queues an ingestion run for all of the user's content sources.
     */
    @Operation(
            summary = "Trigger ingestion for a user",
            description = "Queues one run over every content source on the bounded worker pool."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "202", description = "Run queued"),
            @ApiResponse(responseCode = "404", description = "User not found"),
            @ApiResponse(responseCode = "409", description = "A run for this user is already in flight"),
            @ApiResponse(responseCode = "503", description = "Worker pool is full")
    })
    @PostMapping("/ingest")
    public ResponseEntity<?> triggerIngestion(
            @Parameter(description = "User ID", required = true) @PathVariable Long userId) {
        try {
            IngestionTriggerService.TriggerResult result = triggerService.trigger(userId);
            switch (result) {
                case QUEUED:
                    return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("userId", userId, "status", "queued"));
                case ALREADY_RUNNING:
                    return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("userId", userId, "status", "already running"));
                default:
                    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("userId", userId, "status", "rejected"));
            }
        } catch (UserNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(e.getMessage());
        }
    }

    /**
     * Runs ingestion inline and returns the per-source outcomes.
     */
    @Operation(
            summary = "Run ingestion for a user and wait",
            description = "Runs every content source for the user on the request thread and returns counts and discard reasons."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Run finished; report returned"),
            @ApiResponse(responseCode = "404", description = "User not found"),
            @ApiResponse(responseCode = "409", description = "A run for this user is already in flight"),
            @ApiResponse(responseCode = "500", description = "Unexpected server error")
    })
    @PostMapping("/ingest/sync")
    public ResponseEntity<?> runIngestion(
            @Parameter(description = "User ID", required = true) @PathVariable Long userId) {
        try {
            Optional<UserIngestionReport> report = triggerService.runNow(userId);
            if (report.isEmpty()) {
                return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("userId", userId, "status", "already running"));
            }
            return ResponseEntity.ok(report.get());
        } catch (UserNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(e.getMessage());
        } catch (Exception e) {
            logger.error("Inline ingestion for user {} failed: {}", userId, e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(e.getMessage());
        }
    }

    @Operation(summary = "List stored posts", description = "Returns the user's stored posts, newest first.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Posts returned"),
            @ApiResponse(responseCode = "404", description = "User not found")
    })
    @GetMapping("/posts")
    public ResponseEntity<?> listPosts(
            @Parameter(description = "User ID", required = true) @PathVariable Long userId,
            @Parameter(description = "Content source filter") @RequestParam(required = false) ContentSource source) {
        if (!appUserRepository.existsById(userId)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body("User " + userId + " not found");
        }
        List<ScrapedPostView> posts = scrapedPostStore.listPosts(userId, source).stream()
                .map(ScrapedPostView::from)
                .toList();
        return ResponseEntity.ok(posts);
    }
}
