package com.socialfeed.ingest.dto;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-user summary of one ingestion pass across all content sources.
 */
public class UserIngestionReport {

    private final Long userId;
    private final List<IngestionOutcome> outcomes = new ArrayList<>();
    private OffsetDateTime completedAt;

    public UserIngestionReport(Long userId) {
        this.userId = userId;
    }

    public Long getUserId() {
        return userId;
    }

    public List<IngestionOutcome> getOutcomes() {
        return outcomes;
    }

    public void add(IngestionOutcome outcome) {
        outcomes.add(outcome);
    }

    public OffsetDateTime getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(OffsetDateTime completedAt) {
        this.completedAt = completedAt;
    }

    public int getTotalInserted() {
        return outcomes.stream().mapToInt(IngestionOutcome::getInserted).sum();
    }

    public int getTotalEnriched() {
        return outcomes.stream().mapToInt(IngestionOutcome::getEnriched).sum();
    }
}
