package com.socialfeed.ingest.dto;

import com.socialfeed.ingest.model.ContentSource;
import com.socialfeed.ingest.model.DiscardReason;
import com.socialfeed.ingest.model.PipelineState;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Result of one (user, content source) pipeline invocation.
 */
public class IngestionOutcome {

    private final Long userId;
    private final ContentSource source;
    private PipelineState state = PipelineState.IDLE;
    private int fetched;
    private int accepted;
    private int inserted;
    private int enriched;
    private final Map<DiscardReason, Integer> discards = new EnumMap<>(DiscardReason.class);
    private String abortReason;
    private boolean failed;

    public IngestionOutcome(Long userId, ContentSource source) {
        this.userId = userId;
        this.source = source;
    }

    public Long getUserId() {
        return userId;
    }

    public ContentSource getSource() {
        return source;
    }

    public PipelineState getState() {
        return state;
    }

    public void setState(PipelineState state) {
        this.state = state;
    }

    public int getFetched() {
        return fetched;
    }

    public void setFetched(int fetched) {
        this.fetched = fetched;
    }

    public int getAccepted() {
        return accepted;
    }

    public void setAccepted(int accepted) {
        this.accepted = accepted;
    }

    public int getInserted() {
        return inserted;
    }

    public void setInserted(int inserted) {
        this.inserted = inserted;
    }

    public int getEnriched() {
        return enriched;
    }

    public void setEnriched(int enriched) {
        this.enriched = enriched;
    }

    public Map<DiscardReason, Integer> getDiscards() {
        return Collections.unmodifiableMap(discards);
    }

    public void setDiscards(Map<DiscardReason, Integer> counts) {
        discards.clear();
        discards.putAll(counts);
    }

    /**
     * Null unless the invocation ended in {@link PipelineState#ABORTED}.
     */
    public String getAbortReason() {
        return abortReason;
    }

    public void abort(String reason) {
        this.state = PipelineState.ABORTED;
        this.abortReason = reason;
    }

    /**
     * Aborts because a remote call or the insert failed, as opposed to there being nothing to do.
     */
    public void fail(String reason) {
        abort(reason);
        this.failed = true;
    }

    public boolean isAborted() {
        return state == PipelineState.ABORTED;
    }

    public boolean isFailed() {
        return failed;
    }
}
