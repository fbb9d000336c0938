package com.socialfeed.ingest.model;

/**
 * How the actor is told what to scrape.
 */
public enum QueryMode {
    /** One {@code from:<id> since:<d> until:<d>} query string per reference. */
    SEARCH_TERMS,
    /** Targets and window handed over as structured input fields. */
    DIRECT_TARGETS
}
