package com.socialfeed.ingest.model;

/**
 * Why a raw dataset item was not ingested.
 */
public enum DiscardReason {
    /** Stub row emitted by restricted actor plans. */
    DEMO,
    /** Item declares a type tag other than the source's content type. */
    FOREIGN_TYPE,
    /** No native id, no timestamp, or a timestamp that cannot be parsed. */
    MISSING,
    OUT_OF_WINDOW,
    DUPLICATE
}
