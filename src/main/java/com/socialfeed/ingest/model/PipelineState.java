package com.socialfeed.ingest.model;

public enum PipelineState {
    IDLE,
    FETCHING,
    FILTERING,
    INSERTING,
    ENRICHING,
    DONE,
    ABORTED
}
