package com.socialfeed.ingest.service;

/**
 * The actor run finished but exposes no dataset to read.
 */
public class EmptyDatasetException extends IngestionException {
    public EmptyDatasetException(String runId) {
        super("Actor run " + runId + " returned no default dataset id");
    }
}
