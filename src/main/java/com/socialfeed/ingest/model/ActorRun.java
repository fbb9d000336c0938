package com.socialfeed.ingest.model;

/**
 * Terminal state of an actor run and the dataset it produced.
 */
public record ActorRun(String runId, String status, String datasetId) {
}
