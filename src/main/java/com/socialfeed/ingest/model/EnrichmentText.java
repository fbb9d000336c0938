package com.socialfeed.ingest.model;

/**
 * Title and summary parsed from a text-generation reply.
 */
public record EnrichmentText(String title, String summary) {

    public static final String UNTITLED = "Untitled";
}
