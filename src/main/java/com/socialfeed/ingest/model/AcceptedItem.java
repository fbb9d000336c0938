package com.socialfeed.ingest.model;

import java.time.Instant;
import java.util.Map;

/**
 * A dataset item that passed the window and dedup checks, with its extracted key and canonical time.
 */
public record AcceptedItem(Map<String, Object> raw, String nativeId, String rawTimestamp, Instant postedAt) {
}
