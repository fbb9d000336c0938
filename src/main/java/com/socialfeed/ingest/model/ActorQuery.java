package com.socialfeed.ingest.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Run input for one actor invocation. Opaque to the run client.
 */
public record ActorQuery(QueryMode mode, Map<String, Object> runInput) {

    public ActorQuery {
        runInput = Collections.unmodifiableMap(new LinkedHashMap<>(runInput));
    }
}
