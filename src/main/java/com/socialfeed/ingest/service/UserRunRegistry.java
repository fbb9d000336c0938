package com.socialfeed.ingest.service;

import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-user run slots shared by every ingestion caller (triggers, inline runs, batch and sweep).
 * At most one run per user holds a slot at a time.
 */
@Component
public class UserRunRegistry {

    private final Set<Long> inFlight = ConcurrentHashMap.newKeySet();

    /**
     * @return true if the slot was free and is now held by the caller
     */
    public boolean tryClaim(Long userId) {
        return inFlight.add(userId);
    }

    public void release(Long userId) {
        inFlight.remove(userId);
    }

    public boolean isRunning(Long userId) {
        return inFlight.contains(userId);
    }
}
