package com.socialfeed.ingest.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Items accepted by the window and dedup filter, in arrival order, plus discard counts per reason.
 */
public final class FilterResult {

    private final List<AcceptedItem> accepted;
    private final Map<DiscardReason, Integer> discards;

    public FilterResult(List<AcceptedItem> accepted, Map<DiscardReason, Integer> discards) {
        this.accepted = List.copyOf(accepted);
        EnumMap<DiscardReason, Integer> counts = new EnumMap<>(DiscardReason.class);
        for (DiscardReason reason : DiscardReason.values()) {
            counts.put(reason, discards.getOrDefault(reason, 0));
        }
        this.discards = Collections.unmodifiableMap(counts);
    }

    public List<AcceptedItem> getAccepted() {
        return accepted;
    }

    public Map<DiscardReason, Integer> getDiscards() {
        return discards;
    }

    public int discarded(DiscardReason reason) {
        return discards.get(reason);
    }
}
