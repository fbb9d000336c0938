package com.socialfeed.ingest.service;

import com.socialfeed.ingest.model.AcceptedItem;
import com.socialfeed.ingest.model.DiscardReason;
import com.socialfeed.ingest.model.FilterResult;
import com.socialfeed.ingest.model.IngestWindow;
import com.socialfeed.ingest.service.source.ContentSourceAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Decides which dataset items become records. Checks run in a fixed order and the first failing
 * check names the discard reason; accepted items keep their arrival order.
 */
@Component
public class WindowDedupFilter {

    private static final Logger logger = LoggerFactory.getLogger(WindowDedupFilter.class);

    static final String DEMO_MARKER = "demo";
    static final String TYPE_TAG = "type";
    private static final List<String> CONTENT_KEYS = List.of("id", "text", "fullText");

    private final TimestampNormalizer timestampNormalizer;

    public WindowDedupFilter(TimestampNormalizer timestampNormalizer) {
        this.timestampNormalizer = timestampNormalizer;
    }

    /**
     * @param items         dataset items in arrival order
     * @param adapter       source-specific key, timestamp and type extraction
     * @param window        acceptance interval, start inclusive, until exclusive
     * @param alreadyStored existence check for a native id of the current user and source
     */
    public FilterResult filter(List<Map<String, Object>> items,
                               ContentSourceAdapter adapter,
                               IngestWindow window,
                               Predicate<String> alreadyStored) {
        List<AcceptedItem> accepted = new ArrayList<>();
        Map<DiscardReason, Integer> discards = new EnumMap<>(DiscardReason.class);
        Set<String> seen = new HashSet<>();

        for (Map<String, Object> item : items) {
            if (isDemo(item)) {
                count(discards, DiscardReason.DEMO);
                continue;
            }
            if (isForeignType(item, adapter.expectedType())) {
                count(discards, DiscardReason.FOREIGN_TYPE);
                continue;
            }

            Optional<String> nativeId = adapter.extractNativeId(item);
            Optional<String> rawTimestamp = adapter.extractRawTimestamp(item);
            if (nativeId.isEmpty() || rawTimestamp.isEmpty()) {
                count(discards, DiscardReason.MISSING);
                continue;
            }

            Optional<Instant> postedAt = timestampNormalizer.normalize(rawTimestamp.get());
            if (postedAt.isEmpty()) {
                logger.debug("Unparseable timestamp '{}' on item {}", rawTimestamp.get(), nativeId.get());
                count(discards, DiscardReason.MISSING);
                continue;
            }
            if (!window.contains(postedAt.get())) {
                count(discards, DiscardReason.OUT_OF_WINDOW);
                continue;
            }

            String id = nativeId.get();
            if (seen.contains(id) || alreadyStored.test(id)) {
                count(discards, DiscardReason.DUPLICATE);
                continue;
            }
            seen.add(id);
            accepted.add(new AcceptedItem(item, id, rawTimestamp.get(), postedAt.get()));
        }
        return new FilterResult(accepted, discards);
    }

    /**
     * Restricted-plan actor output: just the marker field, optionally with a type tag, and no content.
     */
    static boolean isDemo(Map<String, Object> item) {
        Set<String> keys = item.keySet();
        if (!keys.contains(DEMO_MARKER)) {
            return false;
        }
        if (keys.size() == 1) {
            return true;
        }
        return keys.size() == 2
                && keys.contains(TYPE_TAG)
                && CONTENT_KEYS.stream().noneMatch(keys::contains);
    }

    private static boolean isForeignType(Map<String, Object> item, String expectedType) {
        if (expectedType == null) {
            return false;
        }
        Object type = item.get(TYPE_TAG);
        return type != null && !expectedType.equals(type.toString());
    }

    private static void count(Map<DiscardReason, Integer> discards, DiscardReason reason) {
        discards.merge(reason, 1, Integer::sum);
    }
}
