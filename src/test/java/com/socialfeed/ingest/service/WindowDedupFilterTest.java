package com.socialfeed.ingest.service;

import com.socialfeed.ingest.model.AcceptedItem;
import com.socialfeed.ingest.model.DiscardReason;
import com.socialfeed.ingest.model.FilterResult;
import com.socialfeed.ingest.model.IngestWindow;
import com.socialfeed.ingest.service.source.FacebookSourceAdapter;
import com.socialfeed.ingest.service.source.TwitterSourceAdapter;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class WindowDedupFilterTest {

    private final WindowDedupFilter filter = new WindowDedupFilter(new TimestampNormalizer());
    private final TwitterSourceAdapter twitter = new TwitterSourceAdapter(new ReferenceNormalizer());
    private final FacebookSourceAdapter facebook = new FacebookSourceAdapter(new ReferenceNormalizer());
    private final IngestWindow window = new IngestWindow(LocalDate.of(2024, 1, 10), LocalDate.of(2024, 1, 11));

    @Test
    void untilIsExclusiveInRecencyScenario() {
        List<Map<String, Object>> items = List.of(
                Map.of("id", "A", "createdAt", "2024-01-10T09:00:00Z"),
                Map.of("id", "B", "createdAt", "2024-01-11T00:00:00Z"));

        FilterResult result = filter.filter(items, twitter, window, id -> false);

        assertThat(result.getAccepted()).extracting(AcceptedItem::nativeId).containsExactly("A");
        assertThat(result.discarded(DiscardReason.OUT_OF_WINDOW)).isEqualTo(1);
    }

    @Test
    void startIsInclusive() {
        List<Map<String, Object>> items = List.of(
                Map.of("id", "edge", "createdAt", "2024-01-10T00:00:00Z"),
                Map.of("id", "early", "createdAt", "2024-01-09T23:59:59Z"));

        FilterResult result = filter.filter(items, twitter, window, id -> false);

        assertThat(result.getAccepted()).extracting(AcceptedItem::nativeId).containsExactly("edge");
        assertThat(result.getAccepted().get(0).postedAt()).isEqualTo(Instant.parse("2024-01-10T00:00:00Z"));
        assertThat(result.discarded(DiscardReason.OUT_OF_WINDOW)).isEqualTo(1);
    }

    @Test
    void demoItemsAreAlwaysDiscarded() {
        List<Map<String, Object>> items = List.of(
                Map.of("demo", true),
                Map.of("demo", true, "type", "tweet"));

        FilterResult result = filter.filter(items, twitter, window, id -> false);

        assertThat(result.getAccepted()).isEmpty();
        assertThat(result.discarded(DiscardReason.DEMO)).isEqualTo(2);
    }

    @Test
    void itemWithDemoFieldAndRealContentIsNotTreatedAsDemo() {
        List<Map<String, Object>> items = List.of(
                Map.of("demo", false, "id", "real", "createdAt", "2024-01-10T10:00:00Z"));

        FilterResult result = filter.filter(items, twitter, window, id -> false);

        assertThat(result.getAccepted()).hasSize(1);
        assertThat(result.discarded(DiscardReason.DEMO)).isZero();
    }

    @Test
    void foreignTypesAreDiscardedOnlyWhenTheSourceExpectsOne() {
        Map<String, Object> reply = Map.of("type", "user", "id", "u1", "createdAt", "2024-01-10T10:00:00Z");

        assertThat(filter.filter(List.of(reply), twitter, window, id -> false).discarded(DiscardReason.FOREIGN_TYPE))
                .isEqualTo(1);

        Map<String, Object> pagePost = Map.of("type", "photo", "postId", "p1", "time", "2024-01-10T10:00:00Z");
        assertThat(filter.filter(List.of(pagePost), facebook, window, id -> false).getAccepted()).hasSize(1);
    }

    @Test
    void missingKeyOrUnparseableTimestampCountsAsMissing() {
        List<Map<String, Object>> items = List.of(
                Map.of("createdAt", "2024-01-10T10:00:00Z"),
                Map.of("id", "no-time"),
                Map.of("id", "garbage-time", "createdAt", "not a date"));

        FilterResult result = filter.filter(items, twitter, window, id -> false);

        assertThat(result.getAccepted()).isEmpty();
        assertThat(result.discarded(DiscardReason.MISSING)).isEqualTo(3);
    }

    @Test
    void storedAndRepeatedIdsAreDuplicates() {
        Set<String> stored = Set.of("old");
        List<Map<String, Object>> items = List.of(
                Map.of("id", "old", "createdAt", "2024-01-10T08:00:00Z"),
                Map.of("id", "new", "createdAt", "2024-01-10T09:00:00Z"),
                Map.of("id", "new", "createdAt", "2024-01-10T09:00:00Z"));

        FilterResult result = filter.filter(items, twitter, window, stored::contains);

        assertThat(result.getAccepted()).extracting(AcceptedItem::nativeId).containsExactly("new");
        assertThat(result.discarded(DiscardReason.DUPLICATE)).isEqualTo(2);
    }

    @Test
    void acceptedItemsKeepArrivalOrder() {
        List<Map<String, Object>> items = List.of(
                Map.of("id", "3", "createdAt", "2024-01-10T03:00:00Z"),
                Map.of("id", "1", "createdAt", "2024-01-10T01:00:00Z"),
                Map.of("id", "2", "createdAt", "2024-01-10T02:00:00Z"));

        FilterResult result = filter.filter(items, twitter, window, id -> false);

        assertThat(result.getAccepted()).extracting(AcceptedItem::nativeId).containsExactly("3", "1", "2");
        assertThat(result.getDiscards().values()).allMatch(count -> count == 0);
    }
}
