package com.socialfeed.ingest.service;

import com.socialfeed.ingest.model.AcceptedItem;
import com.socialfeed.ingest.model.ContentSource;
import com.socialfeed.ingest.model.ScrapedPost;
import com.socialfeed.ingest.service.source.ContentSourceAdapter;
import com.socialfeed.ingest.service.source.TwitterSourceAdapter;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RecordMapperTest {

    private final RecordMapper mapper = new RecordMapper();

    @Test
    void mapsKeyTimestampAndSourceFields() {
        Map<String, Object> raw = Map.of(
                "id", "1729",
                "createdAt", "Wed Jan 10 09:00:00 +0000 2024",
                "fullText", "  hello world  ",
                "likeCount", 5,
                "author", Map.of("name", "Jane", "userName", "jane"));
        AcceptedItem item = new AcceptedItem(raw, "1729", "Wed Jan 10 09:00:00 +0000 2024", Instant.parse("2024-01-10T09:00:00Z"));

        ScrapedPost post = mapper.map(item, 7L, new TwitterSourceAdapter(new ReferenceNormalizer()));

        assertThat(post.getUserId()).isEqualTo(7L);
        assertThat(post.getSource()).isEqualTo(ContentSource.TWITTER);
        assertThat(post.getNativeId()).isEqualTo("1729");
        assertThat(post.getPostedAt()).isEqualTo(OffsetDateTime.of(2024, 1, 10, 9, 0, 0, 0, ZoneOffset.UTC));
        assertThat(post.getRawTimestamp()).isEqualTo("Wed Jan 10 09:00:00 +0000 2024");
        assertThat(post.getText()).isEqualTo("hello world");
        assertThat(post.getAuthorName()).isEqualTo("Jane");
        assertThat(post.getLikeCount()).isEqualTo(5);
        assertThat(post.getMediaUrl()).isEmpty();
        assertThat(post.getGeneratedTitle()).isNull();
        assertThat(post.getGeneratedSummary()).isNull();
    }

    @Test
    void extractionFailureDegradesToEmptyFields() {
        ContentSourceAdapter adapter = mock(ContentSourceAdapter.class);
        when(adapter.source()).thenReturn(ContentSource.FACEBOOK);
        doAnswer(invocation -> {
            ScrapedPost target = invocation.getArgument(1);
            target.setText("partial");
            throw new ClassCastException("media is not a list");
        }).when(adapter).extractFields(any(), any());
        AcceptedItem item = new AcceptedItem(Map.of("postId", "p1"), "p1", "2024-01-10", Instant.parse("2024-01-10T00:00:00Z"));

        ScrapedPost post = mapper.map(item, 3L, adapter);

        assertThat(post.getNativeId()).isEqualTo("p1");
        assertThat(post.getText()).isEqualTo("partial");
        assertThat(post.getAuthorName()).isEmpty();
        assertThat(post.getMediaUrl()).isEmpty();
        assertThat(post.getLikeCount()).isZero();
    }
}
