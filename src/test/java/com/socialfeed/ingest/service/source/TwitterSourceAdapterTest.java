package com.socialfeed.ingest.service.source;

import com.socialfeed.ingest.config.IngestionSettings;
import com.socialfeed.ingest.model.ActorQuery;
import com.socialfeed.ingest.model.EnrichmentText;
import com.socialfeed.ingest.model.IngestWindow;
import com.socialfeed.ingest.model.QueryMode;
import com.socialfeed.ingest.model.ScrapedPost;
import com.socialfeed.ingest.service.ReferenceNormalizer;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TwitterSourceAdapterTest {

    private final TwitterSourceAdapter adapter = new TwitterSourceAdapter(new ReferenceNormalizer());
    private final IngestWindow window = new IngestWindow(LocalDate.of(2024, 1, 4), LocalDate.of(2024, 1, 11));

    @Test
    void searchTermModeBuildsOneTermPerHandle() {
        IngestionSettings.SourceSettings settings = new IngestionSettings.SourceSettings(
                "apidojo/tweet-scraper", QueryMode.SEARCH_TERMS, 7, 250, "-filter:replies", List.of());

        ActorQuery query = adapter.buildQuery(List.of("alice", "bob"), window, settings);

        assertThat(query.mode()).isEqualTo(QueryMode.SEARCH_TERMS);
        assertThat(query.runInput()).containsEntry("sort", "Latest").containsEntry("maxItems", 250);
        assertThat(query.runInput().get("searchTerms")).isEqualTo(List.of(
                "from:alice since:2024-01-04 until:2024-01-11 -filter:replies",
                "from:bob since:2024-01-04 until:2024-01-11 -filter:replies"));
    }

    @Test
    void directTargetModePassesHandlesAndDates() {
        IngestionSettings.SourceSettings settings = new IngestionSettings.SourceSettings(
                "apidojo/tweet-scraper", QueryMode.DIRECT_TARGETS, 7, 100, "", List.of());

        ActorQuery query = adapter.buildQuery(List.of("alice"), window, settings);

        assertThat(query.mode()).isEqualTo(QueryMode.DIRECT_TARGETS);
        assertThat(query.runInput())
                .containsEntry("twitterHandles", List.of("alice"))
                .containsEntry("start", "2024-01-04")
                .containsEntry("end", "2024-01-11")
                .containsEntry("sort", "Latest")
                .containsEntry("maxItems", 100);
    }

    @Test
    void extractsKeyAndTimestampFromNestedLocations() {
        assertThat(adapter.extractNativeId(Map.of("id_str", "42"))).contains("42");
        assertThat(adapter.extractNativeId(Map.of("id", 1234567890123L))).contains("1234567890123");
        assertThat(adapter.extractRawTimestamp(Map.of("legacy", Map.of("created_at", "Fri Nov 24 17:49:36 +0000 2023"))))
                .contains("Fri Nov 24 17:49:36 +0000 2023");
        assertThat(adapter.extractRawTimestamp(Map.of("tweet", Map.of("createdAt", "2024-01-10T09:00:00Z"))))
                .contains("2024-01-10T09:00:00Z");
        assertThat(adapter.extractRawTimestamp(Map.of("id", "1"))).isEmpty();
    }

    @Test
    void extractsFieldsWithLegacyUserAndExtendedMediaFallbacks() {
        Map<String, Object> item = Map.of(
                "text", "hello",
                "lang", "en",
                "retweetCount", 3,
                "replyCount", "2",
                "twitterUrl", "https://twitter.com/alice/status/1",
                "user", Map.of("name", "Alice", "screen_name", "alice"),
                "extended_entities", Map.of("media", List.of(Map.of("media_url", "http://pbs/img.jpg"))));
        ScrapedPost post = new ScrapedPost();

        adapter.extractFields(item, post);

        assertThat(post.getText()).isEqualTo("hello");
        assertThat(post.getLang()).isEqualTo("en");
        assertThat(post.getShareCount()).isEqualTo(3);
        assertThat(post.getReplyCount()).isEqualTo(2);
        assertThat(post.getLikeCount()).isZero();
        assertThat(post.getPostUrl()).isEqualTo("https://twitter.com/alice/status/1");
        assertThat(post.getAuthorName()).isEqualTo("Alice");
        assertThat(post.getAuthorUsername()).isEqualTo("alice");
        assertThat(post.getMediaUrl()).isEqualTo("http://pbs/img.jpg");
    }

    @Test
    void malformedNestedStructuresYieldEmptyValues() {
        Map<String, Object> item = Map.of(
                "fullText", "body",
                "author", "not-an-object",
                "entities", Map.of("media", "not-a-list"));
        ScrapedPost post = new ScrapedPost();

        adapter.extractFields(item, post);

        assertThat(post.getText()).isEqualTo("body");
        assertThat(post.getAuthorName()).isEmpty();
        assertThat(post.getMediaUrl()).isEmpty();
    }

    @Test
    void promptEmbedsLanguageAuthorAndVerbatimText() {
        ScrapedPost post = new ScrapedPost();
        post.setAuthorName("Alice");
        post.setText("Original words, untouched.");

        String prompt = adapter.buildPrompt(post, "Hebrew", "ignored@example.com");

        assertThat(prompt)
                .contains("readable in Hebrew")
                .contains("In the latest tweet from (Alice)")
                .contains("Post Title: [Title]")
                .endsWith("Original Tweet: Original words, untouched.");
    }

    @Test
    void promptUsesUnknownWhenAuthorIsMissing() {
        ScrapedPost post = new ScrapedPost();
        post.setText("x");

        assertThat(adapter.buildPrompt(post, "English", "user@example.com")).contains("(Unknown)");
    }

    @Test
    void parsesSummaryAndTitleAroundMarker() {
        EnrichmentText text = adapter.parseReply("In the latest tweet from (Alice)...\nSummary here.\nPost Title: Big News\n");

        assertThat(text.title()).isEqualTo("Big News");
        assertThat(text.summary()).isEqualTo("In the latest tweet from (Alice)...\nSummary here.");
    }

    @Test
    void replyWithoutMarkerBecomesUntitledSummary() {
        EnrichmentText text = adapter.parseReply("  Just a summary.  ");

        assertThat(text.title()).isEqualTo(EnrichmentText.UNTITLED);
        assertThat(text.summary()).isEqualTo("Just a summary.");
    }
}
