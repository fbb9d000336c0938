package com.socialfeed.ingest.service.source;

import com.socialfeed.ingest.config.IngestionSettings;
import com.socialfeed.ingest.model.ActorQuery;
import com.socialfeed.ingest.model.ContentSource;
import com.socialfeed.ingest.model.EnrichmentText;
import com.socialfeed.ingest.model.IngestWindow;
import com.socialfeed.ingest.model.QueryMode;
import com.socialfeed.ingest.model.ScrapedPost;
import com.socialfeed.ingest.service.ReferenceNormalizer;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tweets scraped from profile handles.
 */
@Component
public class TwitterSourceAdapter implements ContentSourceAdapter {

    static final String TITLE_MARKER = "Post Title:";

    private final ReferenceNormalizer referenceNormalizer;

    public TwitterSourceAdapter(ReferenceNormalizer referenceNormalizer) {
        this.referenceNormalizer = referenceNormalizer;
    }

    @Override
    public ContentSource source() {
        return ContentSource.TWITTER;
    }

    @Override
    public Optional<String> normalizeReference(String raw) {
        return referenceNormalizer.normalizeHandle(raw);
    }

    @Override
    public ActorQuery buildQuery(List<String> identifiers, IngestWindow window, IngestionSettings.SourceSettings settings) {
        if (settings.queryMode() == QueryMode.SEARCH_TERMS) {
            return ActorQueries.searchTerms(identifiers, window, settings.extraQuery(), settings.maxItems());
        }
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("twitterHandles", identifiers);
        input.put("start", window.startDate().toString());
        input.put("end", window.untilDate().toString());
        input.put("sort", ActorQueries.SORT_LATEST);
        input.put("maxItems", settings.maxItems());
        return new ActorQuery(QueryMode.DIRECT_TARGETS, input);
    }

    @Override
    public String expectedType() {
        return "tweet";
    }

    @Override
    public Optional<String> extractNativeId(Map<String, Object> item) {
        String id = RawItems.text(item, "id", "id_str");
        return id.isEmpty() ? Optional.empty() : Optional.of(id);
    }

    @Override
    public Optional<String> extractRawTimestamp(Map<String, Object> item) {
        String raw = RawItems.text(item, "createdAt", "created_at");
        if (raw.isEmpty()) {
            raw = RawItems.text(RawItems.object(item, "legacy"), "created_at");
        }
        if (raw.isEmpty()) {
            raw = RawItems.text(RawItems.object(item, "tweet"), "createdAt", "created_at");
        }
        return raw.isEmpty() ? Optional.empty() : Optional.of(raw);
    }

    @Override
    public void extractFields(Map<String, Object> item, ScrapedPost target) {
        target.setText(RawItems.text(item, "fullText", "text").trim());
        target.setFullText(RawItems.text(item, "fullText", "text"));
        target.setLang(RawItems.text(item, "lang"));
        target.setShareCount(RawItems.count(item, "retweetCount"));
        target.setReplyCount(RawItems.count(item, "replyCount"));
        target.setLikeCount(RawItems.count(item, "likeCount"));
        target.setQuoteCount(RawItems.count(item, "quoteCount"));
        target.setPostUrl(RawItems.text(item, "url", "twitterUrl"));

        Map<String, Object> author = RawItems.object(item, "author");
        String name = RawItems.text(author, "name");
        String username = RawItems.text(author, "username", "userName");
        if (username.isEmpty()) {
            Map<String, Object> user = RawItems.object(item, "user");
            username = RawItems.text(user, "screen_name");
            if (name.isEmpty()) {
                name = RawItems.text(user, "name");
            }
        }
        target.setAuthorName(name);
        target.setAuthorUsername(username);
        target.setProfilePictureUrl(RawItems.text(author, "profilePicture"));
        target.setMediaUrl(extractPhotoUrl(item));
    }

    private String extractPhotoUrl(Map<String, Object> item) {
        Map<String, Object> media = RawItems.firstObject(RawItems.object(item, "entities"), "media");
        if (media.isEmpty()) {
            Map<String, Object> extended = RawItems.object(item, "extendedEntities");
            if (extended.isEmpty()) {
                extended = RawItems.object(item, "extended_entities");
            }
            media = RawItems.firstObject(extended, "media");
        }
        return RawItems.text(media, "media_url_https", "media_url");
    }

    @Override
    public String buildPrompt(ScrapedPost post, String languageName, String fallbackAuthor) {
        String authorName = hasText(post.getAuthorName()) ? post.getAuthorName() : "Unknown";
        String tweetText = hasText(post.getText()) ? post.getText() : (post.getFullText() == null ? "" : post.getFullText());
        return "You are ChatGPT-4. Below is a tweet in its original language. "
                + "Please translate and adjust it so that it is readable in " + languageName + ". "
                + "Start by saying: 'In the latest tweet from (" + authorName + ")...'. "
                + "Then provide a summary in two paragraphs or less, explaining the context or importance of the tweet, "
                + "and finally repeat the original tweet as is. Please do it in " + languageName + ". "
                + "At the end, on a new line, output the short title in the format: '" + TITLE_MARKER + " [Title]'.\n\n"
                + "Original Tweet: " + tweetText;
    }

    @Override
    public EnrichmentText parseReply(String reply) {
        String text = reply == null ? "" : reply;
        int markerAt = text.indexOf(TITLE_MARKER);
        if (markerAt < 0) {
            return new EnrichmentText(EnrichmentText.UNTITLED, text.trim());
        }
        String summary = text.substring(0, markerAt).trim();
        String afterMarker = text.substring(markerAt + TITLE_MARKER.length());
        int nextMarker = afterMarker.indexOf(TITLE_MARKER);
        String title = (nextMarker >= 0 ? afterMarker.substring(0, nextMarker) : afterMarker).trim();
        return new EnrichmentText(title, summary);
    }

    @Override
    public double temperature() {
        return 0.3;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
