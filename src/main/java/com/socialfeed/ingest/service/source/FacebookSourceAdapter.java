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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Posts scraped from page URLs.
 */
@Component
public class FacebookSourceAdapter implements ContentSourceAdapter {

    static final String TITLE_MARKER = "Title:";
    static final String ARTICLE_MARKER = "Article:";
    static final String ORIGINAL_MARKER = "Original Post:";

    private final ReferenceNormalizer referenceNormalizer;

    public FacebookSourceAdapter(ReferenceNormalizer referenceNormalizer) {
        this.referenceNormalizer = referenceNormalizer;
    }

    @Override
    public ContentSource source() {
        return ContentSource.FACEBOOK;
    }

    @Override
    public Optional<String> normalizeReference(String raw) {
        return referenceNormalizer.normalizePageUrl(raw);
    }

    /**
     * Always builds structured start URLs; the page actor has no search-term input.
     */
    @Override
    public ActorQuery buildQuery(List<String> identifiers, IngestWindow window, IngestionSettings.SourceSettings settings) {
        List<Map<String, Object>> startUrls = new ArrayList<>();
        for (String url : identifiers) {
            startUrls.add(Map.of("url", url));
        }
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("startUrls", startUrls);
        input.put("resultsLimit", settings.maxItems());
        input.put("onlyPostsNewerThan", window.startDate().toString());
        input.put("onlyPostsOlderThan", window.untilDate().toString());
        input.put("sort", ActorQueries.SORT_LATEST);
        if (!settings.proxyGroups().isEmpty()) {
            Map<String, Object> proxy = new LinkedHashMap<>();
            proxy.put("useApifyProxy", true);
            proxy.put("apifyProxyGroups", settings.proxyGroups());
            input.put("proxy", proxy);
        }
        return new ActorQuery(QueryMode.DIRECT_TARGETS, input);
    }

    @Override
    public String expectedType() {
        // page posts carry no content type tag
        return null;
    }

    @Override
    public Optional<String> extractNativeId(Map<String, Object> item) {
        String id = RawItems.text(item, "postId", "id");
        return id.isEmpty() ? Optional.empty() : Optional.of(id);
    }

    @Override
    public Optional<String> extractRawTimestamp(Map<String, Object> item) {
        String raw = RawItems.text(item, "time", "timestamp");
        return raw.isEmpty() ? Optional.empty() : Optional.of(raw);
    }

    @Override
    public void extractFields(Map<String, Object> item, ScrapedPost target) {
        String pageName = RawItems.text(item, "pageName");
        if (pageName.isEmpty()) {
            pageName = RawItems.text(RawItems.object(item, "pageName"), "name");
        }
        target.setAuthorName(pageName);
        target.setAuthorUsername(RawItems.text(RawItems.object(item, "user"), "name"));
        target.setText(RawItems.text(item, "text"));
        target.setFullText(RawItems.text(item, "text"));
        target.setLang("");
        target.setPostUrl(RawItems.text(item, "url"));
        target.setLikeCount(RawItems.count(item, "likes"));
        target.setReplyCount(RawItems.count(item, "comments"));
        target.setShareCount(RawItems.count(item, "shares"));
        target.setQuoteCount(0);
        target.setMediaUrl(RawItems.text(RawItems.firstObject(item, "media"), "thumbnail"));
        target.setProfilePictureUrl(RawItems.text(RawItems.object(item, "user"), "profilePic"));
    }

    @Override
    public String buildPrompt(ScrapedPost post, String languageName, String fallbackAuthor) {
        String pageName = post.getAuthorName() != null && !post.getAuthorName().isBlank()
                ? post.getAuthorName()
                : fallbackAuthor;
        String postText = post.getText() == null ? "" : post.getText();
        return "You are ChatGPT-4. Below is a Facebook post in its original language.\n\n"
                + "Requirements:\n"
                + "1) Begin the response with: \"Latest Facebook post from \\\"" + pageName + "\\\"\"\n"
                + "2) Create an expanded article in " + languageName + " with a short title and a summary consisting of 3-5 sentences.\n"
                + "3) The title must include the Facebook page name (e.g., \"" + pageName + ": [topic]\").\n"
                + "4) Under the header \"" + ARTICLE_MARKER + "\", summarize the main content of the post including key details.\n"
                + "5) Use a formal and informative tone that emphasizes the significance or context of the post.\n"
                + "6) Finally, add a section \"" + ORIGINAL_MARKER + "\" and include the full original post enclosed in quotes.\n\n"
                + "Format your response exactly as follows:\n\n"
                + "Latest Facebook post from \"" + pageName + "\"\n\n"
                + TITLE_MARKER + " [Your generated title]\n\n"
                + ARTICLE_MARKER + "\n[Your 3-5 sentence summary]\n\n"
                + ORIGINAL_MARKER + "\n\"" + postText + "\"";
    }

    @Override
    public EnrichmentText parseReply(String reply) {
        String text = reply == null ? "" : reply;
        int titleAt = text.indexOf(TITLE_MARKER);
        if (titleAt < 0) {
            return new EnrichmentText(EnrichmentText.UNTITLED, text.trim());
        }
        String afterTitle = text.substring(titleAt + TITLE_MARKER.length());
        int lineEnd = afterTitle.indexOf('\n');
        if (lineEnd < 0) {
            return new EnrichmentText(EnrichmentText.UNTITLED, text.trim());
        }
        String title = afterTitle.substring(0, lineEnd).trim();
        String rest = afterTitle.substring(lineEnd + 1);
        int originalAt = rest.indexOf(ORIGINAL_MARKER);
        String article = originalAt >= 0 ? rest.substring(0, originalAt) : rest;
        article = article.replace(ARTICLE_MARKER, "").trim();
        return new EnrichmentText(title, article);
    }

    @Override
    public double temperature() {
        return 0.2;
    }
}
