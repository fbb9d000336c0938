package com.socialfeed.ingest.dto;

import com.socialfeed.ingest.model.ContentSource;
import com.socialfeed.ingest.model.ScrapedPost;

import java.time.OffsetDateTime;

/**
 * Read model returned by the posts listing endpoint.
 */
public record ScrapedPostView(
        Long id,
        ContentSource source,
        String nativeId,
        String authorName,
        String text,
        String postUrl,
        String mediaUrl,
        OffsetDateTime postedAt,
        String generatedTitle,
        String generatedSummary
) {
    public static ScrapedPostView from(ScrapedPost post) {
        return new ScrapedPostView(
                post.getId(),
                post.getSource(),
                post.getNativeId(),
                post.getAuthorName(),
                post.getText(),
                post.getPostUrl(),
                post.getMediaUrl(),
                post.getPostedAt(),
                post.getGeneratedTitle(),
                post.getGeneratedSummary());
    }
}
