package com.socialfeed.ingest.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

/**
 * One ingested post. Natural key is (userId, source, nativeId).
 *
 * Ingestion fields are written once at insert; generatedTitle/generatedSummary are filled by
 * enrichment and afterwards only changed by manual edits.
 */
@Setter
@Getter
@Entity
@Table(name = "scraped_post",
        uniqueConstraints = @UniqueConstraint(name = "uk_scraped_post_natural_key",
                columnNames = {"user_id", "source", "native_id"}))
public class ScrapedPost {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "source", nullable = false, updatable = false, length = 32)
    private ContentSource source;

    @Column(name = "native_id", nullable = false, updatable = false)
    private String nativeId;

    @Column(name = "text", columnDefinition = "TEXT")
    private String text;

    @Column(name = "full_text", columnDefinition = "TEXT")
    private String fullText;

    @Column(name = "lang", length = 16)
    private String lang;

    /**
     * Display name of the author, or the page name for page posts.
     */
    @Column(name = "author_name")
    private String authorName;

    @Column(name = "author_username")
    private String authorUsername;

    @Column(name = "post_url", length = 1000)
    private String postUrl;

    @Column(name = "media_url", length = 1000)
    private String mediaUrl;

    @Column(name = "profile_picture_url", length = 1000)
    private String profilePictureUrl;

    @Column(name = "like_count")
    private Integer likeCount = 0;

    /**
     * Replies for tweets, comments for page posts.
     */
    @Column(name = "reply_count")
    private Integer replyCount = 0;

    /**
     * Retweets for tweets, shares for page posts.
     */
    @Column(name = "share_count")
    private Integer shareCount = 0;

    @Column(name = "quote_count")
    private Integer quoteCount = 0;

    @Column(name = "posted_at", nullable = false)
    private OffsetDateTime postedAt;

    @Column(name = "raw_timestamp", length = 100)
    private String rawTimestamp;

    @Column(name = "generated_title", length = 500)
    private String generatedTitle;

    @Column(name = "generated_summary", columnDefinition = "TEXT")
    private String generatedSummary;

    @Column(name = "enriched_at")
    private OffsetDateTime enrichedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    public ScrapedPost() {
    }

    @PrePersist
    void onCreate() {
        if (createdAt == null) createdAt = OffsetDateTime.now();
    }
}
