package com.socialfeed.ingest.repository;

import com.socialfeed.ingest.model.ContentSource;
import com.socialfeed.ingest.model.ScrapedPost;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ScrapedPostRepository extends JpaRepository<ScrapedPost, Long> {
    /**
     * Checks whether a post with the given natural key is already stored.
     */
    boolean existsByUserIdAndSourceAndNativeId(Long userId, ContentSource source, String nativeId);

    /**
     * Lists a user's posts for one source, newest first.
     */
    List<ScrapedPost> findAllByUserIdAndSourceOrderByPostedAtDesc(Long userId, ContentSource source);

    /**
     * Lists all of a user's posts, newest first.
     */
    List<ScrapedPost> findAllByUserIdOrderByPostedAtDesc(Long userId);
}
