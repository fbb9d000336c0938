package com.socialfeed.ingest.service;

import com.socialfeed.ingest.model.AcceptedItem;
import com.socialfeed.ingest.model.ScrapedPost;
import com.socialfeed.ingest.service.source.ContentSourceAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.ZoneOffset;

/**
 * Turns an accepted item into an unsaved {@link ScrapedPost} with empty enrichment fields.
 * A malformed item still yields a record; whatever could not be extracted is left empty.
 */
@Component
public class RecordMapper {

    private static final Logger logger = LoggerFactory.getLogger(RecordMapper.class);

    public ScrapedPost map(AcceptedItem item, Long userId, ContentSourceAdapter adapter) {
        ScrapedPost post = new ScrapedPost();
        post.setUserId(userId);
        post.setSource(adapter.source());
        post.setNativeId(item.nativeId());
        post.setPostedAt(item.postedAt().atOffset(ZoneOffset.UTC));
        post.setRawTimestamp(item.rawTimestamp());

        try {
            adapter.extractFields(item.raw(), post);
        } catch (RuntimeException e) {
            logger.warn("Partial field extraction for {} item {}: {}", adapter.source(), item.nativeId(), e.toString());
        }
        fillBlanks(post);
        return post;
    }

    private static void fillBlanks(ScrapedPost post) {
        if (post.getText() == null) post.setText("");
        if (post.getFullText() == null) post.setFullText(post.getText());
        if (post.getLang() == null) post.setLang("");
        if (post.getAuthorName() == null) post.setAuthorName("");
        if (post.getAuthorUsername() == null) post.setAuthorUsername("");
        if (post.getPostUrl() == null) post.setPostUrl("");
        if (post.getMediaUrl() == null) post.setMediaUrl("");
        if (post.getProfilePictureUrl() == null) post.setProfilePictureUrl("");
        if (post.getLikeCount() == null) post.setLikeCount(0);
        if (post.getReplyCount() == null) post.setReplyCount(0);
        if (post.getShareCount() == null) post.setShareCount(0);
        if (post.getQuoteCount() == null) post.setQuoteCount(0);
    }
}
