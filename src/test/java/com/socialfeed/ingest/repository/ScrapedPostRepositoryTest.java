package com.socialfeed.ingest.repository;

import com.socialfeed.ingest.model.AppUser;
import com.socialfeed.ingest.model.ContentSource;
import com.socialfeed.ingest.model.ScrapedPost;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
class ScrapedPostRepositoryTest {

    @Autowired
    private ScrapedPostRepository scrapedPostRepository;

    @Autowired
    private AppUserRepository appUserRepository;

    @Autowired
    private TestEntityManager entityManager;

    @Test
    void existenceCheckIsScopedToUserAndSource() {
        scrapedPostRepository.saveAndFlush(post(1L, ContentSource.TWITTER, "42", 9));

        assertThat(scrapedPostRepository.existsByUserIdAndSourceAndNativeId(1L, ContentSource.TWITTER, "42")).isTrue();
        assertThat(scrapedPostRepository.existsByUserIdAndSourceAndNativeId(2L, ContentSource.TWITTER, "42")).isFalse();
        assertThat(scrapedPostRepository.existsByUserIdAndSourceAndNativeId(1L, ContentSource.FACEBOOK, "42")).isFalse();
    }

    @Test
    void naturalKeyIsUniqueInStorage() {
        scrapedPostRepository.saveAndFlush(post(1L, ContentSource.TWITTER, "42", 9));

        assertThatThrownBy(() -> scrapedPostRepository.saveAndFlush(post(1L, ContentSource.TWITTER, "42", 10)))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    void listsNewestFirst() {
        scrapedPostRepository.save(post(1L, ContentSource.TWITTER, "old", 8));
        scrapedPostRepository.save(post(1L, ContentSource.TWITTER, "new", 10));
        scrapedPostRepository.save(post(1L, ContentSource.FACEBOOK, "page", 9));
        scrapedPostRepository.flush();

        assertThat(scrapedPostRepository.findAllByUserIdAndSourceOrderByPostedAtDesc(1L, ContentSource.TWITTER))
                .extracting(ScrapedPost::getNativeId)
                .containsExactly("new", "old");
        assertThat(scrapedPostRepository.findAllByUserIdOrderByPostedAtDesc(1L))
                .extracting(ScrapedPost::getNativeId)
                .containsExactly("new", "page", "old");
    }

    @Test
    void updatesOnlyLastScrapedTime() {
        AppUser user = new AppUser("alice@example.com", "Alice");
        user.setPreferredLanguage("he");
        user.addReference(ContentSource.TWITTER, "@alice");
        Long id = entityManager.persistAndFlush(user).getId();
        entityManager.clear();

        OffsetDateTime scrapedAt = OffsetDateTime.of(2024, 1, 10, 12, 0, 0, 0, ZoneOffset.UTC);
        assertThat(appUserRepository.updateLastScrapedAt(id, scrapedAt)).isEqualTo(1);
        entityManager.clear();

        AppUser reloaded = appUserRepository.findById(id).orElseThrow();
        assertThat(reloaded.getLastScrapedAt().toInstant()).isEqualTo(scrapedAt.toInstant());
        assertThat(reloaded.getPreferredLanguage()).isEqualTo("he");
        assertThat(reloaded.referencesFor(ContentSource.TWITTER)).containsExactly("@alice");
    }

    private static ScrapedPost post(Long userId, ContentSource source, String nativeId, int day) {
        ScrapedPost post = new ScrapedPost();
        post.setUserId(userId);
        post.setSource(source);
        post.setNativeId(nativeId);
        post.setText("text " + nativeId);
        post.setPostedAt(OffsetDateTime.of(2024, 1, day, 9, 0, 0, 0, ZoneOffset.UTC));
        return post;
    }
}
