package com.socialfeed.ingest.repository;

import com.socialfeed.ingest.model.AppUser;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;

@Repository
public interface AppUserRepository extends JpaRepository<AppUser, Long> {
    /**
     * Sets only the last-scraped time, leaving other preferences untouched.
     */
    @Modifying
    @Transactional
    @Query("UPDATE AppUser u SET u.lastScrapedAt = :scrapedAt WHERE u.id = :userId")
    int updateLastScrapedAt(@Param("userId") Long userId, @Param("scrapedAt") OffsetDateTime scrapedAt);
}
