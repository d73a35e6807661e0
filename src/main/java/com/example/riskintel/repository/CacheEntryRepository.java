package com.example.riskintel.repository;

import com.example.riskintel.domain.CacheEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

@Repository
public interface CacheEntryRepository extends JpaRepository<CacheEntry, String> {

    /** Backslash, percent and underscore in {@code likePattern} must already be escaped with a backslash. */
    @Transactional
    @Modifying
    @Query("DELETE FROM CacheEntry c WHERE c.cacheKey LIKE :likePattern ESCAPE '\\'")
    int deleteByKeyLike(String likePattern);

    @Transactional
    @Modifying
    @Query("DELETE FROM CacheEntry c WHERE c.expiresAt <= :now")
    int deleteExpired(Instant now);
}
