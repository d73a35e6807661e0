package com.example.riskintel.cache;

import java.time.Instant;
import java.util.Optional;

/**
 * One storage tier of the {@link TieredCache}. Values are JSON documents.
 */
public interface CacheTier {

    String name();

    Optional<CachedValue> get(String key, Instant now);

    /** {@code now} comes from the caller's clock and is the write time of the entry. */
    void put(String key, String json, Instant expiresAt, Instant now);

    /** Returns how many keys were removed when the tier can tell, otherwise -1. */
    int invalidate(CachePattern pattern);
}
