package com.example.riskintel.cache;

import com.example.riskintel.config.RiskIntelProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;

/**
 * In-process tier: size-bounded LRU with per-entry expiry, capped at the tier's max TTL.
 */
@Component
public class CaffeineCacheTier implements CacheTier {

    private record Stored(String json, Instant expiresAt) {
    }

    private final Cache<String, Stored> cache;
    private final RiskIntelProperties properties;

    public CaffeineCacheTier(RiskIntelProperties properties) {
        this.properties = properties;
        this.cache = Caffeine.newBuilder()
                .maximumSize(properties.getCache().getFastMaximumSize())
                .expireAfterWrite(properties.getCache().getFastMaxTtl())
                .recordStats()
                .build();
    }

    @Override
    public String name() {
        return "fast";
    }

    @Override
    public Optional<CachedValue> get(String key, Instant now) {
        Stored stored = cache.getIfPresent(key);
        if (stored == null) {
            return Optional.empty();
        }
        if (!now.isBefore(stored.expiresAt())) {
            cache.invalidate(key);
            return Optional.empty();
        }
        return Optional.of(new CachedValue(stored.json(), stored.expiresAt()));
    }

    /** Expiry is capped at {@code now + fastMaxTtl}, measured from the caller's clock. */
    @Override
    public void put(String key, String json, Instant expiresAt, Instant now) {
        Instant cap = now.plus(properties.getCache().getFastMaxTtl());
        cache.put(key, new Stored(json, expiresAt.isBefore(cap) ? expiresAt : cap));
    }

    @Override
    public int invalidate(CachePattern pattern) {
        if (!pattern.isPrefix()) {
            boolean present = cache.getIfPresent(pattern.value()) != null;
            cache.invalidate(pattern.value());
            return present ? 1 : 0;
        }
        int before = cache.asMap().size();
        cache.asMap().keySet().removeIf(pattern::matches);
        return Math.max(0, before - cache.asMap().size());
    }

    public long size() {
        return cache.estimatedSize();
    }

    public CacheStats stats() {
        return cache.stats();
    }
}
