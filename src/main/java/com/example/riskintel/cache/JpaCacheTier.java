package com.example.riskintel.cache;

import com.example.riskintel.domain.CacheEntry;
import com.example.riskintel.repository.CacheEntryRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;

/**
 * Durable tier backed by the cache_entries table. Entries expire by TTL only.
 */
@Component
@RequiredArgsConstructor
public class JpaCacheTier implements CacheTier {

    private final CacheEntryRepository repository;

    @Override
    public String name() {
        return "durable";
    }

    @Override
    public Optional<CachedValue> get(String key, Instant now) {
        Optional<CacheEntry> entry = repository.findById(key);
        if (entry.isEmpty()) {
            return Optional.empty();
        }
        if (!now.isBefore(entry.get().getExpiresAt())) {
            repository.deleteById(key);
            return Optional.empty();
        }
        return Optional.of(new CachedValue(entry.get().getValueJson(), entry.get().getExpiresAt()));
    }

    @Override
    public void put(String key, String json, Instant expiresAt, Instant now) {
        repository.save(CacheEntry.builder()
                .cacheKey(key)
                .valueJson(json)
                .expiresAt(expiresAt)
                .createdAt(now)
                .build());
    }

    @Override
    public int invalidate(CachePattern pattern) {
        if (!pattern.isPrefix()) {
            if (!repository.existsById(pattern.value())) {
                return 0;
            }
            repository.deleteById(pattern.value());
            return 1;
        }
        return repository.deleteByKeyLike(escapeLike(pattern.prefix()) + "%");
    }

    public int purgeExpired(Instant now) {
        return repository.deleteExpired(now);
    }

    static String escapeLike(String text) {
        return text.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
