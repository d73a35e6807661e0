package com.example.riskintel.cache;

import com.example.riskintel.config.RiskIntelProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Two-tier cache for propagation results and score breakdowns.
 * <p>
 * {@code get} reads the fast tier, then the durable tier, promoting durable hits.
 * {@code set} writes both tiers and {@code invalidate} clears both. When the durable tier
 * fails the cache keeps serving from the fast tier alone.
 */
@Slf4j
@Service
public class TieredCache {

    private final CaffeineCacheTier fastTier;
    private final JpaCacheTier durableTier;
    private final ObjectMapper objectMapper;
    private final RiskIntelProperties properties;
    private final Clock clock;

    private final Counter fastHits;
    private final Counter durableHits;
    private final Counter misses;
    private final Counter durableFailures;

    public TieredCache(CaffeineCacheTier fastTier, JpaCacheTier durableTier, ObjectMapper objectMapper,
                       RiskIntelProperties properties, Clock clock, MeterRegistry meterRegistry) {
        this.fastTier = fastTier;
        this.durableTier = durableTier;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
        this.fastHits = Counter.builder("riskintel.cache.hits").tag("tier", "fast").register(meterRegistry);
        this.durableHits = Counter.builder("riskintel.cache.hits").tag("tier", "durable").register(meterRegistry);
        this.misses = Counter.builder("riskintel.cache.misses").register(meterRegistry);
        this.durableFailures = Counter.builder("riskintel.cache.durable.failures").register(meterRegistry);
    }

    public <T> Optional<T> get(String key, Class<T> type) {
        Instant now = clock.instant();
        Optional<CachedValue> fast = fastTier.get(key, now);
        if (fast.isPresent()) {
            Optional<T> value = decode(key, fast.get().json(), type);
            if (value.isPresent()) {
                fastHits.increment();
                return value;
            }
        }

        if (durableEnabled()) {
            try {
                Optional<CachedValue> durable = durableTier.get(key, now);
                if (durable.isPresent()) {
                    Optional<T> value = decode(key, durable.get().json(), type);
                    if (value.isPresent()) {
                        // keeps the durable expiry; the fast tier caps it at its own max TTL
                        fastTier.put(key, durable.get().json(), durable.get().expiresAt(), now);
                        durableHits.increment();
                        return value;
                    }
                }
            } catch (RuntimeException e) {
                durableFailure("get", key, e);
            }
        }

        misses.increment();
        return Optional.empty();
    }

    public void set(String key, Object value, Duration ttl) {
        String json;
        try {
            json = objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.error("Cannot cache {}: {}", key, e.getOriginalMessage());
            return;
        }
        Instant now = clock.instant();
        Instant expiresAt = now.plus(ttl);
        fastTier.put(key, json, expiresAt, now);
        if (durableEnabled()) {
            try {
                durableTier.put(key, json, expiresAt, now);
            } catch (RuntimeException e) {
                durableFailure("set", key, e);
            }
        }
    }

    /**
     * Removes an exact key, or every key starting with the prefix when the pattern ends in {@code *}.
     * Returns the number of fast-tier keys removed.
     */
    public int invalidate(String pattern) {
        CachePattern parsed = CachePattern.of(pattern);
        int removed = fastTier.invalidate(parsed);
        if (durableEnabled()) {
            try {
                int durableRemoved = durableTier.invalidate(parsed);
                log.debug("Invalidated {}: fast={}, durable={}", pattern, removed, durableRemoved);
            } catch (RuntimeException e) {
                durableFailure("invalidate", pattern, e);
            }
        }
        return removed;
    }

    @Scheduled(fixedDelayString = "${risk-intel.cache.purge-interval-ms:300000}")
    public void purgeExpired() {
        if (!durableEnabled()) return;
        try {
            int purged = durableTier.purgeExpired(clock.instant());
            if (purged > 0) {
                log.info("Purged {} expired durable cache entries", purged);
            }
        } catch (RuntimeException e) {
            durableFailure("purge", "*", e);
        }
    }

    public CacheStatistics statistics() {
        return new CacheStatistics(
                fastTier.size(),
                fastHits.count(),
                durableHits.count(),
                misses.count(),
                durableFailures.count(),
                fastTier.stats().hitRate(),
                durableEnabled());
    }

    public record CacheStatistics(long fastSize, double fastHits, double durableHits, double misses,
                                  double durableFailures, double fastHitRate, boolean durableEnabled) {
    }

    private boolean durableEnabled() {
        return properties.getCache().isDurableEnabled();
    }

    private <T> Optional<T> decode(String key, String json, Class<T> type) {
        try {
            return Optional.of(objectMapper.readValue(json, type));
        } catch (JsonProcessingException e) {
            log.warn("Dropping unreadable cache entry {}: {}", key, e.getOriginalMessage());
            fastTier.invalidate(CachePattern.of(key));
            return Optional.empty();
        }
    }

    private void durableFailure(String operation, String key, RuntimeException e) {
        durableFailures.increment();
        log.warn("Durable cache {} failed for {}, continuing with fast tier only: {}", operation, key, e.getMessage());
    }
}
