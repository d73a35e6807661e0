package com.example.riskintel.cache;

import com.example.riskintel.config.AppConfig;
import com.example.riskintel.config.RiskIntelProperties;
import com.example.riskintel.support.MutableClock;
import com.example.riskintel.support.TestEvents;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class TieredCacheTest {

    record Sample(String name, double score) {
    }

    private RiskIntelProperties properties;
    private MutableClock clock;
    private CaffeineCacheTier fastTier;
    private JpaCacheTier durableTier;
    private TieredCache cache;

    @BeforeEach
    void setUp() {
        properties = new RiskIntelProperties();
        clock = new MutableClock(TestEvents.T0);
        fastTier = new CaffeineCacheTier(properties);
        durableTier = mock(JpaCacheTier.class);
        when(durableTier.get(anyString(), any())).thenReturn(Optional.empty());
        cache = new TieredCache(fastTier, durableTier, new AppConfig().objectMapper(), properties, clock,
                new SimpleMeterRegistry());
    }

    @Test
    void setWritesBothTiersAndGetReadsFastTierFirst() {
        cache.set("score:1", new Sample("a", 42.5), Duration.ofMinutes(5));

        assertEquals(Optional.of(new Sample("a", 42.5)), cache.get("score:1", Sample.class));
        verify(durableTier).put(eq("score:1"), anyString(), eq(TestEvents.T0.plus(Duration.ofMinutes(5))),
                eq(TestEvents.T0));
        verify(durableTier, never()).get(anyString(), any());
        assertEquals(1.0, cache.statistics().fastHits());
    }

    @Test
    void expiredEntryIsAMiss() {
        cache.set("score:1", new Sample("a", 1.0), Duration.ofMinutes(5));

        clock.advance(Duration.ofMinutes(5));

        assertTrue(cache.get("score:1", Sample.class).isEmpty());
        assertEquals(1.0, cache.statistics().misses());
    }

    @Test
    void durableHitIsPromotedToFastTier() {
        when(durableTier.get(eq("score:2"), any())).thenReturn(Optional.of(
                new CachedValue("{\"name\":\"b\",\"score\":7.0}", TestEvents.T0.plus(Duration.ofHours(1)))));

        assertEquals(Optional.of(new Sample("b", 7.0)), cache.get("score:2", Sample.class));
        assertEquals(Optional.of(new Sample("b", 7.0)), cache.get("score:2", Sample.class));

        verify(durableTier, times(1)).get(eq("score:2"), any());
        assertEquals(1.0, cache.statistics().durableHits());
        assertEquals(1.0, cache.statistics().fastHits());
    }

    @Test
    void promotedEntryKeepsItsDurableExpiry() {
        Instant expiresAt = TestEvents.T0.plus(Duration.ofMinutes(5));
        when(durableTier.get(eq("propagation:api"), any())).thenAnswer(inv -> {
            Instant now = inv.getArgument(1);
            return now.isBefore(expiresAt)
                    ? Optional.of(new CachedValue("{\"name\":\"api\",\"score\":75.0}", expiresAt))
                    : Optional.empty();
        });

        clock.advance(Duration.ofMinutes(4));
        assertTrue(cache.get("propagation:api", Sample.class).isPresent());
        assertEquals(Optional.of(expiresAt), fastTier.get("propagation:api", clock.instant()).map(CachedValue::expiresAt));

        clock.advance(Duration.ofMinutes(4));
        assertTrue(cache.get("propagation:api", Sample.class).isEmpty());
    }

    @Test
    void fastTierNeverOutlivesItsMaxTtl() {
        cache.set("score:1", new Sample("a", 1.0), Duration.ofHours(2));

        clock.advance(properties.getCache().getFastMaxTtl());

        assertTrue(fastTier.get("score:1", clock.instant()).isEmpty());
    }

    @Test
    void invalidatePrefixClearsMatchingKeysInBothTiers() {
        cache.set("propagation:api:1", new Sample("a", 1.0), Duration.ofMinutes(5));
        cache.set("propagation:api:2", new Sample("b", 2.0), Duration.ofMinutes(5));
        cache.set("score:api", new Sample("c", 3.0), Duration.ofMinutes(5));

        int removed = cache.invalidate("propagation:*");

        assertEquals(2, removed);
        assertTrue(cache.get("propagation:api:1", Sample.class).isEmpty());
        assertTrue(cache.get("propagation:api:2", Sample.class).isEmpty());
        assertTrue(cache.get("score:api", Sample.class).isPresent());
        verify(durableTier).invalidate(CachePattern.of("propagation:*"));
    }

    @Test
    void invalidateExactKey() {
        cache.set("score:1", new Sample("a", 1.0), Duration.ofMinutes(5));
        cache.set("score:10", new Sample("b", 1.0), Duration.ofMinutes(5));

        assertEquals(1, cache.invalidate("score:1"));

        assertTrue(cache.get("score:1", Sample.class).isEmpty());
        assertTrue(cache.get("score:10", Sample.class).isPresent());
    }

    @Test
    void durableFailuresDegradeToFastTier() {
        doThrow(new DataAccessResourceFailureException("db down")).when(durableTier).put(anyString(), anyString(), any(), any());
        when(durableTier.get(anyString(), any())).thenThrow(new DataAccessResourceFailureException("db down"));

        cache.set("score:1", new Sample("a", 1.0), Duration.ofMinutes(5));

        assertEquals(Optional.of(new Sample("a", 1.0)), cache.get("score:1", Sample.class));
        assertTrue(cache.get("score:missing", Sample.class).isEmpty());
        assertEquals(2.0, cache.statistics().durableFailures());
    }

    @Test
    void disabledDurableTierIsNeverTouched() {
        properties.getCache().setDurableEnabled(false);
        JpaCacheTier untouched = mock(JpaCacheTier.class);
        TieredCache fastOnly = new TieredCache(fastTier, untouched, new AppConfig().objectMapper(), properties, clock,
                new SimpleMeterRegistry());

        fastOnly.set("score:1", Map.of("k", "v"), Duration.ofMinutes(5));
        fastOnly.get("score:2", Sample.class);
        fastOnly.invalidate("score:*");
        fastOnly.purgeExpired();

        verifyNoInteractions(untouched);
    }

    @Test
    void purgeDelegatesToDurableTier() {
        when(durableTier.purgeExpired(any(Instant.class))).thenReturn(3);

        cache.purgeExpired();

        verify(durableTier).purgeExpired(TestEvents.T0);
    }
}
