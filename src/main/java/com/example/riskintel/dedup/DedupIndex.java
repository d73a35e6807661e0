package com.example.riskintel.dedup;

import java.time.Instant;
import java.util.Optional;
import java.util.function.BiFunction;

/**
 * Fingerprint index with per-entry windows. Implementations must apply
 * {@link #compute} atomically per fingerprint.
 */
public interface DedupIndex {

    DedupEntry compute(String fingerprint, BiFunction<String, DedupEntry, DedupEntry> remapping);

    Optional<DedupEntry> get(String fingerprint);

    /** Adds an entry unless one is already indexed for its fingerprint. */
    boolean putIfAbsent(DedupEntry entry);

    /** Drops entries whose window closed at or before {@code now}. Returns how many were dropped. */
    int purgeExpired(Instant now);

    int size();
}
