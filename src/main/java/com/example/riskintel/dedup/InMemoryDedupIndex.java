package com.example.riskintel.dedup;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiFunction;

/**
 * Single-node dedup index. {@link ConcurrentHashMap#compute} serializes writers per key,
 * so two ingestions of one fingerprint can never both create.
 */
@Component
public class InMemoryDedupIndex implements DedupIndex {

    private final ConcurrentHashMap<String, DedupEntry> entries = new ConcurrentHashMap<>();

    @Override
    public DedupEntry compute(String fingerprint, BiFunction<String, DedupEntry, DedupEntry> remapping) {
        return entries.compute(fingerprint, remapping);
    }

    @Override
    public Optional<DedupEntry> get(String fingerprint) {
        return Optional.ofNullable(entries.get(fingerprint));
    }

    @Override
    public boolean putIfAbsent(DedupEntry entry) {
        return entries.putIfAbsent(entry.fingerprint(), entry) == null;
    }

    @Override
    public int purgeExpired(Instant now) {
        int before = entries.size();
        entries.values().removeIf(entry -> !entry.isOpenAt(now));
        return Math.max(0, before - entries.size());
    }

    @Override
    public int size() {
        return entries.size();
    }
}
