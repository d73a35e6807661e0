package com.example.riskintel.dedup;

import com.example.riskintel.config.RiskIntelProperties;
import com.example.riskintel.domain.EventSource;
import com.example.riskintel.domain.ProcessingState;
import com.example.riskintel.domain.Provenance;
import com.example.riskintel.domain.RiskEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Deduplication Engine.
 * <p>
 * Fingerprints a validated event and either merges it into the open index entry for
 * that fingerprint or creates a new entry. A fingerprint whose window already closed is
 * a new recurrence and starts again at duplicateCount 1.
 */
@Slf4j
@Service
public class DeduplicationEngine {

    private final EventFingerprinter fingerprinter;
    private final DedupIndex index;
    private final RiskIntelProperties properties;
    private final Clock clock;

    public DeduplicationEngine(EventFingerprinter fingerprinter, DedupIndex index,
                               RiskIntelProperties properties, Clock clock) {
        this.fingerprinter = fingerprinter;
        this.index = index;
        this.properties = properties;
        this.clock = clock;
    }

    public DedupResult deduplicate(RiskEvent event) {
        RiskEvent normalized = fingerprinter.normalize(event);
        String fingerprint = fingerprinter.fingerprint(normalized);
        Instant now = clock.instant();
        Duration window = properties.getDedup().policyFor(normalized.getEventType()).getWindow();

        DedupEntry entry = index.compute(fingerprint, (key, existing) -> {
            if (existing != null && existing.isOpenAt(now)) {
                return new DedupEntry(key, merge(existing.event(), normalized, now), existing.windowClosesAt(), DedupAction.MERGED);
            }
            if (existing != null) {
                log.debug("Window for {} closed at {}; treating as recurrence", key, existing.windowClosesAt());
            }
            return new DedupEntry(key, create(normalized, key, now), now.plus(window), DedupAction.CREATED);
        });

        RiskEvent stored = entry.event();
        log.debug("Dedup {} event {} [{}] count={}", entry.lastAction(), stored.getId(),
                shortFingerprint(fingerprint), stored.getDuplicateCount());
        return new DedupResult(entry.lastAction(), stored.getId(), stored.getDuplicateCount(), fingerprint, stored);
    }

    /** Window end for an indexed fingerprint, if the entry is still held. */
    public Instant windowClosesAt(String fingerprint) {
        return index.get(fingerprint).map(DedupEntry::windowClosesAt).orElse(null);
    }

    @Scheduled(fixedDelayString = "${risk-intel.dedup.purge-interval-ms:60000}")
    public void purgeExpired() {
        int purged = index.purgeExpired(clock.instant());
        if (purged > 0) {
            log.info("Purged {} closed dedup windows ({} still open)", purged, index.size());
        }
    }

    private RiskEvent create(RiskEvent event, String fingerprint, Instant now) {
        EventSource source = event.getSource();
        return event.toBuilder()
                .id(UUID.randomUUID().toString())
                .fingerprint(fingerprint)
                .detectedAt(event.getDetectedAt() != null ? event.getDetectedAt() : now)
                .firstSeenAt(now)
                .lastSeenAt(now)
                .duplicateCount(1)
                .provenance(List.of(new Provenance(source.system(), source.originalId(), now)))
                .processingState(ProcessingState.pending())
                .build();
    }

    private RiskEvent merge(RiskEvent existing, RiskEvent incoming, Instant now) {
        List<Provenance> provenance = new ArrayList<>(existing.getProvenance());
        provenance.add(new Provenance(incoming.getSource().system(), incoming.getSource().originalId(), now));
        Instant lastSeen = existing.getLastSeenAt() != null && existing.getLastSeenAt().isAfter(now)
                ? existing.getLastSeenAt() : now;
        return existing.toBuilder()
                .duplicateCount(existing.getDuplicateCount() + 1)
                .lastSeenAt(lastSeen)
                .provenance(List.copyOf(provenance))
                .confidence(Math.max(existing.getConfidence(), incoming.getConfidence()))
                .correlationId(existing.getCorrelationId() != null ? existing.getCorrelationId() : incoming.getCorrelationId())
                .build();
    }

    private static String shortFingerprint(String fingerprint) {
        return fingerprint.length() > 12 ? fingerprint.substring(0, 12) : fingerprint;
    }
}
