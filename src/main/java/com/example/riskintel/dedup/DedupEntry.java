package com.example.riskintel.dedup;

import com.example.riskintel.domain.RiskEvent;

import java.time.Instant;

/**
 * Index entry for one fingerprint. The window is fixed when the entry is created and
 * merges do not extend it.
 */
public record DedupEntry(String fingerprint, RiskEvent event, Instant windowClosesAt, DedupAction lastAction) {

    public boolean isOpenAt(Instant now) {
        return now.isBefore(windowClosesAt);
    }
}
