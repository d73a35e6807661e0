package com.example.riskintel.dedup;

import com.example.riskintel.domain.RiskEvent;

public record DedupResult(DedupAction action, String eventId, int duplicateCount,
                          String fingerprint, RiskEvent event) {

    public boolean created() {
        return action == DedupAction.CREATED;
    }
}
