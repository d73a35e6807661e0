package com.example.riskintel.service;

import com.example.riskintel.domain.RiskEvent;
import com.example.riskintel.propagation.PropagationResult;
import com.example.riskintel.scoring.ScoreBreakdown;

import java.util.List;

/**
 * What happened to one ingested event.
 *
 * @param rescored false when a merge arrived while the event was already being scored
 */
public record IngestionResult(Status status,
                              String eventId,
                              String fingerprint,
                              int duplicateCount,
                              List<String> violations,
                              RiskEvent event,
                              ScoreBreakdown score,
                              List<PropagationResult> blastRadius,
                              boolean rescored) {

    public enum Status {
        CREATED,
        MERGED,
        REJECTED
    }

    public static IngestionResult rejected(List<String> violations) {
        return new IngestionResult(Status.REJECTED, null, null, 0, List.copyOf(violations), null, null, List.of(), false);
    }

    public boolean isRejected() {
        return status == Status.REJECTED;
    }
}
