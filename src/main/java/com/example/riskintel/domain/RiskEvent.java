package com.example.riskintel.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A security, operational or compliance event after ingestion.
 * <p>
 * Instances are immutable; merges and lifecycle moves produce a new copy through
 * {@link #toBuilder()}. Connectors post the same shape without the fields the
 * pipeline assigns (id, fingerprint, first/last seen, duplicate count, provenance,
 * processing state).
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class RiskEvent {

    String id;
    String eventType;
    /** 1 (low) to 4 (critical). */
    Integer severity;
    /** 0 to 100. */
    Double confidence;
    EventSource source;
    AffectedEntities affectedEntities;
    Instant occurredAt;
    Instant detectedAt;
    Instant firstSeenAt;
    Instant lastSeenAt;
    String fingerprint;
    String correlationId;

    @Builder.Default
    int duplicateCount = 1;

    @Builder.Default
    List<Provenance> provenance = List.of();

    @Builder.Default
    Map<String, Object> rawPayload = Map.of();

    @Builder.Default
    ProcessingState processingState = ProcessingState.pending();

    public EventStatus status() {
        return processingState.getStatus();
    }

    public RiskEvent transitionTo(EventStatus next) {
        return toBuilder().processingState(processingState.transitionTo(next)).build();
    }

    public RiskEvent withErrors(List<ProcessingError> errors) {
        return toBuilder().processingState(processingState.withErrors(errors)).build();
    }
}
