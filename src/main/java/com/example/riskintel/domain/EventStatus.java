package com.example.riskintel.domain;

/**
 * Lifecycle of an ingested event.
 * PENDING → PROCESSING → ENRICHED → ARCHIVED. A merge may send an enriched event back to
 * PROCESSING for rescoring; any state may be archived.
 */
public enum EventStatus {
    PENDING,
    PROCESSING,
    ENRICHED,
    ARCHIVED;

    public boolean canTransitionTo(EventStatus next) {
        if (next == null || next == this) return false;
        if (next == ARCHIVED) return true;
        return switch (this) {
            case PENDING -> next == PROCESSING;
            case PROCESSING -> next == ENRICHED;
            case ENRICHED -> next == PROCESSING;
            case ARCHIVED -> false;
        };
    }
}
