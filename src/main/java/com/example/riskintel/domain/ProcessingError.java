package com.example.riskintel.domain;

import java.time.Instant;

/**
 * Structured note attached to an event, a score breakdown or a propagation result
 * explaining why an output is partial or low-confidence.
 */
public record ProcessingError(ErrorType type, String component, String message, Instant occurredAt) {

    public static ProcessingError of(ErrorType type, String component, String message, Instant occurredAt) {
        return new ProcessingError(type, component, message, occurredAt);
    }
}
