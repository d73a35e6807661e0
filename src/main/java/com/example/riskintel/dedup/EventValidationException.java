package com.example.riskintel.dedup;

import java.util.List;

/**
 * Raised at the ingestion boundary when an event is malformed or misses required fields.
 * Rejected events never reach deduplication or scoring.
 */
public class EventValidationException extends RuntimeException {

    private final List<String> violations;

    public EventValidationException(List<String> violations) {
        super("Event rejected: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
