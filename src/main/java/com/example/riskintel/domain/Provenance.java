package com.example.riskintel.domain;

import java.time.Instant;

/** One sighting of an event, appended on every merge. */
public record Provenance(String system, String originalId, Instant seenAt) {
}
