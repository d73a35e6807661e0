package com.example.riskintel.support;

import com.example.riskintel.domain.AffectedEntities;
import com.example.riskintel.domain.EventSource;
import com.example.riskintel.domain.RiskEvent;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public final class TestEvents {

    public static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    private TestEvents() {
    }

    public static RiskEvent.RiskEventBuilder telemetry() {
        return RiskEvent.builder()
                .eventType("telemetry")
                .severity(2)
                .confidence(70.0)
                .source(new EventSource("prometheus", "cpu-high-web-01"))
                .affectedEntities(new AffectedEntities(List.of("web-01"), List.of(), List.of(), List.of()))
                .occurredAt(T0.plusSeconds(30))
                .rawPayload(Map.of("metric", "cpu", "value", 97));
    }

    public static RiskEvent.RiskEventBuilder vulnerability(String cveId) {
        return RiskEvent.builder()
                .eventType("vulnerability")
                .severity(4)
                .confidence(95.0)
                .source(new EventSource("scanner", "finding-" + cveId))
                .affectedEntities(new AffectedEntities(List.of("payments-api"), List.of("db-01"), List.of(), List.of()))
                .occurredAt(T0)
                .rawPayload(Map.of("cveId", cveId));
    }

    /** An event as it looks after deduplication, for scoring tests. */
    public static RiskEvent scored(int severity, double confidence) {
        return RiskEvent.builder()
                .id("evt-1")
                .fingerprint("fp-1")
                .eventType("vulnerability")
                .severity(severity)
                .confidence(confidence)
                .source(new EventSource("scanner", "finding-1"))
                .affectedEntities(new AffectedEntities(List.of("payments-api"), List.of(), List.of(), List.of()))
                .occurredAt(T0)
                .detectedAt(T0)
                .firstSeenAt(T0)
                .lastSeenAt(T0)
                .build();
    }
}
