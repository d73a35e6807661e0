package com.example.riskintel.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Event register row. Holds the latest event JSON and the latest score so the
 * dedup index can be rebuilt after a restart.
 */
@Entity
@Table(name = "risk_events", indexes = {
        @Index(name = "idx_risk_event_fingerprint", columnList = "fingerprint"),
        @Index(name = "idx_risk_event_status", columnList = "status"),
        @Index(name = "idx_risk_event_window", columnList = "window_closes_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskEventRecord {

    @Id
    private String id;

    @Column(nullable = false, length = 64)
    private String fingerprint;

    @Column(name = "event_type", nullable = false, length = 64)
    private String eventType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private EventStatus status;

    private int severity;

    @Column(name = "duplicate_count")
    private int duplicateCount;

    @Column(name = "final_score")
    private Double finalScore;

    @Enumerated(EnumType.STRING)
    @Column(name = "risk_level", length = 16)
    private RiskLevel riskLevel;

    @Column(name = "first_seen_at")
    private Instant firstSeenAt;

    @Column(name = "last_seen_at")
    private Instant lastSeenAt;

    /** End of the dedup window on the engine clock. */
    @Column(name = "window_closes_at")
    private Instant windowClosesAt;

    @Column(columnDefinition = "TEXT", nullable = false)
    private String payload;

    @Column(name = "latest_breakdown", columnDefinition = "TEXT")
    private String latestBreakdown;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    protected void onSave() {
        updatedAt = Instant.now();
    }
}
