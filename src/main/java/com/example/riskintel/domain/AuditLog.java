package com.example.riskintel.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Immutable audit trail entry. Records every significant step the pipeline takes
 * for an event (ingest, merge, score, propagation) and every graph change.
 */
@Entity
@Table(name = "audit_logs", indexes = {
        @Index(name = "idx_audit_actor", columnList = "actor"),
        @Index(name = "idx_audit_action", columnList = "action"),
        @Index(name = "idx_audit_target", columnList = "target"),
        @Index(name = "idx_audit_timestamp", columnList = "timestamp")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    /** Component that acted: "pipeline", "dedup", "scoring", "propagation", "graph", "cache" */
    @Column(nullable = false)
    private String actor;

    /** EVENT_CREATED, EVENT_MERGED, EVENT_REJECTED, EVENT_SCORED, BLAST_RADIUS_COMPUTED,
     *  EVENT_ARCHIVED, GRAPH_CHANGED, GRAPH_WRITE_REJECTED, CACHE_INVALIDATED */
    @Column(nullable = false)
    private String action;

    /** Event id, entity id or cache pattern */
    private String target;

    /** JSON details about the action */
    @Column(length = 8192)
    private String details;

    /** Correlation id supplied by the connector, if any */
    @Column(name = "correlation_id")
    private String correlationId;

    @Builder.Default
    private boolean success = true;

    @Column(nullable = false)
    private Instant timestamp;

    @PrePersist
    protected void onCreate() {
        if (timestamp == null) timestamp = Instant.now();
    }
}
