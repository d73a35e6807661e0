package com.example.riskintel.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Durable cache tier row. Values are stored as JSON and expire by TTL only.
 */
@Entity
@Table(name = "cache_entries", indexes = {
        @Index(name = "idx_cache_expires_at", columnList = "expires_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheEntry {

    @Id
    @Column(name = "cache_key", length = 512)
    private String cacheKey;

    @Column(name = "value_json", columnDefinition = "TEXT", nullable = false)
    private String valueJson;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
