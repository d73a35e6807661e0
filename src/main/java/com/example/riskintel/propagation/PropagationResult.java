package com.example.riskintel.propagation;

import com.example.riskintel.domain.ProcessingError;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Blast radius of one scored entity. Ephemeral: cached with a short TTL and recomputed on
 * score change or graph mutation.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class PropagationResult {

    String sourceEntityId;
    double sourceScore;
    /** Keyed by entity id, in the order entities were reached. */
    @Builder.Default
    Map<String, EntityImpact> impacts = Map.of();
    @Builder.Default
    List<CriticalPath> criticalPaths = List.of();
    int totalAffectedServices;
    int criticalServicesAffected;
    double estimatedBusinessImpact;
    int maxPropagationDepth;
    @JsonProperty("isApproximate")
    boolean approximate;
    int stepsUsed;
    long graphVersion;
    Instant computedAt;
    Instant expiresAt;
    @Builder.Default
    List<ProcessingError> errors = List.of();
}
