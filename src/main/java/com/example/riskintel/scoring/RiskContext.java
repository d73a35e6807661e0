package com.example.riskintel.scoring;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/**
 * Contextual signals the scoring passes consume. Any part may be null; a null input makes
 * the corresponding pass record "data unavailable" instead of guessing.
 */
@Value
@With
@Builder(toBuilder = true)
@Jacksonized
public class RiskContext {

    /** 1 to 10. Filled from the dependency graph when the analytics feed has none. */
    Integer assetCriticality;
    /** True when the event is on a known-exploited list. */
    Boolean knownExploited;
    ThreatIntelSignal threatIntel;
    HistoricalPattern history;
    EnvironmentalContext environment;
    DataQuality dataQuality;

    public static RiskContext empty() {
        return RiskContext.builder().build();
    }

    /** Number of threat-intel matches and the highest severity (1-4) among them. */
    public record ThreatIntelSignal(int matchCount, int maxSeverity) {
    }

    /** How often comparable events turned into real incidents. */
    public record HistoricalPattern(int occurrences, double successRate) {
    }

    public record EnvironmentalContext(Boolean internetFacing, Boolean production, Integer compensatingControls) {
    }

    /** Both values are 0 to 1. */
    public record DataQuality(Double sourceReliability, Double completeness) {
    }
}
