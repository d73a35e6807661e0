package com.example.riskintel.propagation;

import com.example.riskintel.config.RiskIntelProperties.PropagationConfig;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Locale;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class PropagationOptions {

    @Builder.Default
    int maxDepth = 3;
    @Builder.Default
    double decayFactor = 0.3;
    @Builder.Default
    double minimumPropagationScore = 0.1;
    @Builder.Default
    boolean includeUpstream = true;
    @Builder.Default
    boolean includeDownstream = true;
    @Builder.Default
    int stepBudget = 10_000;
    @Builder.Default
    long timeBudgetMs = 250;
    @Builder.Default
    int criticalPathLimit = 10;

    public static PropagationOptions from(PropagationConfig config) {
        return PropagationOptions.builder()
                .maxDepth(config.getMaxDepth())
                .decayFactor(config.getDecayFactor())
                .minimumPropagationScore(config.getMinimumPropagationScore())
                .includeUpstream(config.isIncludeUpstream())
                .includeDownstream(config.isIncludeDownstream())
                .stepBudget(config.getStepBudget())
                .timeBudgetMs(config.getTimeBudgetMs())
                .criticalPathLimit(config.getCriticalPathLimit())
                .build();
    }

    /**
     * Rejects options the traversal cannot honour. A negative decay would let scores grow
     * from hop to hop.
     *
     * @throws IllegalArgumentException naming the first offending option
     */
    public void validate() {
        require(maxDepth >= 0, "maxDepth must be >= 0, was " + maxDepth);
        require(Double.isFinite(decayFactor) && decayFactor >= 0,
                "decayFactor must be >= 0, was " + decayFactor);
        require(Double.isFinite(minimumPropagationScore) && minimumPropagationScore >= 0,
                "minimumPropagationScore must be >= 0, was " + minimumPropagationScore);
        require(stepBudget > 0, "stepBudget must be > 0, was " + stepBudget);
        require(timeBudgetMs > 0, "timeBudgetMs must be > 0, was " + timeBudgetMs);
        require(criticalPathLimit >= 0, "criticalPathLimit must be >= 0, was " + criticalPathLimit);
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    /** Stable serialization used in cache keys. */
    public String cacheKey() {
        return String.format(Locale.ROOT, "d%d:f%.4f:m%.4f:u%b:w%b:s%d:t%d:c%d",
                maxDepth, decayFactor, minimumPropagationScore, includeUpstream, includeDownstream,
                stepBudget, timeBudgetMs, criticalPathLimit);
    }
}
