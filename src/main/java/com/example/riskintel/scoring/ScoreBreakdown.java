package com.example.riskintel.scoring;

import com.example.riskintel.domain.ProcessingError;
import com.example.riskintel.domain.RiskLevel;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Explainable score for one event. {@code baseScore} plus every adjustment's
 * contribution equals {@code finalScore}. Never mutated; a rescore yields a new breakdown.
 */
@Value
@Builder
@Jacksonized
public class ScoreBreakdown {

    String eventId;
    String fingerprint;
    double baseScore;
    @Singular
    List<ScoreAdjustment> adjustments;
    /** Clamped to [0, 100]. */
    double finalScore;
    /** Last pass result before its clamp. */
    double preClampScore;
    /** 0 to 100. */
    double confidence;
    RiskLevel riskLevel;
    String calculationId;
    Instant timestamp;
    @Singular("explanationEntry")
    List<ProcessingError> explanation;
    /** True when the score is the base-only fallback after a failure. */
    boolean fallback;
}
