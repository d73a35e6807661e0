package com.example.riskintel.scoring;

import com.example.riskintel.config.RiskIntelProperties;
import com.example.riskintel.config.RiskIntelProperties.RiskBands;
import com.example.riskintel.config.RiskIntelProperties.ScoringConfig;
import com.example.riskintel.domain.ErrorType;
import com.example.riskintel.domain.ProcessingError;
import com.example.riskintel.domain.RiskEvent;
import com.example.riskintel.domain.RiskLevel;
import com.example.riskintel.util.CanonicalJson;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.AnnotationAwareOrderComparator;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Transparent Scoring Engine.
 * <p>
 * Base score from severity and asset criticality, then the ordered adjustment passes,
 * clamping to [0, 100] after each one. Every step is recorded so the breakdown
 * reconstructs the final score. Pure: identical inputs give an equal breakdown, and
 * failures fall back to the base score instead of throwing.
 */
@Slf4j
@Service
public class TransparentScoringEngine {

    static final String COMPONENT = "scoring";

    private final RiskIntelProperties properties;
    private final List<ScoreAdjustmentPass> passes;
    private final ConfidenceCalculator confidenceCalculator;

    public TransparentScoringEngine(RiskIntelProperties properties, List<ScoreAdjustmentPass> passes,
                                    ConfidenceCalculator confidenceCalculator) {
        this.properties = properties;
        List<ScoreAdjustmentPass> ordered = new ArrayList<>(passes);
        AnnotationAwareOrderComparator.sort(ordered);
        this.passes = List.copyOf(ordered);
        this.confidenceCalculator = confidenceCalculator;
    }

    public ScoreBreakdown score(RiskEvent event, RiskContext context) {
        RiskContext ctx = context != null ? context : RiskContext.empty();
        Instant timestamp = scoreTimestamp(event);
        String calculationId;
        try {
            calculationId = calculationId(event, ctx);
        } catch (RuntimeException e) {
            log.error("Could not derive calculation id for event {}: {}", event.getId(), e.getMessage());
            calculationId = "uncomputable-" + event.getFingerprint();
        }
        try {
            return compute(event, ctx, timestamp, calculationId);
        } catch (RuntimeException e) {
            log.error("Scoring failed for event {}, falling back to base score: {}", event.getId(), e.getMessage());
            return fallback(event, ctx, timestamp, calculationId, e);
        }
    }

    /** Name-based id over the event fields that feed scoring, the context and the scoring policy. */
    public String calculationId(RiskEvent event, RiskContext context) {
        Map<String, Object> inputs = new LinkedHashMap<>();
        inputs.put("eventId", event.getId());
        inputs.put("fingerprint", event.getFingerprint());
        inputs.put("eventType", event.getEventType());
        inputs.put("severity", event.getSeverity());
        inputs.put("confidence", event.getConfidence());
        inputs.put("affectedEntities", event.getAffectedEntities());
        inputs.put("duplicateCount", event.getDuplicateCount());
        inputs.put("timestamp", scoreTimestamp(event));
        inputs.put("context", context != null ? context : RiskContext.empty());
        inputs.put("policy", properties.getScoring());
        return CanonicalJson.nameUuid(inputs).toString();
    }

    private ScoreBreakdown compute(RiskEvent event, RiskContext ctx, Instant timestamp, String calculationId) {
        ScoringConfig cfg = properties.getScoring();
        ScoreBreakdown.ScoreBreakdownBuilder breakdown = ScoreBreakdown.builder()
                .eventId(event.getId())
                .fingerprint(event.getFingerprint())
                .calculationId(calculationId)
                .timestamp(timestamp);

        double severityComponent = event.getSeverity() / 4.0 * 100.0 * cfg.getSeverityWeight();
        double base = severityComponent;
        Integer criticality = ctx.getAssetCriticality();
        if (criticality != null) {
            base += Math.max(0, Math.min(10, criticality)) / 10.0 * 100.0 * cfg.getCriticalityWeight();
        }
        base = clamp(base);
        breakdown.baseScore(base);

        if (criticality == null) {
            breakdown.adjustment(new ScoreAdjustment("asset_criticality", AdjustmentKind.INFORMATIONAL,
                    new TreeMap<>(Map.of("missing", "assetCriticality")), cfg.getCriticalityWeight(),
                    base, base, base, 0.0, 0.0, PassResult.DATA_UNAVAILABLE, null));
            breakdown.explanationEntry(ProcessingError.of(ErrorType.DATA_UNAVAILABLE, COMPONENT,
                    "asset_criticality: data unavailable, base score uses severity only", timestamp));
        }

        double current = base;
        double preClamp = base;
        for (ScoreAdjustmentPass pass : passes) {
            PassResult result = pass.apply(current, event, ctx);
            double raw = result.rawScoreAfter();
            if (Double.isNaN(raw) || Double.isInfinite(raw)) {
                throw new IllegalStateException(pass.factor() + " produced a non-finite score");
            }
            double after = clamp(raw);
            breakdown.adjustment(new ScoreAdjustment(pass.factor(), result.kind(), result.inputs(), result.weight(),
                    current, raw, after, after - current, raw - current, result.rationale(), result.dataSource()));
            if (result.dataUnavailable()) {
                breakdown.explanationEntry(ProcessingError.of(ErrorType.DATA_UNAVAILABLE, COMPONENT,
                        pass.factor() + ": data unavailable (" + result.inputs().get("missing") + ")", timestamp));
            }
            preClamp = raw;
            current = after;
        }

        ConfidenceCalculator.ConfidenceAssessment confidence = confidenceCalculator.assess(event, ctx);
        for (String note : confidence.notes()) {
            breakdown.explanationEntry(ProcessingError.of(ErrorType.DATA_UNAVAILABLE, COMPONENT + ".confidence", note, timestamp));
        }

        return breakdown
                .finalScore(current)
                .preClampScore(preClamp)
                .confidence(confidence.confidence())
                .riskLevel(riskLevel(current))
                .fallback(false)
                .build();
    }

    private ScoreBreakdown fallback(RiskEvent event, RiskContext ctx, Instant timestamp, String calculationId,
                                    RuntimeException failure) {
        double base = safeBaseScore(event, ctx);
        String message = failure.getClass().getSimpleName() + ": " + failure.getMessage();
        return ScoreBreakdown.builder()
                .eventId(event.getId())
                .fingerprint(event.getFingerprint())
                .calculationId(calculationId)
                .timestamp(timestamp)
                .baseScore(base)
                .adjustment(new ScoreAdjustment("computation_failure", AdjustmentKind.COMPUTATION_FAILURE,
                        new TreeMap<>(Map.of("error", message)), 0.0, base, base, base, 0.0, 0.0,
                        "scoring failed; base score only", null))
                .finalScore(base)
                .preClampScore(base)
                .confidence(properties.getScoring().getFallbackConfidence())
                .riskLevel(riskLevel(base))
                .explanationEntry(ProcessingError.of(ErrorType.COMPUTATION_FAILURE, COMPONENT, message, timestamp))
                .fallback(true)
                .build();
    }

    private double safeBaseScore(RiskEvent event, RiskContext ctx) {
        ScoringConfig cfg = properties.getScoring();
        double base = 0.0;
        if (event.getSeverity() != null) {
            base += event.getSeverity() / 4.0 * 100.0 * cfg.getSeverityWeight();
        }
        if (ctx.getAssetCriticality() != null) {
            base += Math.max(0, Math.min(10, ctx.getAssetCriticality())) / 10.0 * 100.0 * cfg.getCriticalityWeight();
        }
        return Double.isFinite(base) ? clamp(base) : 0.0;
    }

    public RiskLevel riskLevel(double score) {
        RiskBands bands = properties.getScoring().getBands();
        if (score >= bands.getCritical()) return RiskLevel.CRITICAL;
        if (score >= bands.getHigh()) return RiskLevel.HIGH;
        if (score >= bands.getMedium()) return RiskLevel.MEDIUM;
        return RiskLevel.LOW;
    }

    static Instant scoreTimestamp(RiskEvent event) {
        if (event.getLastSeenAt() != null) return event.getLastSeenAt();
        if (event.getDetectedAt() != null) return event.getDetectedAt();
        return event.getOccurredAt();
    }

    static double clamp(double score) {
        return Math.max(0.0, Math.min(100.0, score));
    }
}
