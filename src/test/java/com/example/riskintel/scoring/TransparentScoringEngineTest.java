package com.example.riskintel.scoring;

import com.example.riskintel.config.RiskIntelProperties;
import com.example.riskintel.domain.ErrorType;
import com.example.riskintel.domain.RiskEvent;
import com.example.riskintel.domain.RiskLevel;
import com.example.riskintel.scoring.RiskContext.DataQuality;
import com.example.riskintel.scoring.RiskContext.EnvironmentalContext;
import com.example.riskintel.scoring.RiskContext.HistoricalPattern;
import com.example.riskintel.scoring.RiskContext.ThreatIntelSignal;
import com.example.riskintel.support.TestEvents;
import com.example.riskintel.util.CanonicalJson;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TransparentScoringEngineTest {

    private static final double EPS = 1e-9;

    private RiskIntelProperties properties;
    private ConfidenceCalculator confidenceCalculator;
    private TransparentScoringEngine engine;

    @BeforeEach
    void setUp() {
        properties = new RiskIntelProperties();
        confidenceCalculator = new ConfidenceCalculator();
        engine = new TransparentScoringEngine(properties, standardPasses(), confidenceCalculator);
    }

    private List<ScoreAdjustmentPass> standardPasses() {
        // deliberately out of order: the engine sorts by @Order
        return List.of(
                new ConfidenceDiscountPass(properties, confidenceCalculator),
                new KnownExploitedPass(properties),
                new EnvironmentalContextPass(properties),
                new ThreatIntelPass(properties),
                new HistoricalPatternPass(properties));
    }

    @Test
    void exploitedCriticalEventOnCriticalAssetScoresAbove80() {
        RiskContext context = RiskContext.builder().assetCriticality(10).knownExploited(true).build();

        ScoreBreakdown breakdown = engine.score(TestEvents.scored(4, 95), context);

        assertEquals(100.0, breakdown.getBaseScore(), EPS);
        assertTrue(breakdown.getFinalScore() > 80);
        assertEquals(99.0, breakdown.getFinalScore(), EPS);
        assertEquals(RiskLevel.CRITICAL, breakdown.getRiskLevel());

        ScoreAdjustment exploited = breakdown.getAdjustments().get(0);
        assertEquals("known_exploited", exploited.factor());
        assertEquals(120.0, exploited.rawScoreAfter(), EPS);
        assertEquals(100.0, exploited.scoreAfter(), EPS);
        assertEquals(20.0, exploited.rawContribution(), EPS);
        assertEquals(0.0, exploited.contribution(), EPS);
    }

    @Test
    void passesRunInFixedOrderWithOneEntryEach() {
        ScoreBreakdown breakdown = engine.score(TestEvents.scored(3, 80),
                RiskContext.builder().assetCriticality(5).build());

        List<String> factors = breakdown.getAdjustments().stream().map(ScoreAdjustment::factor).toList();
        assertEquals(List.of("known_exploited", "threat_intel_correlation", "historical_pattern",
                "environmental_context", "confidence_discount"), factors);
    }

    @Test
    void missingThreatIntelIsAuditedAsDataUnavailable() {
        RiskContext context = RiskContext.builder()
                .assetCriticality(5)
                .knownExploited(false)
                .history(new HistoricalPattern(10, 0.8))
                .environment(new EnvironmentalContext(true, true, 0))
                .build();

        ScoreBreakdown breakdown = engine.score(TestEvents.scored(3, 80), context);

        ScoreAdjustment threatIntel = breakdown.getAdjustments().stream()
                .filter(a -> a.factor().equals("threat_intel_correlation"))
                .findFirst()
                .orElseThrow();
        assertEquals("data unavailable", threatIntel.rationale());
        assertEquals(0.0, threatIntel.contribution(), EPS);
        assertEquals(AdjustmentKind.INFORMATIONAL, threatIntel.kind());
        assertTrue(breakdown.getExplanation().stream()
                .anyMatch(e -> e.type() == ErrorType.DATA_UNAVAILABLE && e.message().startsWith("threat_intel_correlation")));

        // base 45 + 20, history x1.12, internet-facing x1.15, confidence 80 -> x0.96
        assertEquals(65.0 * 1.12 * 1.15 * 0.96, breakdown.getFinalScore(), EPS);
    }

    @Test
    void missingCriticalityLeavesSeverityOnlyBase() {
        ScoreBreakdown breakdown = engine.score(TestEvents.scored(4, 100), RiskContext.empty());

        assertEquals(60.0, breakdown.getBaseScore(), EPS);
        ScoreAdjustment first = breakdown.getAdjustments().get(0);
        assertEquals("asset_criticality", first.factor());
        assertEquals("data unavailable", first.rationale());
    }

    @Test
    void identicalInputsGiveIdenticalBreakdowns() {
        RiskContext context = RiskContext.builder()
                .assetCriticality(7)
                .knownExploited(true)
                .threatIntel(new ThreatIntelSignal(2, 3))
                .history(new HistoricalPattern(12, 0.25))
                .environment(new EnvironmentalContext(true, false, 2))
                .dataQuality(new DataQuality(0.9, 0.8))
                .build();
        RiskEvent event = TestEvents.scored(3, 70);

        ScoreBreakdown first = engine.score(event, context);
        ScoreBreakdown second = engine.score(event, context);

        assertEquals(first, second);
        assertEquals(CanonicalJson.write(first), CanonicalJson.write(second));
        assertEquals(event.getLastSeenAt(), first.getTimestamp());
    }

    @Test
    void calculationIdChangesWithInputs() {
        RiskContext context = RiskContext.builder().assetCriticality(7).build();
        String a = engine.score(TestEvents.scored(3, 70), context).getCalculationId();
        String b = engine.score(TestEvents.scored(3, 71), context).getCalculationId();
        String c = engine.score(TestEvents.scored(3, 70), context.withAssetCriticality(8)).getCalculationId();

        assertNotEquals(a, b);
        assertNotEquals(a, c);
    }

    @Test
    void scoreStaysWithinBoundsWithEveryMultiplierAtMaximum() {
        RiskContext context = RiskContext.builder()
                .assetCriticality(10)
                .knownExploited(true)
                .threatIntel(new ThreatIntelSignal(1000, 4))
                .history(new HistoricalPattern(1000, 1.0))
                .environment(new EnvironmentalContext(true, true, 0))
                .dataQuality(new DataQuality(1.0, 1.0))
                .build();

        ScoreBreakdown breakdown = engine.score(TestEvents.scored(4, 100), context);

        assertEquals(100.0, breakdown.getFinalScore(), EPS);
        for (ScoreAdjustment adjustment : breakdown.getAdjustments()) {
            assertTrue(adjustment.scoreAfter() >= 0.0 && adjustment.scoreAfter() <= 100.0);
        }
        ScoreAdjustment threatIntel = breakdown.getAdjustments().get(1);
        assertEquals(25.0, threatIntel.weight(), EPS);
    }

    @Test
    void scoreStaysWithinBoundsWithEveryDiscountAtMaximum() {
        RiskContext context = RiskContext.builder()
                .assetCriticality(1)
                .knownExploited(false)
                .threatIntel(new ThreatIntelSignal(0, 0))
                .history(new HistoricalPattern(50, 0.0))
                .environment(new EnvironmentalContext(false, false, 40))
                .dataQuality(new DataQuality(0.0, 0.0))
                .build();

        ScoreBreakdown breakdown = engine.score(TestEvents.scored(1, 0), context);

        assertTrue(breakdown.getFinalScore() >= 0.0);
        assertTrue(breakdown.getFinalScore() < breakdown.getBaseScore());
        assertEquals(0.0, breakdown.getConfidence(), EPS);
        assertEquals(RiskLevel.LOW, breakdown.getRiskLevel());
    }

    @Test
    void contributionsReconstructTheFinalScore() {
        RiskContext context = RiskContext.builder()
                .assetCriticality(9)
                .knownExploited(true)
                .threatIntel(new ThreatIntelSignal(3, 4))
                .history(new HistoricalPattern(20, 0.9))
                .environment(new EnvironmentalContext(true, true, 1))
                .build();

        ScoreBreakdown breakdown = engine.score(TestEvents.scored(4, 60), context);
        List<ScoreAdjustment> adjustments = breakdown.getAdjustments();

        double total = breakdown.getBaseScore();
        double previous = breakdown.getBaseScore();
        for (ScoreAdjustment adjustment : adjustments) {
            assertEquals(previous, adjustment.scoreBefore(), EPS);
            total += adjustment.contribution();
            previous = adjustment.scoreAfter();
        }
        assertEquals(breakdown.getFinalScore(), total, EPS);

        ScoreAdjustment last = adjustments.get(adjustments.size() - 1);
        assertEquals(breakdown.getPreClampScore(), last.scoreBefore() + last.rawContribution(), EPS);
    }

    @Test
    void insufficientHistoryLeavesScoreUnchanged() {
        ScoreBreakdown breakdown = engine.score(TestEvents.scored(2, 100),
                RiskContext.builder().assetCriticality(5).history(new HistoricalPattern(2, 1.0)).build());

        ScoreAdjustment history = breakdown.getAdjustments().get(2);
        assertEquals("historical_pattern", history.factor());
        assertTrue(history.rationale().startsWith("insufficient history"));
        assertEquals(0.0, history.contribution(), EPS);
    }

    @Test
    void compensatingControlDiscountIsCapped() {
        ScoreBreakdown breakdown = engine.score(TestEvents.scored(2, 100),
                RiskContext.builder().assetCriticality(5).environment(new EnvironmentalContext(false, true, 20)).build());

        ScoreAdjustment environment = breakdown.getAdjustments().get(3);
        assertEquals(0.7, environment.weight(), EPS);
    }

    @Test
    void confidenceUsesDataQualityAndReportsMissingIndicators() {
        ScoreBreakdown withQuality = engine.score(TestEvents.scored(2, 80),
                RiskContext.builder().dataQuality(new DataQuality(0.5, null)).build());

        assertEquals(40.0, withQuality.getConfidence(), EPS);
        assertTrue(withQuality.getExplanation().stream().anyMatch(e -> e.message().equals("completeness unavailable")));
    }

    @Test
    void unexpectedFailureFallsBackToBaseScore() {
        ScoreAdjustmentPass broken = new ScoreAdjustmentPass() {
            @Override
            public String factor() {
                return "broken";
            }

            @Override
            public PassResult apply(double scoreBefore, RiskEvent event, RiskContext context) {
                throw new IllegalStateException("feed returned garbage");
            }
        };
        List<ScoreAdjustmentPass> passes = new ArrayList<>(standardPasses());
        passes.add(broken);
        TransparentScoringEngine fragile = new TransparentScoringEngine(properties, passes, confidenceCalculator);

        ScoreBreakdown breakdown = fragile.score(TestEvents.scored(4, 90),
                RiskContext.builder().assetCriticality(10).build());

        assertTrue(breakdown.isFallback());
        assertEquals(100.0, breakdown.getFinalScore(), EPS);
        assertEquals(30.0, breakdown.getConfidence(), EPS);
        assertEquals(1, breakdown.getAdjustments().size());
        assertEquals(AdjustmentKind.COMPUTATION_FAILURE, breakdown.getAdjustments().get(0).kind());
        assertEquals(ErrorType.COMPUTATION_FAILURE, breakdown.getExplanation().get(0).type());
    }

    @Test
    void riskLevelBands() {
        assertEquals(RiskLevel.CRITICAL, engine.riskLevel(85.0));
        assertEquals(RiskLevel.HIGH, engine.riskLevel(84.9));
        assertEquals(RiskLevel.HIGH, engine.riskLevel(65.0));
        assertEquals(RiskLevel.MEDIUM, engine.riskLevel(40.0));
        assertEquals(RiskLevel.LOW, engine.riskLevel(39.9));
    }
}
