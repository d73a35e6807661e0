package com.example.riskintel.scoring;

import com.example.riskintel.config.RiskIntelProperties;
import com.example.riskintel.domain.RiskEvent;
import com.example.riskintel.scoring.RiskContext.HistoricalPattern;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
@Order(3)
@RequiredArgsConstructor
public class HistoricalPatternPass implements ScoreAdjustmentPass {

    private final RiskIntelProperties properties;

    @Override
    public String factor() {
        return "historical_pattern";
    }

    @Override
    public PassResult apply(double scoreBefore, RiskEvent event, RiskContext context) {
        HistoricalPattern history = context.getHistory();
        if (history == null) {
            return PassResult.unavailable(scoreBefore, "history");
        }
        RiskIntelProperties.ScoringConfig cfg = properties.getScoring();
        double successRate = Math.max(0.0, Math.min(1.0, history.successRate()));
        Map<String, Object> inputs = Map.of("occurrences", history.occurrences(), "successRate", successRate);
        if (history.occurrences() < cfg.getHistoricalMinObservations()) {
            return PassResult.noChange(scoreBefore, inputs,
                    "insufficient history (" + history.occurrences() + " observations)", "analytics");
        }
        double multiplier = 1.0 + (successRate - 0.5) * cfg.getHistoricalSensitivity();
        return PassResult.multiplicative(scoreBefore, multiplier, inputs,
                String.format("%.0f%% of %d comparable events became incidents: x%.3f",
                        successRate * 100, history.occurrences(), multiplier),
                "analytics");
    }
}
