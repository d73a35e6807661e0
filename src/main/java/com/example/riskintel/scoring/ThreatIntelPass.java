package com.example.riskintel.scoring;

import com.example.riskintel.config.RiskIntelProperties;
import com.example.riskintel.domain.RiskEvent;
import com.example.riskintel.scoring.RiskContext.ThreatIntelSignal;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Additive boost of {@code matches × maxSeverity/4 × perMatch}, capped.
 */
@Component
@Order(2)
@RequiredArgsConstructor
public class ThreatIntelPass implements ScoreAdjustmentPass {

    private final RiskIntelProperties properties;

    @Override
    public String factor() {
        return "threat_intel_correlation";
    }

    @Override
    public PassResult apply(double scoreBefore, RiskEvent event, RiskContext context) {
        ThreatIntelSignal signal = context.getThreatIntel();
        if (signal == null) {
            return PassResult.unavailable(scoreBefore, "threatIntel");
        }
        int matches = Math.max(0, signal.matchCount());
        int maxSeverity = Math.max(0, Math.min(4, signal.maxSeverity()));
        Map<String, Object> inputs = Map.of("matchCount", matches, "maxSeverity", maxSeverity);
        if (matches == 0) {
            return PassResult.noChange(scoreBefore, inputs, "no threat-intel matches", "threat-intel");
        }
        RiskIntelProperties.ScoringConfig cfg = properties.getScoring();
        double boost = Math.min(cfg.getThreatIntelCap(), matches * (maxSeverity / 4.0) * cfg.getThreatIntelPerMatch());
        return PassResult.additive(scoreBefore, boost, inputs,
                String.format("%d threat-intel matches, max severity %d: +%.2f", matches, maxSeverity, boost),
                "threat-intel");
    }
}
