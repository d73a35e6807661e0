package com.example.riskintel.scoring;

import com.example.riskintel.config.RiskIntelProperties;
import com.example.riskintel.domain.RiskEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
@Order(1)
@RequiredArgsConstructor
public class KnownExploitedPass implements ScoreAdjustmentPass {

    private final RiskIntelProperties properties;

    @Override
    public String factor() {
        return "known_exploited";
    }

    @Override
    public PassResult apply(double scoreBefore, RiskEvent event, RiskContext context) {
        Boolean exploited = context.getKnownExploited();
        if (exploited == null) {
            return PassResult.unavailable(scoreBefore, "knownExploited");
        }
        if (!exploited) {
            return PassResult.noChange(scoreBefore, Map.of("knownExploited", false),
                    "not on a known-exploited list", "known-exploited-catalog");
        }
        double bonus = properties.getScoring().getKnownExploitedBonus();
        return PassResult.additive(scoreBefore, bonus, Map.of("knownExploited", true),
                String.format("actively exploited in the wild: +%.1f", bonus), "known-exploited-catalog");
    }
}
