package com.example.riskintel.scoring;

import com.example.riskintel.config.RiskIntelProperties;
import com.example.riskintel.domain.RiskEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * The only place confidence touches the score: {@code x(1 - (1 - confidence/100) × weight)}.
 */
@Component
@Order(5)
@RequiredArgsConstructor
public class ConfidenceDiscountPass implements ScoreAdjustmentPass {

    private final RiskIntelProperties properties;
    private final ConfidenceCalculator confidenceCalculator;

    @Override
    public String factor() {
        return "confidence_discount";
    }

    @Override
    public PassResult apply(double scoreBefore, RiskEvent event, RiskContext context) {
        if (event.getConfidence() == null) {
            return PassResult.unavailable(scoreBefore, "confidence");
        }
        double confidence = confidenceCalculator.assess(event, context).confidence();
        double multiplier = 1.0 - (1.0 - confidence / 100.0) * properties.getScoring().getConfidenceDiscountWeight();
        return PassResult.multiplicative(scoreBefore, multiplier, Map.of("confidence", confidence),
                String.format("confidence %.1f: x%.3f", confidence, multiplier), "data-quality");
    }
}
