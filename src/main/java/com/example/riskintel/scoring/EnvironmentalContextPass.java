package com.example.riskintel.scoring;

import com.example.riskintel.config.RiskIntelProperties;
import com.example.riskintel.domain.RiskEvent;
import com.example.riskintel.scoring.RiskContext.EnvironmentalContext;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Exposure and compensating controls. Internet-facing raises the score, non-production
 * lowers it, and each compensating control takes a few percent off up to a cap.
 */
@Component
@Order(4)
@RequiredArgsConstructor
public class EnvironmentalContextPass implements ScoreAdjustmentPass {

    private static final String UNKNOWN = "unknown";

    private final RiskIntelProperties properties;

    @Override
    public String factor() {
        return "environmental_context";
    }

    @Override
    public PassResult apply(double scoreBefore, RiskEvent event, RiskContext context) {
        EnvironmentalContext env = context.getEnvironment();
        if (env == null || (env.internetFacing() == null && env.production() == null && env.compensatingControls() == null)) {
            return PassResult.unavailable(scoreBefore, "environment");
        }
        RiskIntelProperties.ScoringConfig cfg = properties.getScoring();
        Map<String, Object> inputs = new TreeMap<>();
        List<String> reasons = new ArrayList<>();
        double multiplier = 1.0;

        if (env.internetFacing() == null) {
            inputs.put("internetFacing", UNKNOWN);
        } else {
            inputs.put("internetFacing", env.internetFacing());
            if (env.internetFacing()) {
                multiplier *= cfg.getInternetFacingMultiplier();
                reasons.add("internet-facing x" + cfg.getInternetFacingMultiplier());
            }
        }

        if (env.production() == null) {
            inputs.put("production", UNKNOWN);
        } else {
            inputs.put("production", env.production());
            if (!env.production()) {
                multiplier *= cfg.getNonProductionMultiplier();
                reasons.add("non-production x" + cfg.getNonProductionMultiplier());
            }
        }

        if (env.compensatingControls() == null) {
            inputs.put("compensatingControls", UNKNOWN);
        } else {
            int controls = Math.max(0, env.compensatingControls());
            inputs.put("compensatingControls", controls);
            double discount = Math.min(cfg.getControlDiscountCap(), controls * cfg.getControlDiscountPerControl());
            if (discount > 0) {
                multiplier *= 1.0 - discount;
                reasons.add(String.format("%d compensating controls -%.0f%%", controls, discount * 100));
            }
        }

        String rationale = reasons.isEmpty() ? "no environmental modifiers apply" : String.join(", ", reasons);
        return PassResult.multiplicative(scoreBefore, multiplier, inputs, rationale, "environment");
    }
}
