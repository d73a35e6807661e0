package com.example.riskintel.scoring;

import com.example.riskintel.domain.RiskEvent;

/**
 * One sequential adjustment applied after the base score. Each pass yields exactly one
 * audit entry. Passes run in {@link org.springframework.core.annotation.Order} order.
 */
public interface ScoreAdjustmentPass {

    String factor();

    PassResult apply(double scoreBefore, RiskEvent event, RiskContext context);
}
