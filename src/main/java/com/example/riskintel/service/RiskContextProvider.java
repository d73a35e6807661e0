package com.example.riskintel.service;

import com.example.riskintel.domain.RiskEvent;
import com.example.riskintel.scoring.RiskContext;

/**
 * Source of historical and environmental signals for scoring, fed by the analytics collaborator.
 */
public interface RiskContextProvider {

    RiskContext contextFor(RiskEvent event);
}
