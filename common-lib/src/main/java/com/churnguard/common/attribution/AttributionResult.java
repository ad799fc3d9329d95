package com.churnguard.common.attribution;

import com.churnguard.common.model.InterventionOutcome;

/**
 * Verdict for one intervention plus the numbers it was derived from.
 *
 * @param outcome     {@code PENDING} when there is not enough signal yet
 * @param riskDelta   {@code currentRisk - riskAtIntervention}; negative means improvement
 * @param currentRisk churn probability observed at attribution time
 */
public record AttributionResult(
    InterventionOutcome outcome,
    double              riskDelta,
    double              currentRisk
) {

    public boolean isTerminal() {
        return outcome.isTerminal();
    }
}
