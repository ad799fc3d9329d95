package com.churnguard.common.attribution;

import com.churnguard.common.model.InterventionOutcome;
import com.churnguard.common.model.UserRiskSnapshot;

/**
 * Decides whether a past intervention worked, from the risk it was taken at and the
 * user's current risk.
 *
 * <h3>Rules (first match wins)</h3>
 * <ol>
 *   <li>user has churned -> {@link InterventionOutcome#FAILURE}, whatever the delta</li>
 *   <li>risk delta at or below {@value #SUCCESS_DELTA} (a drop of 20 points or more) -> {@link InterventionOutcome#SUCCESS}</li>
 *   <li>otherwise -> {@link InterventionOutcome#PENDING}</li>
 * </ol>
 *
 * <p>A missing original snapshot is read as {@value #DEFAULT_RISK_AT_INTERVENTION}.
 * Pure function.
 */
public final class OutcomeClassifier {

    public static final double DEFAULT_RISK_AT_INTERVENTION = 0.5;

    public static final double SUCCESS_DELTA = -0.20;

    /** Absorbs binary rounding so that an exact 20-point drop (0.70 -> 0.50) counts. */
    private static final double EPSILON = 1e-9;

    private OutcomeClassifier() { /* utility class */ }

    public static AttributionResult evaluate(Double riskAtIntervention, UserRiskSnapshot current) {
        double baseline = riskAtIntervention != null ? riskAtIntervention : DEFAULT_RISK_AT_INTERVENTION;
        double currentRisk = current.churnProbability();
        double riskDelta = currentRisk - baseline;

        InterventionOutcome outcome;
        if (current.isChurned()) {
            outcome = InterventionOutcome.FAILURE;
        } else if (riskDelta <= SUCCESS_DELTA + EPSILON) {
            outcome = InterventionOutcome.SUCCESS;
        } else {
            outcome = InterventionOutcome.PENDING;
        }
        return new AttributionResult(outcome, riskDelta, currentRisk);
    }
}
