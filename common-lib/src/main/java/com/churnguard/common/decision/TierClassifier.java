package com.churnguard.common.decision;

import com.churnguard.common.model.InterventionAction;
import com.churnguard.common.model.RiskThresholds;

import java.util.Optional;

/**
 * Maps a churn probability to the single highest intervention tier whose threshold
 * it meets.
 *
 * <pre>
 *   risk >= offer   -> OFFER
 *   risk >= support -> SUPPORT
 *   risk >= nudge   -> NUDGE
 *   otherwise       -> empty (never acted upon)
 * </pre>
 *
 * <p>Pure function. No Spring dependencies, no I/O.
 */
public final class TierClassifier {

    private TierClassifier() { /* utility class */ }

    /**
     * @param churnProbability risk score in [0, 1]; {@code NaN} is never classified
     * @param thresholds       validated tier thresholds
     * @return the highest tier met, or empty when the risk is below {@code nudge}
     */
    public static Optional<InterventionAction> classify(double churnProbability, RiskThresholds thresholds) {
        if (Double.isNaN(churnProbability)) {
            return Optional.empty();
        }
        if (churnProbability >= thresholds.offer())   return Optional.of(InterventionAction.OFFER);
        if (churnProbability >= thresholds.support()) return Optional.of(InterventionAction.SUPPORT);
        if (churnProbability >= thresholds.nudge())   return Optional.of(InterventionAction.NUDGE);
        return Optional.empty();
    }
}
