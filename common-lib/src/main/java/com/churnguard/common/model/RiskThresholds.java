package com.churnguard.common.model;

import com.churnguard.common.exception.InvalidConfigurationException;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Minimum churn probability for each intervention tier.
 *
 * <p>Valid thresholds satisfy {@code 0 < nudge < support < offer <= 1}; {@link #validate()}
 * enforces it. Construction itself does not validate so that a partially merged
 * candidate can be inspected before it is rejected.
 */
public record RiskThresholds(
    @JsonProperty("nudge")   double nudge,
    @JsonProperty("support") double support,
    @JsonProperty("offer")   double offer
) {

    public static final RiskThresholds DEFAULTS = new RiskThresholds(0.85, 0.90, 0.95);

    public double thresholdFor(InterventionAction action) {
        return switch (action) {
            case NUDGE   -> nudge;
            case SUPPORT -> support;
            case OFFER   -> offer;
        };
    }

    /**
     * Merges a partial update per key. Keys other than {@code nudge}, {@code support}
     * and {@code offer} are ignored, as are {@code null} values.
     */
    public RiskThresholds merge(Map<String, Double> partial) {
        if (partial == null || partial.isEmpty()) {
            return this;
        }
        return new RiskThresholds(
            valueOr(partial.get("nudge"), nudge),
            valueOr(partial.get("support"), support),
            valueOr(partial.get("offer"), offer));
    }

    /**
     * @return this instance, for chaining
     * @throws InvalidConfigurationException when a value leaves (0, 1] or the tiers are out of order
     */
    public RiskThresholds validate() {
        for (InterventionAction action : InterventionAction.values()) {
            double value = thresholdFor(action);
            if (Double.isNaN(value) || value <= 0.0 || value > 1.0) {
                throw new InvalidConfigurationException(
                    "threshold '" + action.dbValue() + "' must be in (0, 1], was " + value);
            }
        }
        if (!(nudge < support && support < offer)) {
            throw new InvalidConfigurationException(String.format(
                "thresholds must satisfy nudge < support < offer, was nudge=%s support=%s offer=%s",
                nudge, support, offer));
        }
        return this;
    }

    private static double valueOr(Double candidate, double fallback) {
        return candidate != null ? candidate : fallback;
    }
}
