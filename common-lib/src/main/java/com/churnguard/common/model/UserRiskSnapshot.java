package com.churnguard.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Current churn risk for one user as reported by the scoring service.
 * Read-only to the engine.
 */
public record UserRiskSnapshot(
    @JsonProperty("userId")           String  userId,
    @JsonProperty("churnProbability") double  churnProbability,
    @JsonProperty("isChurned")        boolean isChurned
) {

    /** Risk as a whole percentage, rounded half-up (0.934 -> 93). */
    public int riskPercent() {
        return (int) Math.round(churnProbability * 100);
    }
}
