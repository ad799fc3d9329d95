package com.churnguard.intervention.client.dto;

import com.churnguard.common.model.UserRiskSnapshot;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One user as returned by the scoring service. Only the fields the engine reads are
 * mapped; the service also sends demographics and feature values.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UserRiskPayload(
    @JsonProperty("user_id")           String  userId,
    @JsonProperty("churn_probability") Double  churnProbability,
    @JsonProperty("is_churned")        Boolean isChurned
) {

    /** Missing probability is read as {@code NaN}, which is never classified into a tier. */
    public UserRiskSnapshot toSnapshot() {
        return new UserRiskSnapshot(
            userId,
            churnProbability != null ? churnProbability : Double.NaN,
            Boolean.TRUE.equals(isChurned));
    }
}
