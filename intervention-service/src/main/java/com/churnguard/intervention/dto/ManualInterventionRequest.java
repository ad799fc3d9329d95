package com.churnguard.intervention.dto;

import com.churnguard.common.model.InterventionAction;
import com.churnguard.common.model.InterventionSource;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Body of {@code POST /api/v1/interventions}: an action taken by a person or an
 * external system. {@code source} defaults to {@code manual}; {@code sentinel} is
 * reserved for the Sentinel itself.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ManualInterventionRequest(
    @JsonProperty("userId")             String              userId,
    @JsonProperty("actionType")         String              actionType,
    @JsonProperty("source")             String              source,
    @JsonProperty("riskAtIntervention") Double              riskAtIntervention,
    @JsonProperty("metadata")           Map<String, Object> metadata
) {

    /**
     * @throws IllegalArgumentException when a required field is missing or a value is not allowed
     */
    public InterventionAction action() {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId and actionType are required");
        }
        if (actionType == null || actionType.isBlank()) {
            throw new IllegalArgumentException("userId and actionType are required");
        }
        return InterventionAction.fromValue(actionType);
    }

    /**
     * @throws IllegalArgumentException for {@code sentinel} or an unknown source
     */
    public InterventionSource resolvedSource() {
        if (source == null || source.isBlank()) {
            return InterventionSource.MANUAL;
        }
        InterventionSource resolved = InterventionSource.fromValue(source);
        if (resolved == InterventionSource.SENTINEL) {
            throw new IllegalArgumentException("source 'sentinel' is reserved for automated interventions");
        }
        return resolved;
    }

    /**
     * @throws IllegalArgumentException when the risk is outside [0, 1]
     */
    public Double validatedRisk() {
        if (riskAtIntervention != null
                && (riskAtIntervention.isNaN() || riskAtIntervention < 0.0 || riskAtIntervention > 1.0)) {
            throw new IllegalArgumentException("riskAtIntervention must be in [0, 1], was " + riskAtIntervention);
        }
        return riskAtIntervention;
    }
}
