package com.churnguard.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One action taken against a user, by a human, the Sentinel or an API caller.
 *
 * <ul>
 *   <li>{@code id}, {@code createdAt} – assigned once at creation, never change.</li>
 *   <li>{@code riskAtIntervention} – churn probability snapshotted at decision time;
 *       {@code null} when the initiator did not know it.</li>
 *   <li>{@code outcome}, {@code riskDelta}, {@code currentRisk}, {@code attributedAt} –
 *       written together by the Optimizer when the outcome becomes terminal;
 *       {@code attributedAt} is non-null iff {@code outcome} is terminal.</li>
 * </ul>
 */
public record InterventionRecord(
    @JsonProperty("id")                 Long                id,
    @JsonProperty("userId")             String              userId,
    @JsonProperty("actionType")         InterventionAction  actionType,
    @JsonProperty("source")             InterventionSource  source,
    @JsonProperty("status")             InterventionStatus  status,
    @JsonProperty("createdAt")          Instant             createdAt,
    @JsonProperty("completedAt")        Instant             completedAt,
    @JsonProperty("riskAtIntervention") Double              riskAtIntervention,
    @JsonProperty("outcome")            InterventionOutcome outcome,
    @JsonProperty("riskDelta")          Double              riskDelta,
    @JsonProperty("currentRisk")        Double              currentRisk,
    @JsonProperty("attributedAt")       Instant             attributedAt,
    @JsonProperty("metadata")           Map<String, Object> metadata
) {

    public InterventionRecord {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * A completed, not-yet-attributed record as written by every initiator.
     * The id is left {@code null} for the ledger to assign.
     */
    public static InterventionRecord completed(String userId,
                                               InterventionAction actionType,
                                               InterventionSource source,
                                               Instant now,
                                               Double riskAtIntervention,
                                               Map<String, Object> metadata) {
        return new InterventionRecord(null, userId, actionType, source,
            InterventionStatus.COMPLETED, now, now, riskAtIntervention,
            InterventionOutcome.PENDING, null, null, null, metadata);
    }

    public InterventionRecord withId(Long newId) {
        return new InterventionRecord(newId, userId, actionType, source, status, createdAt,
            completedAt, riskAtIntervention, outcome, riskDelta, currentRisk, attributedAt, metadata);
    }

    public boolean isAttributed() {
        return outcome != null && outcome.isTerminal();
    }
}
