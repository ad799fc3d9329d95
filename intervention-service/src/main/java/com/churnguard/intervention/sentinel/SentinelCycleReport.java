package com.churnguard.intervention.sentinel;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * Outcome of one Sentinel cycle, returned by manual runs and logged by scheduled ones.
 *
 * @param executed    false when the Sentinel was disabled and the cycle was a no-op
 * @param fetchFailed the risk batch could not be fetched; no user was evaluated
 * @param actions     users acted upon, including dry-run actions
 * @param decisions   count per terminal state; absent states mean zero
 */
public record SentinelCycleReport(
    @JsonProperty("cycleId")     String                     cycleId,
    @JsonProperty("executed")    boolean                    executed,
    @JsonProperty("dryRun")      boolean                    dryRun,
    @JsonProperty("fetchFailed") boolean                    fetchFailed,
    @JsonProperty("candidates")  int                        candidates,
    @JsonProperty("actions")     int                        actions,
    @JsonProperty("decisions")   Map<UserDecision, Integer> decisions,
    @JsonProperty("startedAt")   Instant                    startedAt,
    @JsonProperty("finishedAt")  Instant                    finishedAt,
    @JsonProperty("nextRun")     Instant                    nextRun
) {

    public static SentinelCycleReport disabled(String cycleId, boolean dryRun, Instant now) {
        return new SentinelCycleReport(cycleId, false, dryRun, false, 0, 0, Map.of(), now, now, null);
    }

    public int count(UserDecision decision) {
        return decisions.getOrDefault(decision, 0);
    }
}
