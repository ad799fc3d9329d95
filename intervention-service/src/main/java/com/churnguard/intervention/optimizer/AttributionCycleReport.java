package com.churnguard.intervention.optimizer;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Outcome of one attribution cycle.
 *
 * @param aborted   the pending-window query failed; nothing was evaluated
 * @param selected  pending records found in the window
 * @param processed records evaluated against a current risk score
 *                  ({@code successes + failures + stillPending})
 */
public record AttributionCycleReport(
    @JsonProperty("cycleId")       String  cycleId,
    @JsonProperty("aborted")       boolean aborted,
    @JsonProperty("selected")      int     selected,
    @JsonProperty("processed")     int     processed,
    @JsonProperty("successes")     int     successes,
    @JsonProperty("failures")      int     failures,
    @JsonProperty("stillPending")  int     stillPending,
    @JsonProperty("skipped")       int     skipped,
    @JsonProperty("writeFailures") int     writeFailures,
    @JsonProperty("windowStart")   Instant windowStart,
    @JsonProperty("windowEnd")     Instant windowEnd,
    @JsonProperty("finishedAt")    Instant finishedAt
) {}
