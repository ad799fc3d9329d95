package com.churnguard.common.event;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * End-of-cycle summary. Failure counters are reported next to the action count so
 * that a degraded cycle is visible and not just quiet.
 */
public record SentinelStatusEvent(
    @JsonProperty("lastRun")          Instant lastRun,
    @JsonProperty("actionsThisCycle") int     actionsThisCycle,
    @JsonProperty("dryRun")           boolean dryRun,
    @JsonProperty("fetchFailed")      boolean fetchFailed,
    @JsonProperty("persistFailures")  int     persistFailures,
    @JsonProperty("gateFailures")     int     gateFailures
) implements EngineEvent {

    public static final String TYPE = "SENTINEL_STATUS";

    @Override
    public String type() {
        return TYPE;
    }
}
