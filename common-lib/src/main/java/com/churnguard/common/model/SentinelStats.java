package com.churnguard.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Run bookkeeping kept next to the Sentinel configuration.
 * {@code actionsToday} counts real (non-dry-run) actions since {@code lastResetDate}.
 */
public record SentinelStats(
    @JsonProperty("lastRun")       Instant   lastRun,
    @JsonProperty("nextRun")       Instant   nextRun,
    @JsonProperty("actionsToday")  int       actionsToday,
    @JsonProperty("lastResetDate") LocalDate lastResetDate
) {

    public static SentinelStats fresh(LocalDate today) {
        return new SentinelStats(null, null, 0, today);
    }
}
