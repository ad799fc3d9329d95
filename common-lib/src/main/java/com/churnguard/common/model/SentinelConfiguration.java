package com.churnguard.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Immutable snapshot of the Sentinel's runtime parameters and stats.
 *
 * <p>The live, mutable copy is owned by the configuration store in
 * {@code intervention-service}; everything else only ever sees snapshots.
 */
public record SentinelConfiguration(
    @JsonProperty("enabled")            boolean        enabled,
    @JsonProperty("dryRun")             boolean        dryRun,
    @JsonProperty("thresholds")         RiskThresholds thresholds,
    @JsonProperty("intervalMinutes")    int            intervalMinutes,
    @JsonProperty("chunkSize")          int            chunkSize,
    @JsonProperty("maxActionsPerRun")   int            maxActionsPerRun,
    @JsonProperty("cooldownHours")      int            cooldownHours,
    @JsonProperty("humanPriorityHours") int            humanPriorityHours,
    @JsonProperty("stats")              SentinelStats  stats
) {

    public SentinelConfiguration withEnabled(boolean value) {
        return new SentinelConfiguration(value, dryRun, thresholds, intervalMinutes, chunkSize,
            maxActionsPerRun, cooldownHours, humanPriorityHours, stats);
    }

    public SentinelConfiguration withDryRun(boolean value) {
        return new SentinelConfiguration(enabled, value, thresholds, intervalMinutes, chunkSize,
            maxActionsPerRun, cooldownHours, humanPriorityHours, stats);
    }

    public SentinelConfiguration withThresholds(RiskThresholds value) {
        return new SentinelConfiguration(enabled, dryRun, value, intervalMinutes, chunkSize,
            maxActionsPerRun, cooldownHours, humanPriorityHours, stats);
    }

    public SentinelConfiguration withIntervalMinutes(int value) {
        return new SentinelConfiguration(enabled, dryRun, thresholds, value, chunkSize,
            maxActionsPerRun, cooldownHours, humanPriorityHours, stats);
    }

    public SentinelConfiguration withStats(SentinelStats value) {
        return new SentinelConfiguration(enabled, dryRun, thresholds, intervalMinutes, chunkSize,
            maxActionsPerRun, cooldownHours, humanPriorityHours, value);
    }
}
