package com.churnguard.intervention.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Partial Sentinel configuration update. {@code null} fields are left unchanged;
 * {@code thresholds} is merged per key. Unrecognized keys are ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SentinelConfigUpdate(
    @JsonProperty("enabled")         Boolean             enabled,
    @JsonProperty("dryRun")          Boolean             dryRun,
    @JsonProperty("intervalMinutes") Integer             intervalMinutes,
    @JsonProperty("thresholds")      Map<String, Double> thresholds
) {}
