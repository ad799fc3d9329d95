package com.churnguard.common.event;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One Sentinel action, real or simulated.
 *
 * @param action      classification label, e.g. {@code AUTO_SUPPORT}
 * @param riskPercent churn probability as a whole percentage
 * @param dryRun      true when nothing was persisted or sent
 */
public record SentinelActionEvent(
    @JsonProperty("userId")      String  userId,
    @JsonProperty("action")      String  action,
    @JsonProperty("riskPercent") int     riskPercent,
    @JsonProperty("dryRun")      boolean dryRun,
    @JsonProperty("timestamp")   Instant timestamp
) implements EngineEvent {

    public static final String TYPE = "SENTINEL_ACTION";

    @Override
    public String type() {
        return TYPE;
    }
}
