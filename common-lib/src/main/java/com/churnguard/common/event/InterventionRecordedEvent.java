package com.churnguard.common.event;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/** A manual or API intervention was written to the ledger. */
public record InterventionRecordedEvent(
    @JsonProperty("userId")         String  userId,
    @JsonProperty("actionType")     String  actionType,
    @JsonProperty("source")         String  source,
    @JsonProperty("interventionId") Long    interventionId,
    @JsonProperty("timestamp")      Instant timestamp
) implements EngineEvent {

    public static final String TYPE = "INTERVENTION_RECORDED";

    @Override
    public String type() {
        return TYPE;
    }
}
