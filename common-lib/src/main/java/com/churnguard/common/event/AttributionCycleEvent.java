package com.churnguard.common.event;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record AttributionCycleEvent(
    @JsonProperty("processed") int     processed,
    @JsonProperty("successes") int     successes,
    @JsonProperty("failures")  int     failures,
    @JsonProperty("timestamp") Instant timestamp
) implements EngineEvent {

    public static final String TYPE = "OPTIMIZER_UPDATE";

    @Override
    public String type() {
        return TYPE;
    }
}
