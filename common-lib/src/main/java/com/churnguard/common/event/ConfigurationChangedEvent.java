package com.churnguard.common.event;

import com.churnguard.common.model.SentinelConfiguration;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Full configuration snapshot, sent after every accepted update. */
public record ConfigurationChangedEvent(
    @JsonProperty("sentinel") SentinelConfiguration sentinel
) implements EngineEvent {

    public static final String TYPE = "SENTINEL_CONFIG";

    @Override
    public String type() {
        return TYPE;
    }
}
