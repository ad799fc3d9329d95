package com.churnguard.intervention.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Attribution results for one action type.
 *
 * @param successRate whole percentage of {@code successes / total}, 0 when nothing is attributed
 */
public record EfficacyDTO(
    @JsonProperty("action")      String action,
    @JsonProperty("total")       int    total,
    @JsonProperty("successes")   int    successes,
    @JsonProperty("failures")    int    failures,
    @JsonProperty("successRate") int    successRate
) {}
