package com.churnguard.intervention.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ApiError(
    @JsonProperty("error")   String error,
    @JsonProperty("message") String message
) {}
