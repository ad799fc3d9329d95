package com.churnguard.intervention.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RiskBatchResponse(
    @JsonProperty("users") List<UserRiskPayload> users
) {}
