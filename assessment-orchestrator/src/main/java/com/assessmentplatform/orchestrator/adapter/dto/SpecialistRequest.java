package com.assessmentplatform.orchestrator.adapter.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * Envelope posted to every decision service. {@code data} always carries
 * {@code requestType} plus one payload entry.
 */
public record SpecialistRequest(
    @JsonProperty("agentType") String agentType,
    @JsonProperty("requestId") String requestId,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("data")      Map<String, Object> data
) {}
