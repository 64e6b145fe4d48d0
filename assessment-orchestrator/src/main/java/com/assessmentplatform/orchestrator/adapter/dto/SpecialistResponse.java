package com.assessmentplatform.orchestrator.adapter.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Envelope returned by every decision service. {@code data} stays untyped until the
 * transport knows which response record the caller expects.
 */
public record SpecialistResponse(
    @JsonProperty("success")  boolean success,
    @JsonProperty("data")     JsonNode data,
    @JsonProperty("error")    ErrorInfo error,
    @JsonProperty("metadata") Metadata metadata
) {

    public record ErrorInfo(
        @JsonProperty("code")    String code,
        @JsonProperty("message") String message,
        @JsonProperty("details") Map<String, Object> details
    ) {}

    public record Metadata(
        @JsonProperty("agentId")        String agentId,
        @JsonProperty("agentVersion")   String agentVersion,
        @JsonProperty("processingTime") double processingTime,
        @JsonProperty("requestId")      String requestId
    ) {}
}
