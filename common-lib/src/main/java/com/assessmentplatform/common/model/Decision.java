package com.assessmentplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Audit entry written each time the sequencer accepts a next-step response.
 * Read for history only; nothing in the control flow consults it.
 */
public record Decision(
    @JsonProperty("timestamp")  Instant timestamp,
    @JsonProperty("specialist") String specialist,
    @JsonProperty("decision")   String decision,
    @JsonProperty("reasoning")  String reasoning,
    @JsonProperty("confidence") double confidence
) {}
