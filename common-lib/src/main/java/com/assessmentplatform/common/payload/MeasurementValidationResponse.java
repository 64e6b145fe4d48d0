package com.assessmentplatform.common.payload;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record MeasurementValidationResponse(
    @JsonProperty("confidence")   double confidence,
    @JsonProperty("isValid")      boolean valid,
    @JsonProperty("accuracy")     double accuracy,
    @JsonProperty("improvements") List<String> improvements
) {
    public MeasurementValidationResponse {
        improvements = improvements == null ? List.of() : List.copyOf(improvements);
    }
}
