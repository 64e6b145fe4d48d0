package com.assessmentplatform.common.payload;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record CompletionValidationResponse(
    @JsonProperty("confidence")  double confidence,
    @JsonProperty("isComplete")  boolean complete,
    @JsonProperty("missingData") List<String> missingData,
    @JsonProperty("nextActions") List<String> nextActions
) {
    public CompletionValidationResponse {
        missingData = missingData == null ? List.of() : List.copyOf(missingData);
        nextActions = nextActions == null ? List.of() : List.copyOf(nextActions);
    }
}
