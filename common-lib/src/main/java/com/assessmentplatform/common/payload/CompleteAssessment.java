package com.assessmentplatform.common.payload;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Full cross-step payload used for completion validation and report generation. */
public record CompleteAssessment(
    @JsonProperty("assessmentData")   AssessmentData assessmentData,
    @JsonProperty("measurements")     TreeMeasurements measurements,
    @JsonProperty("safetyAssessment") SafetyAssessmentData safetyAssessment,
    @JsonProperty("calculatedScores") CalculatedScores calculatedScores
) {
    public record CalculatedScores(
        @JsonProperty("treeScore") int treeScore,
        @JsonProperty("riskScore") int riskScore
    ) {}
}
