package com.assessmentplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Read-only view of a session, emitted after every transition and returned by every
 * operation. Presentation layers poll or subscribe to these instead of binding to
 * live session fields.
 *
 * <p>{@code progress} is always {@code currentStep.progress()}.
 */
public record AssessmentSnapshot(
    @JsonProperty("sessionId")           String sessionId,
    @JsonProperty("currentStep")         AssessmentStep currentStep,
    @JsonProperty("progress")            double progress,
    @JsonProperty("complete")            boolean complete,
    @JsonProperty("readyForCompletion")  boolean readyForCompletion,
    @JsonProperty("navigating")          boolean navigating,
    @JsonProperty("captureActive")       boolean captureActive,
    @JsonProperty("formData")            FormData formData,
    @JsonProperty("dynamicFormFields")   List<DynamicFormField> dynamicFormFields,
    @JsonProperty("currentInstructions") String currentInstructions,
    @JsonProperty("realTimeGuidance")    String realTimeGuidance,
    @JsonProperty("safetyProtocols")     List<SafetyProtocol> safetyProtocols,
    @JsonProperty("validationErrors")    List<String> validationErrors,
    @JsonProperty("recommendations")     List<Recommendation> recommendations,
    @JsonProperty("decisionCount")       int decisionCount
) {}
