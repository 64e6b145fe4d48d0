package com.assessmentplatform.common.payload;

import com.assessmentplatform.common.model.RiskFactor;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Current-assessment payload sent to the field-assessor with every next-step request.
 */
public record AssessmentData(
    @JsonProperty("customerInfo")   CustomerInfo customerInfo,
    @JsonProperty("property")       PropertyInfo property,
    @JsonProperty("trees")          List<TreeData> trees,
    @JsonProperty("currentStep")    String currentStep,
    @JsonProperty("completedSteps") List<String> completedSteps
) {

    public record CustomerInfo(
        @JsonProperty("name")    String name,
        @JsonProperty("email")   String email,
        @JsonProperty("phone")   String phone,
        @JsonProperty("address") String address
    ) {}

    public record PropertyInfo(
        @JsonProperty("address")       String address,
        @JsonProperty("type")          String type,
        @JsonProperty("accessibility") AccessibilityRating accessibility
    ) {}

    /** {@code measurements} is null until a height has been recorded. */
    public record TreeData(
        @JsonProperty("id")           String id,
        @JsonProperty("species")      String species,
        @JsonProperty("measurements") TreeMeasurements measurements,
        @JsonProperty("condition")    String condition,
        @JsonProperty("riskFactors")  List<RiskFactor> riskFactors
    ) {}
}
