package com.assessmentplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-step snapshot handed to the field-assessor when it is asked to generate a form.
 *
 * <p>Owned by the step sequencer. Never mutated: every step change or classification
 * change produces a new instance through one of the {@code with*} copy-factories.
 */
public record AssessmentContext(
    @JsonProperty("currentStep")     AssessmentStep currentStep,
    @JsonProperty("previousData")    Map<String, Object> previousData,
    @JsonProperty("customerType")    String customerType,
    @JsonProperty("jobType")         String jobType,
    @JsonProperty("timeConstraints") TimeConstraints timeConstraints
) {

    public static final String DEFAULT_CUSTOMER_TYPE = "residential";
    public static final String DEFAULT_JOB_TYPE      = "tree-removal";

    public record TimeConstraints(
        @JsonProperty("urgent")        boolean urgent,
        @JsonProperty("scheduledDate") Instant scheduledDate
    ) {}

    public AssessmentContext {
        previousData = previousData == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(previousData));
    }

    public static AssessmentContext initial() {
        return new AssessmentContext(AssessmentStep.INITIALIZATION, Map.of(),
            DEFAULT_CUSTOMER_TYPE, DEFAULT_JOB_TYPE, new TimeConstraints(false, null));
    }

    public AssessmentContext withStep(AssessmentStep step) {
        return new AssessmentContext(step, previousData, customerType, jobType, timeConstraints);
    }

    public AssessmentContext withPreviousData(Map<String, Object> data) {
        return new AssessmentContext(currentStep, data, customerType, jobType, timeConstraints);
    }

    /**
     * Replaces the inferred customer/job classification. Blank values keep the
     * current classification.
     */
    public AssessmentContext withClassification(String newCustomerType, String newJobType) {
        String customer = newCustomerType == null || newCustomerType.isBlank() ? customerType : newCustomerType;
        String job      = newJobType == null || newJobType.isBlank() ? jobType : newJobType;
        if (customer.equals(customerType) && job.equals(jobType)) {
            return this;
        }
        return new AssessmentContext(currentStep, previousData, customer, job, timeConstraints);
    }
}
