package com.assessmentplatform.common.payload;

import com.assessmentplatform.common.model.AssessmentStep;
import com.assessmentplatform.common.model.DynamicFormField;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Field-assessor answer to "what next". {@code customerType} and {@code jobType} are
 * optional and, when present, replace the session's inferred classification.
 */
public record NextStepResponse(
    @JsonProperty("confidence")        double confidence,
    @JsonProperty("nextStep")          AssessmentStep nextStep,
    @JsonProperty("formConfiguration") FormConfiguration formConfiguration,
    @JsonProperty("instructions")      String instructions,
    @JsonProperty("estimatedDuration") double estimatedDuration,
    @JsonProperty("customerType")      String customerType,
    @JsonProperty("jobType")           String jobType
) {

    public record FormConfiguration(
        @JsonProperty("fields") List<DynamicFormField> fields
    ) {
        public FormConfiguration {
            fields = fields == null ? List.of() : List.copyOf(fields);
        }
    }

    public List<DynamicFormField> fields() {
        return formConfiguration == null ? List.of() : formConfiguration.fields();
    }
}
