package com.assessmentplatform.common.payload;

import com.assessmentplatform.common.model.DynamicFormField;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record DynamicFormResponse(
    @JsonProperty("confidence") double confidence,
    @JsonProperty("formFields") List<DynamicFormField> formFields
) {
    public DynamicFormResponse {
        formFields = formFields == null ? List.of() : List.copyOf(formFields);
    }
}
