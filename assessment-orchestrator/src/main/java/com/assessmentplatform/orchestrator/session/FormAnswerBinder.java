package com.assessmentplatform.orchestrator.session;

import com.assessmentplatform.common.model.FormData;
import com.assessmentplatform.common.model.MeasurementType;
import com.assessmentplatform.common.model.RiskFactor;
import com.assessmentplatform.common.validation.FormFieldValidator;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Maps operator answers onto {@link FormData}.
 *
 * <p>Ids that name a typed field are written there; every answer is also kept in the answers
 * map the field-assessor sees. Measurement fields only take numbers: a numeric answer replaces
 * the value and drops its capture provenance, anything else is rejected.
 */
@Component
public class FormAnswerBinder {

    private static final TypeReference<List<RiskFactor>> RISK_FACTORS = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public FormAnswerBinder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public record Result(FormData formData, List<String> errors) {
        public boolean accepted() {
            return errors.isEmpty();
        }
    }

    public Result bind(FormData form, Map<String, Object> answers) {
        List<String> errors = new ArrayList<>();
        FormData bound = form;
        for (Map.Entry<String, Object> answer : answers.entrySet()) {
            String fieldId = answer.getKey();
            Object value = answer.getValue();

            MeasurementType measured = MeasurementType.forField(fieldId);
            if (measured != null) {
                Double number = FormFieldValidator.toNumber(value);
                if (number == null) {
                    errors.add(bound.isMeasured(measured)
                        ? fieldId + " holds a captured measurement; a manual value must be numeric"
                        : fieldId + " must be a number");
                    continue;
                }
                bound = bound.withManualValue(measured, number);
            } else {
                switch (fieldId) {
                    case "customerName"    -> bound = bound.withCustomerName(text(value));
                    case "propertyAddress" -> bound = bound.withPropertyAddress(text(value));
                    case "treeSpecies"     -> bound = bound.withTreeSpecies(text(value));
                    case "additionalNotes" -> bound = bound.withAdditionalNotes(text(value));
                    case "riskFactors"     -> {
                        try {
                            bound = bound.withRiskFactors(objectMapper.convertValue(value, RISK_FACTORS));
                        } catch (IllegalArgumentException e) {
                            errors.add("riskFactors could not be read: " + e.getMessage());
                            continue;
                        }
                    }
                    default -> { }
                }
            }
            bound = bound.withAnswer(fieldId, value);
        }
        return errors.isEmpty() ? new Result(bound, List.of()) : new Result(form, errors);
    }

    private static String text(Object value) {
        return value == null ? "" : String.valueOf(value);
    }
}
