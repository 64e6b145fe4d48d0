package com.assessmentplatform.orchestrator.session;

import com.assessmentplatform.common.model.AssessmentStep;
import com.assessmentplatform.common.model.DynamicFormField;
import com.assessmentplatform.common.model.MeasurementResult;
import com.assessmentplatform.common.model.MeasurementType;
import com.assessmentplatform.common.model.RiskLevel;
import com.assessmentplatform.common.model.SafetyProtocol;
import com.assessmentplatform.common.model.ValidationRule;
import com.assessmentplatform.common.payload.CompletionValidationResponse;
import com.assessmentplatform.common.payload.NextStepResponse;
import com.assessmentplatform.common.payload.SafetyAnalysisResponse;
import com.assessmentplatform.common.payload.TreeScoreResponse;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

/** Canned specialist answers shared by the session engine tests. */
final class Fixtures {

    static final Instant NOW = Instant.parse("2026-05-01T09:30:00Z");
    static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private Fixtures() {}

    static DynamicFormField numberField(String id) {
        return new DynamicFormField(id, id, DynamicFormField.FieldType.NUMBER, true, null,
            List.of(new ValidationRule(ValidationRule.RuleType.MIN, 0, null)), null);
    }

    static DynamicFormField textField(String id) {
        return new DynamicFormField(id, id, DynamicFormField.FieldType.TEXT, true, null, List.of(), null);
    }

    static NextStepResponse nextStep(AssessmentStep step, DynamicFormField... fields) {
        return new NextStepResponse(0.9, step, new NextStepResponse.FormConfiguration(List.of(fields)),
            "Instructions for " + step.id(), 5.0, null, null);
    }

    static CompletionValidationResponse stepComplete(String... nextActions) {
        return new CompletionValidationResponse(0.95, true, List.of(), List.of(nextActions));
    }

    static CompletionValidationResponse stepIncomplete(List<String> missingData, List<String> nextActions) {
        return new CompletionValidationResponse(0.8, false, missingData, nextActions);
    }

    static SafetyAnalysisResponse safety(RiskLevel level, String... recommendations) {
        return new SafetyAnalysisResponse(0.9, level, List.of("Power lines within fall zone"),
            List.of(new SafetyProtocol("ppe-1", "Hard hat", "Head protection", true, List.of("helmet"))),
            List.of(recommendations));
    }

    static TreeScoreResponse score(int treeScore, String... recommendations) {
        return new TreeScoreResponse(0.9, treeScore, Map.of(), List.of(recommendations), Map.of());
    }

    static MeasurementResult capture(MeasurementType type, double value, double confidence) {
        return new MeasurementResult(type, value, "ft", confidence, NOW, Map.of("device", "lidar"));
    }
}
