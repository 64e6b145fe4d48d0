package com.assessmentplatform.orchestrator.adapter;

import com.assessmentplatform.common.model.AssessmentContext;
import com.assessmentplatform.common.payload.AssessmentData;
import com.assessmentplatform.common.payload.CompleteAssessment;
import com.assessmentplatform.common.payload.CompletionValidationResponse;
import com.assessmentplatform.common.payload.DynamicFormResponse;
import com.assessmentplatform.common.payload.NextStepResponse;
import com.assessmentplatform.common.specialist.FieldAssessorService;
import com.assessmentplatform.common.specialist.Specialist;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/** Field-assessor over HTTP. Errors are passed through unchanged; the sequencer recovers them. */
@Component
public class RestFieldAssessorService implements FieldAssessorService {

    private final SpecialistTransport transport;

    public RestFieldAssessorService(SpecialistTransport transport) {
        this.transport = transport;
    }

    @Override
    public Mono<NextStepResponse> getNextAssessmentStep(AssessmentData currentData) {
        return transport.call(Specialist.FIELD_ASSESSOR, "next-assessment-step",
            "currentData", currentData, NextStepResponse.class);
    }

    @Override
    public Mono<CompletionValidationResponse> validateAssessmentCompletion(CompleteAssessment assessment) {
        return transport.call(Specialist.FIELD_ASSESSOR, "validate-assessment-completion",
            "assessment", assessment, CompletionValidationResponse.class);
    }

    @Override
    public Mono<DynamicFormResponse> generateDynamicForm(AssessmentContext context) {
        return transport.call(Specialist.FIELD_ASSESSOR, "generate-dynamic-form",
            "context", context, DynamicFormResponse.class);
    }
}
