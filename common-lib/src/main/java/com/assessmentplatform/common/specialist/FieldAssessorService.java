package com.assessmentplatform.common.specialist;

import com.assessmentplatform.common.model.AssessmentContext;
import com.assessmentplatform.common.payload.AssessmentData;
import com.assessmentplatform.common.payload.CompleteAssessment;
import com.assessmentplatform.common.payload.CompletionValidationResponse;
import com.assessmentplatform.common.payload.DynamicFormResponse;
import com.assessmentplatform.common.payload.NextStepResponse;
import reactor.core.publisher.Mono;

/**
 * Sequencing specialist: decides the next step, validates the current one and authors
 * the dynamic form for a step.
 *
 * <p>Implementations signal every failure (transport, timeout, malformed or agent-level
 * error) as an error signal on the returned {@link Mono}; they never return fallbacks.
 */
public interface FieldAssessorService {

    Mono<NextStepResponse> getNextAssessmentStep(AssessmentData currentData);

    Mono<CompletionValidationResponse> validateAssessmentCompletion(CompleteAssessment assessment);

    Mono<DynamicFormResponse> generateDynamicForm(AssessmentContext context);
}
