package com.assessmentplatform.orchestrator.session;

import com.assessmentplatform.common.model.AssessmentContext;
import com.assessmentplatform.common.model.AssessmentStep;
import com.assessmentplatform.common.model.Decision;
import com.assessmentplatform.common.model.DynamicFormField;
import com.assessmentplatform.common.model.FormData;
import com.assessmentplatform.common.model.MeasurementType;
import com.assessmentplatform.common.model.SafetyProtocol;
import com.assessmentplatform.common.payload.NextStepResponse;

import java.util.ArrayList;
import java.util.List;

/**
 * Where one assessment stands. Immutable; {@link AssessmentSession} swaps whole instances
 * so every specialist response lands as one transition.
 *
 * <p>{@code context.currentStep()} always equals {@code currentStep}. {@code complete} is only
 * ever true while {@code currentStep} is {@link AssessmentStep#COMPLETION} and the latest
 * completion run succeeded. Progress is not stored; it is read from the step.
 * {@code activeCapture} is the measurement type of the live capture session, or {@code null}
 * when none is running.
 */
public record AssessmentState(
    AssessmentStep currentStep,
    AssessmentContext context,
    FormData formData,
    List<DynamicFormField> dynamicFormFields,
    String currentInstructions,
    String realTimeGuidance,
    List<SafetyProtocol> safetyProtocols,
    List<String> validationErrors,
    List<Decision> decisions,
    boolean complete,
    boolean readyForCompletion,
    MeasurementType activeCapture
) {

    public AssessmentState {
        dynamicFormFields = List.copyOf(dynamicFormFields);
        safetyProtocols   = List.copyOf(safetyProtocols);
        validationErrors  = List.copyOf(validationErrors);
        decisions         = List.copyOf(decisions);
        currentInstructions = currentInstructions == null ? "" : currentInstructions;
        realTimeGuidance    = realTimeGuidance == null ? "" : realTimeGuidance;
    }

    public static AssessmentState initial() {
        return new AssessmentState(AssessmentStep.INITIALIZATION, AssessmentContext.initial(), FormData.empty(),
            List.of(), "", "", List.of(), List.of(), List.of(), false, false, null);
    }

    public double progress() {
        return currentStep.progress();
    }

    public boolean captureActive() {
        return activeCapture != null;
    }

    /**
     * Applies an accepted next-step answer. A {@code COMPLETION} answer is not entered: only the
     * completion pipeline may enter that step, so the session is flagged ready instead.
     */
    public AssessmentState withNextStep(NextStepResponse response, Decision decision) {
        List<Decision> audit = new ArrayList<>(decisions);
        audit.add(decision);
        AssessmentContext classified = context.withClassification(response.customerType(), response.jobType());
        if (response.nextStep() == AssessmentStep.COMPLETION) {
            return new AssessmentState(currentStep, classified, formData, response.fields(),
                response.instructions(), realTimeGuidance, safetyProtocols, validationErrors, audit,
                complete, true, activeCapture);
        }
        return new AssessmentState(response.nextStep(), classified.withStep(response.nextStep()), formData,
            response.fields(), response.instructions(), realTimeGuidance, safetyProtocols, validationErrors,
            audit, false, false, activeCapture);
    }

    /** One position back in the fixed order; a no-op at the first step. */
    public AssessmentState withSteppedBack() {
        AssessmentStep previous = currentStep.previous();
        if (previous == currentStep) {
            return this;
        }
        return new AssessmentState(previous, context.withStep(previous), formData, dynamicFormFields,
            currentInstructions, realTimeGuidance, safetyProtocols, validationErrors, decisions,
            false, false, activeCapture);
    }

    public AssessmentState withDynamicForm(List<DynamicFormField> fields, String instructions) {
        return new AssessmentState(currentStep, context, formData, fields, instructions, realTimeGuidance,
            safetyProtocols, validationErrors, decisions, complete, readyForCompletion, activeCapture);
    }

    /** Replaces the form data and mirrors its answers into the context sent to the field-assessor. */
    public AssessmentState withFormData(FormData data) {
        return new AssessmentState(currentStep, context.withPreviousData(data.answers()), data, dynamicFormFields,
            currentInstructions, realTimeGuidance, safetyProtocols, validationErrors, decisions,
            complete, readyForCompletion, activeCapture);
    }

    public AssessmentState withValidationErrors(List<String> errors) {
        return new AssessmentState(currentStep, context, formData, dynamicFormFields, currentInstructions,
            realTimeGuidance, safetyProtocols, errors, decisions, complete, readyForCompletion, activeCapture);
    }

    public AssessmentState withValidationError(String error) {
        List<String> errors = new ArrayList<>(validationErrors);
        errors.add(error);
        return withValidationErrors(errors);
    }

    public AssessmentState withSafetyProtocols(List<SafetyProtocol> protocols) {
        return new AssessmentState(currentStep, context, formData, dynamicFormFields, currentInstructions,
            realTimeGuidance, protocols, validationErrors, decisions, complete, readyForCompletion, activeCapture);
    }

    public AssessmentState withRealTimeGuidance(String guidance) {
        return new AssessmentState(currentStep, context, formData, dynamicFormFields, currentInstructions,
            guidance, safetyProtocols, validationErrors, decisions, complete, readyForCompletion, activeCapture);
    }

    public AssessmentState withCapture(MeasurementType type) {
        return new AssessmentState(currentStep, context, formData, dynamicFormFields, currentInstructions,
            realTimeGuidance, safetyProtocols, validationErrors, decisions, complete, readyForCompletion, type);
    }

    /**
     * A completion run failed: the error joins the validation errors and the session is no
     * longer complete. Step and report of an earlier successful run are kept.
     */
    public AssessmentState withCompletionFailed(String error) {
        List<String> errors = new ArrayList<>(validationErrors);
        errors.add(error);
        return new AssessmentState(currentStep, context, formData, dynamicFormFields, currentInstructions,
            realTimeGuidance, safetyProtocols, errors, decisions, false, readyForCompletion, activeCapture);
    }

    /** Terminal transition of a successful completion pipeline run. */
    public AssessmentState withCompleted(FormData finalData) {
        return new AssessmentState(AssessmentStep.COMPLETION, context.withStep(AssessmentStep.COMPLETION),
            finalData, dynamicFormFields, currentInstructions, realTimeGuidance, safetyProtocols,
            validationErrors, decisions, true, false, activeCapture);
    }
}
