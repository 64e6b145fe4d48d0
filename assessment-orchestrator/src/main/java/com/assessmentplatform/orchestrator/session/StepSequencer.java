package com.assessmentplatform.orchestrator.session;

import com.assessmentplatform.common.exception.SpecialistException;
import com.assessmentplatform.common.model.AssessmentSnapshot;
import com.assessmentplatform.common.model.AssessmentStep;
import com.assessmentplatform.common.model.Decision;
import com.assessmentplatform.common.model.FormData;
import com.assessmentplatform.common.model.MeasurementType;
import com.assessmentplatform.common.payload.NextStepResponse;
import com.assessmentplatform.common.specialist.FieldAssessorService;
import com.assessmentplatform.common.specialist.MeasurementGuidanceService;
import com.assessmentplatform.common.specialist.NavigationPolicy;
import com.assessmentplatform.common.specialist.SafetyAnalysisService;
import com.assessmentplatform.common.specialist.Specialist;
import com.assessmentplatform.common.specialist.TreeScoreService;
import com.assessmentplatform.common.trace.TraceContextUtil;
import com.assessmentplatform.orchestrator.logger.AssessmentFlowLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;

/**
 * Step state machine of an assessment session.
 *
 * <p>Forward order is decided by the field-assessor: every forward transition is a round trip
 * that returns the next step, its dynamic form and instructions. Backward navigation walks the
 * fixed step order after the {@link NavigationPolicy} grants it. {@code start}, {@code proceed}
 * and {@code goBack} run under the session's navigation latch.
 *
 * <p>Entering a step may launch one fire-and-forget analysis (safety, score or measurement
 * guidance). Those run outside the latch and report back through the session whenever they
 * arrive.
 *
 * <p>A failed specialist call never reaches the caller. Its text is appended to the validation
 * errors together with one error recommendation, and the session stays where it was.
 */
@Component
public class StepSequencer {

    private static final Logger log = LoggerFactory.getLogger(StepSequencer.class);

    static final String NEXT_STEP_DECISION   = "next-step";
    static final String GO_BACK_INSTRUCTIONS = "Complete the form below based on your assessment.";

    private final FieldAssessorService fieldAssessor;
    private final SafetyAnalysisService safetyAnalysis;
    private final TreeScoreService treeScore;
    private final MeasurementGuidanceService measurementGuidance;
    private final NavigationPolicy navigationPolicy;
    private final AssessmentFlowLogger flowLogger;
    private final Clock clock;

    public StepSequencer(FieldAssessorService fieldAssessor,
                         SafetyAnalysisService safetyAnalysis,
                         TreeScoreService treeScore,
                         MeasurementGuidanceService measurementGuidance,
                         NavigationPolicy navigationPolicy,
                         AssessmentFlowLogger flowLogger,
                         Clock clock) {
        this.fieldAssessor       = fieldAssessor;
        this.safetyAnalysis      = safetyAnalysis;
        this.treeScore           = treeScore;
        this.measurementGuidance = measurementGuidance;
        this.navigationPolicy    = navigationPolicy;
        this.flowLogger          = flowLogger;
        this.clock               = clock;
    }

    /** Resets the session, then asks the field-assessor for the first step. */
    public Mono<AssessmentSnapshot> start(AssessmentSession session) {
        return session.navigate("start", () -> {
            session.reset();
            flowLogger.logWithSessionId(AssessmentFlowLogger.SESSION_STARTED, session.id());
            return requestNextStep(session);
        });
    }

    /**
     * Validates the current step and, when the field-assessor reports it complete, requests the
     * next one. Does nothing once the assessment is complete.
     */
    public Mono<AssessmentSnapshot> proceed(AssessmentSession session) {
        return session.navigate("proceed", () -> validateAndAdvance(session));
    }

    public Mono<AssessmentSnapshot> goBack(AssessmentSession session) {
        return session.navigate("goBack", () -> stepBack(session));
    }

    /** Live capture guidance for {@code type}; the primary instruction becomes the real-time guidance. */
    public void requestGuidance(AssessmentSession session, MeasurementType type) {
        FormData form = session.state().formData();
        flowLogger.logWithSessionId(AssessmentFlowLogger.SIDE_EFFECT_DISPATCHED, session.id());
        fireAndForget(session, "measurement-guidance",
            SpecialistCalls.required(measurementGuidance.getMeasurementGuidance(
                    AssessmentPayloads.measurementContext(type, form)), Specialist.MEASUREMENT_SPECIALIST)
                .doOnNext(guidance -> session.update(s -> s.withRealTimeGuidance(guidance.primaryInstruction()))));
    }

    // ── forward ──────────────────────────────────────────────────────────────

    private Mono<Void> validateAndAdvance(AssessmentSession session) {
        AssessmentState current = session.state();
        if (current.complete()) {
            log.info("Proceed ignored, assessment already complete. sessionId={}", session.id());
            return Mono.empty();
        }
        return SpecialistCalls.required(fieldAssessor.validateAssessmentCompletion(
                AssessmentPayloads.completeAssessment(session.id(), current)), Specialist.FIELD_ASSESSOR)
            .doOnEach(flowLogger.stage(AssessmentFlowLogger.STEP_VALIDATED))
            .flatMap(validation -> {
                session.update(s -> s.withValidationErrors(validation.missingData()),
                               agg -> agg.appendNextActions(validation.nextActions()));
                if (!validation.complete()) {
                    log.info("Step incomplete, staying. step={} missingData={} sessionId={}",
                             current.currentStep().id(), validation.missingData(), session.id());
                    return Mono.<Void>empty();
                }
                return requestNextStep(session);
            })
            .onErrorResume(e -> recover(session, "validate-assessment-completion", e));
    }

    private Mono<Void> requestNextStep(AssessmentSession session) {
        AssessmentState current = session.state();
        return SpecialistCalls.required(fieldAssessor.getNextAssessmentStep(
                AssessmentPayloads.assessmentData(session.id(), current)), Specialist.FIELD_ASSESSOR)
            .map(response -> applyNextStep(session, response))
            .then()
            .onErrorResume(e -> recover(session, "next-assessment-step", e));
    }

    private AssessmentState applyNextStep(AssessmentSession session, NextStepResponse response) {
        if (response.nextStep() == null) {
            throw new SpecialistException(Specialist.FIELD_ASSESSOR, "No next step in response");
        }
        Decision decision = new Decision(clock.instant(), Specialist.FIELD_ASSESSOR.id(),
            NEXT_STEP_DECISION, response.instructions(), response.confidence());
        AssessmentState applied = session.update(s -> s.withNextStep(response, decision));

        if (response.nextStep() == AssessmentStep.COMPLETION) {
            log.info("Field-assessor reports assessment ready for completion. step={} sessionId={}",
                     applied.currentStep().id(), session.id());
            return applied;
        }
        flowLogger.logStep(AssessmentFlowLogger.STEP_ENTERED, session.id(), applied.currentStep(), applied.progress());
        onStepEntered(session, applied);
        return applied;
    }

    private void onStepEntered(AssessmentSession session, AssessmentState entered) {
        switch (entered.currentStep()) {
            case RISK_ASSESSMENT -> dispatchSafetyAnalysis(session, entered.formData());
            case TREESCORE_CALCULATION -> dispatchTreeScore(session, entered.formData());
            case BASIC_MEASUREMENT -> {
                if (entered.captureActive()) {
                    requestGuidance(session, entered.activeCapture());
                }
            }
            default -> { }
        }
    }

    private void dispatchSafetyAnalysis(AssessmentSession session, FormData form) {
        if (form.propertyAddress().isBlank()) {
            log.info("Safety analysis skipped, no property address yet. sessionId={}", session.id());
            return;
        }
        flowLogger.logWithSessionId(AssessmentFlowLogger.SIDE_EFFECT_DISPATCHED, session.id());
        fireAndForget(session, "safety-analysis",
            SpecialistCalls.required(safetyAnalysis.assessSafetyRisks(AssessmentPayloads.safetyData(form)),
                    Specialist.SAFETY_MANAGER)
                .doOnNext(analysis -> session.update(s -> s.withSafetyProtocols(analysis.requiredProtocols()),
                                                     agg -> agg.appendSafety(analysis))));
    }

    private void dispatchTreeScore(AssessmentSession session, FormData form) {
        if (form.height() <= 0 || form.dbh() <= 0) {
            log.info("TreeScore skipped, height and dbh required. height={} dbh={} sessionId={}",
                     form.height(), form.dbh(), session.id());
            return;
        }
        flowLogger.logWithSessionId(AssessmentFlowLogger.SIDE_EFFECT_DISPATCHED, session.id());
        fireAndForget(session, "treescore",
            SpecialistCalls.required(treeScore.calculateTreeScore(AssessmentPayloads.treeMeasurements(form)),
                    Specialist.TREESCORE_CALCULATOR)
                .doOnNext(score -> session.update(s -> s.withFormData(s.formData().withTreeScore(score.treeScore())),
                                                  agg -> agg.appendTreeScore(score))));
    }

    /** Runs outside the navigation latch; the result is applied whenever it arrives. */
    private void fireAndForget(AssessmentSession session, String name, Mono<?> call) {
        TraceContextUtil.withSessionId(call, session.id())
            .subscribe(
                r   -> log.debug("Step-entry analysis applied. analysis={} sessionId={}", name, session.id()),
                err -> {
                    log.warn("Step-entry analysis failed. analysis={} sessionId={} reason={}",
                             name, session.id(), err.getMessage());
                    session.recordFailure(SpecialistCalls.describe(err));
                }
            );
    }

    // ── backward ─────────────────────────────────────────────────────────────

    private Mono<Void> stepBack(AssessmentSession session) {
        AssessmentState current = session.state();
        return SpecialistCalls.required(navigationPolicy.mayStepBack(current.context()), Specialist.SYSTEM)
            .flatMap(granted -> {
                if (!granted || current.currentStep().isFirst()) {
                    log.info("Step back denied. step={} sessionId={}", current.currentStep().id(), session.id());
                    return Mono.<Void>empty();
                }
                AssessmentState back = session.update(AssessmentState::withSteppedBack);
                flowLogger.logStep(AssessmentFlowLogger.STEP_BACK, session.id(), back.currentStep(), back.progress());
                return SpecialistCalls.required(fieldAssessor.generateDynamicForm(back.context()),
                        Specialist.FIELD_ASSESSOR)
                    .doOnNext(form -> session.update(s -> s.withDynamicForm(form.formFields(), GO_BACK_INSTRUCTIONS)))
                    .then();
            })
            .onErrorResume(e -> recover(session, "go-back", e));
    }

    private Mono<Void> recover(AssessmentSession session, String operation, Throwable e) {
        log.warn("Specialist call failed, recorded on session. operation={} sessionId={} reason={}",
                 operation, session.id(), e.getMessage());
        session.recordFailure(SpecialistCalls.describe(e));
        return Mono.empty();
    }
}
