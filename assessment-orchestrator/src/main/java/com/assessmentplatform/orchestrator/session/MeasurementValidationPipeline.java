package com.assessmentplatform.orchestrator.session;

import com.assessmentplatform.common.model.AssessmentSnapshot;
import com.assessmentplatform.common.model.MeasurementResult;
import com.assessmentplatform.common.payload.MeasurementReading;
import com.assessmentplatform.common.payload.MeasurementValidationResponse;
import com.assessmentplatform.common.specialist.MeasurementGuidanceService;
import com.assessmentplatform.common.specialist.Specialist;
import com.assessmentplatform.common.trace.TraceContextUtil;
import com.assessmentplatform.orchestrator.logger.AssessmentFlowLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Folds a completed capture into the session.
 *
 * <p>The value is written into the form data before the measurement specialist is asked to
 * validate it; validation only decides whether a retake advisory is added. A failed validation
 * call is logged and adds nothing. Afterwards the sequencer is asked to proceed; if a navigation
 * request is already running, that auto-advance is skipped.
 */
@Component
public class MeasurementValidationPipeline {

    private static final Logger log = LoggerFactory.getLogger(MeasurementValidationPipeline.class);

    private final MeasurementGuidanceService measurementGuidance;
    private final StepSequencer sequencer;
    private final AssessmentFlowLogger flowLogger;
    private final double accuracyThreshold;

    public MeasurementValidationPipeline(MeasurementGuidanceService measurementGuidance,
                                         StepSequencer sequencer,
                                         AssessmentFlowLogger flowLogger,
                                         @Value("${assessment.measurement.accuracy-threshold:0.8}") double accuracyThreshold) {
        this.measurementGuidance = measurementGuidance;
        this.sequencer           = sequencer;
        this.flowLogger          = flowLogger;
        this.accuracyThreshold   = accuracyThreshold;
    }

    public Mono<AssessmentSnapshot> applyMeasurementResult(AssessmentSession session, MeasurementResult result) {
        Mono<AssessmentSnapshot> pipeline = Mono.defer(() -> {
            long sequence = session.nextCaptureSequence();
            session.update(s -> s.withFormData(s.formData().withMeasurement(result)));
            flowLogger.logWithSessionId(AssessmentFlowLogger.MEASUREMENT_APPLIED, session.id());

            return SpecialistCalls.required(measurementGuidance.validateMeasurement(MeasurementReading.from(result)),
                    Specialist.MEASUREMENT_SPECIALIST)
                .doOnNext(validation -> {
                    if (needsRetake(validation)) {
                        session.recommend(agg -> agg.appendMeasurementAdvisory(validation, sequence, accuracyThreshold));
                    }
                })
                .then()
                .onErrorResume(e -> {
                    log.warn("Measurement validation failed, value kept. type={} sequence={} sessionId={} reason={}",
                             result.type().id(), sequence, session.id(), e.getMessage());
                    return Mono.empty();
                })
                .then(Mono.defer(() -> sequencer.proceed(session)))
                .onErrorResume(SessionBusyException.class, e -> {
                    log.info("Auto-advance skipped, navigation in flight. sequence={} sessionId={}",
                             sequence, session.id());
                    return Mono.fromSupplier(session::snapshot);
                });
        });
        return TraceContextUtil.withSessionId(pipeline, session.id());
    }

    boolean needsRetake(MeasurementValidationResponse validation) {
        return !validation.valid() || validation.accuracy() < accuracyThreshold;
    }
}
