package com.assessmentplatform.orchestrator.session;

import com.assessmentplatform.common.model.AssessmentSnapshot;
import com.assessmentplatform.common.model.Decision;
import com.assessmentplatform.common.model.MeasurementResult;
import com.assessmentplatform.common.model.MeasurementType;
import com.assessmentplatform.common.validation.FormFieldValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Entry point for everything that can happen to a session, addressed by session id.
 * Unknown ids surface as {@link SessionNotFoundException} error signals.
 */
@Service
public class AssessmentWorkflowService {

    private static final Logger log = LoggerFactory.getLogger(AssessmentWorkflowService.class);

    private final AssessmentSessionRegistry registry;
    private final StepSequencer sequencer;
    private final MeasurementValidationPipeline measurementPipeline;
    private final CompletionPipeline completionPipeline;
    private final FormAnswerBinder answerBinder;

    public AssessmentWorkflowService(AssessmentSessionRegistry registry,
                                     StepSequencer sequencer,
                                     MeasurementValidationPipeline measurementPipeline,
                                     CompletionPipeline completionPipeline,
                                     FormAnswerBinder answerBinder) {
        this.registry            = registry;
        this.sequencer           = sequencer;
        this.measurementPipeline = measurementPipeline;
        this.completionPipeline  = completionPipeline;
        this.answerBinder        = answerBinder;
    }

    /** Creates a session and starts it. */
    public Mono<AssessmentSnapshot> create() {
        return Mono.defer(() -> sequencer.start(registry.create()));
    }

    public Mono<AssessmentSnapshot> snapshot(String sessionId) {
        return Mono.fromSupplier(() -> registry.get(sessionId).snapshot());
    }

    public Mono<AssessmentSnapshot> start(String sessionId) {
        return Mono.defer(() -> sequencer.start(registry.get(sessionId)));
    }

    public Mono<AssessmentSnapshot> proceed(String sessionId) {
        return Mono.defer(() -> sequencer.proceed(registry.get(sessionId)));
    }

    public Mono<AssessmentSnapshot> goBack(String sessionId) {
        return Mono.defer(() -> sequencer.goBack(registry.get(sessionId)));
    }

    public Mono<AssessmentSnapshot> complete(String sessionId) {
        return Mono.defer(() -> completionPipeline.complete(registry.get(sessionId)));
    }

    public Mono<AssessmentSnapshot> applyMeasurement(String sessionId, MeasurementResult result) {
        return Mono.defer(() -> {
            AssessmentSession session = registry.get(sessionId);
            if (result == null || result.type() == null) {
                return Mono.error(new IllegalArgumentException("Measurement type is required"));
            }
            return measurementPipeline.applyMeasurementResult(session, result);
        });
    }

    /**
     * Applies operator answers for the current dynamic form. Rule violations replace the
     * validation errors and nothing is written. Rejected while a navigation request runs,
     * since that request may replace the form being answered.
     */
    public Mono<AssessmentSnapshot> submitAnswers(String sessionId, Map<String, Object> answers) {
        return Mono.defer(() -> {
            AssessmentSession session = registry.get(sessionId);
            if (session.isNavigating()) {
                return Mono.error(new SessionBusyException(sessionId, "submitAnswers"));
            }
            AtomicReference<List<String>> rejected = new AtomicReference<>(List.of());
            session.update(s -> {
                List<String> violations = FormFieldValidator.validate(s.dynamicFormFields(), answers);
                if (!violations.isEmpty()) {
                    rejected.set(violations);
                    return s.withValidationErrors(violations);
                }
                FormAnswerBinder.Result bound = answerBinder.bind(s.formData(), answers);
                rejected.set(bound.errors());
                return bound.accepted()
                    ? s.withFormData(bound.formData()).withValidationErrors(List.of())
                    : s.withValidationErrors(bound.errors());
            });
            if (!rejected.get().isEmpty()) {
                log.info("Answers rejected. violations={} sessionId={}", rejected.get(), sessionId);
            }
            return Mono.just(session.snapshot());
        });
    }

    /** The capture subsystem opened a live capture for {@code type}; guidance is requested for it. */
    public Mono<AssessmentSnapshot> beginCapture(String sessionId, MeasurementType type) {
        return Mono.defer(() -> {
            AssessmentSession session = registry.get(sessionId);
            if (type == null) {
                return Mono.error(new IllegalArgumentException("Measurement type is required"));
            }
            session.update(s -> s.withCapture(type));
            sequencer.requestGuidance(session, type);
            return Mono.just(session.snapshot());
        });
    }

    public Mono<AssessmentSnapshot> endCapture(String sessionId) {
        return Mono.fromSupplier(() -> {
            AssessmentSession session = registry.get(sessionId);
            session.update(s -> s.withCapture(null));
            return session.snapshot();
        });
    }

    public Mono<List<Decision>> decisions(String sessionId) {
        return Mono.fromSupplier(() -> registry.get(sessionId).state().decisions());
    }

    public Flux<AssessmentSnapshot> stream(String sessionId) {
        return Flux.defer(() -> registry.get(sessionId).snapshots());
    }

    public Mono<Void> discard(String sessionId) {
        return Mono.fromRunnable(() -> registry.discard(sessionId));
    }
}
