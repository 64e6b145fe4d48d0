package com.assessmentplatform.orchestrator.session;

import com.assessmentplatform.common.model.AssessmentSnapshot;
import com.assessmentplatform.common.model.AssessmentStep;
import com.assessmentplatform.common.model.MeasurementType;
import com.assessmentplatform.common.payload.CompletionValidationResponse;
import com.assessmentplatform.common.payload.MeasurementGuidanceResponse;
import com.assessmentplatform.common.payload.MeasurementValidationResponse;
import com.assessmentplatform.common.report.CompletedAssessmentPublisher;
import com.assessmentplatform.common.specialist.FieldAssessorService;
import com.assessmentplatform.common.specialist.MeasurementGuidanceService;
import com.assessmentplatform.common.specialist.ReportGenerationService;
import com.assessmentplatform.common.specialist.SafetyAnalysisService;
import com.assessmentplatform.common.specialist.TreeScoreService;
import com.assessmentplatform.orchestrator.adapter.LinearNavigationPolicy;
import com.assessmentplatform.orchestrator.logger.AssessmentFlowLogger;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static com.assessmentplatform.orchestrator.session.Fixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class AssessmentWorkflowServiceTest {

    private FieldAssessorService fieldAssessor;
    private MeasurementGuidanceService measurementGuidance;
    private AssessmentSessionRegistry registry;
    private AssessmentWorkflowService service;

    @BeforeEach
    void setUp() {
        fieldAssessor       = mock(FieldAssessorService.class);
        measurementGuidance = mock(MeasurementGuidanceService.class);
        registry            = new AssessmentSessionRegistry(CLOCK);
        AssessmentFlowLogger flowLogger = new AssessmentFlowLogger();
        StepSequencer sequencer = new StepSequencer(fieldAssessor, mock(SafetyAnalysisService.class),
            mock(TreeScoreService.class), measurementGuidance, new LinearNavigationPolicy(), flowLogger, CLOCK);
        service = new AssessmentWorkflowService(registry, sequencer,
            new MeasurementValidationPipeline(measurementGuidance, sequencer, flowLogger, 0.8),
            new CompletionPipeline(mock(ReportGenerationService.class), mock(CompletedAssessmentPublisher.class),
                flowLogger, CLOCK, "TreeAI Agent System"),
            new FormAnswerBinder(new ObjectMapper()));

        when(fieldAssessor.getNextAssessmentStep(any()))
            .thenReturn(Mono.just(nextStep(AssessmentStep.BASIC_MEASUREMENT, numberField("height"), textField("treeSpecies"))));
    }

    private String createdSession() {
        return service.create().block().sessionId();
    }

    // ── lifecycle ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("create registers a session and runs the first transition")
        void create() {
            AssessmentSnapshot snapshot = service.create().block();

            assertThat(snapshot.currentStep()).isEqualTo(AssessmentStep.BASIC_MEASUREMENT);
            assertThat(registry.size()).isEqualTo(1);
            assertThat(registry.get(snapshot.sessionId())).isNotNull();
        }

        @Test
        @DisplayName("unknown ids surface as SessionNotFoundException")
        void unknownId() {
            StepVerifier.create(service.proceed("nope")).expectError(SessionNotFoundException.class).verify();
            StepVerifier.create(service.snapshot("nope")).expectError(SessionNotFoundException.class).verify();
            StepVerifier.create(service.discard("nope")).expectError(SessionNotFoundException.class).verify();
        }

        @Test
        @DisplayName("discard removes the session and completes its stream")
        void discard() {
            String id = createdSession();
            StepVerifier.create(service.stream(id))
                .expectNextCount(1)
                .then(() -> service.discard(id).block())
                .verifyComplete();
            assertThat(registry.size()).isZero();
        }

        @Test
        @DisplayName("decisions lists the audit trail")
        void decisions() {
            String id = createdSession();

            assertThat(service.decisions(id).block()).singleElement()
                .satisfies(d -> assertThat(d.specialist()).isEqualTo("field-assessor"));
        }
    }

    // ── answers ──────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("submitAnswers()")
    class AnswerTests {

        @Test
        @DisplayName("valid answers are written and clear earlier errors")
        void accepted() {
            String id = createdSession();
            service.submitAnswers(id, Map.of("height", -5)).block();

            AssessmentSnapshot snapshot = service.submitAnswers(id, Map.of("height", 62, "treeSpecies", "Oak")).block();

            assertThat(snapshot.validationErrors()).isEmpty();
            assertThat(snapshot.formData().height()).isEqualTo(62.0);
            assertThat(snapshot.formData().treeSpecies()).isEqualTo("Oak");
            assertThat(registry.get(id).state().context().previousData()).containsEntry("height", 62);
        }

        @Test
        @DisplayName("rule violations replace the validation errors and nothing is written")
        void rejected() {
            String id = createdSession();

            AssessmentSnapshot snapshot = service.submitAnswers(id, Map.of("height", -5)).block();

            assertThat(snapshot.validationErrors()).containsExactly("height must be at least 0");
            assertThat(snapshot.formData().height()).isZero();
        }

        @Test
        @DisplayName("rejected while a navigation request is running")
        void busy() {
            String id = createdSession();
            Sinks.One<CompletionValidationResponse> pending = Sinks.one();
            when(fieldAssessor.validateAssessmentCompletion(any())).thenReturn(pending.asMono());
            service.proceed(id).subscribe();

            StepVerifier.create(service.submitAnswers(id, Map.of("height", 62)))
                .expectError(SessionBusyException.class)
                .verify();
        }
    }

    // ── measurements and capture ─────────────────────────────────────────────

    @Nested
    @DisplayName("measurements and capture")
    class CaptureTests {

        @Test
        @DisplayName("a measurement without a type is refused")
        void missingType() {
            String id = createdSession();

            StepVerifier.create(service.applyMeasurement(id, null))
                .expectError(IllegalArgumentException.class)
                .verify();
        }

        @Test
        @DisplayName("beginCapture marks the capture live and applies guidance; endCapture clears it")
        void captureLifecycle() {
            String id = createdSession();
            when(measurementGuidance.getMeasurementGuidance(any())).thenReturn(Mono.just(
                new MeasurementGuidanceResponse(0.9,
                    new MeasurementGuidanceResponse.Instructions("Hold the device level", List.of()), List.of())));

            AssessmentSnapshot live = service.beginCapture(id, MeasurementType.HEIGHT).block();

            assertThat(live.captureActive()).isTrue();
            assertThat(live.realTimeGuidance()).isEqualTo("Hold the device level");
            assertThat(service.endCapture(id).block().captureActive()).isFalse();
        }

        @Test
        @DisplayName("a capture result is applied and the session advances")
        void measurementAdvances() {
            String id = createdSession();
            when(measurementGuidance.validateMeasurement(any()))
                .thenReturn(Mono.just(new MeasurementValidationResponse(0.9, true, 0.95, List.of())));
            when(fieldAssessor.validateAssessmentCompletion(any())).thenReturn(Mono.just(stepComplete()));
            when(fieldAssessor.getNextAssessmentStep(any()))
                .thenReturn(Mono.just(nextStep(AssessmentStep.RISK_ASSESSMENT)));

            AssessmentSnapshot snapshot = service.applyMeasurement(id, capture(MeasurementType.HEIGHT, 62.0, 0.9)).block();

            assertThat(snapshot.formData().height()).isEqualTo(62.0);
            assertThat(snapshot.currentStep()).isEqualTo(AssessmentStep.RISK_ASSESSMENT);
        }
    }
}
