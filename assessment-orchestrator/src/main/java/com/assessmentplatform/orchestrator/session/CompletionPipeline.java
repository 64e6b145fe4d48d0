package com.assessmentplatform.orchestrator.session;

import com.assessmentplatform.common.model.AssessmentReport;
import com.assessmentplatform.common.model.AssessmentSnapshot;
import com.assessmentplatform.common.model.FormData;
import com.assessmentplatform.common.payload.AssessmentReportResponse;
import com.assessmentplatform.common.report.CompletedAssessmentPublisher;
import com.assessmentplatform.common.specialist.ReportGenerationService;
import com.assessmentplatform.common.specialist.Specialist;
import com.assessmentplatform.orchestrator.logger.AssessmentFlowLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.UUID;

/**
 * Finishes an assessment: asks the certified arborist for the report, freezes it into the form
 * data and moves the session to COMPLETION in one transition, then hands the report to storage.
 *
 * <p>May be requested from any step and re-run after success. A failed run leaves the session
 * incomplete, even if an earlier run had succeeded, and the operator can retry.
 */
@Component
public class CompletionPipeline {

    private static final Logger log = LoggerFactory.getLogger(CompletionPipeline.class);

    private final ReportGenerationService reportGeneration;
    private final CompletedAssessmentPublisher publisher;
    private final AssessmentFlowLogger flowLogger;
    private final Clock clock;
    private final String completedBy;

    public CompletionPipeline(ReportGenerationService reportGeneration,
                              CompletedAssessmentPublisher publisher,
                              AssessmentFlowLogger flowLogger,
                              Clock clock,
                              @Value("${assessment.report.completed-by:TreeAI Agent System}") String completedBy) {
        this.reportGeneration = reportGeneration;
        this.publisher        = publisher;
        this.flowLogger       = flowLogger;
        this.clock            = clock;
        this.completedBy      = completedBy;
    }

    public Mono<AssessmentSnapshot> complete(AssessmentSession session) {
        return session.navigate("complete", () -> generate(session));
    }

    private Mono<Void> generate(AssessmentSession session) {
        AssessmentState current = session.state();
        return SpecialistCalls.required(reportGeneration.generateAssessmentReport(
                AssessmentPayloads.completeAssessment(session.id(), current)), Specialist.CERTIFIED_ARBORIST)
            .map(response -> session.update(
                s -> s.withCompleted(s.formData().withReport(toReport(session.id(), s.formData(), response))),
                agg -> agg.appendReport(response)))
            .doOnEach(flowLogger.stage(AssessmentFlowLogger.REPORT_GENERATED))
            .doOnNext(done -> {
                AssessmentReport report = done.formData().report();
                if (!session.isDiscarded() && report != null) {
                    publisher.publish(report);
                }
            })
            .then()
            .onErrorResume(e -> {
                log.warn("Report generation failed, session left incomplete. sessionId={} reason={}",
                         session.id(), e.getMessage());
                String errorText = SpecialistCalls.describe(e);
                session.update(s -> s.withCompletionFailed(errorText), agg -> agg.appendError(errorText));
                return Mono.empty();
            });
    }

    private AssessmentReport toReport(String sessionId, FormData form, AssessmentReportResponse response) {
        String summary = response.report() != null && response.report().summary() != null
            ? response.report().summary() : "";
        return new AssessmentReport(
            UUID.randomUUID().toString(),
            sessionId,
            clock.instant(),
            form.customerName(),
            form.propertyAddress(),
            form.treeScore(),
            form.measurements(),
            form.riskFactors(),
            summary,
            response.recommendations().stream()
                .map(AssessmentReportResponse.ProfessionalRecommendation::description)
                .toList(),
            completedBy);
    }
}
