package com.assessmentplatform.orchestrator.adapter;

import com.assessmentplatform.common.payload.AssessmentReportResponse;
import com.assessmentplatform.common.payload.CompleteAssessment;
import com.assessmentplatform.common.specialist.ReportGenerationService;
import com.assessmentplatform.common.specialist.Specialist;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

@Component
public class RestReportGenerationService implements ReportGenerationService {

    private final SpecialistTransport transport;

    public RestReportGenerationService(SpecialistTransport transport) {
        this.transport = transport;
    }

    @Override
    public Mono<AssessmentReportResponse> generateAssessmentReport(CompleteAssessment assessment) {
        return transport.call(Specialist.CERTIFIED_ARBORIST, "generate-assessment-report",
            "assessment", assessment, AssessmentReportResponse.class);
    }
}
