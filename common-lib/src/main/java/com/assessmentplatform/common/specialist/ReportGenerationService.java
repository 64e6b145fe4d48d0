package com.assessmentplatform.common.specialist;

import com.assessmentplatform.common.payload.AssessmentReportResponse;
import com.assessmentplatform.common.payload.CompleteAssessment;
import reactor.core.publisher.Mono;

public interface ReportGenerationService {

    Mono<AssessmentReportResponse> generateAssessmentReport(CompleteAssessment assessment);
}
