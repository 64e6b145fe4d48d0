package com.assessmentplatform.common.specialist;

import com.assessmentplatform.common.payload.SafetyAnalysisResponse;
import com.assessmentplatform.common.payload.SafetyAssessmentData;
import reactor.core.publisher.Mono;

public interface SafetyAnalysisService {

    Mono<SafetyAnalysisResponse> assessSafetyRisks(SafetyAssessmentData assessment);
}
