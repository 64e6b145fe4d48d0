package com.assessmentplatform.orchestrator.adapter;

import com.assessmentplatform.common.payload.SafetyAnalysisResponse;
import com.assessmentplatform.common.payload.SafetyAssessmentData;
import com.assessmentplatform.common.specialist.SafetyAnalysisService;
import com.assessmentplatform.common.specialist.Specialist;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

@Component
public class RestSafetyAnalysisService implements SafetyAnalysisService {

    private final SpecialistTransport transport;

    public RestSafetyAnalysisService(SpecialistTransport transport) {
        this.transport = transport;
    }

    @Override
    public Mono<SafetyAnalysisResponse> assessSafetyRisks(SafetyAssessmentData assessment) {
        return transport.call(Specialist.SAFETY_MANAGER, "safety-risk-assessment",
            "assessmentData", assessment, SafetyAnalysisResponse.class);
    }
}
