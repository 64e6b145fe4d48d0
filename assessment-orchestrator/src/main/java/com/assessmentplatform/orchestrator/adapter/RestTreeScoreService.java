package com.assessmentplatform.orchestrator.adapter;

import com.assessmentplatform.common.payload.TreeMeasurements;
import com.assessmentplatform.common.payload.TreeScoreResponse;
import com.assessmentplatform.common.specialist.Specialist;
import com.assessmentplatform.common.specialist.TreeScoreService;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

@Component
public class RestTreeScoreService implements TreeScoreService {

    private final SpecialistTransport transport;

    public RestTreeScoreService(SpecialistTransport transport) {
        this.transport = transport;
    }

    @Override
    public Mono<TreeScoreResponse> calculateTreeScore(TreeMeasurements measurements) {
        return transport.call(Specialist.TREESCORE_CALCULATOR, "calculate-treescore",
            "measurements", measurements, TreeScoreResponse.class);
    }
}
