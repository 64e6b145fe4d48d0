package com.assessmentplatform.common.specialist;

import com.assessmentplatform.common.payload.TreeMeasurements;
import com.assessmentplatform.common.payload.TreeScoreResponse;
import reactor.core.publisher.Mono;

public interface TreeScoreService {

    Mono<TreeScoreResponse> calculateTreeScore(TreeMeasurements measurements);
}
