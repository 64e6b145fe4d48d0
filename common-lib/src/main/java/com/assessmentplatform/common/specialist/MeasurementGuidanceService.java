package com.assessmentplatform.common.specialist;

import com.assessmentplatform.common.payload.MeasurementContext;
import com.assessmentplatform.common.payload.MeasurementGuidanceResponse;
import com.assessmentplatform.common.payload.MeasurementReading;
import com.assessmentplatform.common.payload.MeasurementValidationResponse;
import reactor.core.publisher.Mono;

/** Capture specialist: live guidance while measuring, and after-the-fact validation. */
public interface MeasurementGuidanceService {

    Mono<MeasurementGuidanceResponse> getMeasurementGuidance(MeasurementContext context);

    Mono<MeasurementValidationResponse> validateMeasurement(MeasurementReading reading);
}
