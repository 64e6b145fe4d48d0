package com.assessmentplatform.orchestrator.adapter;

import com.assessmentplatform.common.payload.MeasurementContext;
import com.assessmentplatform.common.payload.MeasurementGuidanceResponse;
import com.assessmentplatform.common.payload.MeasurementReading;
import com.assessmentplatform.common.payload.MeasurementValidationResponse;
import com.assessmentplatform.common.specialist.MeasurementGuidanceService;
import com.assessmentplatform.common.specialist.Specialist;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

@Component
public class RestMeasurementGuidanceService implements MeasurementGuidanceService {

    private final SpecialistTransport transport;

    public RestMeasurementGuidanceService(SpecialistTransport transport) {
        this.transport = transport;
    }

    @Override
    public Mono<MeasurementGuidanceResponse> getMeasurementGuidance(MeasurementContext context) {
        return transport.call(Specialist.MEASUREMENT_SPECIALIST, "ar-measurement-guidance",
            "context", context, MeasurementGuidanceResponse.class);
    }

    @Override
    public Mono<MeasurementValidationResponse> validateMeasurement(MeasurementReading reading) {
        return transport.call(Specialist.MEASUREMENT_SPECIALIST, "validate-ar-measurement",
            "measurement", reading, MeasurementValidationResponse.class);
    }
}
