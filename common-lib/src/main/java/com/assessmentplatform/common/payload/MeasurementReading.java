package com.assessmentplatform.common.payload;

import com.assessmentplatform.common.model.MeasurementResult;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/** One raw capture as sent to the measurement specialist for validation. */
public record MeasurementReading(
    @JsonProperty("type")       String type,
    @JsonProperty("value")      double value,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("timestamp")  Instant timestamp,
    @JsonProperty("metadata")   Map<String, Object> metadata
) {
    public static MeasurementReading from(MeasurementResult result) {
        return new MeasurementReading(result.type().id(), result.value(), result.confidence(),
            result.timestamp(), result.metadata());
    }
}
