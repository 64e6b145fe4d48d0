package com.assessmentplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raw result of one measurement capture. Kept alongside the applied value in
 * {@link FormData#measurements()} as provenance.
 */
public record MeasurementResult(
    @JsonProperty("type")       MeasurementType type,
    @JsonProperty("value")      double value,
    @JsonProperty("unit")       String unit,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("timestamp")  Instant timestamp,
    @JsonProperty("metadata")   Map<String, Object> metadata
) {
    public MeasurementResult {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
