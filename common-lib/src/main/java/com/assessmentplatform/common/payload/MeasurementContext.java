package com.assessmentplatform.common.payload;

import com.assessmentplatform.common.model.MeasurementType;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record MeasurementContext(
    @JsonProperty("measurementType")         MeasurementType measurementType,
    @JsonProperty("treeSpecies")             String treeSpecies,
    @JsonProperty("environmentalConditions") EnvironmentalConditions environmentalConditions,
    @JsonProperty("deviceCapabilities")      DeviceCapabilities deviceCapabilities
) {

    public record EnvironmentalConditions(
        @JsonProperty("lighting")  String lighting,
        @JsonProperty("weather")   String weather,
        @JsonProperty("obstacles") List<String> obstacles
    ) {}

    public record DeviceCapabilities(
        @JsonProperty("hasLiDAR")        boolean hasLiDAR,
        @JsonProperty("cameraQuality")   String cameraQuality,
        @JsonProperty("processingPower") String processingPower
    ) {}

    public static MeasurementContext of(MeasurementType type, String treeSpecies) {
        return new MeasurementContext(type, treeSpecies,
            new EnvironmentalConditions("good", "clear", List.of()),
            new DeviceCapabilities(true, "high", "high"));
    }
}
