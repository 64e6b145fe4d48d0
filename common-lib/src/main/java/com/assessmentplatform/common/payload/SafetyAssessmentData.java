package com.assessmentplatform.common.payload;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Location and hazard snapshot sent to the safety specialist.
 *
 * <p>Ground, weather and traffic conditions are not captured by this service yet and are
 * sent as neutral defaults; power-line presence comes from the recorded risk factors.
 */
public record SafetyAssessmentData(
    @JsonProperty("location")         LocationData location,
    @JsonProperty("powerLines")       PowerLineProximity powerLines,
    @JsonProperty("structures")       List<String> structures,
    @JsonProperty("groundConditions") GroundConditions groundConditions,
    @JsonProperty("weather")          WeatherConditions weather,
    @JsonProperty("traffic")          TrafficConditions traffic
) {

    public record PowerLineProximity(
        @JsonProperty("present")  boolean present,
        @JsonProperty("distance") double distance,
        @JsonProperty("voltage")  String voltage
    ) {}

    public record GroundConditions(
        @JsonProperty("slope")     String slope,
        @JsonProperty("surface")   String surface,
        @JsonProperty("stability") String stability
    ) {}

    public record WeatherConditions(
        @JsonProperty("windSpeed")     double windSpeed,
        @JsonProperty("precipitation") double precipitation,
        @JsonProperty("visibility")    double visibility,
        @JsonProperty("temperature")   double temperature
    ) {}

    public record TrafficConditions(
        @JsonProperty("volume")          String volume,
        @JsonProperty("speed")           int speed,
        @JsonProperty("proximityToRoad") double proximityToRoad
    ) {}

    public static SafetyAssessmentData forSite(String address, boolean powerLinesPresent) {
        return new SafetyAssessmentData(
            LocationData.forAddress(address),
            new PowerLineProximity(powerLinesPresent, 10.0, "residential"),
            List.of(),
            new GroundConditions("level", "grass", "stable"),
            new WeatherConditions(5.0, 0.0, 10.0, 70.0),
            new TrafficConditions("low", 25, 50.0));
    }
}
