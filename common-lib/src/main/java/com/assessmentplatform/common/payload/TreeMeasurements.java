package com.assessmentplatform.common.payload;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Input of the TreeScore calculation. Scoring itself happens inside the specialist. */
public record TreeMeasurements(
    @JsonProperty("height")      double height,
    @JsonProperty("dbh")         double dbh,
    @JsonProperty("crownRadius") double crownRadius,
    @JsonProperty("species")     String species,
    @JsonProperty("condition")   String condition,
    @JsonProperty("location")    LocationData location
) {}
