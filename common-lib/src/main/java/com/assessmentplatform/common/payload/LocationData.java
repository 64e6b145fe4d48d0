package com.assessmentplatform.common.payload;

import com.fasterxml.jackson.annotation.JsonProperty;

public record LocationData(
    @JsonProperty("latitude")      double latitude,
    @JsonProperty("longitude")     double longitude,
    @JsonProperty("address")       String address,
    @JsonProperty("accessibility") AccessibilityRating accessibility
) {
    public static LocationData forAddress(String address) {
        return new LocationData(0.0, 0.0, address, AccessibilityRating.UNRATED);
    }
}
