package com.assessmentplatform.common.payload;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Site access ratings on a 1–10 scale. */
public record AccessibilityRating(
    @JsonProperty("vehicleAccess")   int vehicleAccess,
    @JsonProperty("equipmentAccess") int equipmentAccess,
    @JsonProperty("workSpace")       int workSpace,
    @JsonProperty("fallZone")        int fallZone
) {
    /** Used until the operator or a specialist supplies a site-specific rating. */
    public static final AccessibilityRating UNRATED = new AccessibilityRating(8, 7, 6, 5);
}
