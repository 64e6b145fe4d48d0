package com.assessmentplatform.common.payload;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record MeasurementGuidanceResponse(
    @JsonProperty("confidence")   double confidence,
    @JsonProperty("instructions") Instructions instructions,
    @JsonProperty("tips")         List<String> tips
) {

    public record Instructions(
        @JsonProperty("primaryInstruction") String primaryInstruction,
        @JsonProperty("steps")              List<String> steps
    ) {}

    public MeasurementGuidanceResponse {
        tips = tips == null ? List.of() : List.copyOf(tips);
    }

    public String primaryInstruction() {
        return instructions == null || instructions.primaryInstruction() == null
            ? "" : instructions.primaryInstruction();
    }
}
