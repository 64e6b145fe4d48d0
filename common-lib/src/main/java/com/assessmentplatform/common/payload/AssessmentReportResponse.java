package com.assessmentplatform.common.payload;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record AssessmentReportResponse(
    @JsonProperty("confidence")      double confidence,
    @JsonProperty("report")          GeneratedReport report,
    @JsonProperty("recommendations") List<ProfessionalRecommendation> recommendations,
    @JsonProperty("followUpActions") List<String> followUpActions
) {

    public record GeneratedReport(
        @JsonProperty("title")   String title,
        @JsonProperty("summary") String summary,
        @JsonProperty("body")    String body
    ) {}

    /** {@code priority} is the specialist's own label ("high", "medium", ...). */
    public record ProfessionalRecommendation(
        @JsonProperty("description") String description,
        @JsonProperty("priority")    String priority,
        @JsonProperty("category")    String category
    ) {}

    public AssessmentReportResponse {
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
        followUpActions = followUpActions == null ? List.of() : List.copyOf(followUpActions);
    }
}
