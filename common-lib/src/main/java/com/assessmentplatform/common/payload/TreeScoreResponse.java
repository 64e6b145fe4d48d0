package com.assessmentplatform.common.payload;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * TreeScore result. {@code breakdown} and {@code afissScore} are opaque to this service
 * and only passed through.
 */
public record TreeScoreResponse(
    @JsonProperty("confidence")      double confidence,
    @JsonProperty("treeScore")       int treeScore,
    @JsonProperty("breakdown")       Map<String, Object> breakdown,
    @JsonProperty("recommendations") List<String> recommendations,
    @JsonProperty("afissScore")      Map<String, Object> afissScore
) {
    public TreeScoreResponse {
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }
}
