package com.assessmentplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Final report frozen into {@link FormData} by the completion pipeline and handed to
 * report storage.
 */
public record AssessmentReport(
    @JsonProperty("id")              String id,
    @JsonProperty("sessionId")       String sessionId,
    @JsonProperty("timestamp")       Instant timestamp,
    @JsonProperty("customerName")    String customerName,
    @JsonProperty("propertyAddress") String propertyAddress,
    @JsonProperty("treeScore")       int treeScore,
    @JsonProperty("measurements")    Map<String, MeasurementResult> measurements,
    @JsonProperty("riskFactors")     List<RiskFactor> riskFactors,
    @JsonProperty("summary")         String summary,
    @JsonProperty("recommendations") List<String> recommendations,
    @JsonProperty("completedBy")     String completedBy
) {}
