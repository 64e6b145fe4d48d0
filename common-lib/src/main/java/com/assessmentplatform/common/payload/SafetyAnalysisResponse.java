package com.assessmentplatform.common.payload;

import com.assessmentplatform.common.model.RiskLevel;
import com.assessmentplatform.common.model.SafetyProtocol;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record SafetyAnalysisResponse(
    @JsonProperty("confidence")        double confidence,
    @JsonProperty("riskLevel")         RiskLevel riskLevel,
    @JsonProperty("identifiedRisks")   List<String> identifiedRisks,
    @JsonProperty("requiredProtocols") List<SafetyProtocol> requiredProtocols,
    @JsonProperty("recommendations")   List<String> recommendations
) {
    public SafetyAnalysisResponse {
        identifiedRisks   = identifiedRisks == null ? List.of() : List.copyOf(identifiedRisks);
        requiredProtocols = requiredProtocols == null ? List.of() : List.copyOf(requiredProtocols);
        recommendations   = recommendations == null ? List.of() : List.copyOf(recommendations);
    }
}
