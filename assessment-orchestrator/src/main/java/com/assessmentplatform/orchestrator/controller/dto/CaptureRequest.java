package com.assessmentplatform.orchestrator.controller.dto;

import com.assessmentplatform.common.model.MeasurementType;
import com.fasterxml.jackson.annotation.JsonProperty;

public record CaptureRequest(@JsonProperty("type") MeasurementType type) {}
