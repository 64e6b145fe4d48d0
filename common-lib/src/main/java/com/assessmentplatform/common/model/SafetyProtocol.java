package com.assessmentplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record SafetyProtocol(
    @JsonProperty("id")          String id,
    @JsonProperty("name")        String name,
    @JsonProperty("description") String description,
    @JsonProperty("mandatory")   boolean mandatory,
    @JsonProperty("equipment")   List<String> equipment
) {}
