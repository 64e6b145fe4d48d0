package com.assessmentplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Overall site risk reported by the safety specialist. */
public enum RiskLevel {
    LOW, MEDIUM, HIGH, CRITICAL;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RiskLevel fromId(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
