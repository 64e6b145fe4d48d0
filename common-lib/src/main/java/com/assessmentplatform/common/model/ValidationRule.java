package com.assessmentplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * One specialist-authored constraint on a {@link DynamicFormField}. {@code value} is the
 * bound for MIN/MAX, the regular expression for PATTERN and opaque for CUSTOM.
 */
public record ValidationRule(
    @JsonProperty("type")    RuleType type,
    @JsonProperty("value")   Object value,
    @JsonProperty("message") String message
) {

    public enum RuleType {
        REQUIRED, MIN, MAX, PATTERN, CUSTOM;

        @JsonValue
        public String id() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static RuleType fromId(String value) {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }
}
