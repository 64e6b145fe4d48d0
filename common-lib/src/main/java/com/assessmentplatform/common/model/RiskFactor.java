package com.assessmentplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public record RiskFactor(
    @JsonProperty("type")        String type,
    @JsonProperty("severity")    Severity severity,
    @JsonProperty("description") String description
) {

    public static final String POWER_LINES = "Power Lines";

    public enum Severity {
        LOW(1), MEDIUM(3), HIGH(5), CRITICAL(10);

        private final int weight;

        Severity(int weight) {
            this.weight = weight;
        }

        /** Contribution of one factor of this severity to the cumulative risk score. */
        public int weight() {
            return weight;
        }

        @JsonValue
        public String id() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static Severity fromId(String value) {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }
}
