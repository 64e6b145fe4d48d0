package com.assessmentplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Instant;
import java.util.Locale;

/**
 * Advisory message surfaced to the operator, attributed to the specialist that produced it.
 *
 * <p>Created once and never changed. {@code captureSequence} links a measurement advisory to
 * the capture it was raised for and is {@code null} for every other recommendation.
 */
public record Recommendation(
    @JsonProperty("type")            Type type,
    @JsonProperty("message")         String message,
    @JsonProperty("priority")        Priority priority,
    @JsonProperty("source")          String source,
    @JsonProperty("timestamp")       Instant timestamp,
    @JsonProperty("captureSequence") Long captureSequence
) {

    public enum Type {
        SAFETY, CALCULATION, IMPROVEMENT, ERROR, RECOMMENDATION;

        @JsonValue
        public String id() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static Type fromId(String value) {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    public enum Priority {
        LOW, MEDIUM, HIGH, CRITICAL;

        @JsonValue
        public String id() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static Priority fromId(String value) {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    public static Recommendation of(Type type, String message, Priority priority,
                                    String source, Instant timestamp) {
        return new Recommendation(type, message, priority, source, timestamp, null);
    }
}
