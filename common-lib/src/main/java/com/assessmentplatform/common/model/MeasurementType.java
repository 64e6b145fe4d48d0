package com.assessmentplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of capture the measurement subsystem produces. The id doubles as the
 * {@link FormData} field name the value is written to.
 */
public enum MeasurementType {
    HEIGHT("height"),
    DBH("dbh"),
    CROWN_RADIUS("crownRadius");

    private final String id;

    MeasurementType(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }

    @JsonCreator
    public static MeasurementType fromId(String value) {
        for (MeasurementType type : values()) {
            if (type.id.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown measurement type: " + value);
    }

    /** @return the type whose form field id is {@code fieldId}, or {@code null} */
    public static MeasurementType forField(String fieldId) {
        for (MeasurementType type : values()) {
            if (type.id.equals(fieldId)) {
                return type;
            }
        }
        return null;
    }
}
