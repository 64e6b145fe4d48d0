package com.assessmentplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * Specialist-supplied description of one input the operator must provide next.
 * The whole field list is replaced each time the sequencer moves; fields are never merged.
 */
public record DynamicFormField(
    @JsonProperty("id")              String id,
    @JsonProperty("label")           String label,
    @JsonProperty("type")            FieldType type,
    @JsonProperty("required")        boolean required,
    @JsonProperty("options")         List<String> options,
    @JsonProperty("validationRules") List<ValidationRule> validationRules,
    @JsonProperty("helpText")        String helpText
) {

    public DynamicFormField {
        validationRules = validationRules == null ? List.of() : List.copyOf(validationRules);
        options = options == null ? null : List.copyOf(options);
    }

    public enum FieldType {
        TEXT("text"),
        NUMBER("number"),
        BOOLEAN("boolean"),
        SELECT("select"),
        MULTI_SELECT("multiSelect"),
        SLIDER("slider"),
        MEASUREMENT("measurement");

        private final String id;

        FieldType(String id) {
            this.id = id;
        }

        @JsonValue
        public String id() {
            return id;
        }

        public boolean isNumeric() {
            return this == NUMBER || this == SLIDER || this == MEASUREMENT;
        }

        @JsonCreator
        public static FieldType fromId(String value) {
            for (FieldType type : values()) {
                if (type.id.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                    return type;
                }
            }
            throw new IllegalArgumentException("Unknown field type: " + value);
        }
    }
}
