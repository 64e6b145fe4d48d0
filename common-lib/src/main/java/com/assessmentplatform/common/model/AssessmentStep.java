package com.assessmentplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;

/**
 * Fixed, totally ordered sequence of assessment steps.
 *
 * <p>Forward order is chosen by the field-assessor specialist; backward navigation always
 * walks this declaration order one position at a time. Progress is derived from the
 * position in this list and is never stored on its own.
 */
public enum AssessmentStep {
    INITIALIZATION("initialization", "Initialize Assessment", "Setting up assessment parameters"),
    BASIC_MEASUREMENT("basic_measurement", "Basic Measurements", "Measuring height, DBH, and crown"),
    RISK_ASSESSMENT("risk_assessment", "Risk Assessment", "Evaluating safety risks and hazards"),
    TREESCORE_CALCULATION("treescore_calculation", "TreeScore Calculation", "Calculating final TreeScore"),
    COMPLETION("completion", "Complete Assessment", "Finalizing assessment report");

    private final String id;
    private final String displayName;
    private final String description;

    AssessmentStep(String id, String displayName, String description) {
        this.id = id;
        this.displayName = displayName;
        this.description = description;
    }

    @JsonValue
    public String id() {
        return id;
    }

    public String displayName() {
        return displayName;
    }

    public String description() {
        return description;
    }

    public int index() {
        return ordinal();
    }

    /** {@code index / (count - 1)}; 0.0 at INITIALIZATION, 1.0 at COMPLETION. */
    public double progress() {
        return (double) ordinal() / (values().length - 1);
    }

    /** @return the preceding step, or {@code this} when already first */
    public AssessmentStep previous() {
        return ordinal() == 0 ? this : values()[ordinal() - 1];
    }

    public boolean isFirst() {
        return ordinal() == 0;
    }

    /** Wire ids of every step strictly before this one. */
    public List<String> completedBefore() {
        return Arrays.stream(values())
            .limit(ordinal())
            .map(AssessmentStep::id)
            .toList();
    }

    @JsonCreator
    public static AssessmentStep fromId(String value) {
        for (AssessmentStep step : values()) {
            if (step.id.equalsIgnoreCase(value) || step.name().equalsIgnoreCase(value)) {
                return step;
            }
        }
        throw new IllegalArgumentException("Unknown assessment step: " + value);
    }
}
