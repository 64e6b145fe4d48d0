package com.assessmentplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Accumulated operator-entered and specialist-derived values for one assessment.
 *
 * <p>Immutable; the session replaces the whole record in one atomic transition.
 * Measurement fields carry the capture that produced them in {@link #measurements()},
 * keyed by {@link MeasurementType#id()}. A value entered by hand drops that provenance.
 */
public record FormData(
    @JsonProperty("customerName")    String customerName,
    @JsonProperty("propertyAddress") String propertyAddress,
    @JsonProperty("treeSpecies")     String treeSpecies,
    @JsonProperty("height")          double height,
    @JsonProperty("dbh")             double dbh,
    @JsonProperty("crownRadius")     double crownRadius,
    @JsonProperty("measurements")    Map<String, MeasurementResult> measurements,
    @JsonProperty("riskFactors")     List<RiskFactor> riskFactors,
    @JsonProperty("treeScore")       int treeScore,
    @JsonProperty("additionalNotes") String additionalNotes,
    @JsonProperty("answers")         Map<String, Object> answers,
    @JsonProperty("report")          AssessmentReport report
) {

    public FormData {
        customerName    = customerName == null ? "" : customerName;
        propertyAddress = propertyAddress == null ? "" : propertyAddress;
        treeSpecies     = treeSpecies == null ? "" : treeSpecies;
        additionalNotes = additionalNotes == null ? "" : additionalNotes;
        measurements    = measurements == null ? Map.of() : Map.copyOf(measurements);
        riskFactors     = riskFactors == null ? List.of() : List.copyOf(riskFactors);
        answers         = answers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(answers));
    }

    public static FormData empty() {
        return new FormData("", "", "", 0, 0, 0, Map.of(), List.of(), 0, "", Map.of(), null);
    }

    public double valueOf(MeasurementType type) {
        return switch (type) {
            case HEIGHT       -> height;
            case DBH          -> dbh;
            case CROWN_RADIUS -> crownRadius;
        };
    }

    /** True when the field's current value came from a capture rather than manual entry. */
    public boolean isMeasured(MeasurementType type) {
        return measurements.containsKey(type.id());
    }

    /** Sum of severity weights across all recorded risk factors. */
    @JsonIgnore
    public int riskScore() {
        return riskFactors.stream().mapToInt(f -> f.severity().weight()).sum();
    }

    @JsonIgnore
    public boolean hasPowerLines() {
        return riskFactors.stream().anyMatch(f -> RiskFactor.POWER_LINES.equals(f.type()));
    }

    // ── copy-factories ───────────────────────────────────────────────────────

    /** Applies a capture value and records the capture as provenance. */
    public FormData withMeasurement(MeasurementResult result) {
        Map<String, MeasurementResult> captured = new HashMap<>(measurements);
        captured.put(result.type().id(), result);
        return withValue(result.type(), result.value(), captured);
    }

    /** Applies a hand-entered value; any capture provenance for the field is dropped. */
    public FormData withManualValue(MeasurementType type, double value) {
        Map<String, MeasurementResult> captured = new HashMap<>(measurements);
        captured.remove(type.id());
        return withValue(type, value, captured);
    }

    private FormData withValue(MeasurementType type, double value, Map<String, MeasurementResult> captured) {
        double h = type == MeasurementType.HEIGHT ? value : height;
        double d = type == MeasurementType.DBH ? value : dbh;
        double c = type == MeasurementType.CROWN_RADIUS ? value : crownRadius;
        return new FormData(customerName, propertyAddress, treeSpecies, h, d, c, captured,
            riskFactors, treeScore, additionalNotes, answers, report);
    }

    public FormData withCustomerName(String value) {
        return new FormData(value, propertyAddress, treeSpecies, height, dbh, crownRadius, measurements,
            riskFactors, treeScore, additionalNotes, answers, report);
    }

    public FormData withPropertyAddress(String value) {
        return new FormData(customerName, value, treeSpecies, height, dbh, crownRadius, measurements,
            riskFactors, treeScore, additionalNotes, answers, report);
    }

    public FormData withTreeSpecies(String value) {
        return new FormData(customerName, propertyAddress, value, height, dbh, crownRadius, measurements,
            riskFactors, treeScore, additionalNotes, answers, report);
    }

    public FormData withAdditionalNotes(String value) {
        return new FormData(customerName, propertyAddress, treeSpecies, height, dbh, crownRadius, measurements,
            riskFactors, treeScore, value, answers, report);
    }

    public FormData withRiskFactors(List<RiskFactor> value) {
        return new FormData(customerName, propertyAddress, treeSpecies, height, dbh, crownRadius, measurements,
            value, treeScore, additionalNotes, answers, report);
    }

    public FormData withTreeScore(int value) {
        return new FormData(customerName, propertyAddress, treeSpecies, height, dbh, crownRadius, measurements,
            riskFactors, value, additionalNotes, answers, report);
    }

    public FormData withAnswer(String fieldId, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(answers);
        merged.put(fieldId, value);
        return new FormData(customerName, propertyAddress, treeSpecies, height, dbh, crownRadius, measurements,
            riskFactors, treeScore, additionalNotes, merged, report);
    }

    public FormData withReport(AssessmentReport value) {
        return new FormData(customerName, propertyAddress, treeSpecies, height, dbh, crownRadius, measurements,
            riskFactors, treeScore, additionalNotes, answers, value);
    }
}
