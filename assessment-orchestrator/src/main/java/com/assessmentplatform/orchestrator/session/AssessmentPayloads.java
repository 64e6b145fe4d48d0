package com.assessmentplatform.orchestrator.session;

import com.assessmentplatform.common.model.FormData;
import com.assessmentplatform.common.model.MeasurementType;
import com.assessmentplatform.common.payload.AccessibilityRating;
import com.assessmentplatform.common.payload.AssessmentData;
import com.assessmentplatform.common.payload.CompleteAssessment;
import com.assessmentplatform.common.payload.LocationData;
import com.assessmentplatform.common.payload.MeasurementContext;
import com.assessmentplatform.common.payload.SafetyAssessmentData;
import com.assessmentplatform.common.payload.TreeMeasurements;

import java.util.List;

/**
 * Builds specialist request payloads from a session's current state.
 *
 * <p>Pure functions of their arguments. Site details the service does not capture yet
 * (GPS position, accessibility, tree condition) go out as fixed defaults.
 */
public final class AssessmentPayloads {

    static final String DEFAULT_TREE_CONDITION = "healthy";

    private AssessmentPayloads() {}

    public static AssessmentData assessmentData(String sessionId, AssessmentState state) {
        FormData form = state.formData();
        return new AssessmentData(
            new AssessmentData.CustomerInfo(form.customerName(), "", "", form.propertyAddress()),
            new AssessmentData.PropertyInfo(form.propertyAddress(), state.context().customerType(),
                AccessibilityRating.UNRATED),
            List.of(treeData(sessionId, form)),
            state.currentStep().id(),
            state.currentStep().completedBefore());
    }

    public static CompleteAssessment completeAssessment(String sessionId, AssessmentState state) {
        FormData form = state.formData();
        return new CompleteAssessment(
            assessmentData(sessionId, state),
            treeMeasurements(form),
            safetyData(form),
            new CompleteAssessment.CalculatedScores(form.treeScore(), form.riskScore()));
    }

    public static TreeMeasurements treeMeasurements(FormData form) {
        return new TreeMeasurements(form.height(), form.dbh(), form.crownRadius(), form.treeSpecies(),
            DEFAULT_TREE_CONDITION, LocationData.forAddress(form.propertyAddress()));
    }

    public static SafetyAssessmentData safetyData(FormData form) {
        return SafetyAssessmentData.forSite(form.propertyAddress(), form.hasPowerLines());
    }

    public static MeasurementContext measurementContext(MeasurementType type, FormData form) {
        return MeasurementContext.of(type, form.treeSpecies());
    }

    /** Measurements are only attached once a height has been recorded. */
    private static AssessmentData.TreeData treeData(String sessionId, FormData form) {
        return new AssessmentData.TreeData(
            sessionId + "-tree-1",
            form.treeSpecies(),
            form.height() > 0 ? treeMeasurements(form) : null,
            DEFAULT_TREE_CONDITION,
            form.riskFactors());
    }
}
