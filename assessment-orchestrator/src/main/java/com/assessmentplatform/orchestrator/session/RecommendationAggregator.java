package com.assessmentplatform.orchestrator.session;

import com.assessmentplatform.common.model.Recommendation;
import com.assessmentplatform.common.model.Recommendation.Priority;
import com.assessmentplatform.common.model.Recommendation.Type;
import com.assessmentplatform.common.model.RiskLevel;
import com.assessmentplatform.common.payload.AssessmentReportResponse;
import com.assessmentplatform.common.payload.MeasurementValidationResponse;
import com.assessmentplatform.common.payload.SafetyAnalysisResponse;
import com.assessmentplatform.common.payload.TreeScoreResponse;
import com.assessmentplatform.common.specialist.Specialist;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-session recommendation log.
 *
 * <p>Append-only and safe for concurrent writers: records land in the order their responses
 * arrive, each stamped with the arrival time and the originating specialist. Nothing is
 * de-duplicated and priorities are taken as given. Only a session reset empties it.
 */
public class RecommendationAggregator {

    static final String ERROR_PREFIX = "Agent communication error: ";

    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final List<Recommendation> entries = new ArrayList<>();

    public RecommendationAggregator(Clock clock) {
        this.clock = clock;
    }

    public void appendSafety(SafetyAnalysisResponse response) {
        Priority priority = response.riskLevel() == RiskLevel.CRITICAL ? Priority.CRITICAL : Priority.HIGH;
        appendEach(Type.SAFETY, response.recommendations(), priority, Specialist.SAFETY_MANAGER);
    }

    public void appendTreeScore(TreeScoreResponse response) {
        appendEach(Type.CALCULATION, response.recommendations(), Priority.MEDIUM, Specialist.TREESCORE_CALCULATOR);
    }

    /** Suggested follow-ups from a step validation, whether or not the step passed. */
    public void appendNextActions(List<String> nextActions) {
        appendEach(Type.IMPROVEMENT, nextActions, Priority.MEDIUM, Specialist.FIELD_ASSESSOR);
    }

    public void appendReport(AssessmentReportResponse response) {
        Instant now = clock.instant();
        List<Recommendation> batch = response.recommendations().stream()
            .map(r -> Recommendation.of(Type.RECOMMENDATION, r.description(),
                "high".equalsIgnoreCase(r.priority()) ? Priority.HIGH : Priority.MEDIUM,
                Specialist.CERTIFIED_ARBORIST.id(), now))
            .toList();
        appendAll(batch);
    }

    /**
     * Retake advisory for one capture, tagged with its sequence number so concurrent captures
     * of the same type can be told apart.
     */
    public void appendMeasurementAdvisory(MeasurementValidationResponse response, long captureSequence,
                                          double accuracyThreshold) {
        long pct = Math.round(response.accuracy() * 100);
        Priority priority = response.accuracy() < accuracyThreshold ? Priority.HIGH : Priority.MEDIUM;
        appendAll(List.of(new Recommendation(Type.IMPROVEMENT,
            "Measurement accuracy: " + pct + "%. Consider retaking.", priority,
            Specialist.MEASUREMENT_SPECIALIST.id(), clock.instant(), captureSequence)));
    }

    public void appendError(String errorText) {
        appendAll(List.of(Recommendation.of(Type.ERROR, ERROR_PREFIX + errorText, Priority.HIGH,
            Specialist.SYSTEM.id(), clock.instant())));
    }

    private void appendEach(Type type, List<String> messages, Priority priority, Specialist source) {
        Instant now = clock.instant();
        appendAll(messages.stream()
            .map(m -> Recommendation.of(type, m, priority, source.id(), now))
            .toList());
    }

    private void appendAll(List<Recommendation> batch) {
        if (batch.isEmpty()) return;
        lock.lock();
        try {
            entries.addAll(batch);
        } finally {
            lock.unlock();
        }
    }

    public List<Recommendation> list() {
        lock.lock();
        try {
            return List.copyOf(entries);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }
}
