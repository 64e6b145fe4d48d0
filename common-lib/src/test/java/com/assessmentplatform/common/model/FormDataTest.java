package com.assessmentplatform.common.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FormDataTest {

    private static MeasurementResult capture(MeasurementType type, double value) {
        return new MeasurementResult(type, value, "ft", 0.9, Instant.parse("2026-05-01T10:00:00Z"), Map.of());
    }

    // ── measurement provenance ───────────────────────────────────────────────

    @Nested
    @DisplayName("measurements")
    class MeasurementTests {

        @Test
        @DisplayName("a capture sets the value and keeps the raw result")
        void captureRecordsProvenance() {
            MeasurementResult height = capture(MeasurementType.HEIGHT, 62.0);
            FormData data = FormData.empty().withMeasurement(height);

            assertEquals(62.0, data.height());
            assertTrue(data.isMeasured(MeasurementType.HEIGHT));
            assertSame(height, data.measurements().get("height"));
            assertFalse(data.isMeasured(MeasurementType.DBH));
        }

        @Test
        @DisplayName("a manual value replaces the capture and drops its provenance")
        void manualValueDropsProvenance() {
            FormData data = FormData.empty()
                .withMeasurement(capture(MeasurementType.DBH, 18.0))
                .withManualValue(MeasurementType.DBH, 20.5);

            assertEquals(20.5, data.dbh());
            assertFalse(data.isMeasured(MeasurementType.DBH));
        }

        @Test
        @DisplayName("writing one field leaves the other measurements alone")
        void otherFieldsUntouched() {
            FormData data = FormData.empty()
                .withMeasurement(capture(MeasurementType.HEIGHT, 40.0))
                .withMeasurement(capture(MeasurementType.CROWN_RADIUS, 12.0));

            assertEquals(40.0, data.valueOf(MeasurementType.HEIGHT));
            assertEquals(12.0, data.valueOf(MeasurementType.CROWN_RADIUS));
            assertEquals(0.0, data.valueOf(MeasurementType.DBH));
            assertEquals(2, data.measurements().size());
        }
    }

    // ── risk ─────────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("riskScore()")
    class RiskScoreTests {

        @Test
        @DisplayName("empty → 0")
        void emptyIsZero() {
            assertEquals(0, FormData.empty().riskScore());
        }

        @Test
        @DisplayName("sums severity weights 1 / 3 / 5 / 10")
        void sumsWeights() {
            FormData data = FormData.empty().withRiskFactors(List.of(
                new RiskFactor(RiskFactor.POWER_LINES, RiskFactor.Severity.CRITICAL, "Primary line over crown"),
                new RiskFactor("Deadwood", RiskFactor.Severity.HIGH, null),
                new RiskFactor("Lean", RiskFactor.Severity.MEDIUM, null),
                new RiskFactor("Root heave", RiskFactor.Severity.LOW, null)));

            assertEquals(19, data.riskScore());
            assertTrue(data.hasPowerLines());
        }
    }

    @Test
    @DisplayName("answers accumulate without touching typed fields")
    void answersAccumulate() {
        FormData data = FormData.empty()
            .withAnswer("accessNotes", "Gate code 1234")
            .withAnswer("stumpRemoval", true);

        assertEquals(Map.of("accessNotes", "Gate code 1234", "stumpRemoval", true), data.answers());
        assertEquals("", data.customerName());
    }

    @Test
    @DisplayName("null collections are normalized to empty")
    void nullsNormalized() {
        FormData data = new FormData(null, null, null, 0, 0, 0, null, null, 0, null, null, null);
        assertEquals("", data.propertyAddress());
        assertTrue(data.measurements().isEmpty());
        assertTrue(data.riskFactors().isEmpty());
        assertNull(data.report());
    }
}
