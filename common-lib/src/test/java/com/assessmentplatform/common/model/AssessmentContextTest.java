package com.assessmentplatform.common.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AssessmentContextTest {

    @Test
    @DisplayName("initial context is a residential tree removal at INITIALIZATION")
    void initialDefaults() {
        AssessmentContext ctx = AssessmentContext.initial();
        assertEquals(AssessmentStep.INITIALIZATION, ctx.currentStep());
        assertEquals("residential", ctx.customerType());
        assertEquals("tree-removal", ctx.jobType());
        assertTrue(ctx.previousData().isEmpty());
    }

    @Test
    @DisplayName("withClassification replaces only non-blank values")
    void classification() {
        AssessmentContext ctx = AssessmentContext.initial().withClassification("commercial", " ");
        assertEquals("commercial", ctx.customerType());
        assertEquals("tree-removal", ctx.jobType());
    }

    @Test
    @DisplayName("withClassification returns the same instance when nothing changes")
    void unchangedClassification() {
        AssessmentContext ctx = AssessmentContext.initial();
        assertSame(ctx, ctx.withClassification(null, "tree-removal"));
    }

    @Test
    @DisplayName("copy-factories never mutate the original")
    void copiesAreIndependent() {
        AssessmentContext ctx = AssessmentContext.initial();
        AssessmentContext moved = ctx.withStep(AssessmentStep.RISK_ASSESSMENT)
            .withPreviousData(Map.of("height", 80));

        assertEquals(AssessmentStep.INITIALIZATION, ctx.currentStep());
        assertEquals(AssessmentStep.RISK_ASSESSMENT, moved.currentStep());
        assertEquals(80, moved.previousData().get("height"));
    }
}
