package com.assessmentplatform.common.report;

import com.assessmentplatform.common.model.AssessmentReport;

/**
 * Hands a finished {@link AssessmentReport} to persistent storage once the completion
 * pipeline has frozen it into the session.
 *
 * <p>Current implementation: {@code RestCompletedAssessmentPublisher}, a fire-and-forget
 * HTTP POST to the report storage service. The orchestrator depends only on this interface.
 */
public interface CompletedAssessmentPublisher {

    /**
     * Implementations must not block and must not throw; a failed hand-off is logged by the
     * implementation and never affects the session.
     */
    void publish(AssessmentReport report);
}
