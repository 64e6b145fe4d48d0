package com.assessmentplatform.orchestrator.publisher;

import com.assessmentplatform.common.model.AssessmentReport;
import com.assessmentplatform.common.report.CompletedAssessmentPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * REST-based implementation of {@link CompletedAssessmentPublisher}.
 *
 * <p>Posts the report to the report storage service (fire-and-forget). Storage being down
 * never affects the session: the report is already part of the session's form data.
 */
@Component
public class RestCompletedAssessmentPublisher implements CompletedAssessmentPublisher {

    private static final Logger log = LoggerFactory.getLogger(RestCompletedAssessmentPublisher.class);

    private final WebClient reportStorageClient;

    public RestCompletedAssessmentPublisher(WebClient reportStorageClient) {
        this.reportStorageClient = reportStorageClient;
    }

    @Override
    public void publish(AssessmentReport report) {
        reportStorageClient.post()
            .uri("/api/v1/reports")
            .header("X-Trace-Id", report.sessionId())
            .bodyValue(report)
            .retrieve()
            .toBodilessEntity()
            .subscribe(
                r   -> log.info("Assessment report stored. reportId={} sessionId={} status={}",
                                report.id(), report.sessionId(), r.getStatusCode()),
                err -> log.warn("Assessment report storage failed (non-critical). reportId={} sessionId={}",
                                report.id(), report.sessionId(), err)
            );
    }
}
