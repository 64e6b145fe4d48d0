package com.assessmentplatform.orchestrator.logger;

import com.assessmentplatform.common.model.AssessmentStep;
import com.assessmentplatform.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Logs the lifecycle of an assessment session inside the reactive pipelines. Pure
 * side-effects; nothing here changes session behavior.
 *
 * <p>Stages:
 * <ol>
 *   <li>{@link #SESSION_STARTED}       start() reset the session</li>
 *   <li>{@link #STEP_VALIDATED}        the field-assessor answered a step validation</li>
 *   <li>{@link #STEP_ENTERED}          a next-step answer was applied</li>
 *   <li>{@link #STEP_BACK}             backward navigation was applied</li>
 *   <li>{@link #SIDE_EFFECT_DISPATCHED} a step-entry analysis was launched</li>
 *   <li>{@link #MEASUREMENT_APPLIED}   a capture value was written into the form data</li>
 *   <li>{@link #REPORT_GENERATED}      the completion pipeline finished</li>
 * </ol>
 *
 * <pre>
 *     .doOnEach(flowLogger.stage(AssessmentFlowLogger.STEP_VALIDATED))
 * </pre>
 */
@Component
public class AssessmentFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(AssessmentFlowLogger.class);

    public static final String SESSION_STARTED        = "SESSION_STARTED";
    public static final String STEP_VALIDATED         = "STEP_VALIDATED";
    public static final String STEP_ENTERED           = "STEP_ENTERED";
    public static final String STEP_BACK              = "STEP_BACK";
    public static final String SIDE_EFFECT_DISPATCHED = "SIDE_EFFECT_DISPATCHED";
    public static final String MEASUREMENT_APPLIED    = "MEASUREMENT_APPLIED";
    public static final String REPORT_GENERATED       = "REPORT_GENERATED";

    /**
     * Returns a {@code doOnEach} consumer that logs the stage on {@code onNext}, reading the
     * session id from the Reactor Context carried by the signal.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String sessionId = TraceContextUtil.getSessionId(signal.getContextView());
            TraceContextUtil.withMdc(signal.getContextView(), () ->
                log.info("[AssessmentFlow] stage={} sessionId={}", stageName, sessionId)
            );
        };
    }

    /** For call sites that already hold the session id. */
    public void logWithSessionId(String stageName, String sessionId) {
        TraceContextUtil.withMdc(sessionId, () ->
            log.info("[AssessmentFlow] stage={} sessionId={}", stageName, sessionId)
        );
    }

    public void logStep(String stageName, String sessionId, AssessmentStep step, double progress) {
        TraceContextUtil.withMdc(sessionId, () ->
            log.info("[AssessmentFlow] stage={} step={} progress={} sessionId={}",
                     stageName, step.id(), progress, sessionId)
        );
    }
}
