package com.assessmentplatform.common.specialist;

import com.assessmentplatform.common.model.AssessmentContext;
import reactor.core.publisher.Mono;

/**
 * Decides whether the operator may step back from the context's current step.
 *
 * <p>Shaped like a specialist call so a remote policy service can replace the local
 * implementation without touching the sequencer. An error signal is handled like any
 * other specialist failure.
 */
public interface NavigationPolicy {

    Mono<Boolean> mayStepBack(AssessmentContext context);
}
