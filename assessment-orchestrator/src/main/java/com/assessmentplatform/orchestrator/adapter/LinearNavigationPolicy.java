package com.assessmentplatform.orchestrator.adapter;

import com.assessmentplatform.common.model.AssessmentContext;
import com.assessmentplatform.common.specialist.NavigationPolicy;
import reactor.core.publisher.Mono;

/**
 * Local stand-in for a navigation policy service: stepping back is allowed from every
 * step except the first.
 */
public class LinearNavigationPolicy implements NavigationPolicy {

    @Override
    public Mono<Boolean> mayStepBack(AssessmentContext context) {
        return Mono.fromSupplier(() -> !context.currentStep().isFirst());
    }
}
