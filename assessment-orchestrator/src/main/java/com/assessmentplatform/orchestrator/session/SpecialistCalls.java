package com.assessmentplatform.orchestrator.session;

import com.assessmentplatform.common.exception.SpecialistException;
import com.assessmentplatform.common.specialist.Specialist;
import reactor.core.publisher.Mono;

/** Shared handling of specialist call results inside the session engine. */
final class SpecialistCalls {

    private SpecialistCalls() {}

    /** An empty answer counts as a failed call, so every call ends in a value or an error. */
    static <T> Mono<T> required(Mono<T> call, Specialist specialist) {
        return Mono.defer(() -> call)
            .switchIfEmpty(Mono.error(() -> new SpecialistException(specialist, "No response data received")));
    }

    /** Text recorded in validation errors and the error recommendation. */
    static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
