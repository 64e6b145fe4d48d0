package com.assessmentplatform.common.trace;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import reactor.util.context.Context;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class TraceContextUtilTest {

    private static Mono<String> idSeen() {
        return Mono.deferContextual(ctx -> Mono.just(TraceContextUtil.getSessionId(ctx)));
    }

    @Test
    @DisplayName("no session id in the context reads as unknown")
    void missingId() {
        assertThat(TraceContextUtil.getSessionId(Context.empty())).isEqualTo(TraceContextUtil.NO_SESSION);
    }

    @Test
    @DisplayName("a snapshot stream sees the session id on every element")
    void fluxCarriesId() {
        Flux<String> stream = Flux.range(1, 3).flatMap(i -> idSeen());

        StepVerifier.create(TraceContextUtil.withSessionId(stream, "session-7"))
            .expectNext("session-7", "session-7", "session-7")
            .verifyComplete();
    }

    @Test
    @DisplayName("detached work keeps the caller's session id when subscribed on its own")
    void detachedKeepsCallerId() {
        Context caller = Context.of(TraceContextUtil.SESSION_ID_KEY, "session-3");

        StepVerifier.create(TraceContextUtil.detached(idSeen(), caller))
            .expectNext("session-3")
            .verifyComplete();
    }

    @Test
    @DisplayName("withMdc always runs the action and leaves MDC clean")
    void mdcCleared() {
        AtomicInteger runs = new AtomicInteger();

        TraceContextUtil.withMdc("session-9", runs::incrementAndGet);
        TraceContextUtil.withMdc(TraceContextUtil.NO_SESSION, runs::incrementAndGet);
        TraceContextUtil.withMdc(Context.empty(), runs::incrementAndGet);

        assertThat(runs).hasValue(3);
        assertThat(MDC.get(TraceContextUtil.SESSION_ID_KEY)).isNull();
    }
}
