package com.assessmentplatform.orchestrator.session;

import com.assessmentplatform.common.model.AssessmentSnapshot;
import com.assessmentplatform.common.model.Recommendation;
import com.assessmentplatform.common.trace.TraceContextUtil;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * One operator's assessment: current state, recommendation log, navigation latch and
 * snapshot stream.
 *
 * <p>Every mutation is a single {@code updateAndGet} on the state reference, its
 * recommendations and one snapshot emission, all under one transition lock, so a snapshot
 * never shows a state without the records that came with it. Once {@link #discard() discarded},
 * late results from in-flight specialist calls are dropped.
 *
 * <p>Navigation work runs detached from whoever requested it. A caller that goes away
 * (an HTTP client disconnecting) does not cancel the specialist call; its result is still
 * applied and the latch is released only when the work ends.
 */
public class AssessmentSession {

    private final String id;
    private final Instant createdAt;
    private final RecommendationAggregator recommendations;
    private final AtomicReference<AssessmentState> state = new AtomicReference<>(AssessmentState.initial());
    private final AtomicBoolean navigating = new AtomicBoolean();
    private final AtomicLong captureSequence = new AtomicLong();
    private final Sinks.Many<AssessmentSnapshot> snapshotSink = Sinks.many().replay().latest();
    private final ReentrantLock transitionLock = new ReentrantLock();
    private volatile boolean discarded;

    public AssessmentSession(String id, Clock clock) {
        this.id = id;
        this.createdAt = clock.instant();
        this.recommendations = new RecommendationAggregator(clock);
        publish();
    }

    public String id() {
        return id;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public AssessmentState state() {
        return state.get();
    }

    public List<Recommendation> recommendations() {
        return recommendations.list();
    }

    public boolean isNavigating() {
        return navigating.get();
    }

    public boolean isDiscarded() {
        return discarded;
    }

    // ── transitions ──────────────────────────────────────────────────────────

    public AssessmentState update(UnaryOperator<AssessmentState> transition) {
        return update(transition, agg -> { });
    }

    /** Applies a state transition and its recommendations, then emits one snapshot. */
    public AssessmentState update(UnaryOperator<AssessmentState> transition,
                                  Consumer<RecommendationAggregator> append) {
        transitionLock.lock();
        try {
            if (discarded) {
                return state.get();
            }
            AssessmentState next = state.updateAndGet(transition);
            append.accept(recommendations);
            publish();
            return next;
        } finally {
            transitionLock.unlock();
        }
    }

    public void recommend(Consumer<RecommendationAggregator> append) {
        update(UnaryOperator.identity(), append);
    }

    /** Records a failed specialist call: the text joins the validation errors, plus one error record. */
    public void recordFailure(String errorText) {
        update(s -> s.withValidationError(errorText), agg -> agg.appendError(errorText));
    }

    /**
     * Back to the initial state with an empty recommendation log. A running capture session
     * belongs to the capture subsystem and survives the reset.
     */
    void reset() {
        transitionLock.lock();
        try {
            if (discarded) return;
            state.updateAndGet(s -> AssessmentState.initial().withCapture(s.activeCapture()));
            recommendations.clear();
            publish();
        } finally {
            transitionLock.unlock();
        }
    }

    public long nextCaptureSequence() {
        return captureSequence.incrementAndGet();
    }

    // ── navigation latch ─────────────────────────────────────────────────────

    /**
     * Runs {@code work} while holding the navigation latch and completes with the snapshot
     * taken after the latch is released. Fails fast with {@link SessionBusyException} when
     * another navigation request is still running.
     *
     * <p>The work is subscribed on its own; cancelling the returned {@code Mono} only stops
     * the caller from waiting for it.
     */
    public Mono<AssessmentSnapshot> navigate(String operation, Supplier<Mono<Void>> work) {
        Mono<AssessmentSnapshot> pipeline = Mono.deferContextual(callerContext -> {
            if (!navigating.compareAndSet(false, true)) {
                return Mono.error(new SessionBusyException(id, operation));
            }
            publish();
            Sinks.One<AssessmentSnapshot> outcome = Sinks.one();
            TraceContextUtil.detached(Mono.defer(work), callerContext)
                .doOnTerminate(this::endNavigation)
                .then(Mono.fromSupplier(this::snapshot))
                .subscribe(outcome::tryEmitValue, outcome::tryEmitError);
            return outcome.asMono();
        });
        return TraceContextUtil.withSessionId(pipeline, id);
    }

    private void endNavigation() {
        if (navigating.compareAndSet(true, false)) {
            publish();
        }
    }

    // ── snapshots ────────────────────────────────────────────────────────────

    public AssessmentSnapshot snapshot() {
        AssessmentState s;
        List<Recommendation> recs;
        transitionLock.lock();
        try {
            s = state.get();
            recs = recommendations.list();
        } finally {
            transitionLock.unlock();
        }
        return new AssessmentSnapshot(id, s.currentStep(), s.progress(), s.complete(), s.readyForCompletion(),
            navigating.get(), s.captureActive(), s.formData(), s.dynamicFormFields(), s.currentInstructions(),
            s.realTimeGuidance(), s.safetyProtocols(), s.validationErrors(), recs, s.decisions().size());
    }

    /** Latest snapshot on subscribe, then one per transition; completes when the session is discarded. */
    public Flux<AssessmentSnapshot> snapshots() {
        return TraceContextUtil.withSessionId(snapshotSink.asFlux(), id);
    }

    public void discard() {
        transitionLock.lock();
        try {
            discarded = true;
            snapshotSink.tryEmitComplete();
        } finally {
            transitionLock.unlock();
        }
    }

    private void publish() {
        transitionLock.lock();
        try {
            if (discarded) return;
            snapshotSink.tryEmitNext(snapshot());
        } finally {
            transitionLock.unlock();
        }
    }
}
