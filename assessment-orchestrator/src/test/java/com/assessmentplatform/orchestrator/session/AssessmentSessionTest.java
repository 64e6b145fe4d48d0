package com.assessmentplatform.orchestrator.session;

import com.assessmentplatform.common.model.AssessmentSnapshot;
import com.assessmentplatform.common.model.AssessmentStep;
import com.assessmentplatform.common.model.MeasurementType;
import com.assessmentplatform.common.model.RiskLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.stream.IntStream;

import static com.assessmentplatform.orchestrator.session.Fixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

class AssessmentSessionTest {

    private final AssessmentSession session = new AssessmentSession("session-1", CLOCK);

    // ── state ────────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("state transitions")
    class StateTests {

        @Test
        @DisplayName("a new session sits at INITIALIZATION with nothing recorded")
        void initial() {
            AssessmentSnapshot snapshot = session.snapshot();

            assertThat(snapshot.sessionId()).isEqualTo("session-1");
            assertThat(snapshot.currentStep()).isEqualTo(AssessmentStep.INITIALIZATION);
            assertThat(snapshot.progress()).isZero();
            assertThat(snapshot.complete()).isFalse();
            assertThat(snapshot.captureActive()).isFalse();
            assertThat(session.createdAt()).isEqualTo(NOW);
        }

        @Test
        @DisplayName("recordFailure appends both a validation error and an error record")
        void recordFailure() {
            session.recordFailure("HTTP error: 503");
            session.recordFailure("Request timed out");

            assertThat(session.state().validationErrors()).containsExactly("HTTP error: 503", "Request timed out");
            assertThat(session.recommendations()).hasSize(2);
        }

        @Test
        @DisplayName("reset clears everything except a running capture")
        void resetKeepsCapture() {
            session.update(s -> s.withCapture(MeasurementType.DBH)
                    .withFormData(s.formData().withTreeScore(70)),
                agg -> agg.appendSafety(safety(RiskLevel.HIGH, "Hard hats")));

            session.reset();

            assertThat(session.state().activeCapture()).isEqualTo(MeasurementType.DBH);
            assertThat(session.state().formData().treeScore()).isZero();
            assertThat(session.recommendations()).isEmpty();
        }

        @Test
        @DisplayName("updates after discard are ignored")
        void discardedIgnoresUpdates() {
            session.discard();

            session.update(s -> s.withFormData(s.formData().withTreeScore(90)),
                agg -> agg.appendError("late"));

            assertThat(session.isDiscarded()).isTrue();
            assertThat(session.state().formData().treeScore()).isZero();
            assertThat(session.recommendations()).isEmpty();
        }
    }

    // ── navigation latch ─────────────────────────────────────────────────────

    @Nested
    @DisplayName("navigation latch")
    class LatchTests {

        @Test
        @DisplayName("held while work runs, released on completion")
        void heldAndReleased() {
            Sinks.Empty<Void> work = Sinks.empty();

            StepVerifier.create(session.navigate("proceed", work::asMono))
                .then(() -> assertThat(session.isNavigating()).isTrue())
                .then(work::tryEmitEmpty)
                .assertNext(snapshot -> assertThat(snapshot.navigating()).isFalse())
                .verifyComplete();
        }

        @Test
        @DisplayName("second request fails fast with SessionBusyException")
        void busy() {
            session.navigate("proceed", Mono::never).subscribe();

            StepVerifier.create(session.navigate("goBack", Mono::empty))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(SessionBusyException.class);
                    assertThat(((SessionBusyException) e).getSessionId()).isEqualTo("session-1");
                })
                .verify();
        }

        @Test
        @DisplayName("released when the work fails")
        void releasedOnError() {
            StepVerifier.create(session.navigate("proceed", () -> Mono.error(new IllegalStateException("boom"))))
                .expectError(IllegalStateException.class)
                .verify();

            assertThat(session.isNavigating()).isFalse();
        }

        @Test
        @DisplayName("a caller that goes away does not cancel the work; its result is still applied")
        void callerCancelKeepsWork() {
            Sinks.Empty<Void> specialistAnswer = Sinks.empty();
            Supplier<Mono<Void>> work = () -> specialistAnswer.asMono()
                .then(Mono.fromRunnable(() -> session.update(s -> s.withFormData(s.formData().withTreeScore(70)))));

            session.navigate("proceed", work).subscribe().dispose();

            assertThat(session.isNavigating()).isTrue();
            StepVerifier.create(session.navigate("goBack", Mono::empty))
                .expectError(SessionBusyException.class)
                .verify();

            specialistAnswer.tryEmitEmpty();

            assertThat(session.isNavigating()).isFalse();
            assertThat(session.state().formData().treeScore()).isEqualTo(70);
        }
    }

    // ── transition atomicity ─────────────────────────────────────────────────

    @Nested
    @DisplayName("transition atomicity")
    class AtomicityTests {

        @Test
        @DisplayName("every published snapshot shows a state together with the records that came with it")
        void stateAndRecordsTogether() throws InterruptedException {
            List<AssessmentSnapshot> seen = Collections.synchronizedList(new ArrayList<>());
            session.snapshots().subscribe(seen::add);
            ExecutorService pool = Executors.newFixedThreadPool(8);
            CountDownLatch go = new CountDownLatch(1);
            IntStream.range(0, 400).forEach(i -> pool.execute(() -> {
                try {
                    go.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                if (i % 50 == 0) {
                    session.reset();
                } else {
                    session.recordFailure("failure " + i);
                }
            }));

            go.countDown();
            pool.shutdown();
            assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

            synchronized (seen) {
                assertThat(seen).isNotEmpty();
                assertThat(seen).allSatisfy(snapshot ->
                    assertThat(snapshot.recommendations()).hasSameSizeAs(snapshot.validationErrors()));
            }
            AssessmentSnapshot last = session.snapshot();
            assertThat(last.recommendations()).hasSameSizeAs(last.validationErrors());
        }
    }

    // ── snapshot stream ──────────────────────────────────────────────────────

    @Nested
    @DisplayName("snapshot stream")
    class StreamTests {

        @Test
        @DisplayName("replays the latest snapshot, emits per transition and completes on discard")
        void stream() {
            StepVerifier.create(session.snapshots())
                .assertNext(s -> assertThat(s.formData().treeScore()).isZero())
                .then(() -> session.update(s -> s.withFormData(s.formData().withTreeScore(70))))
                .assertNext(s -> assertThat(s.formData().treeScore()).isEqualTo(70))
                .then(session::discard)
                .verifyComplete();
        }

        @Test
        @DisplayName("a late subscriber sees only the current snapshot")
        void lateSubscriber() {
            session.update(s -> s.withFormData(s.formData().withTreeScore(70)));
            session.update(s -> s.withFormData(s.formData().withTreeScore(75)));

            StepVerifier.create(session.snapshots().take(1))
                .assertNext(s -> assertThat(s.formData().treeScore()).isEqualTo(75))
                .verifyComplete();
        }
    }
}
