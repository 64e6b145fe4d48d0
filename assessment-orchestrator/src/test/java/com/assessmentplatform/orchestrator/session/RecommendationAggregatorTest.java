package com.assessmentplatform.orchestrator.session;

import com.assessmentplatform.common.model.Recommendation;
import com.assessmentplatform.common.model.Recommendation.Priority;
import com.assessmentplatform.common.model.Recommendation.Type;
import com.assessmentplatform.common.model.RiskLevel;
import com.assessmentplatform.common.payload.MeasurementValidationResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

import static com.assessmentplatform.orchestrator.session.Fixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

class RecommendationAggregatorTest {

    private final RecommendationAggregator aggregator = new RecommendationAggregator(CLOCK);

    @Test
    @DisplayName("HIGH risk → one HIGH safety record per recommendation, stamped with arrival time")
    void safetyHigh() {
        aggregator.appendSafety(safety(RiskLevel.HIGH, "Establish drop zone", "Spotter required"));

        List<Recommendation> recs = aggregator.list();
        assertThat(recs).hasSize(2);
        assertThat(recs).allSatisfy(r -> {
            assertThat(r.type()).isEqualTo(Type.SAFETY);
            assertThat(r.priority()).isEqualTo(Priority.HIGH);
            assertThat(r.source()).isEqualTo("safety-manager");
            assertThat(r.timestamp()).isEqualTo(NOW);
            assertThat(r.captureSequence()).isNull();
        });
    }

    @Test
    @DisplayName("LOW risk still maps to HIGH; only CRITICAL escalates")
    void safetyPriorityMapping() {
        aggregator.appendSafety(safety(RiskLevel.LOW, "Wear gloves"));
        aggregator.appendSafety(safety(RiskLevel.CRITICAL, "Call the utility"));

        assertThat(aggregator.list()).extracting(Recommendation::priority)
            .containsExactly(Priority.HIGH, Priority.CRITICAL);
    }

    @Test
    @DisplayName("tree score recommendations are MEDIUM calculations")
    void treeScore() {
        aggregator.appendTreeScore(score(70, "Crown reduction advised"));

        Recommendation rec = aggregator.list().get(0);
        assertThat(rec.type()).isEqualTo(Type.CALCULATION);
        assertThat(rec.priority()).isEqualTo(Priority.MEDIUM);
        assertThat(rec.source()).isEqualTo("treescore-calculator");
    }

    @Test
    @DisplayName("advisory rounds accuracy to a whole percent")
    void advisoryRounding() {
        aggregator.appendMeasurementAdvisory(new MeasurementValidationResponse(0.9, true, 0.786, List.of()), 3, 0.8);

        Recommendation rec = aggregator.list().get(0);
        assertThat(rec.message()).isEqualTo("Measurement accuracy: 79%. Consider retaking.");
        assertThat(rec.priority()).isEqualTo(Priority.HIGH);
        assertThat(rec.captureSequence()).isEqualTo(3L);
    }

    @Test
    @DisplayName("error text is prefixed and attributed to the system")
    void error() {
        aggregator.appendError("Request timed out");

        Recommendation rec = aggregator.list().get(0);
        assertThat(rec.message()).isEqualTo("Agent communication error: Request timed out");
        assertThat(rec.type()).isEqualTo(Type.ERROR);
        assertThat(rec.source()).isEqualTo("system");
    }

    @Test
    @DisplayName("identical records are not de-duplicated")
    void noDedup() {
        aggregator.appendNextActions(List.of("Measure DBH"));
        aggregator.appendNextActions(List.of("Measure DBH"));

        assertThat(aggregator.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("list() is a copy unaffected by later appends")
    void listIsSnapshot() {
        aggregator.appendError("first");
        List<Recommendation> before = aggregator.list();

        aggregator.appendError("second");

        assertThat(before).hasSize(1);
        assertThat(aggregator.list()).hasSize(2);
    }

    @Test
    @DisplayName("concurrent writers lose nothing")
    void concurrentAppends() throws InterruptedException {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch go = new CountDownLatch(1);
        IntStream.range(0, 200).forEach(i -> pool.execute(() -> {
            try {
                go.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            aggregator.appendError("failure " + i);
        }));

        go.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        assertThat(aggregator.size()).isEqualTo(200);
    }
}
