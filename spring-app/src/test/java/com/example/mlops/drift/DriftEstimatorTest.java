package com.example.mlops.drift;

import com.example.mlops.dto.FeatureVector;
import com.example.mlops.exception.InsufficientSampleException;
import com.example.mlops.reference.CategoricalSummary;
import com.example.mlops.reference.FeatureSummary;
import com.example.mlops.reference.NumericSummary;
import com.example.mlops.reference.ReferenceDistribution;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class DriftEstimatorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-01T00:00:00Z"), ZoneOffset.UTC);

    private final DriftEstimator estimator = new DriftEstimator(100, FeatureAggregation.MAX, CLOCK);

    @Test
    void sameDistribution_scoresBelowThreshold() {
        ReferenceDistribution ref = reference(uniform(new Random(42), 2000, 0, 10));

        DriftReport report = estimator.evaluate(ref, uniform(new Random(7), 1000, 0, 10));

        assertThat(report.aggregateScore()).isLessThan(0.2);
        assertThat(report.modelVersion()).isEqualTo(1L);
        assertThat(report.sampleSize()).isEqualTo(1000);
        assertThat(report.evaluatedAt()).isEqualTo(CLOCK.instant());
    }

    @Test
    void shiftedDistribution_scoresAboveThreshold() {
        ReferenceDistribution ref = reference(uniform(new Random(42), 2000, 0, 10));

        DriftReport report = estimator.evaluate(ref, uniform(new Random(7), 1000, 50, 60));

        assertThat(report.aggregateScore()).isGreaterThan(0.2);
        assertThat(report.exceeds(0.2)).isTrue();
    }

    @Test
    void identicalSample_scoresZero() {
        List<FeatureVector> values = uniform(new Random(42), 500, 0, 10);
        ReferenceDistribution ref = reference(values);

        DriftReport report = estimator.evaluate(ref, values);

        assertThat(report.featureScores().get("x")).isCloseTo(0.0, within(1e-12));
    }

    @Test
    void stableData_scoreShrinksWithSampleSize() {
        ReferenceDistribution ref = reference(uniform(new Random(42), 20_000, 0, 10));
        DriftEstimator small = new DriftEstimator(10, FeatureAggregation.MAX, CLOCK);

        double s200 = small.evaluate(ref, uniform(new Random(1), 200, 0, 10)).aggregateScore();
        double s20000 = small.evaluate(ref, uniform(new Random(1), 20_000, 0, 10)).aggregateScore();

        assertThat(s20000).isLessThan(s200);
        assertThat(s20000).isLessThan(0.01);
    }

    @Test
    void tooFewInputs_throwInsufficientSample() {
        ReferenceDistribution ref = reference(uniform(new Random(42), 500, 0, 10));

        assertThatThrownBy(() -> estimator.evaluate(ref, uniform(new Random(1), 99, 0, 10)))
                .isInstanceOf(InsufficientSampleException.class)
                .satisfies(e -> {
                    InsufficientSampleException ise = (InsufficientSampleException) e;
                    assertThat(ise.getRequired()).isEqualTo(100);
                    assertThat(ise.getActual()).isEqualTo(99);
                });
    }

    @Test
    void categorical_usesTotalVariation() {
        ReferenceDistribution ref = new ReferenceDistribution(3L,
                Map.of("zone", CategoricalSummary.fromValues(List.of("a", "a", "b", "b"))), CLOCK.instant());
        List<FeatureVector> sample = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            sample.add(new FeatureVector(Map.of(), Map.of("zone", i < 50 ? "a" : "c")));
        }

        DriftReport report = estimator.evaluate(ref, sample);

        // |0.5-0.5| + |0.5-0| + |0-0.5| = 1.0, halved
        assertThat(report.featureScores().get("zone")).isCloseTo(0.5, within(1e-12));
    }

    @Test
    void featureAbsentFromSample_isLeftOut() {
        ReferenceDistribution ref = new ReferenceDistribution(1L, Map.of(
                "x", NumericSummary.fromValues(values(uniform(new Random(42), 500, 0, 10)), 10),
                "zone", CategoricalSummary.fromValues(List.of("a", "b"))), CLOCK.instant());

        DriftReport report = estimator.evaluate(ref, uniform(new Random(1), 200, 0, 10));

        assertThat(report.featureScores()).containsOnlyKeys("x");
    }

    @Test
    void sparselyObservedFeature_isNotScored() {
        ReferenceDistribution ref = new ReferenceDistribution(1L, Map.of(
                "x", NumericSummary.fromValues(values(uniform(new Random(42), 2000, 0, 10)), 10),
                "zone", CategoricalSummary.fromValues(List.of("a", "b"))), CLOCK.instant());
        List<FeatureVector> sample = new ArrayList<>();
        sample.add(FeatureVector.ofNumeric(Map.of("x", 55.0)));
        for (int i = 0; i < 199; i++) {
            sample.add(new FeatureVector(Map.of(), Map.of("zone", i % 2 == 0 ? "a" : "b")));
        }

        DriftReport report = estimator.evaluate(ref, sample);

        assertThat(report.featureScores()).containsOnlyKeys("zone");
        assertThat(report.aggregateScore()).isLessThan(0.2);
    }

    @Test
    void noReferenceFeatureObserved_refusesToScore() {
        ReferenceDistribution ref = reference(uniform(new Random(42), 2000, 0, 10));
        List<FeatureVector> renamed = new ArrayList<>();
        for (int i = 0; i < 200; i++) renamed.add(FeatureVector.ofNumeric(Map.of("renamed_x", 55.0)));

        assertThatThrownBy(() -> estimator.evaluate(ref, renamed))
                .isInstanceOf(InsufficientSampleException.class)
                .hasMessageContaining("No reference feature");
    }

    @Test
    void meanAggregation_averagesFeatureScores() {
        Map<String, FeatureSummary> features = Map.of(
                "stable", CategoricalSummary.fromValues(List.of("a", "b")),
                "moved", CategoricalSummary.fromValues(List.of("a", "b")));
        ReferenceDistribution ref = new ReferenceDistribution(1L, features, CLOCK.instant());
        List<FeatureVector> sample = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            sample.add(new FeatureVector(Map.of(), Map.of("stable", i % 2 == 0 ? "a" : "b", "moved", "z")));
        }

        DriftReport max = estimator.evaluate(ref, sample);
        DriftReport mean = new DriftEstimator(100, FeatureAggregation.MEAN, CLOCK).evaluate(ref, sample);

        assertThat(max.aggregateScore()).isCloseTo(1.0, within(1e-12));
        assertThat(mean.aggregateScore()).isCloseTo(0.5, within(1e-12));
    }

    @Test
    void psi_isNonNegativeAndZeroOnlyForEqualShares() {
        double[] e = {0.25, 0.25, 0.25, 0.25};

        assertThat(DriftEstimator.psi(e, e)).isZero();
        assertThat(DriftEstimator.psi(e, new double[]{0.4, 0.1, 0.25, 0.25})).isPositive();
        assertThat(DriftEstimator.psi(e, new double[]{0.0, 0.0, 0.0, 1.0})).isGreaterThan(1.0);
    }

    /* ===================== helpers ===================== */

    private static ReferenceDistribution reference(List<FeatureVector> values) {
        return new ReferenceDistribution(1L, ReferenceDistribution.summarize(values, 10), CLOCK.instant());
    }

    private static List<FeatureVector> uniform(Random rnd, int n, double lo, double hi) {
        List<FeatureVector> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            out.add(FeatureVector.ofNumeric(Map.of("x", lo + rnd.nextDouble() * (hi - lo))));
        }
        return out;
    }

    private static double[] values(List<FeatureVector> vectors) {
        return vectors.stream().mapToDouble(v -> v.numeric().get("x")).toArray();
    }
}
