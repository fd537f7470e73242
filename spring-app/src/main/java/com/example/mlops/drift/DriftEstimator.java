package com.example.mlops.drift;

import com.example.mlops.RetrainProperties;
import com.example.mlops.dto.FeatureVector;
import com.example.mlops.exception.InsufficientSampleException;
import com.example.mlops.reference.CategoricalSummary;
import com.example.mlops.reference.FeatureSummary;
import com.example.mlops.reference.NumericSummary;
import com.example.mlops.reference.ReferenceDistribution;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Scores a window of live inference inputs against a frozen reference distribution.
 *
 * <h2>Distances</h2>
 * <ul>
 *   <li><b>Numeric</b> – population stability index over the reference's quantile bins:
 *       {@code PSI = Σ (a_i - e_i) · ln(a_i / e_i)}. Empty bins are smoothed with
 *       {@value #EPSILON} on both sides. Every term is non-negative, so the score is
 *       zero exactly when the binned shares agree and grows with the divergence.
 *       The usual reading is: below 0.1 stable, 0.1–0.2 moderate, above 0.2 significant.</li>
 *   <li><b>Categorical</b> – total-variation distance {@code ½ Σ |p_ref(c) - p_cur(c)|};
 *       categories never seen in the reference count in full.</li>
 * </ul>
 *
 * <h2>Missing values</h2>
 * A value absent from a vector is skipped for that feature only. A feature observed in
 * fewer than {@code minSampleSize} vectors is left out of the report; if that leaves no
 * feature at all (e.g. serving renamed its columns) the evaluation is refused rather than
 * reported as zero drift.
 *
 * <h2>Thread-safety</h2>
 * Stateless apart from configuration; safe to share.
 */
@Component
@Slf4j
public class DriftEstimator {

    static final double EPSILON = 1e-4;

    private final int minSampleSize;
    private final FeatureAggregation aggregation;
    private final Clock clock;

    @Autowired
    public DriftEstimator(RetrainProperties props, Clock clock) {
        this(props.getMinSampleSize(), props.getFeatureAggregation(), clock);
    }

    public DriftEstimator(int minSampleSize, FeatureAggregation aggregation, Clock clock) {
        if (minSampleSize < 1) throw new IllegalArgumentException("minSampleSize must be >= 1");
        this.minSampleSize = minSampleSize;
        this.aggregation = aggregation;
        this.clock = clock;
    }

    /**
     * Compute a {@link DriftReport} for {@code sample} against {@code reference}.
     *
     * @throws InsufficientSampleException if the sample holds fewer vectors than the configured minimum,
     *                                     or no reference feature is observed in at least that many vectors
     */
    public DriftReport evaluate(ReferenceDistribution reference, List<FeatureVector> sample) {
        int size = sample == null ? 0 : sample.size();
        if (size < minSampleSize) {
            throw new InsufficientSampleException(minSampleSize, size);
        }

        Map<String, Double> scores = new LinkedHashMap<>();
        int bestObserved = 0;
        for (Map.Entry<String, FeatureSummary> e : reference.features().entrySet()) {
            String name = e.getKey();
            FeatureSummary summary = e.getValue();
            if (summary instanceof NumericSummary numeric) {
                double[] values = numericValues(name, sample);
                bestObserved = Math.max(bestObserved, values.length);
                if (enough(name, values.length)) {
                    scores.put(name, psi(numeric.proportions(), numeric.proportionsOf(values)));
                }
            } else if (summary instanceof CategoricalSummary categorical) {
                List<String> values = categoricalValues(name, sample);
                bestObserved = Math.max(bestObserved, values.size());
                if (enough(name, values.size())) {
                    scores.put(name, totalVariation(categorical.frequencies(), CategoricalSummary.frequenciesOf(values)));
                }
            } else {
                throw new IllegalArgumentException("Unsupported summary for feature " + name + ": " + summary);
            }
        }
        if (scores.isEmpty()) {
            throw new InsufficientSampleException("No reference feature of v" + reference.modelVersion()
                    + " observed in " + minSampleSize + " inputs (best: " + bestObserved + " of " + size + ")",
                    minSampleSize, bestObserved);
        }

        return new DriftReport(
                reference.modelVersion(),
                scores,
                aggregation.apply(scores.values()),
                clock.instant(),
                size);
    }

    private boolean enough(String feature, int observed) {
        if (observed >= minSampleSize) return true;
        if (observed > 0) {
            log.debug("Feature {} observed in {} inputs (< {}); left out of the report", feature, observed, minSampleSize);
        }
        return false;
    }

    private static double[] numericValues(String name, List<FeatureVector> sample) {
        return sample.stream()
                .map(v -> v.numeric().get(name))
                .filter(x -> x != null && !x.isNaN())
                .mapToDouble(Double::doubleValue)
                .toArray();
    }

    private static List<String> categoricalValues(String name, List<FeatureVector> sample) {
        List<String> values = new ArrayList<>();
        for (FeatureVector v : sample) {
            String c = v.categorical().get(name);
            if (c != null) values.add(c);
        }
        return values;
    }

    static double psi(double[] expected, double[] actual) {
        double sum = 0.0;
        for (int i = 0; i < expected.length; i++) {
            double e = Math.max(expected[i], EPSILON);
            double a = Math.max(actual[i], EPSILON);
            sum += (a - e) * Math.log(a / e);
        }
        return Math.max(0.0, sum);
    }

    static double totalVariation(Map<String, Double> reference, Map<String, Double> current) {
        Set<String> categories = new HashSet<>(reference.keySet());
        categories.addAll(current.keySet());
        double sum = 0.0;
        for (String c : categories) {
            sum += Math.abs(reference.getOrDefault(c, 0.0) - current.getOrDefault(c, 0.0));
        }
        return sum / 2.0;
    }
}
