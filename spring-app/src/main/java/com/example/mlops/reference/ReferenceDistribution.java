package com.example.mlops.reference;

import com.example.mlops.dto.FeatureVector;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable baseline feature distribution captured for one model version.
 *
 * <p>
 * A new instance is created for every promoted version; an existing one is
 * never modified. Drift is always measured against the distribution that
 * belongs to the version that was ACTIVE when the report was produced.
 * </p>
 *
 * @param modelVersion version the baseline belongs to
 * @param features     feature name to its summary
 * @param capturedAt   capture time
 */
public record ReferenceDistribution(
        long modelVersion,
        Map<String, FeatureSummary> features,
        Instant capturedAt) {

    public ReferenceDistribution {
        features = features == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(features));
    }

    /**
     * Summarize every feature present in {@code vectors}: numeric features as
     * quantile histograms with {@code bins} bins, categorical ones as frequency tables.
     */
    public static Map<String, FeatureSummary> summarize(List<FeatureVector> vectors, int bins) {
        Map<String, List<Double>> numeric = new TreeMap<>();
        Map<String, List<String>> categorical = new TreeMap<>();
        for (FeatureVector v : vectors) {
            v.numeric().forEach((k, x) -> numeric.computeIfAbsent(k, n -> new ArrayList<>()).add(x));
            v.categorical().forEach((k, c) -> categorical.computeIfAbsent(k, n -> new ArrayList<>()).add(c));
        }

        Map<String, FeatureSummary> out = new TreeMap<>();
        numeric.forEach((name, xs) -> {
            double[] finite = xs.stream().mapToDouble(Double::doubleValue).filter(Double::isFinite).toArray();
            if (finite.length > 0) out.put(name, NumericSummary.fromValues(finite, bins));
        });
        categorical.forEach((name, cs) -> out.put(name, CategoricalSummary.fromValues(cs)));
        return out;
    }
}
