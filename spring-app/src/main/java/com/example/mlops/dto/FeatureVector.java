package com.example.mlops.dto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable Data Transfer Object (DTO) representing one inference input as
 * seen by the served regression model.
 *
 * <p>
 * Feature vectors are sampled from the serving side for drift evaluation and
 * also make up the input half of each training row. Numeric and categorical
 * features are kept in separate maps because the drift estimator scores them
 * with different distances (binned PSI vs. total variation).
 * </p>
 *
 * <h2>Fields:</h2>
 * <ul>
 *   <li><b>numeric</b> – feature name to value, e.g. {@code trip_distance → 3.2}.</li>
 *   <li><b>categorical</b> – feature name to category label, e.g. {@code payment_type → "card"}.</li>
 * </ul>
 *
 * <p>
 * Null maps become empty maps and entries with a {@code null} key or value are
 * dropped, so a missing value simply means the feature was not observed for
 * this input.
 * </p>
 *
 * <h2>Usage Example:</h2>
 * <pre>{@code
 * FeatureVector v = new FeatureVector(
 *     Map.of("trip_distance", 3.2, "hour", 17.0),
 *     Map.of("payment_type", "card"));
 * }</pre>
 */
public record FeatureVector(
        Map<String, Double> numeric,
        Map<String, String> categorical) {

    public FeatureVector {
        numeric = compact(numeric);
        categorical = compact(categorical);
    }

    public static FeatureVector ofNumeric(Map<String, Double> numeric) {
        return new FeatureVector(numeric, Map.of());
    }

    private static <V> Map<String, V> compact(Map<String, V> in) {
        if (in == null || in.isEmpty()) return Map.of();
        Map<String, V> out = new LinkedHashMap<>();
        in.forEach((k, v) -> {
            if (k != null && v != null) out.put(k, v);
        });
        return Collections.unmodifiableMap(out);
    }
}
