package com.example.mlops.reference;

import java.util.Collection;
import java.util.Map;
import java.util.TreeMap;

/**
 * Frequency table of a categorical feature; values sum to 1.
 */
public record CategoricalSummary(Map<String, Double> frequencies, long count) implements FeatureSummary {

    public CategoricalSummary {
        frequencies = frequencies == null ? Map.of() : Map.copyOf(frequencies);
    }

    public static CategoricalSummary fromValues(Collection<String> values) {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("Cannot summarize an empty categorical feature");
        }
        return new CategoricalSummary(frequenciesOf(values), values.size());
    }

    public static Map<String, Double> frequenciesOf(Collection<String> values) {
        Map<String, Double> counts = new TreeMap<>();
        for (String v : values) counts.merge(v, 1.0, Double::sum);
        counts.replaceAll((k, c) -> c / values.size());
        return counts;
    }
}
