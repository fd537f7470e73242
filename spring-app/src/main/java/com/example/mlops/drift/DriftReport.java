package com.example.mlops.drift;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Result of one drift evaluation. Never mutated once created.
 *
 * @param modelVersion   version whose reference distribution was used
 * @param featureScores  per-feature divergence, each {@code >= 0}
 * @param aggregateScore combined score, {@code >= 0}
 * @param evaluatedAt    evaluation time
 * @param sampleSize     number of inference inputs scored
 */
public record DriftReport(
        long modelVersion,
        Map<String, Double> featureScores,
        double aggregateScore,
        Instant evaluatedAt,
        int sampleSize) {

    public DriftReport {
        featureScores = featureScores == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(featureScores));
    }

    public boolean exceeds(double threshold) {
        return aggregateScore > threshold;
    }
}
