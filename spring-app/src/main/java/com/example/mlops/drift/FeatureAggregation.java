package com.example.mlops.drift;

import java.util.Collection;

/**
 * How per-feature divergences are folded into one drift score.
 */
public enum FeatureAggregation {
    /** Worst feature wins: one badly drifted feature is enough to raise the score. */
    MAX {
        @Override
        public double apply(Collection<Double> scores) {
            return scores.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
        }
    },
    MEAN {
        @Override
        public double apply(Collection<Double> scores) {
            return scores.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        }
    };

    public abstract double apply(Collection<Double> scores);
}
