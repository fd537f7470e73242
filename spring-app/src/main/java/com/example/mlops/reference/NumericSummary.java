package com.example.mlops.reference;

import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import java.util.Arrays;

/**
 * Quantile histogram of a numeric feature.
 *
 * <p>
 * {@code edges} holds the strictly increasing interior cut points; bin {@code i}
 * covers {@code (edges[i-1], edges[i]]} and the two outer bins are open-ended, so
 * every value lands in exactly one of {@code edges.length + 1} bins.
 * {@code proportions[i]} is the reference share of bin {@code i}.
 * </p>
 *
 * <p>
 * Cut points are the reference quantiles {@code 1/bins .. (bins-1)/bins}
 * (Commons Math {@link Percentile}, R-7 estimation). Duplicate cut points
 * (constant or heavily tied features) are collapsed, so fewer bins may result.
 * </p>
 */
public record NumericSummary(double[] edges, double[] proportions, long count) implements FeatureSummary {

    public NumericSummary {
        if (edges == null || proportions == null || proportions.length != edges.length + 1) {
            throw new IllegalArgumentException("proportions must have edges.length + 1 entries");
        }
        edges = edges.clone();
        proportions = proportions.clone();
    }

    public static NumericSummary fromValues(double[] values, int bins) {
        if (values == null || values.length == 0) {
            throw new IllegalArgumentException("Cannot summarize an empty numeric feature");
        }
        if (bins < 2) throw new IllegalArgumentException("bins must be >= 2");

        Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        percentile.setData(values);
        double[] cuts = new double[bins - 1];
        int n = 0;
        for (int i = 1; i < bins; i++) {
            double q = percentile.evaluate(100.0 * i / bins);
            if (n == 0 || q > cuts[n - 1]) cuts[n++] = q;
        }
        double[] edges = Arrays.copyOf(cuts, n);
        return new NumericSummary(edges, histogram(edges, values), values.length);
    }

    @Override
    public double[] edges() {
        return edges.clone();
    }

    @Override
    public double[] proportions() {
        return proportions.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NumericSummary other)) return false;
        return count == other.count
                && Arrays.equals(edges, other.edges)
                && Arrays.equals(proportions, other.proportions);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * Arrays.hashCode(edges) + Arrays.hashCode(proportions)) + Long.hashCode(count);
    }

    @Override
    public String toString() {
        return "NumericSummary[edges=" + Arrays.toString(edges) + ", proportions=" + Arrays.toString(proportions)
                + ", count=" + count + "]";
    }

    /** Share of {@code values} falling into each of this summary's bins. */
    public double[] proportionsOf(double[] values) {
        return histogram(edges, values);
    }

    public int bins() {
        return proportions.length;
    }

    static int binOf(double[] edges, double value) {
        int idx = Arrays.binarySearch(edges, value);
        return idx >= 0 ? idx : -idx - 1;
    }

    private static double[] histogram(double[] edges, double[] values) {
        double[] out = new double[edges.length + 1];
        if (values.length == 0) return out;
        for (double v : values) out[binOf(edges, v)] += 1.0;
        for (int i = 0; i < out.length; i++) out[i] /= values.length;
        return out;
    }
}
