package com.example.mlops.coordinator;

import com.example.mlops.registry.PrimaryMetric;

/**
 * Result of comparing a candidate against the active version. A rejection is a
 * normal outcome, not an error.
 *
 * @param accepted       whether the candidate may be promoted
 * @param metric         metric compared
 * @param candidateError candidate's value of {@code metric}
 * @param activeError    active version's value of {@code metric}
 * @param tolerance      allowed relative regression
 * @param activeVersion  version the candidate was validated against
 */
public record ValidationOutcome(
        boolean accepted,
        PrimaryMetric metric,
        double candidateError,
        double activeError,
        double tolerance,
        long activeVersion) {

    public String reason() {
        return String.format(java.util.Locale.ROOT, "%s candidate=%.4f active(v%d)=%.4f limit=%.4f",
                metric, candidateError, activeVersion, activeError, limit());
    }

    public double limit() {
        return activeError * (1.0 + tolerance);
    }
}
