package com.example.mlops.monitor;

import com.example.mlops.drift.DriftReport;
import com.example.mlops.policy.Verdict;

import java.time.Instant;

/**
 * What one monitoring tick did.
 *
 * @param at            tick time
 * @param report        drift report, {@code null} when the tick was skipped
 * @param verdict       policy verdict, {@link Verdict#NONE} when skipped
 * @param jobId         id of the retrain job started by this tick, if any
 * @param skippedReason why no report was produced, {@code null} otherwise
 */
public record CycleOutcome(
        Instant at,
        DriftReport report,
        Verdict verdict,
        String jobId,
        String skippedReason) {

    public static CycleOutcome skipped(Instant at, String reason) {
        return new CycleOutcome(at, null, Verdict.NONE, null, reason);
    }

    public static CycleOutcome evaluated(Instant at, DriftReport report, Verdict verdict, String jobId) {
        return new CycleOutcome(at, report, verdict, jobId, null);
    }

    public boolean skipped() {
        return skippedReason != null;
    }
}
