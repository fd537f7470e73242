package com.example.mlops.policy;

import java.time.Instant;

/**
 * What the decision policy needs to know about the retrain pipeline.
 *
 * @param jobInFlight     whether a retrain job currently holds the pipeline lock
 * @param lastCompletedAt finish time of the last successful retrain, {@code null} if none yet
 */
public record CoordinatorState(boolean jobInFlight, Instant lastCompletedAt) {

    public static CoordinatorState idle() {
        return new CoordinatorState(false, null);
    }
}
