package com.example.mlops.coordinator;

import java.util.EnumSet;
import java.util.Set;

/**
 * States of a retrain job.
 * <pre>
 * IDLE → INGESTING → TRAINING → VALIDATING → SWAPPING → DONE
 *            └──────────┴───────────┴────────────┴────→ FAILED
 * </pre>
 */
public enum JobState {
    IDLE,
    INGESTING,
    TRAINING,
    VALIDATING,
    SWAPPING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }

    public boolean canTransitionTo(JobState next) {
        return successors().contains(next);
    }

    private Set<JobState> successors() {
        switch (this) {
            case IDLE:
                return EnumSet.of(INGESTING);
            case INGESTING:
                return EnumSet.of(TRAINING, FAILED);
            case TRAINING:
                return EnumSet.of(VALIDATING, FAILED);
            case VALIDATING:
                return EnumSet.of(SWAPPING, FAILED);
            case SWAPPING:
                return EnumSet.of(DONE, FAILED);
            default:
                return EnumSet.noneOf(JobState.class);
        }
    }
}
