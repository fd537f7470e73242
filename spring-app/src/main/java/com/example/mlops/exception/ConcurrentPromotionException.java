package com.example.mlops.exception;

/**
 * The registry's active pointer moved between validation and promotion.
 * Nothing is promoted when this is thrown.
 */
public class ConcurrentPromotionException extends RetrainException {
    private final long candidateVersion;
    private final Long expectedActive;
    private final Long actualActive;

    public ConcurrentPromotionException(long candidateVersion, Long expectedActive, Long actualActive) {
        super("Cannot promote v" + candidateVersion + ": expected active v" + expectedActive
                + " but registry points at v" + actualActive);
        this.candidateVersion = candidateVersion;
        this.expectedActive = expectedActive;
        this.actualActive = actualActive;
    }

    public long getCandidateVersion() {
        return candidateVersion;
    }

    public Long getExpectedActive() {
        return expectedActive;
    }

    public Long getActualActive() {
        return actualActive;
    }
}
