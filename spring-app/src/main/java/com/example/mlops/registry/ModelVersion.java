package com.example.mlops.registry;

import com.example.mlops.reference.ReferenceDistribution;

import java.time.Instant;

/**
 * One registered model. Instances are immutable; a status change produces a new instance.
 *
 * @param version         monotonically increasing id
 * @param dataWindow      id of the data window the model was trained on
 * @param artifactRef     where the trainer stored the fitted model
 * @param metrics         hold-out evaluation metrics
 * @param reference       baseline distribution captured from the training window
 * @param status          promotion status
 * @param createdAt       registration time
 * @param statusChangedAt time of the last status change
 */
public record ModelVersion(
        long version,
        String dataWindow,
        String artifactRef,
        ModelMetrics metrics,
        ReferenceDistribution reference,
        PromotionStatus status,
        Instant createdAt,
        Instant statusChangedAt) {

    public ModelVersion withStatus(PromotionStatus next, Instant at) {
        return new ModelVersion(version, dataWindow, artifactRef, metrics, reference, next, createdAt, at);
    }
}
