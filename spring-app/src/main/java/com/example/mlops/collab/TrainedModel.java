package com.example.mlops.collab;

import com.example.mlops.registry.ModelMetrics;

/**
 * @param artifactRef where the fitted model was stored (path or URI)
 * @param metrics     hold-out evaluation metrics
 */
public record TrainedModel(String artifactRef, ModelMetrics metrics) {}
