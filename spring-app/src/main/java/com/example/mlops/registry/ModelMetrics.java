package com.example.mlops.registry;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Evaluation metrics of a fitted model. Error measures come from the held-out split.
 *
 * @param mae      mean absolute error on the hold-out split
 * @param rmse     root mean squared error on the hold-out split
 * @param r2       coefficient of determination on the hold-out split (may be negative)
 * @param trainMae mean absolute error on the training split
 */
public record ModelMetrics(double mae, double rmse, double r2, double trainMae) {

    /** Finite, with non-negative error measures. */
    @JsonIgnore
    public boolean isSane() {
        return Double.isFinite(mae) && mae >= 0
                && Double.isFinite(rmse) && rmse >= 0
                && Double.isFinite(r2)
                && Double.isFinite(trainMae) && trainMae >= 0;
    }
}
