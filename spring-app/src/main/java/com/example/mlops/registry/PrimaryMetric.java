package com.example.mlops.registry;

/** Error metric used when a candidate is compared against the active version. */
public enum PrimaryMetric {
    MAE {
        @Override
        public double of(ModelMetrics m) {
            return m.mae();
        }
    },
    RMSE {
        @Override
        public double of(ModelMetrics m) {
            return m.rmse();
        }
    };

    public abstract double of(ModelMetrics metrics);
}
