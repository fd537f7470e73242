package com.example.mlops.coordinator;

import com.example.mlops.RetrainProperties;
import com.example.mlops.registry.ModelVersion;
import com.example.mlops.registry.PrimaryMetric;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Guards against deploying a worse model just because drift was detected: the candidate's
 * primary error may exceed the active version's by at most {@code regressionTolerance}
 * (relative).
 */
@Component
public class CandidateValidator {

    private final PrimaryMetric metric;
    private final double tolerance;

    @Autowired
    public CandidateValidator(RetrainProperties props) {
        this(props.getPrimaryMetric(), props.getRegressionTolerance());
    }

    public CandidateValidator(PrimaryMetric metric, double tolerance) {
        if (tolerance < 0) throw new IllegalArgumentException("tolerance must be >= 0");
        this.metric = metric;
        this.tolerance = tolerance;
    }

    public ValidationOutcome validate(ModelVersion candidate, ModelVersion active) {
        double candidateError = metric.of(candidate.metrics());
        double activeError = metric.of(active.metrics());
        boolean accepted = candidateError <= activeError * (1.0 + tolerance);
        return new ValidationOutcome(accepted, metric, candidateError, activeError, tolerance, active.version());
    }
}
