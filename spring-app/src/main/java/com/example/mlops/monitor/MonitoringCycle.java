package com.example.mlops.monitor;

import com.example.mlops.RetrainProperties;
import com.example.mlops.collab.ServingAdapter;
import com.example.mlops.coordinator.JobHandle;
import com.example.mlops.coordinator.RetrainCoordinator;
import com.example.mlops.coordinator.TriggerReason;
import com.example.mlops.drift.DriftEstimator;
import com.example.mlops.drift.DriftHistory;
import com.example.mlops.drift.DriftReport;
import com.example.mlops.dto.FeatureVector;
import com.example.mlops.exception.InsufficientSampleException;
import com.example.mlops.policy.DecisionPolicy;
import com.example.mlops.policy.Verdict;
import com.example.mlops.reference.ReferenceDistribution;
import com.example.mlops.reference.ReferenceStore;
import com.example.mlops.registry.ModelRegistry;
import com.example.mlops.registry.ModelVersion;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * One monitoring tick: sample → score → decide → (maybe) submit.
 *
 * <p>
 * The registry's active version is read first and its baseline is fetched afterwards,
 * so a report is always computed against the version that was ACTIVE when the tick ran.
 * Submitting a job never blocks the tick; the coordinator runs it elsewhere.
 * </p>
 *
 * <p>
 * Skipped ticks (no active version, sampling failure, too few inputs) are counted in
 * {@code mlops.monitor.skipped}; {@code mlops.drift.aggregate} gauges the latest score.
 * Only {@link com.example.mlops.exception.RegistryUnavailableException} escapes.
 * </p>
 */
@Component
@Slf4j
public class MonitoringCycle {

    private final ModelRegistry registry;
    private final ReferenceStore referenceStore;
    private final ServingAdapter serving;
    private final DriftEstimator estimator;
    private final DriftHistory history;
    private final DecisionPolicy policy;
    private final RetrainCoordinator coordinator;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final int sampleSize;

    public MonitoringCycle(ModelRegistry registry,
                           ReferenceStore referenceStore,
                           ServingAdapter serving,
                           DriftEstimator estimator,
                           DriftHistory history,
                           DecisionPolicy policy,
                           RetrainCoordinator coordinator,
                           MeterRegistry meterRegistry,
                           Clock clock,
                           RetrainProperties props) {
        this.registry = registry;
        this.referenceStore = referenceStore;
        this.serving = serving;
        this.estimator = estimator;
        this.history = history;
        this.policy = policy;
        this.coordinator = coordinator;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.sampleSize = props.getSampleSize();

        Gauge.builder("mlops.drift.aggregate", history,
                        h -> h.latest().map(DriftReport::aggregateScore).orElse(0.0))
                .description("Aggregate drift score of the latest evaluation")
                .register(meterRegistry);
    }

    public CycleOutcome runOnce() {
        Instant now = clock.instant();
        if (!registry.hasActive()) {
            return skip(now, "no active model version");
        }
        ModelVersion active = registry.getActive();
        ReferenceDistribution reference = referenceStore.baselineFor(active);

        List<FeatureVector> sample;
        try {
            sample = serving.sampleRecentInputs(sampleSize);
        } catch (RuntimeException e) {
            log.warn("Sampling recent inputs failed; skipping cycle: {}", e.toString());
            return skip(now, "sampling failed: " + e.getMessage());
        }

        DriftReport report;
        try {
            report = estimator.evaluate(reference, sample);
        } catch (InsufficientSampleException e) {
            log.info("Skipping drift evaluation: {}", e.getMessage());
            return skip(now, e.getMessage());
        }

        List<DriftReport> prior = history.snapshot();
        history.append(report);
        Verdict verdict = policy.decide(report, prior, coordinator.state());
        log.info("Drift v{}: aggregate={} over {} inputs, per-feature={} → {}",
                report.modelVersion(), round4(report.aggregateScore()), report.sampleSize(),
                report.featureScores(), verdict);

        String jobId = null;
        if (verdict == Verdict.RETRAIN) {
            jobId = coordinator.submit(TriggerReason.DRIFT)
                    .map(JobHandle::accepted)
                    .map(j -> j.id())
                    .orElse(null);
        }
        return CycleOutcome.evaluated(now, report, verdict, jobId);
    }

    private CycleOutcome skip(Instant at, String reason) {
        meterRegistry.counter("mlops.monitor.skipped").increment();
        return CycleOutcome.skipped(at, reason);
    }

    private static double round4(double v) { return Math.round(v * 10_000.0) / 10_000.0; }
}
