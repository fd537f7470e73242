package com.example.mlops.coordinator;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Reporting channel for retrain outcomes: structured log lines plus Micrometer counters.
 *
 * <h2>Metrics</h2>
 * <ul>
 *   <li>{@code mlops.retrain.jobs}: finished jobs, tagged {@code outcome=done|failed|rejected} and {@code trigger}.</li>
 *   <li>{@code mlops.retrain.dropped}: submissions dropped because a job was in flight.</li>
 * </ul>
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JobOutcomeReporter {

    private final MeterRegistry meterRegistry;

    public void report(RetrainJob job) {
        String outcome = outcomeOf(job);
        meterRegistry.counter("mlops.retrain.jobs",
                "outcome", outcome, "trigger", job.trigger().name()).increment();
        if (job.state() == JobState.DONE) {
            log.info("Retrain job {} DONE: v{} active (window={}, trigger={})",
                    job.id(), job.candidateVersion(), job.dataWindow(), job.trigger());
        } else {
            log.warn("Retrain job {} FAILED ({}): {} (window={}, candidate={}, trigger={})",
                    job.id(), outcome, job.failureReason(), job.dataWindow(), job.candidateVersion(), job.trigger());
        }
    }

    public void dropped(TriggerReason trigger, RetrainJob inFlight) {
        meterRegistry.counter("mlops.retrain.dropped", "trigger", trigger.name()).increment();
        log.info("Dropped {} retrain trigger: job {} is still {}", trigger,
                inFlight == null ? "?" : inFlight.id(),
                inFlight == null ? "running" : inFlight.state());
    }

    private static String outcomeOf(RetrainJob job) {
        if (job.state() == JobState.DONE) return "done";
        if (job.validation() != null && !job.validation().accepted()) return "rejected";
        return "failed";
    }
}
