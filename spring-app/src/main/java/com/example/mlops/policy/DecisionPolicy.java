package com.example.mlops.policy;

import com.example.mlops.RetrainProperties;
import com.example.mlops.drift.DriftReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Turns a drift report into a retrain verdict.
 *
 * <p>
 * {@link Verdict#RETRAIN} is returned iff all of the following hold:
 * </p>
 * <ol>
 *   <li>{@code report.aggregateScore() > driftThreshold};</li>
 *   <li>when {@code requiredConsecutiveBreaches > 1}, the preceding
 *       {@code requiredConsecutiveBreaches - 1} reports in {@code history} for the
 *       same model version also exceeded the threshold;</li>
 *   <li>no retrain job is in flight;</li>
 *   <li>the cool-down since the last completed retrain has elapsed.</li>
 * </ol>
 *
 * The policy keeps no state of its own; history and coordinator state are passed in.
 */
@Component
@Slf4j
public class DecisionPolicy {

    private final double driftThreshold;
    private final Duration coolDown;
    private final int requiredConsecutiveBreaches;
    private final Clock clock;

    @Autowired
    public DecisionPolicy(RetrainProperties props, Clock clock) {
        this(props.getDriftThreshold(), props.coolDown(), props.getRequiredConsecutiveBreaches(), clock);
    }

    public DecisionPolicy(double driftThreshold, Duration coolDown, int requiredConsecutiveBreaches, Clock clock) {
        this.driftThreshold = driftThreshold;
        this.coolDown = coolDown;
        this.requiredConsecutiveBreaches = Math.max(1, requiredConsecutiveBreaches);
        this.clock = clock;
    }

    public Verdict decide(DriftReport report, List<DriftReport> history, CoordinatorState state) {
        if (!report.exceeds(driftThreshold)) {
            log.debug("No drift: score={} <= threshold={}", report.aggregateScore(), driftThreshold);
            return Verdict.NONE;
        }
        if (!sustained(report, history)) {
            log.info("Drift score {} above threshold {} but not yet sustained over {} reports",
                    report.aggregateScore(), driftThreshold, requiredConsecutiveBreaches);
            return Verdict.NONE;
        }
        if (state.jobInFlight()) {
            log.info("Drift score {} above threshold but a retrain job is already in flight", report.aggregateScore());
            return Verdict.NONE;
        }
        Instant last = state.lastCompletedAt();
        if (last != null) {
            Duration since = Duration.between(last, clock.instant());
            if (since.compareTo(coolDown) < 0) {
                log.info("Drift score {} above threshold but inside cool-down ({} of {} elapsed)",
                        report.aggregateScore(), since, coolDown);
                return Verdict.NONE;
            }
        }
        log.info("Drift score {} exceeds threshold {} → RETRAIN", report.aggregateScore(), driftThreshold);
        return Verdict.RETRAIN;
    }

    private boolean sustained(DriftReport report, List<DriftReport> history) {
        int needed = requiredConsecutiveBreaches - 1;
        if (needed == 0) return true;
        if (history == null || history.size() < needed) return false;
        for (int i = history.size() - 1; i >= history.size() - needed; i--) {
            DriftReport past = history.get(i);
            if (past.modelVersion() != report.modelVersion() || !past.exceeds(driftThreshold)) return false;
        }
        return true;
    }
}
