package com.example.mlops.monitor;

import com.example.mlops.RetrainProperties;
import com.example.mlops.exception.RegistryUnavailableException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;

/**
 * Timer that runs {@link MonitoringCycle#runOnce()} every {@code mlops.monitor.interval}.
 *
 * <ul>
 *   <li>Ticks are serialized ({@code concatMap}); while a cycle runs at most one tick waits,
 *       later ones are dropped.</li>
 *   <li>Each tick runs on {@code boundedElastic} because sampling blocks on HTTP.</li>
 *   <li>Any tick error is logged and the schedule continues, except
 *       {@link RegistryUnavailableException}, which stops the schedule and turns health DOWN.</li>
 * </ul>
 */
@Component
@Slf4j
public class MonitoringScheduler implements HealthIndicator {

    private final MonitoringCycle cycle;
    private final RetrainProperties.Monitor config;
    private final Clock clock;

    private volatile Disposable subscription;
    private volatile Throwable haltCause;
    private volatile CycleOutcome lastOutcome;

    public MonitoringScheduler(MonitoringCycle cycle, RetrainProperties props, Clock clock) {
        this.cycle = cycle;
        this.config = props.getMonitor();
        this.clock = clock;
    }

    @PostConstruct
    public void start() {
        if (!config.isEnabled()) {
            log.info("Drift monitoring schedule disabled (mlops.monitor.enabled=false)");
            return;
        }
        log.info("Starting drift monitoring every {} (first tick after {})", config.getInterval(), config.getInitialDelay());
        subscription = Flux.interval(config.getInitialDelay(), config.getInterval())
                .onBackpressureDrop(tick -> log.warn("Monitoring tick {} dropped; previous cycle still running", tick))
                .concatMap(tick -> Mono.fromCallable(cycle::runOnce)
                        .subscribeOn(Schedulers.boundedElastic())
                        .onErrorResume(e -> !(e instanceof RegistryUnavailableException), e -> {
                            log.warn("Monitoring cycle failed; continuing on next tick", e);
                            return Mono.empty();
                        }), 1)
                .subscribe(
                        outcome -> lastOutcome = outcome,
                        e -> {
                            haltCause = e;
                            log.error("Drift monitoring halted: model registry unavailable", e);
                        });
    }

    @PreDestroy
    public void stop() {
        Disposable s = subscription;
        if (s != null && !s.isDisposed()) {
            s.dispose();
            log.info("Drift monitoring schedule stopped");
        }
    }

    public boolean isRunning() {
        Disposable s = subscription;
        return s != null && !s.isDisposed() && haltCause == null;
    }

    @Override
    public Health health() {
        if (haltCause != null) {
            return Health.down().withDetail("reason", haltCause.toString()).build();
        }
        Health.Builder b = config.isEnabled() ? Health.up() : Health.unknown().withDetail("schedule", "disabled");
        CycleOutcome last = lastOutcome;
        if (last != null) {
            b.withDetail("lastCycleAt", last.at().toString())
                    .withDetail("lastVerdict", last.verdict().name());
        }
        return b.withDetail("checkedAt", clock.instant().toString()).build();
    }
}
