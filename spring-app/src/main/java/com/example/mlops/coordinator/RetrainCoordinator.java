package com.example.mlops.coordinator;

import com.example.mlops.RetrainProperties;
import com.example.mlops.collab.DataIngestionClient;
import com.example.mlops.collab.ServingAdapter;
import com.example.mlops.collab.TrainedModel;
import com.example.mlops.collab.Trainer;
import com.example.mlops.dto.DataWindow;
import com.example.mlops.dto.Dataset;
import com.example.mlops.exception.ConcurrentPromotionException;
import com.example.mlops.exception.NotAvailableException;
import com.example.mlops.exception.RegistryUnavailableException;
import com.example.mlops.exception.RetrainException;
import com.example.mlops.exception.SwapException;
import com.example.mlops.exception.TrainingException;
import com.example.mlops.policy.CoordinatorState;
import com.example.mlops.reference.ReferenceDistribution;
import com.example.mlops.reference.ReferenceStore;
import com.example.mlops.registry.ModelRegistry;
import com.example.mlops.registry.ModelVersion;
import com.example.mlops.registry.Promotion;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives a retrain job from an accepted verdict to a promoted, serving model version.
 *
 * <h2>Exclusivity</h2>
 * <p>
 * The in-flight slot is an {@link AtomicReference}; a submission wins the pipeline lock by
 * compare-and-setting it from {@code null}. A submission that loses is dropped (logged and
 * counted, never queued). The slot is cleared only after the job reached a terminal state.
 * </p>
 *
 * <h2>Pipeline</h2>
 * <ol>
 *   <li><b>INGESTING</b> – fetch the window chosen by {@link DataWindowPolicy}; missing or empty data fails the job.</li>
 *   <li><b>TRAINING</b> – fit a candidate; errors and insane metrics fail the job. The candidate is
 *       registered as CANDIDATE together with a baseline captured from the training window.</li>
 *   <li><b>VALIDATING</b> – compare against the ACTIVE version with {@link CandidateValidator}; a rejection
 *       ends the job FAILED and leaves the candidate in the registry for audit.</li>
 *   <li><b>SWAPPING</b> – compare-and-set promotion, serving activation, reference refresh. If serving
 *       refuses, the promotion is rolled back so registry and serving agree on the live version.</li>
 * </ol>
 *
 * <h2>Threading</h2>
 * Jobs run on the injected Reactor {@link Scheduler} (boundedElastic in production) so the
 * monitoring cycle never waits on ingestion, training or the swap call.
 *
 * <h2>Shutdown</h2>
 * After {@link #shutdown()} no job is accepted; a running job is abandoned (FAILED) at its next
 * step boundary unless it already entered SWAPPING, which always runs to completion.
 */
@Service
@Slf4j
public class RetrainCoordinator {

    private final DataWindowPolicy windowPolicy;
    private final DataIngestionClient ingestion;
    private final Trainer trainer;
    private final ModelRegistry registry;
    private final CandidateValidator validator;
    private final ServingAdapter serving;
    private final ReferenceStore referenceStore;
    private final JobOutcomeReporter reporter;
    private final Clock clock;
    private final Scheduler scheduler;
    private final int numericBins;
    private final int jobRetention;

    private final AtomicReference<RetrainJob> inFlight = new AtomicReference<>();
    private final Deque<RetrainJob> finished = new ArrayDeque<>();
    private volatile Instant lastCompletedAt;
    private volatile boolean shuttingDown;

    public RetrainCoordinator(DataWindowPolicy windowPolicy,
                              DataIngestionClient ingestion,
                              Trainer trainer,
                              ModelRegistry registry,
                              CandidateValidator validator,
                              ServingAdapter serving,
                              ReferenceStore referenceStore,
                              JobOutcomeReporter reporter,
                              Clock clock,
                              @Qualifier("retrainScheduler") Scheduler scheduler,
                              RetrainProperties props) {
        this.windowPolicy = windowPolicy;
        this.ingestion = ingestion;
        this.trainer = trainer;
        this.registry = registry;
        this.validator = validator;
        this.serving = serving;
        this.referenceStore = referenceStore;
        this.reporter = reporter;
        this.clock = clock;
        this.scheduler = scheduler;
        this.numericBins = props.getNumericBins();
        this.jobRetention = props.getJobRetention();
        this.lastCompletedAt = lastRetrainPromotion(registry);
    }

    /* ===================== SUBMISSION ===================== */

    /**
     * Try to start a retrain job.
     *
     * @return the accepted job and its completion, or empty if another job holds the lock
     *         or the coordinator is shutting down
     */
    public Optional<JobHandle> submit(TriggerReason trigger) {
        if (shuttingDown) {
            log.warn("Ignoring {} retrain trigger: coordinator is shutting down", trigger);
            return Optional.empty();
        }
        RetrainJob job = RetrainJob.accept(trigger, clock.instant());
        if (!inFlight.compareAndSet(null, job)) {
            reporter.dropped(trigger, inFlight.get());
            return Optional.empty();
        }
        log.info("Accepted retrain job {} (trigger={})", job.id(), trigger);

        Mono<RetrainJob> completion = Mono.fromCallable(() -> execute(job))
                .subscribeOn(scheduler)
                .onErrorResume(e -> Mono.fromCallable(() -> abandon(job, e)))
                .cache();
        completion.subscribe();
        return Optional.of(new JobHandle(job, completion));
    }

    /** Lock and cool-down state for the decision policy. */
    public CoordinatorState state() {
        return new CoordinatorState(inFlight.get() != null, lastCompletedAt);
    }

    public Optional<RetrainJob> currentJob() {
        return Optional.ofNullable(inFlight.get());
    }

    /** Finished jobs, oldest first. */
    public List<RetrainJob> finishedJobs() {
        synchronized (finished) {
            return List.copyOf(finished);
        }
    }

    public Optional<RetrainJob> findJob(String id) {
        RetrainJob current = inFlight.get();
        if (current != null && current.id().equals(id)) return Optional.of(current);
        synchronized (finished) {
            return finished.stream().filter(j -> j.id().equals(id)).findFirst();
        }
    }

    @PreDestroy
    public void shutdown() {
        shuttingDown = true;
        RetrainJob current = inFlight.get();
        if (current != null) {
            log.info("Shutdown requested; job {} in {} will stop at its next step boundary", current.id(), current.state());
        }
    }

    /* ===================== PIPELINE ===================== */

    private RetrainJob execute(RetrainJob accepted) {
        RetrainJob job = accepted;
        try {
            DataWindow window = windowPolicy.nextWindow();
            job = update(job.withDataWindow(window.id()));
            Dataset dataset = ingest(window);

            job = step(job, JobState.TRAINING);
            TrainedModel trained = train(dataset);
            ModelVersion candidate = registry.registerCandidate(window.id(), trained.artifactRef(), trained.metrics(),
                    ReferenceDistribution.summarize(dataset.features(), numericBins));
            job = update(job.withCandidate(candidate.version()));

            job = step(job, JobState.VALIDATING);
            ModelVersion active = registry.getActive();
            ValidationOutcome outcome = validator.validate(candidate, active);
            job = update(job.withValidation(outcome));
            if (!outcome.accepted()) {
                log.info("Job {}: candidate v{} rejected ({})", job.id(), candidate.version(), outcome.reason());
                return finish(job.fail("Validation rejected: " + outcome.reason(), clock.instant()));
            }

            job = step(job, JobState.SWAPPING);
            swap(candidate, active);
            return finish(job.advance(JobState.DONE, clock.instant()));
        } catch (ConcurrentPromotionException e) {
            log.warn("Job {}: active moved to v{} while v{} was validated against v{}; not promoting",
                    job.id(), e.getActualActive(), e.getCandidateVersion(), e.getExpectedActive());
            return finish(job.fail(e.getMessage(), clock.instant()));
        } catch (NotAvailableException e) {
            log.warn("Job {}: window {} not available: {}", job.id(), e.getWindowId(), e.getMessage());
            return finish(job.fail(e.getMessage(), clock.instant()));
        } catch (RegistryUnavailableException e) {
            log.error("Job {}: model registry unavailable in {}: {}", job.id(), job.state(), e.toString());
            return finish(job.fail("Registry unavailable: " + e.getMessage(), clock.instant()));
        } catch (RetrainException e) {
            return finish(job.fail(e.getMessage(), clock.instant()));
        } catch (RuntimeException e) {
            log.warn("Job {}: unexpected error in {}", job.id(), job.state(), e);
            return finish(job.fail(job.state() + " failed: " + e, clock.instant()));
        }
    }

    private Dataset ingest(DataWindow window) {
        Dataset dataset;
        try {
            dataset = ingestion.fetchWindow(window);
        } catch (NotAvailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new NotAvailableException(window.id(), "fetch failed: " + e, e);
        }
        if (dataset == null || dataset.isEmpty()) {
            throw new NotAvailableException(window.id(), "no data available for window");
        }
        log.info("Ingested {} rows for window {}", dataset.size(), window.id());
        return dataset;
    }

    private TrainedModel train(Dataset dataset) {
        TrainedModel trained;
        try {
            trained = trainer.fit(dataset);
        } catch (TrainingException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TrainingException("Trainer failed: " + e, e);
        }
        if (trained == null || trained.metrics() == null || !trained.metrics().isSane()) {
            throw new TrainingException("Trainer produced invalid metrics: "
                    + (trained == null ? "no result" : String.valueOf(trained.metrics())));
        }
        return trained;
    }

    private void swap(ModelVersion candidate, ModelVersion active) {
        Promotion promotion = registry.promote(candidate.version(), active.version());
        ModelVersion promoted = registry.find(candidate.version()).orElseThrow();
        try {
            serving.activate(promoted);
        } catch (RuntimeException e) {
            log.warn("Serving refused v{}; rolling back registry to v{}: {}",
                    candidate.version(), promotion.retiredVersion(), e.toString());
            registry.rollback(promotion);
            throw e instanceof SwapException se ? se : new SwapException(candidate.version(), e.toString(), e);
        }
        referenceStore.replace(promoted.reference());
    }

    /* ===================== bookkeeping ===================== */

    private RetrainJob step(RetrainJob job, JobState next) {
        if (shuttingDown) {
            throw new RetrainException("abandoned on shutdown in " + job.state());
        }
        log.debug("Job {}: {} -> {}", job.id(), job.state(), next);
        return update(job.advance(next, clock.instant()));
    }

    private RetrainJob update(RetrainJob job) {
        inFlight.set(job);
        return job;
    }

    private RetrainJob finish(RetrainJob job) {
        synchronized (finished) {
            finished.addLast(job);
            while (finished.size() > jobRetention) finished.removeFirst();
        }
        if (job.state() == JobState.DONE) {
            lastCompletedAt = job.finishedAt();
        }
        inFlight.updateAndGet(cur -> cur != null && cur.id().equals(job.id()) ? null : cur);
        reporter.report(job);
        return job;
    }

    /** Releases the lock if the pipeline task itself could not run (e.g. rejected by the scheduler). */
    private RetrainJob abandon(RetrainJob accepted, Throwable cause) {
        log.error("Retrain job {} could not run", accepted.id(), cause);
        RetrainJob latest = inFlight.get();
        RetrainJob base = latest != null && latest.id().equals(accepted.id()) ? latest : accepted;
        if (base.isTerminal()) return base;
        return finish(base.fail("pipeline task failed: " + cause, clock.instant()));
    }

    private static Instant lastRetrainPromotion(ModelRegistry registry) {
        if (!registry.hasActive()) return null;
        ModelVersion active = registry.getActive();
        // v1 is the seeded model, not the product of a retrain
        return active.version() > 1 ? active.statusChangedAt() : null;
    }
}
