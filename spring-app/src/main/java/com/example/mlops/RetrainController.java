package com.example.mlops;

import com.example.mlops.coordinator.RetrainCoordinator;
import com.example.mlops.coordinator.RetrainJob;
import com.example.mlops.coordinator.TriggerReason;
import com.example.mlops.drift.DriftHistory;
import com.example.mlops.drift.DriftReport;
import com.example.mlops.monitor.CycleOutcome;
import com.example.mlops.monitor.MonitoringCycle;
import com.example.mlops.registry.ModelMetrics;
import com.example.mlops.registry.ModelRegistry;
import com.example.mlops.registry.ModelVersion;
import com.example.mlops.registry.PromotionStatus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
@Tag(name = "retrain", description = "Model registry, drift history and retrain jobs")
public class RetrainController {

    private final ModelRegistry registry;
    private final DriftHistory history;
    private final RetrainCoordinator coordinator;
    private final MonitoringCycle cycle;

    @GetMapping("/model")
    @Operation(summary = "Currently ACTIVE model version")
    public ModelView active() {
        if (!registry.hasActive()) {
            throw new NoSuchElementException("No ACTIVE model version");
        }
        return ModelView.of(registry.getActive());
    }

    @GetMapping("/model/versions")
    @Operation(summary = "All registered model versions, oldest first")
    public List<ModelView> versions() {
        return registry.versions().stream().map(ModelView::of).toList();
    }

    @GetMapping("/drift/reports")
    @Operation(summary = "Most recent drift reports, newest last")
    public List<DriftReport> driftReports(@RequestParam(defaultValue = "20") int limit) {
        if (limit < 1) throw new IllegalArgumentException("limit must be >= 1");
        return history.recent(limit);
    }

    @GetMapping("/jobs")
    @Operation(summary = "Job in flight (if any) and finished jobs")
    public JobsView jobs() {
        return new JobsView(coordinator.currentJob().orElse(null), coordinator.finishedJobs());
    }

    @GetMapping("/jobs/{id}")
    @Operation(summary = "One retrain job by id")
    public RetrainJob job(@PathVariable String id) {
        return coordinator.findJob(id)
                .orElseThrow(() -> new NoSuchElementException("Unknown job " + id));
    }

    @PostMapping("/jobs")
    @Operation(summary = "Start a MANUAL retrain; skips threshold and cool-down, never runs two jobs at once")
    public ResponseEntity<Object> trigger() {
        return coordinator.submit(TriggerReason.MANUAL)
                .<ResponseEntity<Object>>map(h -> ResponseEntity.status(HttpStatus.ACCEPTED).body(h.accepted()))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.CONFLICT)
                        .body(Map.of("error", "A retrain job is already in flight")));
    }

    @PostMapping("/monitor/run")
    @Operation(summary = "Run one monitoring cycle now")
    public Mono<CycleOutcome> runCycle() {
        return Mono.fromCallable(cycle::runOnce).subscribeOn(Schedulers.boundedElastic());
    }

    public record ModelView(long version, String data_window, String artifact_ref, ModelMetrics metrics,
                            PromotionStatus status, Set<String> reference_features,
                            Instant created_at, Instant status_changed_at) {
        static ModelView of(ModelVersion v) {
            return new ModelView(v.version(), v.dataWindow(), v.artifactRef(), v.metrics(), v.status(),
                    v.reference().features().keySet(), v.createdAt(), v.statusChangedAt());
        }
    }

    public record JobsView(RetrainJob current, List<RetrainJob> finished) {}
}
