package com.example.mlops;

import com.example.mlops.collab.DataIngestionClient;
import com.example.mlops.collab.ServingAdapter;
import com.example.mlops.collab.Trainer;
import com.example.mlops.coordinator.JobHandle;
import com.example.mlops.coordinator.RetrainCoordinator;
import com.example.mlops.coordinator.RetrainJob;
import com.example.mlops.coordinator.TriggerReason;
import com.example.mlops.drift.DriftHistory;
import com.example.mlops.drift.DriftReport;
import com.example.mlops.exception.RegistryUnavailableException;
import com.example.mlops.monitor.CycleOutcome;
import com.example.mlops.monitor.MonitoringCycle;
import com.example.mlops.reference.CategoricalSummary;
import com.example.mlops.reference.ReferenceDistribution;
import com.example.mlops.registry.ModelMetrics;
import com.example.mlops.registry.ModelRegistry;
import com.example.mlops.registry.ModelVersion;
import com.example.mlops.registry.PromotionStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.Mockito.when;

@SpringBootTest(properties = {
        "spring.profiles.active=test",
        "springdoc.api-docs.enabled=false",
        "springdoc.swagger-ui.enabled=false"
})
@AutoConfigureWebTestClient
class RetrainControllerTest {

    @Autowired WebTestClient web;
    @Autowired DriftHistory history;

    @MockBean ModelRegistry registry;
    @MockBean RetrainCoordinator coordinator;
    @MockBean MonitoringCycle cycle;
    @MockBean ServingAdapter serving;
    @MockBean DataIngestionClient ingestion;
    @MockBean Trainer trainer;

    @TempDir
    static Path tmp;

    @DynamicPropertySource
    static void props(DynamicPropertyRegistry r) {
        r.add("mlops.registry-file", () -> tmp.resolve("registry.json").toString());
        r.add("mlops.models-dir", () -> tmp.resolve("models").toString());
        // nothing should reach real collaborators
        r.add("mlops.serving.base-url", () -> "http://127.0.0.1:65535");
        r.add("mlops.ingestion.base-url", () -> "http://127.0.0.1:65535");
    }

    @Test
    void activeModel_isReturned() {
        when(registry.hasActive()).thenReturn(true);
        when(registry.getActive()).thenReturn(version(2, PromotionStatus.ACTIVE));

        web.get().uri("/v1/model").exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.version").isEqualTo(2)
                .jsonPath("$.status").isEqualTo("ACTIVE")
                .jsonPath("$.data_window").isEqualTo("2024-05")
                .jsonPath("$.metrics.mae").isEqualTo(1.5)
                .jsonPath("$.reference_features[0]").isEqualTo("zone");
    }

    @Test
    void noActiveModel_is404() {
        when(registry.hasActive()).thenReturn(false);

        web.get().uri("/v1/model").exchange()
                .expectStatus().isNotFound()
                .expectBody().jsonPath("$.error").exists();
    }

    @Test
    void versions_areListed() {
        when(registry.versions()).thenReturn(List.of(version(1, PromotionStatus.RETIRED), version(2, PromotionStatus.ACTIVE)));

        web.get().uri("/v1/model/versions").exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(2)
                .jsonPath("$[0].status").isEqualTo("RETIRED");
    }

    @Test
    void manualTrigger_isAccepted() {
        RetrainJob job = RetrainJob.accept(TriggerReason.MANUAL, Instant.parse("2024-06-01T00:00:00Z"));
        when(coordinator.submit(TriggerReason.MANUAL)).thenReturn(Optional.of(new JobHandle(job, Mono.never())));

        web.post().uri("/v1/jobs").exchange()
                .expectStatus().isAccepted()
                .expectBody()
                .jsonPath("$.id").isEqualTo(job.id())
                .jsonPath("$.state").isEqualTo("INGESTING")
                .jsonPath("$.trigger").isEqualTo("MANUAL");
    }

    @Test
    void manualTrigger_whileJobInFlight_is409() {
        when(coordinator.submit(TriggerReason.MANUAL)).thenReturn(Optional.empty());

        web.post().uri("/v1/jobs").exchange()
                .expectStatus().isEqualTo(409)
                .expectBody().jsonPath("$.error").isEqualTo("A retrain job is already in flight");
    }

    @Test
    void unknownJob_is404() {
        when(coordinator.findJob("nope")).thenReturn(Optional.empty());

        web.get().uri("/v1/jobs/nope").exchange().expectStatus().isNotFound();
    }

    @Test
    void jobs_listCurrentAndFinished() {
        RetrainJob done = RetrainJob.accept(TriggerReason.DRIFT, Instant.EPOCH).fail("boom", Instant.EPOCH);
        when(coordinator.currentJob()).thenReturn(Optional.empty());
        when(coordinator.finishedJobs()).thenReturn(List.of(done));

        web.get().uri("/v1/jobs").exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.current").doesNotExist()
                .jsonPath("$.finished[0].failureReason").isEqualTo("boom");
    }

    @Test
    void driftReports_respectLimit() {
        history.append(new DriftReport(1L, Map.of("x", 0.1), 0.1, Instant.EPOCH, 200));
        history.append(new DriftReport(1L, Map.of("x", 0.3), 0.3, Instant.EPOCH, 200));

        web.get().uri("/v1/drift/reports?limit=1").exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(1)
                .jsonPath("$[0].aggregateScore").isEqualTo(0.3);

        web.get().uri("/v1/drift/reports?limit=0").exchange().expectStatus().isBadRequest();
    }

    @Test
    void monitorRun_returnsCycleOutcome() {
        when(cycle.runOnce()).thenReturn(CycleOutcome.skipped(Instant.EPOCH, "no active model version"));

        web.post().uri("/v1/monitor/run").exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.verdict").isEqualTo("NONE")
                .jsonPath("$.skippedReason").isEqualTo("no active model version");
    }

    @Test
    void registryFailure_is503() {
        when(registry.hasActive()).thenThrow(new RegistryUnavailableException("poisoned", new IOException("EIO")));

        web.get().uri("/v1/model").exchange()
                .expectStatus().isEqualTo(503)
                .expectBody().jsonPath("$.error").isEqualTo("Model registry unavailable");
    }

    private static ModelVersion version(long id, PromotionStatus status) {
        Instant t = Instant.parse("2024-06-01T00:00:00Z");
        return new ModelVersion(id, "2024-05", "models/v" + id + ".json", new ModelMetrics(1.5, 2.0, 0.8, 1.4),
                new ReferenceDistribution(id, Map.of("zone", CategoricalSummary.fromValues(List.of("a"))), t),
                status, t, t);
    }
}
