package com.example.mlops.coordinator;

import com.example.mlops.RetrainProperties;
import com.example.mlops.collab.DataIngestionClient;
import com.example.mlops.collab.TrainedModel;
import com.example.mlops.collab.Trainer;
import com.example.mlops.dto.DataWindow;
import com.example.mlops.dto.Dataset;
import com.example.mlops.exception.RetrainException;
import com.example.mlops.reference.ReferenceDistribution;
import com.example.mlops.reference.ReferenceStore;
import com.example.mlops.registry.ModelRegistry;
import com.example.mlops.registry.ModelVersion;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.time.YearMonth;
import java.time.format.DateTimeParseException;

/**
 * Seeds an empty registry with an initial model trained on {@code mlops.bootstrap.window}
 * (a {@code YYYY-MM} month). Without that property, or when the registry already has an
 * active version, nothing happens and monitoring cycles are skipped until a version exists.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RegistryBootstrap implements ApplicationRunner {

    private final RetrainProperties props;
    private final ModelRegistry registry;
    private final DataIngestionClient ingestion;
    private final Trainer trainer;
    private final ReferenceStore referenceStore;

    @Override
    public void run(ApplicationArguments args) {
        String month = props.getBootstrap().getWindow();
        if (registry.hasActive()) {
            ModelVersion active = registry.getActive();
            referenceStore.replace(active.reference());
            log.info("Registry already active at v{}; bootstrap skipped", active.version());
            return;
        }
        if (month == null || month.isBlank()) {
            log.warn("Registry is empty and mlops.bootstrap.window is not set; drift monitoring is idle until a model is seeded");
            return;
        }
        seed(month.trim());
    }

    public ModelVersion seed(String month) {
        DataWindow window;
        try {
            window = DataWindow.ofMonth(YearMonth.parse(month));
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("mlops.bootstrap.window must be YYYY-MM, got " + month, e);
        }
        log.info("Bootstrapping registry from window {}", window.id());
        try {
            Dataset dataset = ingestion.fetchWindow(window);
            if (dataset == null || dataset.isEmpty()) {
                log.warn("Bootstrap window {} has no data; registry stays empty", window.id());
                return null;
            }
            TrainedModel trained = trainer.fit(dataset);
            ModelVersion first = registry.seed(window.id(), trained.artifactRef(), trained.metrics(),
                    ReferenceDistribution.summarize(dataset.features(), props.getNumericBins()));
            referenceStore.replace(first.reference());
            return first;
        } catch (RetrainException e) {
            log.warn("Bootstrap from {} failed; registry stays empty: {}", window.id(), e.toString());
            return null;
        }
    }
}
