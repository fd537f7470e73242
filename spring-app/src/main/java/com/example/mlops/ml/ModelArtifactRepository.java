package com.example.mlops.ml;

import com.example.mlops.registry.ModelMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Writes fitted linear models as JSON files under a models directory.
 */
public class ModelArtifactRepository {

    private final Path dir;
    private final ObjectMapper om = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    /**
     * @param window     training window id
     * @param features   input columns in coefficient order
     * @param beta       intercept first, then one weight per feature
     * @param metrics    hold-out metrics
     * @param trainRows  rows used for fitting
     * @param trainedAt  fit time
     */
    public record ModelFile(String window, List<String> features, double[] beta,
                            ModelMetrics metrics, int trainRows, Instant trainedAt) {}

    public ModelArtifactRepository(Path dir) {
        this.dir = dir;
    }

    /** Persist {@code model} and return the file it was written to. */
    public Path save(ModelFile model) throws IOException {
        Files.createDirectories(dir);
        Path path = dir.resolve("model-" + model.window() + "-" + model.trainedAt().toEpochMilli() + ".json");
        om.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), model);
        return path;
    }

    public ModelFile load(Path path) throws IOException {
        return om.readValue(path.toFile(), ModelFile.class);
    }
}
