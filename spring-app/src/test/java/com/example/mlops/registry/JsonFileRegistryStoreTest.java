package com.example.mlops.registry;

import com.example.mlops.exception.RegistryUnavailableException;
import com.example.mlops.reference.CategoricalSummary;
import com.example.mlops.reference.FeatureSummary;
import com.example.mlops.reference.NumericSummary;
import com.example.mlops.reference.ReferenceDistribution;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonFileRegistryStoreTest {

    @TempDir
    Path tmp;

    @Test
    void missingFile_loadsEmpty() {
        assertThat(new JsonFileRegistryStore(tmp.resolve("none.json")).load()).isEmpty();
    }

    @Test
    void save_writesSnapshotWithPolymorphicSummaries() throws Exception {
        Path file = tmp.resolve("nested/registry.json");
        JsonFileRegistryStore store = new JsonFileRegistryStore(file);
        Map<String, FeatureSummary> features = Map.of(
                "trip_distance", new NumericSummary(new double[]{1.0, 2.5}, new double[]{0.2, 0.5, 0.3}, 40),
                "zone", CategoricalSummary.fromValues(List.of("a", "b", "b")));
        Instant t = Instant.parse("2024-05-02T10:15:30Z");
        ModelVersion v1 = new ModelVersion(1L, "2024-04", "models/m1.json", new ModelMetrics(1.5, 2.0, 0.8, 1.4),
                new ReferenceDistribution(1L, features, t), PromotionStatus.ACTIVE, t, t);

        store.save(new RegistrySnapshot(1L, List.of(v1)));

        assertThat(Files.readString(file)).contains("\"kind\"").contains("2024-05-02T10:15:30Z");
        assertThat(tmp.resolve("nested/registry.json.tmp")).doesNotExist();

        RegistrySnapshot loaded = store.load().orElseThrow();
        assertThat(loaded.activeVersion()).isEqualTo(1L);
        ModelVersion back = loaded.versions().get(0);
        assertThat(back.metrics()).isEqualTo(v1.metrics());
        assertThat(back.reference().features().get("zone")).isInstanceOf(CategoricalSummary.class);
        NumericSummary num = (NumericSummary) back.reference().features().get("trip_distance");
        assertThat(num.edges()).containsExactly(1.0, 2.5);
        assertThat(num.proportions()).containsExactly(0.2, 0.5, 0.3);
    }

    @Test
    void corruptFile_raisesRegistryUnavailable() throws Exception {
        Path file = tmp.resolve("registry.json");
        Files.writeString(file, "{not json");

        assertThatThrownBy(() -> new JsonFileRegistryStore(file).load())
                .isInstanceOf(RegistryUnavailableException.class);
    }
}
