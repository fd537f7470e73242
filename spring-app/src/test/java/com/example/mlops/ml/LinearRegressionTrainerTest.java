package com.example.mlops.ml;

import com.example.mlops.collab.TrainedModel;
import com.example.mlops.dto.DataWindow;
import com.example.mlops.dto.Dataset;
import com.example.mlops.dto.FeatureVector;
import com.example.mlops.dto.LabeledRow;
import com.example.mlops.exception.TrainingException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class LinearRegressionTrainerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-01T00:00:00Z"), ZoneOffset.UTC);
    private static final DataWindow MAY = DataWindow.ofMonth(YearMonth.of(2024, 5));

    @TempDir
    Path tmp;

    @Test
    void exactLinearData_isRecovered_andArtifactWritten() throws Exception {
        ModelArtifactRepository artifacts = new ModelArtifactRepository(tmp.resolve("models"));
        LinearRegressionTrainer trainer = new LinearRegressionTrainer(List.of("a", "b", "month"), artifacts, CLOCK);

        TrainedModel model = trainer.fit(new Dataset(MAY, linearRows(200, new Random(42))));

        assertThat(model.metrics().mae()).isCloseTo(0.0, within(1e-6));
        assertThat(model.metrics().r2()).isCloseTo(1.0, within(1e-9));
        assertThat(model.metrics().isSane()).isTrue();
        Path artifact = Path.of(model.artifactRef());
        assertThat(Files.exists(artifact)).isTrue();

        ModelArtifactRepository.ModelFile file = artifacts.load(artifact);
        assertThat(file.window()).isEqualTo("2024-05");
        assertThat(file.features()).containsExactly("a", "b", "month");
        assertThat(file.trainRows()).isEqualTo(160);
        assertThat(file.beta()[0]).isCloseTo(2.0, within(1e-6));
        assertThat(file.beta()[1]).isCloseTo(3.0, within(1e-6));
        assertThat(file.beta()[2]).isCloseTo(-1.0, within(1e-6));
        // constant within the window
        assertThat(file.beta()[3]).isZero();
        assertThat(file.metrics()).isEqualTo(model.metrics());
        assertThat(Files.readString(artifact)).doesNotContain("\"sane\"");
    }

    @Test
    void sameWindow_yieldsSameMetrics() {
        List<LabeledRow> rows = noisyRows(300, new Random(3));
        LinearRegressionTrainer trainer = new LinearRegressionTrainer(List.of("a", "b"),
                new ModelArtifactRepository(tmp), CLOCK);

        var first = trainer.fit(new Dataset(MAY, rows)).metrics();
        var second = trainer.fit(new Dataset(MAY, rows)).metrics();

        assertThat(second).isEqualTo(first);
    }

    @Test
    void rowsWithMissingValues_areDropped() {
        List<LabeledRow> rows = new ArrayList<>(linearRows(50, new Random(1)));
        rows.add(new LabeledRow(FeatureVector.ofNumeric(Map.of("a", 1.0)), 5.0));
        rows.add(new LabeledRow(FeatureVector.ofNumeric(Map.of("a", 1.0, "b", 2.0, "month", 5.0)), Double.NaN));
        LinearRegressionTrainer trainer = new LinearRegressionTrainer(List.of("a", "b", "month"),
                new ModelArtifactRepository(tmp), CLOCK);

        assertThat(trainer.fit(new Dataset(MAY, rows)).metrics().mae()).isCloseTo(0.0, within(1e-6));
    }

    @Test
    void noConfiguredFeatures_usesAllNumericOnes() throws Exception {
        ModelArtifactRepository artifacts = new ModelArtifactRepository(tmp);
        LinearRegressionTrainer trainer = new LinearRegressionTrainer(List.of(), artifacts, CLOCK);

        TrainedModel model = trainer.fit(new Dataset(MAY, linearRows(60, new Random(9))));

        assertThat(artifacts.load(Path.of(model.artifactRef())).features()).containsExactly("a", "b", "month");
    }

    @Test
    void tooFewRows_failTraining() {
        LinearRegressionTrainer trainer = new LinearRegressionTrainer(List.of("a", "b", "month"),
                new ModelArtifactRepository(tmp), CLOCK);

        assertThatThrownBy(() -> trainer.fit(new Dataset(MAY, linearRows(3, new Random(1)))))
                .isInstanceOf(TrainingException.class)
                .hasMessageContaining("2024-05");
    }

    private static List<LabeledRow> linearRows(int n, Random rnd) {
        List<LabeledRow> rows = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            double a = rnd.nextDouble() * 10;
            double b = rnd.nextDouble() * 5;
            Map<String, Double> x = new HashMap<>();
            x.put("a", a);
            x.put("b", b);
            x.put("month", 5.0);
            rows.add(new LabeledRow(FeatureVector.ofNumeric(x), 2.0 + 3.0 * a - b));
        }
        return rows;
    }

    private static List<LabeledRow> noisyRows(int n, Random rnd) {
        List<LabeledRow> rows = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            double a = rnd.nextDouble() * 10;
            double b = rnd.nextDouble() * 5;
            rows.add(new LabeledRow(FeatureVector.ofNumeric(Map.of("a", a, "b", b)),
                    1.0 + a + b + rnd.nextGaussian()));
        }
        return rows;
    }
}
