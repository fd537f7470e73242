package com.example.mlops.ml;

import com.example.mlops.collab.TrainedModel;
import com.example.mlops.collab.Trainer;
import com.example.mlops.dto.Dataset;
import com.example.mlops.dto.LabeledRow;
import com.example.mlops.exception.TrainingException;
import com.example.mlops.registry.ModelMetrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.moment.Variance;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.TreeSet;
import java.util.stream.IntStream;

/**
 * Default {@link Trainer}: a linear least-squares model over numeric features.
 *
 * <h2>Procedure</h2>
 * <ol>
 *   <li>Keep rows where every selected feature and the label are present and finite.</li>
 *   <li>Shuffle with a fixed seed ({@value #SPLIT_SEED}) and hold out {@value #TEST_FRACTION} of the rows,
 *       so the same window always yields the same split.</li>
 *   <li>Fit on the training split. Columns that are constant in the training split
 *       (e.g. {@code month} inside a monthly window) get a zero weight instead of making
 *       the design matrix singular.</li>
 *   <li>Report MAE, RMSE and R² on the hold-out split plus the training MAE, and write the
 *       coefficients to the models directory.</li>
 * </ol>
 *
 * Features come from configuration; when none are configured every numeric feature
 * present in the dataset is used, in name order.
 */
@Slf4j
public class LinearRegressionTrainer implements Trainer {

    static final double TEST_FRACTION = 0.2;
    static final long SPLIT_SEED = 42L;

    private final List<String> features;
    private final ModelArtifactRepository artifacts;
    private final Clock clock;

    public LinearRegressionTrainer(List<String> features, ModelArtifactRepository artifacts, Clock clock) {
        this.features = features == null ? List.of() : List.copyOf(features);
        this.artifacts = artifacts;
        this.clock = clock;
    }

    @Override
    public TrainedModel fit(Dataset dataset) {
        List<String> names = features.isEmpty() ? numericFeaturesOf(dataset) : features;
        if (names.isEmpty()) throw new TrainingException("No numeric features to train on");

        List<double[]> X = new ArrayList<>();
        List<Double> y = new ArrayList<>();
        for (LabeledRow row : dataset.rows()) {
            double[] x = vector(row, names);
            if (x != null && Double.isFinite(row.label())) {
                X.add(x);
                y.add(row.label());
            }
        }
        int n = X.size();
        int nTest = Math.max(1, (int) Math.round(n * TEST_FRACTION));
        int nTrain = n - nTest;
        if (nTrain < names.size() + 1) {
            throw new TrainingException("Window " + dataset.window().id() + " has " + n
                    + " usable rows; too few for " + names.size() + " features");
        }
        if (n < dataset.size()) {
            log.info("Dropped {} of {} rows with missing or non-finite values", dataset.size() - n, dataset.size());
        }

        List<Integer> idx = new ArrayList<>(IntStream.range(0, n).boxed().toList());
        Collections.shuffle(idx, new Random(SPLIT_SEED));
        List<Integer> trainIdx = idx.subList(0, nTrain);
        List<Integer> testIdx = idx.subList(nTrain, n);

        boolean[] varying = varyingColumns(X, trainIdx, names.size());
        List<double[]> Xtrain = new ArrayList<>();
        List<Double> ytrain = new ArrayList<>();
        for (int i : trainIdx) {
            Xtrain.add(select(X.get(i), varying));
            ytrain.add(y.get(i));
        }

        double[] beta;
        try {
            beta = expand(LeastSquaresRegression.fit(Xtrain, ytrain).coefficients(), varying);
        } catch (IllegalArgumentException e) {
            throw new TrainingException("Least-squares fit failed on window " + dataset.window().id() + ": " + e, e);
        }

        ModelMetrics metrics = new ModelMetrics(
                mae(beta, X, y, testIdx),
                rmse(beta, X, y, testIdx),
                r2(beta, X, y, testIdx),
                mae(beta, X, y, trainIdx));
        log.info("Trained on {} rows ({} held out) with {} features: test MAE={} RMSE={} R2={}",
                nTrain, nTest, names.size(), round3(metrics.mae()), round3(metrics.rmse()), round3(metrics.r2()));

        Instant now = clock.instant();
        try {
            Path path = artifacts.save(new ModelArtifactRepository.ModelFile(
                    dataset.window().id(), names, beta, metrics, nTrain, now));
            return new TrainedModel(path.toString(), metrics);
        } catch (IOException e) {
            throw new TrainingException("Cannot persist model artifact: " + e, e);
        }
    }

    /* ===================== helpers ===================== */

    private static List<String> numericFeaturesOf(Dataset dataset) {
        TreeSet<String> names = new TreeSet<>();
        dataset.rows().forEach(r -> names.addAll(r.features().numeric().keySet()));
        return List.copyOf(names);
    }

    private static double[] vector(LabeledRow row, List<String> names) {
        double[] x = new double[names.size()];
        for (int j = 0; j < x.length; j++) {
            Double v = row.features().numeric().get(names.get(j));
            if (v == null || !Double.isFinite(v)) return null;
            x[j] = v;
        }
        return x;
    }

    private static boolean[] varyingColumns(List<double[]> X, List<Integer> rows, int p) {
        boolean[] out = new boolean[p];
        Variance variance = new Variance();
        for (int j = 0; j < p; j++) {
            final int col = j;
            double[] values = rows.stream().mapToDouble(i -> X.get(i)[col]).toArray();
            out[j] = variance.evaluate(values) > 0.0;
        }
        return out;
    }

    private static double[] select(double[] x, boolean[] keep) {
        double[] out = new double[count(keep)];
        for (int j = 0, k = 0; j < x.length; j++) if (keep[j]) out[k++] = x[j];
        return out;
    }

    /** Re-inserts zero weights for the dropped columns; index 0 stays the intercept. */
    private static double[] expand(double[] fitted, boolean[] keep) {
        double[] beta = new double[keep.length + 1];
        beta[0] = fitted[0];
        for (int j = 0, k = 1; j < keep.length; j++) if (keep[j]) beta[j + 1] = fitted[k++];
        return beta;
    }

    private static int count(boolean[] flags) {
        int c = 0;
        for (boolean f : flags) if (f) c++;
        return c;
    }

    private static double predict(double[] beta, double[] x) {
        double s = beta[0];
        for (int j = 0; j < x.length; j++) s += beta[j + 1] * x[j];
        return s;
    }

    private static double mae(double[] beta, List<double[]> X, List<Double> y, List<Integer> rows) {
        return rows.stream().mapToDouble(i -> Math.abs(predict(beta, X.get(i)) - y.get(i))).average().orElse(Double.NaN);
    }

    private static double rmse(double[] beta, List<double[]> X, List<Double> y, List<Integer> rows) {
        double mse = rows.stream().mapToDouble(i -> {
            double e = predict(beta, X.get(i)) - y.get(i);
            return e * e;
        }).average().orElse(Double.NaN);
        return Math.sqrt(mse);
    }

    private static double r2(double[] beta, List<double[]> X, List<Double> y, List<Integer> rows) {
        double mean = rows.stream().mapToDouble(y::get).average().orElse(Double.NaN);
        double ssRes = 0.0, ssTot = 0.0;
        for (int i : rows) {
            double e = predict(beta, X.get(i)) - y.get(i);
            double d = y.get(i) - mean;
            ssRes += e * e;
            ssTot += d * d;
        }
        if (ssTot == 0.0) return ssRes == 0.0 ? 1.0 : 0.0;
        return 1.0 - ssRes / ssTot;
    }

    private static double round3(double v) { return Math.round(v * 1000.0) / 1000.0; }
}
