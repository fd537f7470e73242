package com.example.mlops;

import com.example.mlops.drift.FeatureAggregation;
import com.example.mlops.registry.PrimaryMetric;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Externalized settings of the orchestrator, bound from {@code mlops.*}.
 *
 * <h2>Drift and decision</h2>
 * <ul>
 *   <li>{@code drift-threshold} – aggregate score above which a retrain is considered (0.2).</li>
 *   <li>{@code cool-down-seconds} – minimum time after a completed retrain before the next one (3600).</li>
 *   <li>{@code min-sample-size} – fewer live inputs than this and the cycle is skipped (100).</li>
 *   <li>{@code required-consecutive-breaches} – reports in a row that must exceed the threshold (1).</li>
 * </ul>
 *
 * <h2>Validation</h2>
 * A candidate is accepted iff its {@code primary-metric} error is at most
 * {@code active * (1 + regression-tolerance)}.
 *
 * <p>Invalid values fail startup.</p>
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "mlops")
public class RetrainProperties {

    @DecimalMin("0.0")
    private double driftThreshold = 0.2;

    @Min(0)
    private long coolDownSeconds = 3600;

    @Min(1)
    private int minSampleSize = 100;

    /** How many recent inference inputs one monitoring cycle asks serving for. */
    @Min(1)
    private int sampleSize = 500;

    @Min(2)
    private int numericBins = 10;

    @DecimalMin("0.0")
    private double regressionTolerance = 0.05;

    @NotNull
    private FeatureAggregation featureAggregation = FeatureAggregation.MAX;

    @Min(1)
    private int requiredConsecutiveBreaches = 1;

    @NotNull
    private PrimaryMetric primaryMetric = PrimaryMetric.MAE;

    /** Regressors of the default trainer; empty means every numeric feature of the window. */
    private List<String> numericFeatures = new ArrayList<>();

    @NotBlank
    private String registryFile = "data/registry.json";

    @NotBlank
    private String modelsDir = "data/models";

    @Min(1)
    private int historyRetention = 1000;

    @Min(1)
    private int jobRetention = 200;

    @Valid
    private Monitor monitor = new Monitor();

    @Valid
    private Endpoint serving = new Endpoint("http://localhost:8000");

    @Valid
    private Endpoint ingestion = new Endpoint("http://localhost:8090");

    private Bootstrap bootstrap = new Bootstrap();

    public Duration coolDown() {
        return Duration.ofSeconds(coolDownSeconds);
    }

    /** A cycle that samples fewer inputs than the minimum could never score a feature. */
    @AssertTrue(message = "min-sample-size must not exceed sample-size")
    public boolean isSampleSizeCoveringMinimum() {
        return minSampleSize <= sampleSize;
    }

    @Getter
    @Setter
    public static class Monitor {
        private boolean enabled = true;
        @NotNull
        private Duration interval = Duration.ofMinutes(5);
        @NotNull
        private Duration initialDelay = Duration.ofSeconds(30);
    }

    @Getter
    @Setter
    public static class Endpoint {
        @NotBlank
        private String baseUrl;
        @NotNull
        private Duration timeout = Duration.ofSeconds(10);

        public Endpoint() {
        }

        public Endpoint(String baseUrl) {
            this.baseUrl = baseUrl;
        }
    }

    @Getter
    @Setter
    public static class Bootstrap {
        /** {@code YYYY-MM} month used to train v1 when the registry is empty. */
        private String window;
    }
}
