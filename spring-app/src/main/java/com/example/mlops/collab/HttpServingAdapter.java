package com.example.mlops.collab;

import com.example.mlops.dto.FeatureVector;
import com.example.mlops.exception.SwapException;
import com.example.mlops.registry.ModelVersion;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;

/**
 * {@link ServingAdapter} talking to the model-serving API over HTTP.
 *
 * <ul>
 *   <li>{@code GET /inputs/recent?n=} → JSON array of {@link FeatureVector}</li>
 *   <li>{@code POST /models/activate} with {@code {"version":..,"artifactRef":".."}} → any 2xx means activated</li>
 * </ul>
 *
 * Calls block for at most {@code timeout}; callers run on boundedElastic threads.
 */
@Slf4j
public class HttpServingAdapter implements ServingAdapter {

    private final WebClient web;
    private final Duration timeout;

    public HttpServingAdapter(WebClient web, Duration timeout) {
        this.web = web;
        this.timeout = timeout;
    }

    @Override
    public List<FeatureVector> sampleRecentInputs(int n) {
        List<FeatureVector> sample = web.get()
                .uri(b -> b.path("/inputs/recent").queryParam("n", n).build())
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToFlux(FeatureVector.class)
                .take(n)
                .collectList()
                .block(timeout);
        log.debug("Sampled {} recent inference inputs (requested {})", sample == null ? 0 : sample.size(), n);
        return sample == null ? List.of() : sample;
    }

    @Override
    public void activate(ModelVersion version) {
        web.post()
                .uri("/models/activate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new ActivationRequest(version.version(), version.artifactRef()))
                .retrieve()
                .toBodilessEntity()
                .timeout(timeout)
                .onErrorMap(e -> new SwapException(version.version(), e.toString(), e))
                .block();
        log.info("Serving now routes traffic to v{} ({})", version.version(), version.artifactRef());
    }

    public record ActivationRequest(long version, String artifactRef) {}
}
