package com.example.mlops.collab;

import com.example.mlops.dto.DataWindow;
import com.example.mlops.dto.Dataset;
import com.example.mlops.dto.LabeledRow;
import com.example.mlops.exception.NotAvailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * {@link DataIngestionClient} for the data-preparation service.
 * {@code GET /windows/{id}} returns {@code {"rows":[{"features":{...},"label":..}, ...]}};
 * 404 means the window is not available yet.
 */
@Slf4j
public class HttpDataIngestionClient implements DataIngestionClient {

    private final WebClient web;
    private final Duration timeout;

    public HttpDataIngestionClient(WebClient web, Duration timeout) {
        this.web = web;
        this.timeout = timeout;
    }

    @Override
    public Dataset fetchWindow(DataWindow window) {
        log.info("Fetching training window {} ({} .. {})", window.id(), window.start(), window.endExclusive());
        WindowPayload payload = web.get()
                .uri("/windows/{id}", window.id())
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .onStatus(s -> s.value() == HttpStatus.NOT_FOUND.value(),
                        r -> Mono.error(new NotAvailableException(window.id(), "window not published yet")))
                .bodyToMono(WindowPayload.class)
                .timeout(timeout)
                .onErrorMap(e -> !(e instanceof NotAvailableException),
                        e -> new NotAvailableException(window.id(), "fetch failed: " + e, e))
                .block();
        if (payload == null) {
            throw new NotAvailableException(window.id(), "empty response");
        }
        return new Dataset(window, payload.rows());
    }

    public record WindowPayload(List<LabeledRow> rows) {}
}
