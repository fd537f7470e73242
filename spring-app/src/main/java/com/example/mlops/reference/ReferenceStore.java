package com.example.mlops.reference;

import com.example.mlops.registry.ModelVersion;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the baseline the drift estimator compares live inputs against.
 *
 * <p>
 * Callers read the registry's active version first and then ask for its
 * baseline via {@link #baselineFor(ModelVersion)}; a cached baseline that
 * belongs to another version is never returned, so a swap that completed
 * mid-cycle is picked up on the next read.
 * </p>
 */
@Component
@Slf4j
public class ReferenceStore {

    private final AtomicReference<ReferenceDistribution> current = new AtomicReference<>();

    public Optional<ReferenceDistribution> current() {
        return Optional.ofNullable(current.get());
    }

    /** Baseline of {@code active}; refreshes the cached baseline when it is stale. */
    public ReferenceDistribution baselineFor(ModelVersion active) {
        ReferenceDistribution cached = current.get();
        if (cached != null && cached.modelVersion() == active.version()) {
            return cached;
        }
        ReferenceDistribution fresh = active.reference();
        if (current.compareAndSet(cached, fresh)) {
            log.info("Reference baseline switched to v{} (was {})", active.version(),
                    cached == null ? "none" : "v" + cached.modelVersion());
        }
        return fresh;
    }

    /** Replace the baseline after a promotion. */
    public void replace(ReferenceDistribution next) {
        ReferenceDistribution previous = current.getAndSet(next);
        log.info("Reference baseline replaced: v{} -> v{} ({} features, captured {})",
                previous == null ? "-" : previous.modelVersion(),
                next.modelVersion(), next.features().size(), next.capturedAt());
    }
}
