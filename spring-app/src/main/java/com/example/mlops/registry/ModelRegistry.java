package com.example.mlops.registry;

import com.example.mlops.exception.ConcurrentPromotionException;
import com.example.mlops.exception.RegistryUnavailableException;
import com.example.mlops.reference.FeatureSummary;
import com.example.mlops.reference.ReferenceDistribution;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Versioned store of trained models and the single "active" pointer.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>Once seeded, exactly one version is {@link PromotionStatus#ACTIVE}.</li>
 *   <li>Version ids are assigned as {@code max + 1} and never reused.</li>
 *   <li>Every change is written to the {@link RegistryStore} first and applied in memory
 *       only after the write succeeded, so memory and storage never diverge.</li>
 * </ul>
 * A stored snapshot that breaks these on load is refused with {@link RegistryUnavailableException}.
 *
 * <h2>Concurrency</h2>
 * All operations are serialized on the registry monitor. {@link #promote(long, Long)} is a
 * compare-and-set on the active pointer: the caller states which version it validated
 * against and the promotion fails if the pointer moved in the meantime.
 *
 * <h2>Failure</h2>
 * If the store fails once, the registry refuses every further call with
 * {@link RegistryUnavailableException}. No safe decision can be taken without a
 * trustworthy active pointer.
 */
@Component
@Slf4j
public class ModelRegistry {

    private final RegistryStore store;
    private final Clock clock;

    private final TreeMap<Long, ModelVersion> versions = new TreeMap<>();
    private Long activeVersion;
    private RegistryUnavailableException failure;

    public ModelRegistry(RegistryStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
        RegistrySnapshot snapshot = store.load().orElse(RegistrySnapshot.empty());
        verify(snapshot);
        snapshot.versions().forEach(v -> versions.put(v.version(), v));
        this.activeVersion = snapshot.activeVersion();
        log.info("Model registry loaded: {} versions, active={}", versions.size(),
                activeVersion == null ? "none" : "v" + activeVersion);
    }

    /**
     * Register the very first model (trained outside the retrain pipeline) directly as ACTIVE.
     *
     * @throws IllegalStateException if any version already exists
     */
    public synchronized ModelVersion seed(String dataWindow, String artifactRef, ModelMetrics metrics,
                                          Map<String, FeatureSummary> baseline) {
        ensureAvailable();
        if (!versions.isEmpty()) {
            throw new IllegalStateException("Registry already holds " + versions.size() + " versions; cannot seed");
        }
        ModelVersion first = newVersion(1L, dataWindow, artifactRef, metrics, baseline, PromotionStatus.ACTIVE);
        TreeMap<Long, ModelVersion> next = new TreeMap<>();
        next.put(first.version(), first);
        commit(next, first.version());
        log.info("Seeded registry with v{} (window={}, metrics={})", first.version(), dataWindow, metrics);
        return first;
    }

    /** Register a freshly trained model with status {@link PromotionStatus#CANDIDATE}. */
    public synchronized ModelVersion registerCandidate(String dataWindow, String artifactRef, ModelMetrics metrics,
                                                       Map<String, FeatureSummary> baseline) {
        ensureAvailable();
        long id = versions.isEmpty() ? 1L : versions.lastKey() + 1;
        ModelVersion candidate = newVersion(id, dataWindow, artifactRef, metrics, baseline, PromotionStatus.CANDIDATE);
        TreeMap<Long, ModelVersion> next = new TreeMap<>(versions);
        next.put(id, candidate);
        commit(next, activeVersion);
        log.info("Registered candidate v{} (window={}, metrics={})", id, dataWindow, metrics);
        return candidate;
    }

    /**
     * Make {@code candidateId} the active version, retiring the current one in the same write.
     *
     * @param candidateId    version to promote
     * @param expectedActive the active version the candidate was validated against
     * @return what changed; {@link Promotion#changed()} is {@code false} if the candidate was already active
     * @throws ConcurrentPromotionException if the active pointer no longer equals {@code expectedActive}
     * @throws NoSuchElementException       if the candidate is unknown
     * @throws IllegalStateException        if the candidate was retired
     */
    public synchronized Promotion promote(long candidateId, Long expectedActive) {
        ensureAvailable();
        ModelVersion candidate = require(candidateId);
        if (candidate.status() == PromotionStatus.ACTIVE) {
            log.info("v{} is already ACTIVE; promote is a no-op", candidateId);
            return new Promotion(candidateId, null, false);
        }
        if (candidate.status() == PromotionStatus.RETIRED) {
            throw new IllegalStateException("v" + candidateId + " is RETIRED and cannot be promoted");
        }
        if (!Objects.equals(activeVersion, expectedActive)) {
            throw new ConcurrentPromotionException(candidateId, expectedActive, activeVersion);
        }

        Instant now = clock.instant();
        TreeMap<Long, ModelVersion> next = new TreeMap<>(versions);
        Long retired = activeVersion;
        if (retired != null) {
            next.put(retired, versions.get(retired).withStatus(PromotionStatus.RETIRED, now));
        }
        next.put(candidateId, candidate.withStatus(PromotionStatus.ACTIVE, now));
        commit(next, candidateId);
        log.info("Promoted v{} to ACTIVE (retired {})", candidateId, retired == null ? "none" : "v" + retired);
        return new Promotion(candidateId, retired, true);
    }

    /**
     * Undo {@code promotion}: the retired version becomes ACTIVE again and the promoted one
     * goes back to CANDIDATE.
     *
     * @throws ConcurrentPromotionException if the active pointer moved after the promotion
     */
    public synchronized void rollback(Promotion promotion) {
        ensureAvailable();
        if (!promotion.changed()) return;
        if (!Objects.equals(activeVersion, promotion.promotedVersion())) {
            throw new ConcurrentPromotionException(promotion.promotedVersion(), promotion.promotedVersion(), activeVersion);
        }

        Instant now = clock.instant();
        TreeMap<Long, ModelVersion> next = new TreeMap<>(versions);
        next.put(promotion.promotedVersion(),
                versions.get(promotion.promotedVersion()).withStatus(PromotionStatus.CANDIDATE, now));
        Long restored = promotion.retiredVersion();
        if (restored != null) {
            next.put(restored, versions.get(restored).withStatus(PromotionStatus.ACTIVE, now));
        }
        commit(next, restored);
        log.warn("Rolled back promotion of v{}; active is {}", promotion.promotedVersion(),
                restored == null ? "none" : "v" + restored);
    }

    /**
     * @throws IllegalStateException if the registry has never been seeded
     */
    public synchronized ModelVersion getActive() {
        ensureAvailable();
        if (activeVersion == null) {
            throw new IllegalStateException("No ACTIVE model version; the registry has not been seeded");
        }
        return versions.get(activeVersion);
    }

    public synchronized boolean hasActive() {
        ensureAvailable();
        return activeVersion != null;
    }

    public synchronized Optional<ModelVersion> find(long version) {
        ensureAvailable();
        return Optional.ofNullable(versions.get(version));
    }

    /** All versions, oldest first. */
    public synchronized List<ModelVersion> versions() {
        ensureAvailable();
        return List.copyOf(versions.values());
    }

    public synchronized boolean isAvailable() {
        return failure == null;
    }

    /* ===================== internals ===================== */

    /**
     * A loaded snapshot is usable only if its version ids are unique, at most one version is ACTIVE,
     * and the active pointer names exactly that version.
     */
    private static void verify(RegistrySnapshot snapshot) {
        Set<Long> ids = new HashSet<>();
        List<Long> active = new ArrayList<>();
        for (ModelVersion v : snapshot.versions()) {
            if (!ids.add(v.version())) {
                throw new RegistryUnavailableException("Corrupt registry snapshot: duplicate version v" + v.version());
            }
            if (v.status() == PromotionStatus.ACTIVE) active.add(v.version());
        }
        Long pointer = snapshot.activeVersion();
        boolean consistent = pointer == null ? active.isEmpty() : active.equals(List.of(pointer));
        if (!consistent) {
            throw new RegistryUnavailableException("Corrupt registry snapshot: active pointer "
                    + (pointer == null ? "none" : "v" + pointer) + " but ACTIVE versions " + active);
        }
    }

    private ModelVersion newVersion(long id, String dataWindow, String artifactRef, ModelMetrics metrics,
                                    Map<String, FeatureSummary> baseline, PromotionStatus status) {
        Instant now = clock.instant();
        ReferenceDistribution reference = new ReferenceDistribution(id, baseline, now);
        return new ModelVersion(id, dataWindow, artifactRef, metrics, reference, status, now, now);
    }

    private ModelVersion require(long id) {
        ModelVersion v = versions.get(id);
        if (v == null) throw new NoSuchElementException("Unknown model version v" + id);
        return v;
    }

    private void commit(TreeMap<Long, ModelVersion> next, Long nextActive) {
        try {
            store.save(new RegistrySnapshot(nextActive, List.copyOf(next.values())));
        } catch (RegistryUnavailableException e) {
            failure = e;
            log.error("Model registry persistence failed; refusing further operations: {}", e.toString());
            throw e;
        }
        versions.clear();
        versions.putAll(next);
        activeVersion = nextActive;
    }

    private void ensureAvailable() {
        if (failure != null) {
            throw new RegistryUnavailableException("Model registry is unavailable", failure);
        }
    }
}
