package com.example.mlops.registry;

import com.example.mlops.exception.RegistryUnavailableException;

import java.util.Optional;

/**
 * Durable storage behind {@link ModelRegistry}.
 *
 * <p>
 * {@link #save} must replace the whole snapshot atomically: a reader sees either
 * the previous snapshot or the new one, never a mix. That makes the active-version
 * field a compare-and-set target when the registry serializes its writers.
 * </p>
 */
public interface RegistryStore {

    /**
     * @return the last saved snapshot, or empty if nothing was ever saved
     * @throws RegistryUnavailableException if the store cannot be read
     */
    Optional<RegistrySnapshot> load();

    /**
     * @throws RegistryUnavailableException if the snapshot could not be durably written
     */
    void save(RegistrySnapshot snapshot);
}
