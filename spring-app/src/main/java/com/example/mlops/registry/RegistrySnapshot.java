package com.example.mlops.registry;

import java.util.List;

/** Persisted form of the registry: every version plus the active pointer. */
public record RegistrySnapshot(Long activeVersion, List<ModelVersion> versions) {

    public RegistrySnapshot {
        versions = versions == null ? List.of() : List.copyOf(versions);
    }

    public static RegistrySnapshot empty() {
        return new RegistrySnapshot(null, List.of());
    }
}
