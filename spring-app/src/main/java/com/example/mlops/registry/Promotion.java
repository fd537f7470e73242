package com.example.mlops.registry;

/**
 * Outcome of {@link ModelRegistry#promote(long, Long)}; needed to roll a promotion back.
 *
 * @param promotedVersion version now ACTIVE
 * @param retiredVersion  version retired by this promotion, {@code null} if none
 * @param changed         {@code false} when the version was already ACTIVE and nothing happened
 */
public record Promotion(long promotedVersion, Long retiredVersion, boolean changed) {}
