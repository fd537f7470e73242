package com.example.mlops.coordinator;

import reactor.core.publisher.Mono;

/**
 * Returned for an accepted retrain submission.
 *
 * @param accepted   the job as accepted (state {@link JobState#INGESTING})
 * @param completion emits the terminal job; already subscribed and cached, so it can be
 *                   subscribed to any number of times without re-running the pipeline
 */
public record JobHandle(RetrainJob accepted, Mono<RetrainJob> completion) {}
