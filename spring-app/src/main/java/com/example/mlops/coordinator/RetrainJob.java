package com.example.mlops.coordinator;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;

/**
 * Immutable snapshot of a retrain job. Every change yields a new snapshot; the
 * coordinator owns the latest one until the job is terminal.
 *
 * @param id               unique job id
 * @param trigger          what started the job
 * @param state            current state
 * @param dataWindow       id of the training window, once chosen
 * @param candidateVersion registry version of the candidate, once trained
 * @param validation       validation outcome, once validated
 * @param failureReason    why the job failed, {@code null} unless {@link JobState#FAILED}
 * @param transitions      time each state was entered
 */
public record RetrainJob(
        String id,
        TriggerReason trigger,
        JobState state,
        String dataWindow,
        Long candidateVersion,
        ValidationOutcome validation,
        String failureReason,
        Map<JobState, Instant> transitions) {

    public RetrainJob {
        transitions = transitions == null || transitions.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(transitions));
    }

    /** A freshly accepted job: IDLE → INGESTING at {@code at}. */
    public static RetrainJob accept(TriggerReason trigger, Instant at) {
        Map<JobState, Instant> t = new EnumMap<>(JobState.class);
        t.put(JobState.IDLE, at);
        t.put(JobState.INGESTING, at);
        return new RetrainJob(UUID.randomUUID().toString(), trigger, JobState.INGESTING,
                null, null, null, null, t);
    }

    /**
     * @throws IllegalStateException if {@code next} is not a legal successor of the current state
     */
    public RetrainJob advance(JobState next, Instant at) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Job " + id + ": illegal transition " + state + " -> " + next);
        }
        Map<JobState, Instant> t = new EnumMap<>(JobState.class);
        t.putAll(transitions);
        t.put(next, at);
        return new RetrainJob(id, trigger, next, dataWindow, candidateVersion, validation, failureReason, t);
    }

    public RetrainJob fail(String reason, Instant at) {
        RetrainJob failed = advance(JobState.FAILED, at);
        return new RetrainJob(id, trigger, JobState.FAILED, dataWindow, candidateVersion, validation,
                reason, failed.transitions());
    }

    public RetrainJob withDataWindow(String window) {
        return new RetrainJob(id, trigger, state, window, candidateVersion, validation, failureReason, transitions);
    }

    public RetrainJob withCandidate(long version) {
        return new RetrainJob(id, trigger, state, dataWindow, version, validation, failureReason, transitions);
    }

    public RetrainJob withValidation(ValidationOutcome outcome) {
        return new RetrainJob(id, trigger, state, dataWindow, candidateVersion, outcome, failureReason, transitions);
    }

    @JsonIgnore
    public boolean isTerminal() {
        return state.isTerminal();
    }

    /** Time the job reached a terminal state, {@code null} while running. */
    public Instant finishedAt() {
        return isTerminal() ? transitions.get(state) : null;
    }
}
