package com.example.mlops.coordinator;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetrainJobTest {

    private static final Instant T0 = Instant.parse("2024-06-01T00:00:00Z");

    @Test
    void accept_startsInIngesting() {
        RetrainJob job = RetrainJob.accept(TriggerReason.DRIFT, T0);

        assertThat(job.state()).isEqualTo(JobState.INGESTING);
        assertThat(job.transitions()).containsKeys(JobState.IDLE, JobState.INGESTING);
        assertThat(job.id()).isNotBlank();
        assertThat(job.finishedAt()).isNull();
    }

    @Test
    void advance_followsPipelineOrder() {
        RetrainJob job = RetrainJob.accept(TriggerReason.MANUAL, T0)
                .advance(JobState.TRAINING, T0.plusSeconds(1))
                .advance(JobState.VALIDATING, T0.plusSeconds(2))
                .advance(JobState.SWAPPING, T0.plusSeconds(3))
                .advance(JobState.DONE, T0.plusSeconds(4));

        assertThat(job.isTerminal()).isTrue();
        assertThat(job.finishedAt()).isEqualTo(T0.plusSeconds(4));
    }

    @Test
    void illegalTransitions_areRejected() {
        RetrainJob job = RetrainJob.accept(TriggerReason.DRIFT, T0);

        assertThatThrownBy(() -> job.advance(JobState.SWAPPING, T0)).isInstanceOf(IllegalStateException.class);
        RetrainJob failed = job.fail("boom", T0);
        assertThat(failed.failureReason()).isEqualTo("boom");
        assertThatThrownBy(() -> failed.advance(JobState.TRAINING, T0)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void windowPolicy_picksPreviousCalendarMonth() {
        Clock clock = Clock.fixed(Instant.parse("2024-01-15T08:00:00Z"), ZoneOffset.UTC);

        var window = new DataWindowPolicy(clock).nextWindow();

        assertThat(window.id()).isEqualTo("2023-12");
        assertThat(window.start()).hasToString("2023-12-01");
        assertThat(window.endExclusive()).hasToString("2024-01-01");
    }
}
