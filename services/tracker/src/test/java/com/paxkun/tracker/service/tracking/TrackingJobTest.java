package com.paxkun.tracker.service.tracking;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TrackingJobTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2026, 1, 15, 12, 0);

    @Test
    void followsPendingRunningCompleted() {
        TrackingJob job = new TrackingJob("job-1", TrackingRequest.all(), T0);
        assertThat(job.toStatus().status()).isEqualTo("pending");

        job.markRunning(T0.plusSeconds(1));
        job.setTotalMappings(2);
        job.mappingProcessed();
        job.recordError("Error processing mapping 2: boom");
        job.markCompleted(T0.plusSeconds(5));

        TrackingJobStatus status = job.toStatus();
        assertThat(status.status()).isEqualTo("completed");
        assertThat(status.startedAt()).isEqualTo(T0.plusSeconds(1));
        assertThat(status.completedAt()).isEqualTo(T0.plusSeconds(5));
        assertThat(status.totalMappings()).isEqualTo(2);
        assertThat(status.processedMappings()).isEqualTo(1);
        assertThat(status.errors()).containsExactly("Error processing mapping 2: boom");
    }

    @Test
    void terminalStatesCannotBeLeft() {
        TrackingJob completed = new TrackingJob("job-1", TrackingRequest.all(), T0);
        completed.markRunning(T0);
        completed.markCompleted(T0);

        assertThatThrownBy(() -> completed.markFailed("late", T0)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> completed.markRunning(T0)).isInstanceOf(IllegalStateException.class);
        assertThat(completed.getStatus()).isEqualTo(JobStatus.COMPLETED);

        TrackingJob failed = new TrackingJob("job-2", TrackingRequest.all(), T0);
        failed.markRunning(T0);
        failed.markFailed("Job failed: db down", T0);

        assertThatThrownBy(() -> failed.markCompleted(T0)).isInstanceOf(IllegalStateException.class);
        assertThat(failed.getStatus()).isEqualTo(JobStatus.FAILED);
    }

    @Test
    void cannotCompleteWithoutRunning() {
        TrackingJob job = new TrackingJob("job-1", TrackingRequest.all(), T0);

        assertThatThrownBy(() -> job.markCompleted(T0))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("pending");
    }

    @Test
    void failureReplacesAccumulatedErrors() {
        TrackingJob job = new TrackingJob("job-1", TrackingRequest.all(), T0);
        job.markRunning(T0);
        job.recordError("Error processing mapping 1: timeout");

        job.markFailed("Job failed: db down", T0.plusMinutes(1));

        assertThat(job.toStatus().errors()).containsExactly("Job failed: db down");
        assertThat(job.toStatus().status()).isEqualTo("failed");
    }

    @Test
    void snapshotsAreNotAffectedByLaterUpdates() {
        TrackingJob job = new TrackingJob("job-1", TrackingRequest.all(), T0);
        job.markRunning(T0);
        TrackingJobStatus before = job.toStatus();

        job.recordError("later");
        job.chapterFound(new NewChapterNotice("Solo Leveling", "1", "Chapter 1", "https://x/1", "Asura Scans", T0));

        assertThat(before.errors()).isEmpty();
        assertThat(before.newChaptersFound()).isZero();
        assertThat(job.toSummary().newChaptersFound()).isEqualTo(1);
        assertThat(job.getNotices()).hasSize(1);
    }

    @Test
    void notificationsDefaultToEnabled() {
        assertThat(new TrackingRequest(1L, null, null).notifyEnabled()).isTrue();
        assertThat(new TrackingRequest(1L, null, false).notifyEnabled()).isFalse();
    }
}
