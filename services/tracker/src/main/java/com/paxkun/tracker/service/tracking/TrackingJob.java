package com.paxkun.tracker.service.tracking;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Thread-safe state of one tracking run.
 * <p>
 * Only the job's own background task mutates it; status and listing calls read
 * snapshots. Status moves forward only: PENDING, RUNNING, then COMPLETED or FAILED.
 * Any other transition throws {@link IllegalStateException}.
 */
public class TrackingJob {

    private final String jobId;
    private final TrackingRequest request;
    private final LocalDateTime createdAt;

    private JobStatus status = JobStatus.PENDING;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private int totalMappings;
    private int processedMappings;
    private int newChaptersFound;
    private final List<String> errors = new ArrayList<>();
    private final List<NewChapterNotice> notices = new ArrayList<>();

    public TrackingJob(String jobId, TrackingRequest request, LocalDateTime createdAt) {
        this.jobId = jobId;
        this.request = request;
        this.createdAt = createdAt;
    }

    public synchronized void markRunning(LocalDateTime now) {
        requireStatus(JobStatus.PENDING, JobStatus.RUNNING);
        this.status = JobStatus.RUNNING;
        this.startedAt = now;
    }

    public synchronized void setTotalMappings(int totalMappings) {
        this.totalMappings = totalMappings;
    }

    public synchronized void mappingProcessed() {
        this.processedMappings++;
    }

    public synchronized void chapterFound(NewChapterNotice notice) {
        this.newChaptersFound++;
        this.notices.add(notice);
    }

    public synchronized void recordError(String message) {
        this.errors.add(message);
    }

    public synchronized void markCompleted(LocalDateTime now) {
        requireStatus(JobStatus.RUNNING, JobStatus.COMPLETED);
        this.status = JobStatus.COMPLETED;
        this.completedAt = now;
    }

    /**
     * Replaces accumulated errors with the fatal one.
     */
    public synchronized void markFailed(String message, LocalDateTime now) {
        requireStatus(JobStatus.RUNNING, JobStatus.FAILED);
        this.status = JobStatus.FAILED;
        this.errors.clear();
        this.errors.add(message);
        this.completedAt = now;
    }

    private void requireStatus(JobStatus expected, JobStatus target) {
        if (status != expected) {
            throw new IllegalStateException(
                    "Job " + jobId + " cannot move from " + status.value() + " to " + target.value());
        }
    }

    public synchronized TrackingJobStatus toStatus() {
        return new TrackingJobStatus(
                jobId,
                status.value(),
                startedAt,
                completedAt,
                totalMappings,
                processedMappings,
                newChaptersFound,
                List.copyOf(errors));
    }

    public synchronized TrackingJobSummary toSummary() {
        return new TrackingJobSummary(jobId, status.value(), startedAt, newChaptersFound);
    }

    public synchronized List<NewChapterNotice> getNotices() {
        return List.copyOf(notices);
    }

    public String getJobId() {
        return jobId;
    }

    public TrackingRequest getRequest() {
        return request;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public synchronized JobStatus getStatus() {
        return status;
    }

    public synchronized LocalDateTime getStartedAt() {
        return startedAt;
    }
}
