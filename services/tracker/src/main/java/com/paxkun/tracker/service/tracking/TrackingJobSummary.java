package com.paxkun.tracker.service.tracking;

import java.time.LocalDateTime;

public record TrackingJobSummary(String jobId, String status, LocalDateTime startedAt, int newChaptersFound) {
}
