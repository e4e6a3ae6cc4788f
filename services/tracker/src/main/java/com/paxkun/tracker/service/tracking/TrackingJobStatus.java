package com.paxkun.tracker.service.tracking;

import java.time.LocalDateTime;
import java.util.List;

public record TrackingJobStatus(
        String jobId,
        String status,
        LocalDateTime startedAt,
        LocalDateTime completedAt,
        int totalMappings,
        int processedMappings,
        int newChaptersFound,
        List<String> errors) {
}
