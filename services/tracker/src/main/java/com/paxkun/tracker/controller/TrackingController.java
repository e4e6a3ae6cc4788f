package com.paxkun.tracker.controller;

import com.paxkun.tracker.service.LoggerService;
import com.paxkun.tracker.service.NotificationService;
import com.paxkun.tracker.service.TrackerService;
import com.paxkun.tracker.service.tracking.JobStatus;
import com.paxkun.tracker.service.tracking.TrackingJobStatus;
import com.paxkun.tracker.service.tracking.TrackingJobSummary;
import com.paxkun.tracker.service.tracking.TrackingRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * TrackingController starts tracking jobs and reports their progress.
 *
 * Author: Pax
 */
@RestController
@RequestMapping("/v1/tracking")
@RequiredArgsConstructor
public class TrackingController {

    private static final String TAG = "TRACKING_CONTROLLER";

    private final TrackerService trackerService;
    private final NotificationService notificationService;
    private final LoggerService logger;

    /**
     * Starts a tracking job in the background.
     *
     * @param request optional scope; an empty body tracks every verified mapping
     * @return the job id with status {@code pending}
     */
    @PostMapping("/trigger")
    public ResponseEntity<Map<String, String>> trigger(@RequestBody(required = false) TrackingRequest request) {
        String jobId = trackerService.trigger(request);
        logger.debug(TAG, "Trigger accepted | jobId=" + jobId);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(Map.of("jobId", jobId, "status", JobStatus.PENDING.value()));
    }

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<TrackingJobStatus> getJob(@PathVariable String jobId) {
        return trackerService.getStatus(jobId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> {
                    logger.debug(TAG, "Job not found | jobId=" + LoggerService.sanitizeForLog(jobId));
                    return ResponseEntity.notFound().build();
                });
    }

    @GetMapping("/jobs")
    public ResponseEntity<List<TrackingJobSummary>> listJobs(@RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(trackerService.listJobs(limit));
    }

    @PostMapping("/test-notification")
    public ResponseEntity<Map<String, String>> testNotification() {
        if (notificationService.sendTestNotification()) {
            return ResponseEntity.ok(Map.of("message", "Test notification sent"));
        }
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("message", "Failed to send test notification. Check the webhook configuration."));
    }
}
