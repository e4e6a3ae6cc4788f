package com.paxkun.tracker.service;

import com.paxkun.tracker.service.tracking.TrackingRequest;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically triggers an unscoped tracking run with notifications.
 */
@Component
@ConditionalOnProperty(prefix = "tracker.schedule", name = "enabled", havingValue = "true")
public class TrackingScheduler {

    private final TrackerService trackerService;
    private final LoggerService logger;

    public TrackingScheduler(TrackerService trackerService, LoggerService logger) {
        this.trackerService = trackerService;
        this.logger = logger;
    }

    @Scheduled(cron = "${tracker.schedule.cron:0 0 */6 * * *}", zone = "${tracker.schedule.zone:UTC}")
    public void runScheduledTracking() {
        String jobId = trackerService.trigger(TrackingRequest.all());
        logger.info("SCHEDULER", "⏰ Scheduled tracking job started: " + jobId);
    }
}
