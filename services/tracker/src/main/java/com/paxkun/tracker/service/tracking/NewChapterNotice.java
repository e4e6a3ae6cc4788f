package com.paxkun.tracker.service.tracking;

import java.time.LocalDateTime;

/**
 * A newly detected chapter, buffered by a tracking job for notification.
 */
public record NewChapterNotice(
        String workTitle,
        String chapterNumber,
        String chapterTitle,
        String url,
        String sourceName,
        LocalDateTime detectedAt) {
}
