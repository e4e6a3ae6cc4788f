package com.paxkun.tracker.service.tracking;

import java.util.Locale;

/**
 * Tracking job lifecycle. COMPLETED and FAILED are terminal.
 */
public enum JobStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Lowercase name used in API responses.
     */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
