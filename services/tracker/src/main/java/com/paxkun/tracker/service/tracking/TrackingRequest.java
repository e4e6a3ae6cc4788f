package com.paxkun.tracker.service.tracking;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Scope of a tracking run. Null ids mean "all"; notifications default to on.
 */
public record TrackingRequest(Long mangaId, Long scanlatorId, @JsonProperty("notify") Boolean notifyRequested) {

    public static TrackingRequest all() {
        return new TrackingRequest(null, null, true);
    }

    public boolean notifyEnabled() {
        return notifyRequested == null || notifyRequested;
    }
}
