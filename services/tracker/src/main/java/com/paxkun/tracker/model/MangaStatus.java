package com.paxkun.tracker.model;

public enum MangaStatus {
    READING,
    COMPLETED,
    ON_HOLD,
    PLAN_TO_READ
}
