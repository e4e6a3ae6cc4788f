package com.paxkun.tracker.controller;

import java.time.LocalDateTime;

public record ApiError(String message, LocalDateTime timestamp) {
}
