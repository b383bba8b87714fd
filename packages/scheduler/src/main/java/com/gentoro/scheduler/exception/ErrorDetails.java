package com.gentoro.scheduler.exception;

import java.time.Instant;
import java.util.Map;

/** Structured representation of a failure, suitable for logs and API responses. */
public record ErrorDetails(
    String type,
    String message,
    SchedulerErrorCode code,
    Map<String, Object> context,
    Instant timestamp) {}
