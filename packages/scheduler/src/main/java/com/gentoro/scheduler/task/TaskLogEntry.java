package com.gentoro.scheduler.task;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * Individual entry logged during task execution.
 *
 * @param severity severity of the entry
 * @param time milliseconds since execution started, {@code null} when logged before the start
 * @param message human readable message
 * @param data trailing values passed along with the message
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskLogEntry(
    TaskLogSeverity severity, Double time, String message, List<Object> data) {}
