package com.gentoro.scheduler.scheduler;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Request to persist and queue a task.
 *
 * @param taskName registered name of the task
 * @param params parameters, {@code null} for none
 * @param delayMs delay before the first execution
 * @param intervalMs interval at which the task repeats, {@code null} for a one-off task
 * @param parentTaskId task this one manually repeats, if any
 */
public record ScheduleTaskRequest(
    String taskName, JsonNode params, long delayMs, Long intervalMs, Long parentTaskId) {
  public static ScheduleTaskRequest once(String taskName, JsonNode params, long delayMs) {
    return new ScheduleTaskRequest(taskName, params, delayMs, null, null);
  }
}
