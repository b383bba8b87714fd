package com.gentoro.scheduler.storage;

import com.gentoro.scheduler.task.TaskResult;
import java.time.Instant;

/** A row of the {@code tasks} table. */
public record TaskRecord(
    long taskId,
    String taskName,
    String params,
    Long parentTaskId,
    Long intervalMs,
    Instant scheduledDate,
    TaskResult result,
    String logs,
    Long runtimeMs) {

  public boolean isPending() {
    return result == null;
  }
}
