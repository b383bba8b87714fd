package com.gentoro.scheduler.storage;

import java.time.Instant;
import java.util.Objects;

/** Values for a row that is about to be inserted into the {@code tasks} table. */
public record NewTaskRecord(
    String taskName, String params, Long parentTaskId, Long intervalMs, Instant scheduledDate) {
  public NewTaskRecord {
    Objects.requireNonNull(taskName, "taskName");
    Objects.requireNonNull(scheduledDate, "scheduledDate");
  }
}
