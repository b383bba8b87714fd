package com.gentoro.scheduler.task;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;

/**
 * Collects the log entries of one task invocation in arrival order. The entries are shown to
 * operators in the task overview, and persisted as a JSON array when the task is finalized.
 */
public final class TaskLogger {
  private final List<TaskLogEntry> entries = new ArrayList<>();
  private final Supplier<Double> elapsedMillis;

  TaskLogger(Supplier<Double> elapsedMillis) {
    this.elapsedMillis = elapsedMillis;
  }

  public void debug(String message, Object... data) {
    append(TaskLogSeverity.DEBUG, message, data);
  }

  public void info(String message, Object... data) {
    append(TaskLogSeverity.INFO, message, data);
  }

  public void warning(String message, Object... data) {
    append(TaskLogSeverity.WARNING, message, data);
  }

  public void error(String message, Object... data) {
    append(TaskLogSeverity.ERROR, message, data);
  }

  public void exception(String message, Object... data) {
    append(TaskLogSeverity.EXCEPTION, message, data);
  }

  public List<TaskLogEntry> entries() {
    return Collections.unmodifiableList(entries);
  }

  private synchronized void append(TaskLogSeverity severity, String message, Object[] data) {
    List<Object> values = data == null ? List.of() : new ArrayList<>(Arrays.asList(data));
    entries.add(new TaskLogEntry(severity, elapsedMillis.get(), message, values));
  }
}
