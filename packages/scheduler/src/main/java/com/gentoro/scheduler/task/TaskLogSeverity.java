package com.gentoro.scheduler.task;

import com.fasterxml.jackson.annotation.JsonValue;

/** Severity of an entry logged by a task during its execution. */
public enum TaskLogSeverity {
  DEBUG("Debug"),
  INFO("Info"),
  WARNING("Warning"),
  ERROR("Error"),
  EXCEPTION("Exception");

  private final String label;

  TaskLogSeverity(String label) {
    this.label = label;
  }

  @JsonValue
  public String label() {
    return label;
  }
}
