package com.gentoro.scheduler.task;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Addresses a task invocation either by the ID of a persisted row (static) or by task name
 * (ephemeral). Exactly one of the two is set. Named invocations may carry their parameters.
 */
public record TaskIdentifier(Long taskId, String taskName, JsonNode params) {
  public TaskIdentifier {
    if ((taskId == null) == (taskName == null)) {
      throw new IllegalArgumentException("Exactly one of taskId and taskName must be given");
    }
    if (taskName != null && taskName.isBlank()) {
      throw new IllegalArgumentException("taskName must not be blank");
    }
    if (taskId != null && params != null) {
      throw new IllegalArgumentException("Static tasks read their parameters from storage");
    }
  }

  public static TaskIdentifier forId(long taskId) {
    return new TaskIdentifier(taskId, null, null);
  }

  public static TaskIdentifier forName(String taskName) {
    return new TaskIdentifier(null, taskName, null);
  }

  public static TaskIdentifier forName(String taskName, JsonNode params) {
    return new TaskIdentifier(null, taskName, params);
  }

  public boolean isStatic() {
    return taskId != null;
  }

  @Override
  public String toString() {
    return isStatic() ? "task#" + taskId : "task:" + taskName;
  }
}
