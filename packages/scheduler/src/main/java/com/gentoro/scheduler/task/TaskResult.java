package com.gentoro.scheduler.task;

/** Outcome of a single task invocation. Persisted by name alongside the invocation's row. */
public enum TaskResult {
  /** The task ran and reported success. */
  TASK_SUCCESS,
  /** The task threw while executing. */
  TASK_EXCEPTION,
  /** The task ran and reported failure. */
  TASK_FAILURE,
  /** The task name is not known to the registry. */
  INVALID_NAMED_TASK,
  /** The task's parameters were rejected by its validation. */
  INVALID_PARAMETERS,
  /** No pending row exists for the task ID. */
  INVALID_TASK_ID,
  /** Reserved for outcomes that could not be classified. */
  UNKNOWN_FAILURE;

  /** Whether the task body ran to completion, successfully or not. */
  public boolean isCompleted() {
    return this == TASK_SUCCESS || this == TASK_FAILURE;
  }
}
