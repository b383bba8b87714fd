package com.gentoro.scheduler.task;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A task that takes a validated parameter object.
 *
 * @param <P> type of the validated parameters
 */
public abstract class TaskWithParams<P> extends BaseTask {
  @Override
  public final TaskKind kind() {
    return TaskKind.PARAMETERIZED;
  }

  /** Validates the raw parameters and converts them into {@code P}. */
  public abstract P validate(JsonNode params) throws InvalidParametersException;

  /** Executes the task with parameters previously returned by {@link #validate}. */
  public abstract boolean execute(P params) throws Exception;
}
