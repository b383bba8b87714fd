package com.gentoro.scheduler.task;

/**
 * A task without parameters. Success or failure is communicated through the return value of
 * {@link #execute()}; exceptions are reserved for unexpected faults and are not caught by the task.
 */
public abstract class Task extends BaseTask {
  @Override
  public final TaskKind kind() {
    return TaskKind.SIMPLE;
  }

  /** Executes the task, returning whether it succeeded. */
  public abstract boolean execute() throws Exception;
}
