package com.gentoro.scheduler.task;

import com.gentoro.scheduler.exception.StateException;
import com.gentoro.scheduler.scheduler.Scheduler;

/**
 * Capabilities shared by every task: a logger scoped to the current invocation, the ability to
 * change its own repeat interval while executing, and access to the scheduler that runs it.
 *
 * <p>Implementations extend either {@link Task} or {@link TaskWithParams}. A fresh instance is
 * created for each invocation.
 */
public abstract class BaseTask {
  private TaskContext context;
  private Scheduler scheduler;
  private TaskServices services;

  /** Whether this task is a {@link Task} or a {@link TaskWithParams}. */
  public abstract TaskKind kind();

  final void bind(TaskContext context, Scheduler scheduler, TaskServices services) {
    this.context = context;
    this.scheduler = scheduler;
    this.services = services;
  }

  /** Logger whose entries are persisted with the invocation. */
  protected TaskLogger log() {
    return context().log();
  }

  /**
   * Requests that the task is repeated {@code intervalMs} milliseconds after it completes, or
   * cancels repetition when {@code null}.
   */
  protected void setIntervalForRepeatingTask(Long intervalMs) {
    context().setIntervalMs(intervalMs);
  }

  protected TaskContext context() {
    if (context == null) {
      throw new StateException("Task has not been bound to an invocation");
    }
    return context;
  }

  protected Scheduler scheduler() {
    if (scheduler == null) {
      throw new StateException("Task has not been bound to an invocation");
    }
    return scheduler;
  }

  protected TaskServices services() {
    if (services == null) {
      throw new StateException("Task has not been bound to an invocation");
    }
    return services;
  }
}
