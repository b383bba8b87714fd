package com.gentoro.scheduler.scheduler;

import com.gentoro.scheduler.task.TaskIdentifier;
import com.gentoro.scheduler.task.TaskResult;
import java.util.OptionalLong;

/**
 * Owns a time-ordered queue of pending task invocations and executes the ones that have become
 * due. Timestamps are monotonic nanoseconds as reported by the scheduler's {@link MonotonicClock}.
 */
public interface Scheduler {
  /** Number of {@link #execute()} calls so far. */
  long executionCount();

  /** Number of task invocations so far. */
  long invocationCount();

  OptionalLong lastExecutionTime();

  OptionalLong lastInvocationTime();

  /** Queues the task to be executed after {@code delayMs} milliseconds. Never blocks. */
  void queueTask(TaskIdentifier identifier, long delayMs);

  /**
   * Executes every queued invocation that is due, one after another in due-time order. Exceptions
   * thrown by a task propagate; the invocations that were not reached stay queued.
   */
  void execute() throws Exception;

  /**
   * Requests execution of the task by the process serving the invocation endpoint, and returns its
   * result.
   */
  TaskResult invoke(TaskIdentifier identifier);

  int taskQueueSize();

  /** Drops every queued invocation. Counters are left unchanged. */
  void clearTasks();
}
