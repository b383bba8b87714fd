package com.gentoro.scheduler.scheduler;

import com.gentoro.scheduler.task.TaskIdentifier;
import com.gentoro.scheduler.task.TaskResult;

/** Executes a task in another process, typically through its invocation endpoint. */
@FunctionalInterface
public interface TaskInvoker {
  TaskResult invoke(TaskIdentifier identifier);
}
