package com.gentoro.scheduler.scheduler;

import com.gentoro.scheduler.task.TaskIdentifier;
import java.util.Comparator;

/** A queued task invocation together with the monotonic time at which it becomes due. */
record QueuedInvocation(TaskIdentifier identifier, long dueAtNanos) {
  static final Comparator<QueuedInvocation> BY_DUE_TIME =
      Comparator.comparingLong(QueuedInvocation::dueAtNanos);

  boolean isDue(long nowNanos) {
    return dueAtNanos - nowNanos <= 0;
  }
}
