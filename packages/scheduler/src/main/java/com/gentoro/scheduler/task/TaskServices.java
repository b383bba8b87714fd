package com.gentoro.scheduler.task;

import com.gentoro.scheduler.scheduler.MonotonicClock;
import com.gentoro.scheduler.storage.TaskStore;
import java.time.Clock;
import java.util.Objects;

/**
 * Collaborators shared by every invocation of one scheduler.
 *
 * @param store persistence for static tasks
 * @param clock monotonic clock used for execution timing and queue due times
 * @param wallClock wall clock used for persisted scheduling dates
 */
public record TaskServices(TaskStore store, MonotonicClock clock, Clock wallClock) {
  public TaskServices {
    Objects.requireNonNull(store, "store");
    Objects.requireNonNull(clock, "clock");
    Objects.requireNonNull(wallClock, "wallClock");
  }

  public static TaskServices of(TaskStore store) {
    return new TaskServices(store, MonotonicClock.SYSTEM, Clock.systemUTC());
  }
}
