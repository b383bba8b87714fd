package com.gentoro.scheduler.scheduler;

/** Waits between loop iterations of the {@link SchedulerRunner}. */
@FunctionalInterface
public interface Sleeper {
  void sleep(long millis) throws InterruptedException;
}
