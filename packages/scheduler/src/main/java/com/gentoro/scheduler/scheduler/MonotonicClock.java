package com.gentoro.scheduler.scheduler;

/**
 * Source of monotonic time. Scheduling decisions are expressed against this clock rather than the
 * wall clock so that they are unaffected by clock adjustments.
 */
@FunctionalInterface
public interface MonotonicClock {
  MonotonicClock SYSTEM = System::nanoTime;

  /** Current monotonic time in nanoseconds; only differences between readings are meaningful. */
  long nanoTime();
}
