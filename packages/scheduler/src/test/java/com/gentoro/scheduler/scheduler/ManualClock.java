package com.gentoro.scheduler.scheduler;

import java.util.concurrent.TimeUnit;

/** Monotonic clock that only moves when told to. */
public final class ManualClock implements MonotonicClock {
  private long nanos = 1_000_000_000L;

  @Override
  public synchronized long nanoTime() {
    return nanos;
  }

  public synchronized void advanceMillis(long millis) {
    nanos += TimeUnit.MILLISECONDS.toNanos(millis);
  }
}
