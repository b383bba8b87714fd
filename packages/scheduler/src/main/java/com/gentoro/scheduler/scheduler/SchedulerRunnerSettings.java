package com.gentoro.scheduler.scheduler;

import org.apache.commons.configuration2.Configuration;

/**
 * Loop settings of the {@link SchedulerRunner}.
 *
 * @param intervalMs base sleep between two loop iterations
 * @param maxExceptionMultiplier ceiling of the exception-penalty multiplier
 */
public record SchedulerRunnerSettings(long intervalMs, int maxExceptionMultiplier) {
  public static final long DEFAULT_INTERVAL_MS = 1000;
  public static final int DEFAULT_MAX_EXCEPTION_MULTIPLIER = 64;

  public SchedulerRunnerSettings {
    if (intervalMs <= 0) {
      throw new IllegalArgumentException("intervalMs must be positive");
    }
    if (maxExceptionMultiplier < 1) {
      throw new IllegalArgumentException("maxExceptionMultiplier must be at least 1");
    }
  }

  public static SchedulerRunnerSettings defaults() {
    return new SchedulerRunnerSettings(DEFAULT_INTERVAL_MS, DEFAULT_MAX_EXCEPTION_MULTIPLIER);
  }

  public static SchedulerRunnerSettings fromConfiguration(Configuration configuration) {
    return new SchedulerRunnerSettings(
        configuration.getLong("scheduler.interval-ms", DEFAULT_INTERVAL_MS),
        configuration.getInt(
            "scheduler.max-exception-multiplier", DEFAULT_MAX_EXCEPTION_MULTIPLIER));
  }
}
