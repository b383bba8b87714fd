package com.gentoro.scheduler.task.builtin;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.scheduler.task.Task;

/** Task that does nothing and always succeeds. Useful to verify that the scheduler is alive. */
public final class NoopTask extends Task {
  public static final String NAME = "NoopTask";

  public static String describe(JsonNode params) {
    return "No-op task";
  }

  @Override
  public boolean execute() {
    return true;
  }
}
