package com.gentoro.scheduler.task.builtin;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.scheduler.logging.LoggingService;
import com.gentoro.scheduler.storage.TaskRecord;
import com.gentoro.scheduler.task.Task;
import com.gentoro.scheduler.task.TaskIdentifier;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;

/**
 * Queues every pending row of the task store on the scheduler running this task. Queued
 * automatically when a scheduler is attached to the runner, so that work persisted before a
 * restart is picked up without waiting for new requests.
 */
public final class PopulateSchedulerTask extends Task {
  private static final Logger logger = LoggingService.getLogger(PopulateSchedulerTask.class);

  public static final String NAME = "PopulateSchedulerTask";

  public static String describe(JsonNode params) {
    return "Populate the scheduler";
  }

  @Override
  public boolean execute() {
    List<TaskRecord> pending = services().store().findPendingTasks();
    Instant now = services().wallClock().instant();

    for (TaskRecord task : pending) {
      long delayMs = Math.max(0, Duration.between(now, task.scheduledDate()).toMillis());
      scheduler().queueTask(TaskIdentifier.forId(task.taskId()), delayMs);
    }

    log().info("Queued pending tasks", pending.size());
    logger.info("Populated the scheduler with {} pending task(s)", pending.size());
    return true;
  }
}
