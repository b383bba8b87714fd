package com.gentoro.scheduler.scheduler;

import com.gentoro.scheduler.logging.LoggingService;
import com.gentoro.scheduler.storage.NewTaskRecord;
import com.gentoro.scheduler.storage.TaskStore;
import com.gentoro.scheduler.task.TaskIdentifier;
import com.gentoro.scheduler.task.TaskRegistry;
import com.gentoro.scheduler.utility.JacksonUtility;
import java.time.Clock;
import org.slf4j.Logger;

/** Entry point for the rest of the application to get work done asynchronously. */
public final class TaskSchedulingService {
  private static final Logger log = LoggingService.getLogger(TaskSchedulingService.class);

  private final TaskStore store;
  private final TaskRegistry registry;
  private final Scheduler scheduler;
  private final Clock wallClock;

  public TaskSchedulingService(
      TaskStore store, TaskRegistry registry, Scheduler scheduler, Clock wallClock) {
    this.store = store;
    this.registry = registry;
    this.scheduler = scheduler;
    this.wallClock = wallClock;
  }

  /**
   * Persists the task with a scheduled date of now plus the requested delay, and queues it on the
   * scheduler.
   *
   * @return the ID of the persisted task
   * @throws IllegalArgumentException when the task name is unknown or a duration is negative
   */
  public long scheduleTask(ScheduleTaskRequest request) {
    if (!registry.contains(request.taskName())) {
      throw new IllegalArgumentException("Unknown task: " + request.taskName());
    }
    if (request.delayMs() < 0) {
      throw new IllegalArgumentException("delayMs must not be negative");
    }
    if (request.intervalMs() != null && request.intervalMs() < 0) {
      throw new IllegalArgumentException("intervalMs must not be negative");
    }

    long taskId =
        store.insertTask(
            new NewTaskRecord(
                request.taskName(),
                JacksonUtility.toJson(request.params()),
                request.parentTaskId(),
                request.intervalMs(),
                wallClock.instant().plusMillis(request.delayMs())));

    scheduler.queueTask(TaskIdentifier.forId(taskId), request.delayMs());
    log.info(
        "Scheduled task #{} ({}) in {}ms", taskId, request.taskName(), request.delayMs());
    return taskId;
  }
}
