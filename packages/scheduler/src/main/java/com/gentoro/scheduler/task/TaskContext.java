package com.gentoro.scheduler.task;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.scheduler.exception.StateException;
import com.gentoro.scheduler.logging.LoggingService;
import com.gentoro.scheduler.scheduler.Scheduler;
import com.gentoro.scheduler.storage.NewTaskRecord;
import com.gentoro.scheduler.storage.TaskRecord;
import com.gentoro.scheduler.storage.TaskStore;
import com.gentoro.scheduler.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Binds one task identity, its parameters, a logger and execution timing to a single execution
 * attempt, and owns the side effects of finalizing it: persisting the result of static tasks and
 * rescheduling repeating ones.
 */
public final class TaskContext {
  private static final Logger log = LoggingService.getLogger(TaskContext.class);

  private final TaskConfiguration configuration;
  private final TaskServices services;
  private final TaskLogger logger;

  private Long intervalMs;
  private Long executionStart;
  private Long executionFinished;

  private TaskContext(TaskConfiguration configuration, TaskServices services) {
    this.configuration = configuration;
    this.services = services;
    this.intervalMs = configuration.intervalMs();
    this.logger = new TaskLogger(this::elapsedMillis);
  }

  /** Context for an ephemeral task, i.e. one that has no row in the task store. */
  public static TaskContext forEphemeralTask(
      String taskName, JsonNode params, TaskServices services) {
    Objects.requireNonNull(taskName, "taskName");
    JsonNode effectiveParams =
        params == null ? JacksonUtility.getJsonMapper().createObjectNode() : params;
    return new TaskContext(
        new TaskConfiguration(null, taskName, effectiveParams, null, null), services);
  }

  /**
   * Context for a static task. Empty when the row does not exist, has already recorded a result,
   * or carries parameters that are not valid JSON.
   */
  public static Optional<TaskContext> forStaticTask(long taskId, TaskServices services) {
    Optional<TaskRecord> row = services.store().findPendingTask(taskId);
    if (row.isEmpty()) {
      return Optional.empty();
    }

    TaskRecord task = row.get();
    JsonNode params;
    try {
      String serialized = task.params();
      params =
          JacksonUtility.readTree(
              serialized == null || serialized.isBlank() ? "{}" : serialized);
    } catch (JsonProcessingException e) {
      log.warn("Task #{} has malformed parameters, treating it as unknown", taskId);
      return Optional.empty();
    }

    return Optional.of(
        new TaskContext(
            new TaskConfiguration(
                task.taskId(), task.taskName(), params, task.parentTaskId(), task.intervalMs()),
            services));
  }

  public Optional<Long> taskId() {
    return Optional.ofNullable(configuration.taskId());
  }

  /** Name of the task that should be executed. Not guaranteed to be valid. */
  public String taskName() {
    return configuration.taskName();
  }

  public JsonNode params() {
    return configuration.params();
  }

  public Optional<Long> parentTaskId() {
    return Optional.ofNullable(configuration.parentTaskId());
  }

  /** The interval after which the task will be repeated, if any. */
  public Optional<Long> intervalMs() {
    return Optional.ofNullable(intervalMs);
  }

  /** Changes the repeat interval; {@code null} cancels repetition. */
  public void setIntervalMs(Long intervalMs) {
    if (intervalMs != null && intervalMs < 0) {
      throw new IllegalArgumentException("intervalMs must not be negative");
    }
    this.intervalMs = intervalMs;
  }

  public TaskLogger log() {
    return logger;
  }

  /** Marks that execution has begun. Throws when execution has already started. */
  public void markTaskExecutionStart() {
    if (executionStart != null) {
      throw new StateException("Task execution has already started, unable to restart");
    }
    executionStart = services.clock().nanoTime();
  }

  /**
   * Marks that execution has finished. Throws when execution has not started yet, or has already
   * been marked as finished.
   */
  public void markTaskExecutionFinished() {
    if (executionStart == null) {
      throw new StateException("Task execution has not started yet");
    }
    if (executionFinished != null) {
      throw new StateException("Task execution has already finished, unable to finish again");
    }
    executionFinished = services.clock().nanoTime();
  }

  /** Runtime in nanoseconds, defined once both execution marks are present. */
  public Optional<Long> runtimeNanos() {
    if (executionStart == null || executionFinished == null) {
      return Optional.empty();
    }
    return Optional.of(executionFinished - executionStart);
  }

  /** Runtime rounded up to whole milliseconds, as persisted. */
  public Optional<Long> runtimeMs() {
    return runtimeNanos().map(nanos -> (nanos + 999_999L) / 1_000_000L);
  }

  /**
   * Serializes the log entries as a JSON array. Trailing data that Jackson cannot serialize is
   * written as its string representation so the result is always valid JSON.
   */
  public String serializeLogs() {
    List<TaskLogEntry> entries = logger.entries();
    try {
      return JacksonUtility.getJsonMapper().writeValueAsString(entries);
    } catch (JsonProcessingException e) {
      List<TaskLogEntry> stringified = new ArrayList<>(entries.size());
      for (TaskLogEntry entry : entries) {
        List<Object> data = new ArrayList<>(entry.data().size());
        for (Object value : entry.data()) {
          data.add(value instanceof JsonNode ? value : String.valueOf(value));
        }
        stringified.add(new TaskLogEntry(entry.severity(), entry.time(), entry.message(), data));
      }
      try {
        return JacksonUtility.getJsonMapper().writeValueAsString(stringified);
      } catch (JsonProcessingException inner) {
        throw new IllegalStateException("Unable to serialize task logs", inner);
      }
    }
  }

  /**
   * Finalizes the invocation. Static tasks have their result, logs and runtime written to their
   * row; when the task completed and an interval remains, the next occurrence is inserted in the
   * same transaction and queued on the {@code scheduler}. Ephemeral tasks with an interval are
   * queued again by name.
   */
  public void finalizeTask(Scheduler scheduler, TaskResult result) {
    if (configuration.parentTaskId() != null && intervalMs != null) {
      logger.debug(
          "Ignoring the interval as this is a manual repetition of another task",
          configuration.parentTaskId(),
          intervalMs);
      intervalMs = null;
    }

    Long repeatIntervalMs = result.isCompleted() ? intervalMs : null;

    if (configuration.taskId() != null) {
      Long nextTaskId = null;
      try (TaskStore.Transaction transaction = services.store().transaction()) {
        transaction.updateTaskResult(
            configuration.taskId(), result, serializeLogs(), runtimeMs().orElse(null));
        if (repeatIntervalMs != null) {
          nextTaskId =
              transaction.insertTask(
                  new NewTaskRecord(
                      configuration.taskName(),
                      JacksonUtility.toJson(configuration.params()),
                      null,
                      repeatIntervalMs,
                      services.wallClock().instant().plusMillis(repeatIntervalMs)));
        }
        transaction.commit();
      }

      if (nextTaskId != null) {
        log.debug(
            "Task #{} ({}) will repeat as task #{} in {}ms",
            configuration.taskId(),
            configuration.taskName(),
            nextTaskId,
            repeatIntervalMs);
        scheduler.queueTask(TaskIdentifier.forId(nextTaskId), repeatIntervalMs);
      }
    } else if (repeatIntervalMs != null) {
      scheduler.queueTask(
          TaskIdentifier.forName(configuration.taskName(), configuration.params()),
          repeatIntervalMs);
    }
  }

  private Double elapsedMillis() {
    if (executionStart == null) {
      return null;
    }
    return (services.clock().nanoTime() - executionStart) / 1_000_000.0;
  }
}
