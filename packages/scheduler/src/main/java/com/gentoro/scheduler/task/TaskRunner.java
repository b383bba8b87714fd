package com.gentoro.scheduler.task;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.scheduler.exception.ExceptionUtil;
import com.gentoro.scheduler.logging.LoggingService;
import com.gentoro.scheduler.scheduler.Scheduler;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;

/**
 * Executes a single task invocation end-to-end: resolves the task by ID or name, validates its
 * parameters, invokes it, and finalizes the context so that results are persisted and repeating
 * tasks are rescheduled.
 *
 * <p>Addressing, validation and task-reported failures are turned into a {@link TaskResult}.
 * Exceptions thrown by a task propagate to the caller; for static tasks the row is finalized with
 * {@link TaskResult#TASK_EXCEPTION} first so that it does not remain without a result.
 *
 * <p>Invocations through one runner never overlap: the scheduler loop and the invocation endpoint
 * share the runner of their scheduler, and a second caller waits until the first one has
 * finalized. A static row finalized in the meantime then resolves to {@link
 * TaskResult#INVALID_TASK_ID}.
 */
public final class TaskRunner {
  private static final Logger log = LoggingService.getLogger(TaskRunner.class);

  private final Scheduler scheduler;
  private final TaskRegistry registry;
  private final TaskServices services;
  private final ReentrantLock executionLock = new ReentrantLock();

  public TaskRunner(Scheduler scheduler, TaskRegistry registry, TaskServices services) {
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.registry = Objects.requireNonNull(registry, "registry");
    this.services = Objects.requireNonNull(services, "services");
  }

  public TaskRegistry registry() {
    return registry;
  }

  /** Executes the identified task, using the parameters carried by a named identifier. */
  public TaskResult executeTask(TaskIdentifier identifier) throws Exception {
    return executeTask(identifier, identifier.params());
  }

  /**
   * Executes the identified task. {@code params} only apply to named (ephemeral) invocations,
   * static tasks read theirs from storage.
   */
  public TaskResult executeTask(TaskIdentifier identifier, JsonNode params) throws Exception {
    executionLock.lockInterruptibly();
    try {
      return executeLocked(identifier, params);
    } finally {
      executionLock.unlock();
    }
  }

  private TaskResult executeLocked(TaskIdentifier identifier, JsonNode params) throws Exception {
    TaskContext context;
    if (identifier.isStatic()) {
      Optional<TaskContext> staticContext =
          TaskContext.forStaticTask(identifier.taskId(), services);
      if (staticContext.isEmpty()) {
        log.warn("Task #{} does not exist or has already been executed", identifier.taskId());
        return TaskResult.INVALID_TASK_ID;
      }
      context = staticContext.get();
    } else {
      context = TaskContext.forEphemeralTask(identifier.taskName(), params, services);
    }

    Optional<TaskDefinition> definition = registry.resolve(context.taskName());
    if (definition.isEmpty()) {
      log.warn("Unable to execute {}: unknown task name {}", identifier, context.taskName());
      return conclude(context, TaskResult.INVALID_NAMED_TASK);
    }

    BaseTask task = definition.get().newInstance();
    task.bind(context, scheduler, services);

    return switch (definition.get().kind()) {
      case SIMPLE -> run(context, (Task) task);
      case PARAMETERIZED -> run(context, (TaskWithParams<?>) task);
    };
  }

  private TaskResult run(TaskContext context, Task task) throws Exception {
    context.markTaskExecutionStart();
    boolean success;
    try {
      success = task.execute();
    } catch (Exception e) {
      throw fail(context, e);
    } catch (Error e) {
      throw fail(context, e);
    }
    context.markTaskExecutionFinished();
    return conclude(context, success ? TaskResult.TASK_SUCCESS : TaskResult.TASK_FAILURE);
  }

  private <P> TaskResult run(TaskContext context, TaskWithParams<P> task) throws Exception {
    P params;
    try {
      params = task.validate(context.params());
    } catch (InvalidParametersException e) {
      log.warn("Invalid parameters for task {}: {}", context.taskName(), e.getMessage());
      return conclude(context, TaskResult.INVALID_PARAMETERS);
    }

    context.markTaskExecutionStart();
    boolean success;
    try {
      success = task.execute(params);
    } catch (Exception e) {
      throw fail(context, e);
    } catch (Error e) {
      throw fail(context, e);
    }
    context.markTaskExecutionFinished();
    return conclude(context, success ? TaskResult.TASK_SUCCESS : TaskResult.TASK_FAILURE);
  }

  private TaskResult conclude(TaskContext context, TaskResult result) {
    context.finalizeTask(scheduler, result);
    log.debug("Task {} finished with {}", context.taskName(), result);
    return result;
  }

  /** Records a thrown exception or error on static tasks, and hands it back for rethrowing. */
  private <T extends Throwable> T fail(TaskContext context, T e) {
    context.markTaskExecutionFinished();
    if (context.taskId().isPresent()) {
      context
          .log()
          .exception(
              "The task threw an exception",
              ExceptionUtil.toErrorDetails(e),
              ExceptionUtil.formatCompactStackTrace(e));
      try {
        context.finalizeTask(scheduler, TaskResult.TASK_EXCEPTION);
      } catch (RuntimeException finalizeError) {
        e.addSuppressed(finalizeError);
      }
    }
    return e;
  }
}
