package com.gentoro.scheduler.scheduler;

import com.gentoro.scheduler.exception.StateException;
import com.gentoro.scheduler.logging.LoggingService;
import com.gentoro.scheduler.queue.StablePriorityQueue;
import com.gentoro.scheduler.task.TaskIdentifier;
import com.gentoro.scheduler.task.TaskRegistry;
import com.gentoro.scheduler.task.TaskResult;
import com.gentoro.scheduler.task.TaskRunner;
import com.gentoro.scheduler.task.TaskServices;
import java.util.OptionalLong;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;

/**
 * In-process {@link Scheduler} backed by a {@link StablePriorityQueue}. Invocations with the same
 * due time execute in the order they were queued.
 *
 * <p>{@link #execute()} is meant to be called from a single thread, while {@link #queueTask} may
 * be called from any thread.
 */
public final class DefaultScheduler implements Scheduler {
  private static final Logger log = LoggingService.getLogger(DefaultScheduler.class);

  private final StablePriorityQueue<QueuedInvocation> queue =
      new StablePriorityQueue<>(QueuedInvocation.BY_DUE_TIME);
  private final TaskServices services;
  private final TaskRunner taskRunner;
  private final TaskInvoker invoker;

  private volatile long executionCount;
  private volatile long invocationCount;
  private volatile Long lastExecutionTime;
  private volatile Long lastInvocationTime;

  public DefaultScheduler(TaskRegistry registry, TaskServices services) {
    this(registry, services, null);
  }

  /**
   * @param invoker used by {@link #invoke}; may be {@code null} when this process never delegates
   *     execution
   */
  public DefaultScheduler(TaskRegistry registry, TaskServices services, TaskInvoker invoker) {
    this.services = services;
    this.taskRunner = new TaskRunner(this, registry, services);
    this.invoker = invoker;
  }

  public TaskRunner taskRunner() {
    return taskRunner;
  }

  @Override
  public long executionCount() {
    return executionCount;
  }

  @Override
  public long invocationCount() {
    return invocationCount;
  }

  @Override
  public OptionalLong lastExecutionTime() {
    Long time = lastExecutionTime;
    return time == null ? OptionalLong.empty() : OptionalLong.of(time);
  }

  @Override
  public OptionalLong lastInvocationTime() {
    Long time = lastInvocationTime;
    return time == null ? OptionalLong.empty() : OptionalLong.of(time);
  }

  @Override
  public void queueTask(TaskIdentifier identifier, long delayMs) {
    if (delayMs < 0) {
      throw new IllegalArgumentException("delayMs must not be negative");
    }
    long dueAt = services.clock().nanoTime() + TimeUnit.MILLISECONDS.toNanos(delayMs);
    synchronized (queue) {
      queue.push(new QueuedInvocation(identifier, dueAt));
    }
    log.debug("Queued {} with a delay of {}ms", identifier, delayMs);
  }

  @Override
  public void execute() throws Exception {
    long now = services.clock().nanoTime();
    executionCount++;
    lastExecutionTime = now;

    // Invocations queued while this batch runs are only considered against the batch start time.
    QueuedInvocation next;
    while ((next = popDue(now)) != null) {
      invocationCount++;
      lastInvocationTime = services.clock().nanoTime();
      TaskResult result = taskRunner.executeTask(next.identifier());
      log.debug("Executed {}: {}", next.identifier(), result);
    }
  }

  private QueuedInvocation popDue(long now) {
    synchronized (queue) {
      QueuedInvocation front = queue.front().orElse(null);
      if (front == null || !front.isDue(now)) {
        return null;
      }
      queue.pop();
      return front;
    }
  }

  @Override
  public TaskResult invoke(TaskIdentifier identifier) {
    if (invoker == null) {
      throw new StateException("No task invoker is configured for this scheduler");
    }
    return invoker.invoke(identifier);
  }

  @Override
  public int taskQueueSize() {
    synchronized (queue) {
      return queue.size();
    }
  }

  @Override
  public void clearTasks() {
    synchronized (queue) {
      queue.clear();
    }
  }
}
