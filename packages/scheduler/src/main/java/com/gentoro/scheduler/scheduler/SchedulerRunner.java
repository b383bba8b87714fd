package com.gentoro.scheduler.scheduler;

import com.gentoro.scheduler.exception.StateException;
import com.gentoro.scheduler.logging.LoggingService;
import com.gentoro.scheduler.task.TaskIdentifier;
import com.gentoro.scheduler.task.builtin.PopulateSchedulerTask;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;

/**
 * Control loop that executes every attached {@link Scheduler} at a fixed interval.
 *
 * <p>An exception thrown by any scheduler doubles a process-wide penalty multiplier, up to {@link
 * SchedulerRunnerSettings#maxExceptionMultiplier()}, by which the interval is multiplied. The
 * multiplier resets to one after an iteration in which no scheduler threw.
 *
 * <p>The runner is idle until {@link #runLoop()} or {@link #start()} is called, and active until
 * the loop observes {@link #abort()}. Use {@link #getInstance()} in production code.
 */
public final class SchedulerRunner {
  private static final Logger log = LoggingService.getLogger(SchedulerRunner.class);

  /** Name of the task queued on every scheduler when it is attached. */
  public static final String POPULATE_TASK_NAME = PopulateSchedulerTask.NAME;

  private static volatile SchedulerRunner instance;

  private final Set<Scheduler> schedulers = new CopyOnWriteArraySet<>();
  private final Sleeper sleeper;
  private volatile SchedulerRunnerSettings settings;
  private volatile int exceptionPenaltyMultiplier = 1;
  private CountDownLatch abortSignal;
  private ExecutorService executor;

  private SchedulerRunner(SchedulerRunnerSettings settings, Sleeper sleeper) {
    this.settings = settings;
    this.sleeper = sleeper;
  }

  /** Returns the process-wide runner, creating it with default settings on first access. */
  public static SchedulerRunner getInstance() {
    SchedulerRunner runner = instance;
    if (runner == null) {
      synchronized (SchedulerRunner.class) {
        runner = instance;
        if (runner == null) {
          runner = new SchedulerRunner(SchedulerRunnerSettings.defaults(), null);
          instance = runner;
        }
      }
    }
    return runner;
  }

  /** Returns a new runner that is not shared with the rest of the process. */
  public static SchedulerRunner createInstanceForTesting() {
    return new SchedulerRunner(SchedulerRunnerSettings.defaults(), null);
  }

  /**
   * Returns a new, unshared runner that waits between iterations through {@code sleeper} rather
   * than on its abort signal.
   */
  public static SchedulerRunner createInstanceForTesting(
      SchedulerRunnerSettings settings, Sleeper sleeper) {
    return new SchedulerRunner(settings, sleeper);
  }

  public synchronized boolean isActive() {
    return abortSignal != null;
  }

  public int exceptionPenaltyMultiplier() {
    return exceptionPenaltyMultiplier;
  }

  public SchedulerRunnerSettings settings() {
    return settings;
  }

  /** Replaces the loop settings. Only allowed while the runner is idle. */
  public synchronized void applySettings(SchedulerRunnerSettings settings) {
    if (abortSignal != null) {
      throw new StateException("Settings cannot be changed while the scheduler runner is active");
    }
    this.settings = settings;
  }

  /**
   * Attaches the scheduler and immediately queues the populate task on it, so that persisted work
   * is picked up on the next iteration.
   */
  public void attachScheduler(Scheduler scheduler) {
    schedulers.add(scheduler);
    scheduler.queueTask(TaskIdentifier.forName(POPULATE_TASK_NAME), 0);
  }

  /** Detaches the scheduler. An execution that is in progress is not interrupted. */
  public void detachScheduler(Scheduler scheduler) {
    schedulers.remove(scheduler);
  }

  /**
   * Requests the loop to stop. The current iteration completes first.
   *
   * @throws StateException when the runner is idle
   */
  public synchronized void abort() {
    if (abortSignal == null) {
      throw new StateException("Only active scheduler runners can be aborted");
    }
    abortSignal.countDown();
  }

  /**
   * Runs the loop on the calling thread until {@link #abort()} is called.
   *
   * @throws StateException when the runner is already active
   */
  public void runLoop() throws InterruptedException {
    loop(activate());
  }

  /**
   * Runs the loop on a dedicated {@code scheduler-runner} thread. The runner is active once this
   * method returns.
   *
   * @throws StateException when the runner is already active
   */
  public Future<?> start() {
    CountDownLatch signal = activate();
    ExecutorService loopExecutor;
    synchronized (this) {
      if (executor == null) {
        executor = Executors.newSingleThreadExecutor(r -> new Thread(r, "scheduler-runner"));
      }
      loopExecutor = executor;
    }
    return loopExecutor.submit(
        () -> {
          loop(signal);
          return null;
        });
  }

  private synchronized CountDownLatch activate() {
    if (abortSignal != null) {
      throw new StateException("The scheduler runner is already running, cannot start it again");
    }
    exceptionPenaltyMultiplier = 1;
    abortSignal = new CountDownLatch(1);
    return abortSignal;
  }

  private synchronized void deactivate(CountDownLatch signal) {
    if (abortSignal == signal) {
      abortSignal = null;
    }
  }

  private void loop(CountDownLatch signal) throws InterruptedException {
    log.info("Scheduler runner started with {} scheduler(s)", schedulers.size());
    try {
      while (signal.getCount() > 0) {
        runIteration();
        pause(signal, exceptionPenaltyMultiplier * settings.intervalMs());
      }
    } finally {
      deactivate(signal);
      log.info("Scheduler runner stopped");
    }
  }

  private void runIteration() throws InterruptedException {
    boolean failed = false;
    for (Scheduler scheduler : schedulers) {
      try {
        scheduler.execute();
      } catch (InterruptedException | VirtualMachineError e) {
        throw e;
      } catch (Throwable e) {
        failed = true;
        if (exceptionPenaltyMultiplier < settings.maxExceptionMultiplier()) {
          exceptionPenaltyMultiplier =
              Math.min(exceptionPenaltyMultiplier * 2, settings.maxExceptionMultiplier());
        }
        log.error(
            "An exception was thrown while executing a scheduler, penalty multiplier is now {}",
            exceptionPenaltyMultiplier,
            e);
      }
    }
    if (!failed) {
      exceptionPenaltyMultiplier = 1;
    }
  }

  private void pause(CountDownLatch signal, long millis) throws InterruptedException {
    if (sleeper != null) {
      sleeper.sleep(millis);
    } else {
      signal.await(millis, TimeUnit.MILLISECONDS);
    }
  }

  /** Stops the loop thread, if one was started. */
  public void shutdown() {
    synchronized (this) {
      if (abortSignal != null) {
        abortSignal.countDown();
      }
    }
    ExecutorService loopExecutor;
    synchronized (this) {
      loopExecutor = executor;
      executor = null;
    }
    if (loopExecutor != null) {
      loopExecutor.shutdown();
      try {
        if (!loopExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
          loopExecutor.shutdownNow();
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        loopExecutor.shutdownNow();
      }
    }
  }
}
