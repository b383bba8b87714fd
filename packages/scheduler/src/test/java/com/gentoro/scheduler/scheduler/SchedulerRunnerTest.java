package com.gentoro.scheduler.scheduler;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.scheduler.exception.StateException;
import com.gentoro.scheduler.task.TaskIdentifier;
import com.gentoro.scheduler.task.TaskResult;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

class SchedulerRunnerTest {

  /** Scheduler whose execute() throws a given number of times before succeeding. */
  static final class FlakyScheduler implements Scheduler {
    final List<TaskIdentifier> queued = new ArrayList<>();
    final Error error;
    int failuresLeft;
    int executions;

    FlakyScheduler(int failures) {
      this(failures, null);
    }

    FlakyScheduler(int failures, Error error) {
      this.failuresLeft = failures;
      this.error = error;
    }

    @Override
    public long executionCount() {
      return executions;
    }

    @Override
    public long invocationCount() {
      return 0;
    }

    @Override
    public OptionalLong lastExecutionTime() {
      return OptionalLong.empty();
    }

    @Override
    public OptionalLong lastInvocationTime() {
      return OptionalLong.empty();
    }

    @Override
    public void queueTask(TaskIdentifier identifier, long delayMs) {
      queued.add(identifier);
    }

    @Override
    public void execute() {
      executions++;
      if (failuresLeft > 0) {
        failuresLeft--;
        if (error != null) {
          throw error;
        }
        throw new IllegalStateException("scheduler failure");
      }
    }

    @Override
    public TaskResult invoke(TaskIdentifier identifier) {
      throw new UnsupportedOperationException();
    }

    @Override
    public int taskQueueSize() {
      return queued.size();
    }

    @Override
    public void clearTasks() {
      queued.clear();
    }
  }

  private SchedulerRunner runner;

  private SchedulerRunner runnerAbortingAfter(int iterations, List<Long> sleeps) {
    runner =
        SchedulerRunner.createInstanceForTesting(
            new SchedulerRunnerSettings(1000, 64),
            millis -> {
              sleeps.add(millis);
              if (sleeps.size() == iterations) {
                runner.abort();
              }
            });
    return runner;
  }

  @Test
  void backoffDoublesUpToCeilingAndResetsAfterCleanIteration() throws Exception {
    List<Long> sleeps = new ArrayList<>();
    SchedulerRunner runner = runnerAbortingAfter(10, sleeps);
    FlakyScheduler scheduler = new FlakyScheduler(8);
    runner.attachScheduler(scheduler);

    runner.runLoop();

    assertEquals(
        List.of(2000L, 4000L, 8000L, 16000L, 32000L, 64000L, 64000L, 64000L, 1000L, 1000L),
        sleeps);
    assertEquals(10, scheduler.executions);
    assertEquals(1, runner.exceptionPenaltyMultiplier());
    assertFalse(runner.isActive());
  }

  @Test
  void anyFailingSchedulerSlowsDownTheWholeRunner() throws Exception {
    List<Long> sleeps = new ArrayList<>();
    SchedulerRunner runner = runnerAbortingAfter(3, sleeps);
    FlakyScheduler healthy = new FlakyScheduler(0);
    FlakyScheduler failing = new FlakyScheduler(Integer.MAX_VALUE);
    runner.attachScheduler(healthy);
    runner.attachScheduler(failing);

    runner.runLoop();

    assertEquals(List.of(2000L, 4000L, 8000L), sleeps);
    assertEquals(3, healthy.executions);
  }

  @Test
  void errorThrownBySchedulerIsPenalizedAndLoopKeepsRunning() throws Exception {
    List<Long> sleeps = new ArrayList<>();
    SchedulerRunner runner = runnerAbortingAfter(3, sleeps);
    FlakyScheduler scheduler = new FlakyScheduler(1, new AssertionError("task bug"));
    runner.attachScheduler(scheduler);

    runner.runLoop();

    assertEquals(List.of(2000L, 1000L, 1000L), sleeps);
    assertEquals(3, scheduler.executions);
    assertFalse(runner.isActive());
  }

  @Test
  void virtualMachineErrorStopsTheLoop() {
    List<Long> sleeps = new ArrayList<>();
    SchedulerRunner runner = runnerAbortingAfter(3, sleeps);
    runner.attachScheduler(new FlakyScheduler(1, new OutOfMemoryError("heap")));

    assertThrows(OutOfMemoryError.class, runner::runLoop);
    assertEquals(List.of(), sleeps);
    assertFalse(runner.isActive());
  }

  @Test
  void cleanLoopSleepsForTheBaseInterval() throws Exception {
    List<Long> sleeps = new ArrayList<>();
    SchedulerRunner runner = runnerAbortingAfter(3, sleeps);
    runner.attachScheduler(new FlakyScheduler(0));

    runner.runLoop();

    assertEquals(List.of(1000L, 1000L, 1000L), sleeps);
  }

  @Test
  void attachQueuesPopulateTaskOnce() {
    SchedulerRunner runner = SchedulerRunner.createInstanceForTesting();
    Scheduler scheduler = Mockito.mock(Scheduler.class);

    runner.attachScheduler(scheduler);

    Mockito.verify(scheduler, Mockito.times(1))
        .queueTask(TaskIdentifier.forName(SchedulerRunner.POPULATE_TASK_NAME), 0);
    Mockito.verifyNoMoreInteractions(scheduler);
  }

  @Test
  void detachedSchedulersAreNotExecuted() throws Exception {
    List<Long> sleeps = new ArrayList<>();
    SchedulerRunner runner = runnerAbortingAfter(2, sleeps);
    FlakyScheduler scheduler = new FlakyScheduler(0);
    runner.attachScheduler(scheduler);
    runner.detachScheduler(scheduler);

    runner.runLoop();

    assertEquals(0, scheduler.executions);
  }

  @Test
  void abortingAnIdleRunnerThrows() {
    SchedulerRunner runner = SchedulerRunner.createInstanceForTesting();

    StateException e = assertThrows(StateException.class, runner::abort);
    assertTrue(e.getMessage().contains("Only active scheduler runners can be aborted"));
  }

  @Test
  void startingAnActiveRunnerThrowsAndAbortStopsIt() throws Exception {
    SchedulerRunner runner = SchedulerRunner.createInstanceForTesting();
    runner.applySettings(new SchedulerRunnerSettings(50, 4));
    try {
      Future<?> loop = runner.start();
      assertTrue(runner.isActive());
      assertThrows(StateException.class, runner::runLoop);
      assertThrows(StateException.class, runner::start);
      assertThrows(
          StateException.class, () -> runner.applySettings(SchedulerRunnerSettings.defaults()));

      runner.abort();
      loop.get(5, TimeUnit.SECONDS);
      assertFalse(runner.isActive());
    } finally {
      runner.shutdown();
    }
  }

  @Test
  void getInstanceReturnsTheSameRunner() {
    assertSame(SchedulerRunner.getInstance(), SchedulerRunner.getInstance());
    assertNotSame(SchedulerRunner.getInstance(), SchedulerRunner.createInstanceForTesting());
  }

  @Test
  void settingsAreValidated() {
    assertThrows(IllegalArgumentException.class, () -> new SchedulerRunnerSettings(0, 64));
    assertThrows(IllegalArgumentException.class, () -> new SchedulerRunnerSettings(1000, 0));
  }
}
