package com.gentoro.scheduler.scheduler;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.scheduler.exception.StateException;
import com.gentoro.scheduler.storage.InMemoryTaskStore;
import com.gentoro.scheduler.task.Task;
import com.gentoro.scheduler.task.TaskIdentifier;
import com.gentoro.scheduler.task.TaskRegistry;
import com.gentoro.scheduler.task.TaskResult;
import com.gentoro.scheduler.task.TaskServices;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

class DefaultSchedulerTest {
  private static final List<String> executed = new ArrayList<>();

  static final class MyFirstTask extends Task {
    @Override
    public boolean execute() {
      executed.add("first");
      return true;
    }
  }

  static final class MySecondTask extends Task {
    @Override
    public boolean execute() {
      executed.add("second");
      return true;
    }
  }

  static final class ExplodingTask extends Task {
    @Override
    public boolean execute() throws Exception {
      throw new Exception("exploded");
    }
  }

  private final ManualClock clock = new ManualClock();
  private TaskRegistry registry;
  private DefaultScheduler scheduler;

  @BeforeEach
  void setUp() {
    executed.clear();
    registry =
        TaskRegistry.builder()
            .register("MyFirstTask", MyFirstTask.class, MyFirstTask::new)
            .register("MySecondTask", MySecondTask.class, MySecondTask::new)
            .register("ExplodingTask", ExplodingTask.class, ExplodingTask::new)
            .build();
    scheduler =
        new DefaultScheduler(
            registry, new TaskServices(new InMemoryTaskStore(), clock, Clock.systemUTC()));
  }

  @Test
  void executesInDueTimeOrder() throws Exception {
    scheduler.queueTask(TaskIdentifier.forName("MyFirstTask"), 5);
    scheduler.queueTask(TaskIdentifier.forName("MyFirstTask"), 25);
    scheduler.queueTask(TaskIdentifier.forName("MyFirstTask"), 10);
    scheduler.queueTask(TaskIdentifier.forName("MySecondTask"), 20);
    scheduler.queueTask(TaskIdentifier.forName("MySecondTask"), 15);
    scheduler.queueTask(TaskIdentifier.forName("MySecondTask"), 30);
    assertEquals(6, scheduler.taskQueueSize());

    while (scheduler.taskQueueSize() > 0) {
      clock.advanceMillis(5);
      scheduler.execute();
    }

    assertEquals(List.of("first", "first", "second", "second", "first", "second"), executed);
    assertEquals(6, scheduler.executionCount());
    assertEquals(6, scheduler.invocationCount());
  }

  @Test
  void executeRunsEveryDueInvocationInOneBatch() throws Exception {
    scheduler.queueTask(TaskIdentifier.forName("MySecondTask"), 0);
    scheduler.queueTask(TaskIdentifier.forName("MyFirstTask"), 0);
    scheduler.queueTask(TaskIdentifier.forName("MyFirstTask"), 100);

    scheduler.execute();

    assertEquals(List.of("second", "first"), executed);
    assertEquals(1, scheduler.executionCount());
    assertEquals(2, scheduler.invocationCount());
    assertEquals(1, scheduler.taskQueueSize());
  }

  @Test
  void timestampsAreMonotonic() throws Exception {
    assertTrue(scheduler.lastExecutionTime().isEmpty());
    assertTrue(scheduler.lastInvocationTime().isEmpty());

    scheduler.execute();
    assertEquals(clock.nanoTime(), scheduler.lastExecutionTime().getAsLong());
    assertTrue(scheduler.lastInvocationTime().isEmpty());

    scheduler.queueTask(TaskIdentifier.forName("MyFirstTask"), 0);
    clock.advanceMillis(3);
    scheduler.execute();
    assertEquals(clock.nanoTime(), scheduler.lastInvocationTime().getAsLong());
  }

  @Test
  void clearTasksKeepsCounters() throws Exception {
    scheduler.queueTask(TaskIdentifier.forName("MyFirstTask"), 0);
    scheduler.execute();
    scheduler.queueTask(TaskIdentifier.forName("MyFirstTask"), 10);
    scheduler.queueTask(TaskIdentifier.forName("MySecondTask"), 20);

    scheduler.clearTasks();

    assertEquals(0, scheduler.taskQueueSize());
    assertEquals(1, scheduler.executionCount());
    assertEquals(1, scheduler.invocationCount());
  }

  @Test
  void taskExceptionsPropagateAndLeaveRemainingInvocationsQueued() {
    scheduler.queueTask(TaskIdentifier.forName("ExplodingTask"), 0);
    scheduler.queueTask(TaskIdentifier.forName("MyFirstTask"), 0);

    Exception e = assertThrows(Exception.class, scheduler::execute);
    assertEquals("exploded", e.getMessage());
    assertEquals(1, scheduler.taskQueueSize());
    assertEquals(List.of(), executed);
  }

  @Test
  void negativeDelayIsRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> scheduler.queueTask(TaskIdentifier.forName("MyFirstTask"), -1));
  }

  @Test
  void invokeDelegatesToInvoker() {
    TaskInvoker invoker = Mockito.mock(TaskInvoker.class);
    Mockito.when(invoker.invoke(Mockito.any())).thenReturn(TaskResult.TASK_SUCCESS);
    DefaultScheduler remote =
        new DefaultScheduler(
            registry, new TaskServices(new InMemoryTaskStore(), clock, Clock.systemUTC()), invoker);

    assertEquals(TaskResult.TASK_SUCCESS, remote.invoke(TaskIdentifier.forId(12)));
    Mockito.verify(invoker).invoke(TaskIdentifier.forId(12));
  }

  @Test
  void invokeWithoutInvokerThrows() {
    assertThrows(StateException.class, () -> scheduler.invoke(TaskIdentifier.forId(1)));
  }
}
