package com.gentoro.scheduler.scheduler;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.scheduler.storage.InMemoryTaskStore;
import com.gentoro.scheduler.storage.TaskRecord;
import com.gentoro.scheduler.task.TaskRegistry;
import com.gentoro.scheduler.task.TaskResult;
import com.gentoro.scheduler.task.TaskServices;
import com.gentoro.scheduler.utility.JacksonUtility;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TaskSchedulingServiceTest {
  private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

  private final ManualClock clock = new ManualClock();
  private InMemoryTaskStore store;
  private DefaultScheduler scheduler;
  private TaskSchedulingService service;

  @BeforeEach
  void setUp() {
    store = new InMemoryTaskStore();
    Clock wallClock = Clock.fixed(NOW, ZoneOffset.UTC);
    scheduler =
        new DefaultScheduler(TaskRegistry.builtIn(), new TaskServices(store, clock, wallClock));
    service = new TaskSchedulingService(store, TaskRegistry.builtIn(), scheduler, wallClock);
  }

  @Test
  void persistsAndQueuesTheTask() throws Exception {
    long taskId =
        service.scheduleTask(
            new ScheduleTaskRequest(
                "NoopComplexTask",
                JacksonUtility.readTree("{\"succeed\":true}"),
                2000,
                null,
                null));

    TaskRecord row = store.findPendingTask(taskId).orElseThrow();
    assertEquals(NOW.plusMillis(2000), row.scheduledDate());
    assertEquals(1, scheduler.taskQueueSize());

    scheduler.execute();
    assertTrue(store.findPendingTask(taskId).isPresent());

    clock.advanceMillis(2000);
    scheduler.execute();
    assertEquals(TaskResult.TASK_SUCCESS, store.listTasks(1, 0).get(0).result());
  }

  @Test
  void repeatingTaskKeepsRescheduling() throws Exception {
    long taskId =
        service.scheduleTask(new ScheduleTaskRequest("NoopTask", null, 0, 1000L, null));

    scheduler.execute();

    assertTrue(store.findPendingTask(taskId).isEmpty());
    assertEquals(1, store.findPendingTasks().size());
    assertEquals("{}", store.findPendingTasks().get(0).params());
    assertEquals(1, scheduler.taskQueueSize());
  }

  @Test
  void rejectsUnknownTasksAndNegativeDurations() {
    assertThrows(
        IllegalArgumentException.class,
        () -> service.scheduleTask(ScheduleTaskRequest.once("Unknown", null, 0)));
    assertThrows(
        IllegalArgumentException.class,
        () -> service.scheduleTask(ScheduleTaskRequest.once("NoopTask", null, -5)));
    assertThrows(
        IllegalArgumentException.class,
        () -> service.scheduleTask(new ScheduleTaskRequest("NoopTask", null, 0, -1L, null)));
    assertEquals(0, store.countTasks());
  }
}
