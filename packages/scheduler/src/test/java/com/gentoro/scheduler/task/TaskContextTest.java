package com.gentoro.scheduler.task;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.scheduler.exception.StateException;
import com.gentoro.scheduler.scheduler.ManualClock;
import com.gentoro.scheduler.storage.InMemoryTaskStore;
import com.gentoro.scheduler.storage.NewTaskRecord;
import com.gentoro.scheduler.utility.JacksonUtility;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TaskContextTest {
  private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

  public static class SelfReferencing {
    public SelfReferencing getSelf() {
      return this;
    }
  }

  private final ManualClock clock = new ManualClock();
  private InMemoryTaskStore store;
  private TaskServices services;

  @BeforeEach
  void setUp() {
    store = new InMemoryTaskStore();
    services = new TaskServices(store, clock, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void finishBeforeStartThrows() {
    TaskContext context = TaskContext.forEphemeralTask("NoopTask", null, services);

    StateException e = assertThrows(StateException.class, context::markTaskExecutionFinished);
    assertTrue(e.getMessage().contains("has not started yet"));
  }

  @Test
  void startingTwiceThrows() {
    TaskContext context = TaskContext.forEphemeralTask("NoopTask", null, services);
    context.markTaskExecutionStart();

    StateException e = assertThrows(StateException.class, context::markTaskExecutionStart);
    assertTrue(e.getMessage().contains("has already started"));
  }

  @Test
  void finishingTwiceThrows() {
    TaskContext context = TaskContext.forEphemeralTask("NoopTask", null, services);
    context.markTaskExecutionStart();
    context.markTaskExecutionFinished();

    StateException e = assertThrows(StateException.class, context::markTaskExecutionFinished);
    assertTrue(e.getMessage().contains("has already finished"));
  }

  @Test
  void runtimeIsRoundedUpToMilliseconds() {
    TaskContext context = TaskContext.forEphemeralTask("NoopTask", null, services);
    assertTrue(context.runtimeMs().isEmpty());

    context.markTaskExecutionStart();
    clock.advanceMillis(12);
    context.markTaskExecutionFinished();

    assertEquals(12_000_000L, context.runtimeNanos().orElseThrow());
    assertEquals(12L, context.runtimeMs().orElseThrow());
  }

  @Test
  void logEntriesCarryElapsedTime() throws Exception {
    TaskContext context = TaskContext.forEphemeralTask("NoopTask", null, services);
    context.log().debug("before start");
    context.markTaskExecutionStart();
    clock.advanceMillis(5);
    context.log().warning("slow", 42);

    JsonNode logs = JacksonUtility.readTree(context.serializeLogs());
    assertEquals(2, logs.size());
    assertEquals("Debug", logs.get(0).get("severity").asText());
    assertFalse(logs.get(0).has("time"));
    assertEquals("Warning", logs.get(1).get("severity").asText());
    assertEquals(5.0, logs.get(1).get("time").asDouble());
    assertEquals(42, logs.get(1).get("data").get(0).asInt());
  }

  @Test
  void logsWithUnserializableDataAreStillValidJson() throws Exception {
    TaskContext context = TaskContext.forEphemeralTask("NoopTask", null, services);
    context.log().info("odd data", new SelfReferencing());

    JsonNode logs = JacksonUtility.readTree(context.serializeLogs());
    assertTrue(logs.get(0).get("data").get(0).isTextual());
  }

  @Test
  void staticContextReadsStoredRow() {
    long taskId =
        store.insertTask(new NewTaskRecord("NoopComplexTask", "{\"succeed\":true}", 3L, 500L, NOW));

    TaskContext context = TaskContext.forStaticTask(taskId, services).orElseThrow();

    assertEquals(taskId, context.taskId().orElseThrow());
    assertEquals("NoopComplexTask", context.taskName());
    assertTrue(context.params().get("succeed").asBoolean());
    assertEquals(3L, context.parentTaskId().orElseThrow());
    assertEquals(500L, context.intervalMs().orElseThrow());
  }

  @Test
  void staticContextIsEmptyForMalformedParams() {
    long taskId = store.insertTask(new NewTaskRecord("NoopTask", "{not json", null, null, NOW));

    assertTrue(TaskContext.forStaticTask(taskId, services).isEmpty());
  }

  @Test
  void staticContextIsEmptyForExecutedRow() {
    long taskId = store.insertTask(new NewTaskRecord("NoopTask", "{}", null, null, NOW));
    store.updateTaskResult(taskId, TaskResult.TASK_SUCCESS, "[]", 1L);

    assertTrue(TaskContext.forStaticTask(taskId, services).isEmpty());
    assertTrue(TaskContext.forStaticTask(taskId + 100, services).isEmpty());
  }

  @Test
  void negativeIntervalIsRejected() {
    TaskContext context = TaskContext.forEphemeralTask("NoopTask", null, services);

    assertThrows(IllegalArgumentException.class, () -> context.setIntervalMs(-1L));
    context.setIntervalMs(null);
    assertTrue(context.intervalMs().isEmpty());
  }
}
