package com.gentoro.scheduler.endpoints;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.scheduler.scheduler.Scheduler;
import com.gentoro.scheduler.scheduler.TaskSchedulingService;
import com.gentoro.scheduler.storage.InMemoryTaskStore;
import com.gentoro.scheduler.storage.NewTaskRecord;
import com.gentoro.scheduler.task.TaskIdentifier;
import com.gentoro.scheduler.task.TaskRegistry;
import com.gentoro.scheduler.task.TaskResult;
import com.gentoro.scheduler.utility.JacksonUtility;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.eclipse.jetty.ee10.servlet.ServletHolder;
import org.eclipse.jetty.ee10.servlet.ServletTester;
import org.eclipse.jetty.http.HttpTester;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

class SchedulerTasksServletTest {
  private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

  private InMemoryTaskStore store;
  private Scheduler scheduler;
  private ServletTester tester;

  @BeforeEach
  void setUp() throws Exception {
    store = new InMemoryTaskStore();
    scheduler = Mockito.mock(Scheduler.class);
    TaskRegistry registry = TaskRegistry.builtIn();
    TaskSchedulingService schedulingService =
        new TaskSchedulingService(store, registry, scheduler, Clock.fixed(NOW, ZoneOffset.UTC));

    tester = new ServletTester();
    tester.addServlet(
        new ServletHolder(new SchedulerTasksServlet(store, registry, schedulingService)),
        "/api/scheduler/tasks");
    tester.start();
  }

  @AfterEach
  void tearDown() throws Exception {
    tester.stop();
  }

  private HttpTester.Response request(String method, String uri, String body) throws Exception {
    HttpTester.Request req = HttpTester.newRequest();
    req.setMethod(method);
    req.setURI(uri);
    req.setVersion("HTTP/1.1");
    req.setHeader("Host", "tester");
    if (body != null) {
      req.setHeader("Content-Type", "application/json");
      req.setContent(body);
    }
    return HttpTester.parseResponse(tester.getResponses(req.generate()));
  }

  @Test
  void listsRowsWithStateAndDescription() throws Exception {
    long failed = store.insertTask(new NewTaskRecord("NoopTask", "{}", null, null, NOW));
    store.updateTaskResult(failed, TaskResult.TASK_FAILURE, "[]", 4L);
    store.insertTask(
        new NewTaskRecord(
            "NoopComplexTask", "{\"succeed\":true}", failed, 1000L, NOW.plusSeconds(1)));
    store.insertTask(new NewTaskRecord("RetiredTask", "{}", null, null, NOW.plusSeconds(2)));

    HttpTester.Response resp = request("GET", "/api/scheduler/tasks", null);

    assertEquals(200, resp.getStatus());
    JsonNode body = JacksonUtility.readTree(resp.getContent());
    assertEquals(3, body.get("rowCount").asInt());
    JsonNode rows = body.get("rows");
    assertEquals(3, rows.size());

    assertEquals("RetiredTask", rows.get(0).get("task").asText());
    assertEquals("pending", rows.get(0).get("state").asText());

    assertEquals("No-op task (succeed=true)", rows.get(1).get("task").asText());
    assertEquals(failed, rows.get(1).get("parentId").asLong());
    assertEquals(1000L, rows.get(1).get("executionInterval").asLong());

    assertEquals("failure", rows.get(2).get("state").asText());
    assertEquals(4L, rows.get(2).get("executionTime").asLong());
    assertEquals(NOW.toString(), rows.get(2).get("date").asText());
  }

  @Test
  void paginates() throws Exception {
    for (int i = 0; i < 3; i++) {
      store.insertTask(new NewTaskRecord("NoopTask", "{}", null, null, NOW.plusSeconds(i)));
    }

    HttpTester.Response resp = request("GET", "/api/scheduler/tasks?page=1&pageSize=2", null);

    JsonNode body = JacksonUtility.readTree(resp.getContent());
    assertEquals(1, body.get("rows").size());
    assertEquals(3, body.get("rowCount").asInt());
    assertEquals(400, request("GET", "/api/scheduler/tasks?pageSize=abc", null).getStatus());
    assertEquals(400, request("GET", "/api/scheduler/tasks?pageSize=1000", null).getStatus());
    assertEquals(
        400,
        request("GET", "/api/scheduler/tasks?page=2147483647&pageSize=100", null).getStatus());
  }

  @Test
  void schedulesTask() throws Exception {
    HttpTester.Response resp =
        request(
            "POST",
            "/api/scheduler/tasks",
            "{\"taskName\":\"NoopComplexTask\",\"params\":{\"succeed\":true},"
                + "\"delayMs\":5000,\"intervalMs\":60000}");

    assertEquals(200, resp.getStatus());
    long taskId = JacksonUtility.readTree(resp.getContent()).get("taskId").asLong();
    var row = store.findPendingTask(taskId).orElseThrow();
    assertEquals("{\"succeed\":true}", row.params());
    assertEquals(60000L, row.intervalMs());
    assertEquals(NOW.plusMillis(5000), row.scheduledDate());
    Mockito.verify(scheduler).queueTask(TaskIdentifier.forId(taskId), 5000);
  }

  @Test
  void rejectsInvalidScheduleRequests() throws Exception {
    assertEquals(
        400,
        request("POST", "/api/scheduler/tasks", "{\"taskName\":\"Unknown\",\"delayMs\":0}")
            .getStatus());
    assertEquals(
        400, request("POST", "/api/scheduler/tasks", "{\"taskName\":\"NoopTask\"}").getStatus());
    assertEquals(
        400,
        request("POST", "/api/scheduler/tasks", "{\"taskName\":\"NoopTask\",\"delayMs\":-1}")
            .getStatus());
    assertEquals(0, store.countTasks());
    Mockito.verifyNoInteractions(scheduler);
  }
}
