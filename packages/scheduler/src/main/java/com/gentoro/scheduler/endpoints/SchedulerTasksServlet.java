package com.gentoro.scheduler.endpoints;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.scheduler.scheduler.ScheduleTaskRequest;
import com.gentoro.scheduler.scheduler.TaskSchedulingService;
import com.gentoro.scheduler.storage.TaskRecord;
import com.gentoro.scheduler.storage.TaskStore;
import com.gentoro.scheduler.task.TaskRegistry;
import com.gentoro.scheduler.task.TaskResult;
import com.gentoro.scheduler.utility.JacksonUtility;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;

/**
 * /api/scheduler/tasks
 *
 * <ul>
 *   <li>GET lists task rows, most recently scheduled first ({@code ?page=&pageSize=}).
 *   <li>POST schedules a task, body {@code {taskName, params?, delayMs, intervalMs?,
 *       parentTaskId?}}.
 * </ul>
 */
public final class SchedulerTasksServlet extends HttpServlet {
  static final int DEFAULT_PAGE_SIZE = 25;
  static final int MAX_PAGE_SIZE = 100;

  private final TaskStore store;
  private final TaskRegistry registry;
  private final TaskSchedulingService schedulingService;
  private final ObjectMapper mapper = JacksonUtility.getJsonMapper();

  public SchedulerTasksServlet(
      TaskStore store, TaskRegistry registry, TaskSchedulingService schedulingService) {
    this.store = store;
    this.registry = registry;
    this.schedulingService = schedulingService;
  }

  @Override
  protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    int page;
    int pageSize;
    try {
      page = parseInt(req.getParameter("page"), 0);
      pageSize = parseInt(req.getParameter("pageSize"), DEFAULT_PAGE_SIZE);
    } catch (NumberFormatException e) {
      resp.sendError(400, "page and pageSize must be integers");
      return;
    }
    if (page < 0 || pageSize < 1 || pageSize > MAX_PAGE_SIZE) {
      resp.sendError(400, "Invalid page or pageSize");
      return;
    }
    int offset;
    try {
      offset = Math.multiplyExact(page, pageSize);
    } catch (ArithmeticException e) {
      resp.sendError(400, "page is out of range");
      return;
    }

    ObjectNode node = mapper.createObjectNode();
    ArrayNode rows = node.putArray("rows");
    for (TaskRecord task : store.listTasks(pageSize, offset)) {
      rows.add(toRow(task));
    }
    node.put("rowCount", store.countTasks());

    resp.setStatus(200);
    resp.setContentType("application/json");
    resp.getWriter().write(mapper.writeValueAsString(node));
  }

  @Override
  protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    JsonNode body;
    try {
      body = mapper.readTree(req.getInputStream());
    } catch (IOException e) {
      resp.sendError(400, "Malformed request body");
      return;
    }
    if (body == null || !body.isObject()) {
      resp.sendError(400, "Expected a JSON object");
      return;
    }

    JsonNode taskName = body.get("taskName");
    JsonNode delayMs = body.get("delayMs");
    if (taskName == null || !taskName.isTextual()) {
      resp.sendError(400, "Missing taskName");
      return;
    }
    if (delayMs == null || !delayMs.isIntegralNumber()) {
      resp.sendError(400, "Missing delayMs");
      return;
    }

    long taskId;
    try {
      JsonNode params = body.get("params");
      taskId =
          schedulingService.scheduleTask(
              new ScheduleTaskRequest(
                  taskName.asText(),
                  params == null || params.isNull() ? null : params,
                  delayMs.asLong(),
                  optionalLong(body, "intervalMs"),
                  optionalLong(body, "parentTaskId")));
    } catch (IllegalArgumentException e) {
      resp.sendError(400, e.getMessage());
      return;
    }

    ObjectNode node = mapper.createObjectNode();
    node.put("taskId", taskId);
    resp.setStatus(200);
    resp.setContentType("application/json");
    resp.getWriter().write(mapper.writeValueAsString(node));
  }

  private ObjectNode toRow(TaskRecord task) {
    ObjectNode row = mapper.createObjectNode();
    row.put("id", task.taskId());
    if (task.parentTaskId() != null) row.put("parentId", task.parentTaskId());
    row.put("state", state(task.result()));
    row.put("date", task.scheduledDate().toString());
    row.put("task", registry.describe(task.taskName(), parseParams(task.params())));
    if (task.intervalMs() != null) row.put("executionInterval", task.intervalMs());
    if (task.runtimeMs() != null) row.put("executionTime", task.runtimeMs());
    return row;
  }

  private static String state(TaskResult result) {
    if (result == null) {
      return "pending";
    }
    return result == TaskResult.TASK_SUCCESS ? "success" : "failure";
  }

  private JsonNode parseParams(String params) {
    try {
      return JacksonUtility.readTree(params);
    } catch (JsonProcessingException e) {
      return mapper.createObjectNode();
    }
  }

  private static Long optionalLong(JsonNode body, String field) {
    JsonNode value = body.get(field);
    if (value == null || value.isNull()) {
      return null;
    }
    if (!value.isIntegralNumber()) {
      throw new IllegalArgumentException(field + " must be an integer");
    }
    return value.asLong();
  }

  private static int parseInt(String value, int defaultValue) {
    return value == null || value.isBlank() ? defaultValue : Integer.parseInt(value.trim());
  }
}
