package com.gentoro.scheduler.endpoints;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.scheduler.exception.ExceptionUtil;
import com.gentoro.scheduler.logging.LoggingService;
import com.gentoro.scheduler.task.TaskIdentifier;
import com.gentoro.scheduler.task.TaskResult;
import com.gentoro.scheduler.task.TaskRunner;
import com.gentoro.scheduler.utility.JacksonUtility;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import org.slf4j.Logger;

/**
 * POST /api/scheduler/invoke, executes a task in this process on behalf of another one.
 *
 * <p>Body: {@code {password, taskId?, taskName?, params?}} with exactly one of {@code taskId} and
 * {@code taskName}. Answers {@code {"result": <TaskResult>}}.
 */
public final class TaskInvocationServlet extends HttpServlet {
  private static final Logger log = LoggingService.getLogger(TaskInvocationServlet.class);

  private final TaskRunner runner;
  private final byte[] password;
  private final ObjectMapper mapper = JacksonUtility.getJsonMapper();

  public TaskInvocationServlet(TaskRunner runner, String password) {
    this.runner = runner;
    this.password = password.getBytes(StandardCharsets.UTF_8);
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

    JsonNode suppliedPassword = body.get("password");
    if (suppliedPassword == null
        || !suppliedPassword.isTextual()
        || !MessageDigest.isEqual(
            password, suppliedPassword.asText().getBytes(StandardCharsets.UTF_8))) {
      log.warn("Rejected a task invocation with an invalid password");
      resp.sendError(403, "Invalid password");
      return;
    }

    TaskIdentifier identifier;
    try {
      identifier = toIdentifier(body);
    } catch (IllegalArgumentException e) {
      resp.sendError(400, e.getMessage());
      return;
    }

    ObjectNode node = mapper.createObjectNode();
    try {
      TaskResult result = runner.executeTask(identifier);
      node.put("result", result.name());
      resp.setStatus(200);
    } catch (Exception e) {
      log.error("Invocation of {} threw an exception", identifier, e);
      node.put("result", TaskResult.TASK_EXCEPTION.name());
      node.set("error", mapper.valueToTree(ExceptionUtil.toErrorDetails(e)));
      resp.setStatus(500);
    }

    resp.setContentType("application/json");
    resp.getWriter().write(mapper.writeValueAsString(node));
  }

  private static TaskIdentifier toIdentifier(JsonNode body) {
    JsonNode taskId = body.get("taskId");
    JsonNode taskName = body.get("taskName");
    boolean hasId = taskId != null && !taskId.isNull();
    boolean hasName = taskName != null && !taskName.isNull();
    if (hasId == hasName) {
      throw new IllegalArgumentException("Exactly one of taskId and taskName must be given");
    }
    if (hasId) {
      if (!taskId.canConvertToLong() || !taskId.isIntegralNumber()) {
        throw new IllegalArgumentException("taskId must be an integer");
      }
      return TaskIdentifier.forId(taskId.asLong());
    }
    if (!taskName.isTextual()) {
      throw new IllegalArgumentException("taskName must be a string");
    }
    JsonNode params = body.get("params");
    return TaskIdentifier.forName(
        taskName.asText(), params == null || params.isNull() ? null : params);
  }
}
