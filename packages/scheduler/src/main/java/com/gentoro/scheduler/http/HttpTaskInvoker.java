package com.gentoro.scheduler.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.scheduler.exception.ConfigException;
import com.gentoro.scheduler.exception.NetworkException;
import com.gentoro.scheduler.logging.LoggingService;
import com.gentoro.scheduler.scheduler.TaskInvoker;
import com.gentoro.scheduler.task.TaskIdentifier;
import com.gentoro.scheduler.task.TaskResult;
import com.gentoro.scheduler.utility.JacksonUtility;
import java.io.IOException;
import java.time.Duration;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;

/**
 * {@link TaskInvoker} that asks the process serving {@code /api/scheduler/invoke} to execute the
 * task, authenticating with the shared invocation password.
 */
public final class HttpTaskInvoker implements TaskInvoker {
  private static final Logger log = LoggingService.getLogger(HttpTaskInvoker.class);
  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

  private final OkHttpClient client;
  private final String url;
  private final String password;
  private final ObjectMapper mapper = JacksonUtility.getJsonMapper();

  public HttpTaskInvoker(OkHttpClient client, String url, String password) {
    this.client = client;
    this.url = url;
    this.password = password;
  }

  /** Creates an invoker from {@code scheduler.invocation.*}. */
  public static HttpTaskInvoker fromConfiguration(Configuration configuration) {
    String url = configuration.getString("scheduler.invocation.url");
    String password = configuration.getString("scheduler.invocation.password");
    if (url == null || url.isBlank()) {
      throw new ConfigException("Missing required configuration: scheduler.invocation.url");
    }
    if (password == null || password.isBlank() || password.startsWith("${")) {
      throw new ConfigException("Missing required configuration: scheduler.invocation.password");
    }
    long readTimeoutMs = configuration.getLong("scheduler.invocation.read-timeout-ms", 60_000L);
    return new HttpTaskInvoker(
        OkHttpFactory.create(Duration.ofMillis(readTimeoutMs)), url, password);
  }

  @Override
  public TaskResult invoke(TaskIdentifier identifier) {
    ObjectNode body = mapper.createObjectNode();
    body.put("password", password);
    if (identifier.isStatic()) {
      body.put("taskId", identifier.taskId());
    } else {
      body.put("taskName", identifier.taskName());
      if (identifier.params() != null) {
        body.set("params", identifier.params());
      }
    }

    Request request =
        new Request.Builder().url(url).post(RequestBody.create(body.toString(), JSON)).build();

    try (Response response = client.newCall(request).execute()) {
      ResponseBody responseBody = response.body();
      String content = responseBody == null ? "" : responseBody.string();
      if (!response.isSuccessful()) {
        throw new NetworkException(
                "Task invocation of " + identifier + " failed with HTTP " + response.code())
            .with("status", response.code());
      }

      JsonNode result = mapper.readTree(content).path("result");
      if (!result.isTextual()) {
        throw new NetworkException("Task invocation response carries no result: " + content);
      }
      log.debug("Remote invocation of {} finished with {}", identifier, result.asText());
      return TaskResult.valueOf(result.asText());
    } catch (IOException e) {
      throw new NetworkException("Unable to invoke " + identifier + " at " + url, e);
    } catch (IllegalArgumentException e) {
      throw new NetworkException("Task invocation returned an unknown result", e);
    }
  }
}
