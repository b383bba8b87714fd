package com.gentoro.scheduler.task.builtin;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.scheduler.task.InvalidParametersException;
import com.gentoro.scheduler.task.TaskWithParams;

/**
 * Parameterized task that does no work. Its parameters decide the outcome, which makes it useful
 * for exercising parameter validation, task logging and interval changes:
 *
 * <pre>
 * { "succeed": true, "logs": true, "intervalMs": 60000 }
 * </pre>
 *
 * <p>{@code succeed} is required. When {@code logs} is set the parameters are logged. When the
 * {@code intervalMs} key is present the repeat interval is replaced by its value, {@code null}
 * cancels repetition.
 */
public final class NoopComplexTask extends TaskWithParams<NoopComplexTask.Params> {
  public static final String NAME = "NoopComplexTask";

  /** Validated parameters. */
  public record Params(
      boolean succeed, boolean logs, boolean hasInterval, Long intervalMs, JsonNode raw) {}

  public static String describe(JsonNode params) {
    JsonNode succeed = params == null ? null : params.get("succeed");
    return "No-op task (succeed=" + (succeed == null ? "?" : succeed.asText()) + ")";
  }

  @Override
  public Params validate(JsonNode params) throws InvalidParametersException {
    if (params == null || !params.isObject()) {
      throw new InvalidParametersException("Parameters must be an object");
    }

    JsonNode succeed = params.get("succeed");
    if (succeed == null || !succeed.isBoolean()) {
      throw new InvalidParametersException("succeed: expected a boolean");
    }

    JsonNode logs = params.get("logs");
    if (logs != null && !logs.isBoolean()) {
      throw new InvalidParametersException("logs: expected a boolean");
    }

    boolean hasInterval = params.has("intervalMs");
    Long intervalMs = null;
    if (hasInterval) {
      JsonNode interval = params.get("intervalMs");
      if (!interval.isNull()) {
        if (!interval.canConvertToLong() || !interval.isIntegralNumber() || interval.asLong() < 0) {
          throw new InvalidParametersException("intervalMs: expected a non-negative integer");
        }
        intervalMs = interval.asLong();
      }
    }

    return new Params(
        succeed.booleanValue(),
        logs != null && logs.booleanValue(),
        hasInterval,
        intervalMs,
        params);
  }

  @Override
  public boolean execute(Params params) {
    if (params.logs()) {
      log().info("Parameters=", params.raw());
    }
    if (params.hasInterval()) {
      setIntervalForRepeatingTask(params.intervalMs());
    }
    return params.succeed();
  }
}
