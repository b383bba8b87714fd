package com.gentoro.scheduler.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base unchecked exception of the scheduler service. Carries a {@link SchedulerErrorCode} and an
 * optional map of context values that end up in {@link ErrorDetails}.
 */
public class SchedulerException extends RuntimeException {
  private final SchedulerErrorCode code;
  private final Map<String, Object> context = new LinkedHashMap<>();

  public SchedulerException(SchedulerErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public SchedulerException(SchedulerErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public SchedulerErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }

  /** Attach a context value, returning this exception for chaining. */
  public SchedulerException with(String key, Object value) {
    context.put(key, value);
    return this;
  }
}
