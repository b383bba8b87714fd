package com.gentoro.scheduler.exception;

/** Configuration is missing or cannot be interpreted. */
public class ConfigException extends SchedulerException {
  public ConfigException(String message) {
    super(SchedulerErrorCode.CONFIG_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(SchedulerErrorCode.CONFIG_ERROR, message, cause);
  }
}
