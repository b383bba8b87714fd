package com.gentoro.scheduler.task;

/** Thrown by {@link TaskWithParams#validate} when the given parameters are malformed. */
public class InvalidParametersException extends Exception {
  public InvalidParametersException(String message) {
    super(message);
  }

  public InvalidParametersException(String message, Throwable cause) {
    super(message, cause);
  }
}
