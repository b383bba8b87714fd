package com.gentoro.scheduler.exception;

/** Errors on the HTTP boundary, either serving or calling the invocation endpoint. */
public class NetworkException extends SchedulerException {
  public NetworkException(String message) {
    super(SchedulerErrorCode.NETWORK_ERROR, message);
  }

  public NetworkException(String message, Throwable cause) {
    super(SchedulerErrorCode.NETWORK_ERROR, message, cause);
  }
}
