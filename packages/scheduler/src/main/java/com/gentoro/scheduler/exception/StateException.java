package com.gentoro.scheduler.exception;

/** A component was used in a lifecycle state that does not allow the requested operation. */
public class StateException extends SchedulerException {
  public StateException(String message) {
    super(SchedulerErrorCode.STATE_ERROR, message);
  }
}
