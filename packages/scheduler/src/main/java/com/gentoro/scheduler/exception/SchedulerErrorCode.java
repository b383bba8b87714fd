package com.gentoro.scheduler.exception;

/** Coarse classification of failures raised by the scheduler service. */
public enum SchedulerErrorCode {
  /** Missing or malformed configuration. */
  CONFIG_ERROR,
  /** Failure talking to the backing task store. */
  STORAGE_ERROR,
  /** Failure talking to a remote invocation endpoint. */
  NETWORK_ERROR,
  /** A component was used in a state that does not permit the operation. */
  STATE_ERROR,
  /** Anything that could not be classified. */
  UNKNOWN
}
