package com.gentoro.scheduler.exception;

/** Errors while reading from or writing to the task store. */
public class StorageException extends SchedulerException {
  public StorageException(String message) {
    super(SchedulerErrorCode.STORAGE_ERROR, message);
  }

  public StorageException(String message, Throwable cause) {
    super(SchedulerErrorCode.STORAGE_ERROR, message, cause);
  }
}
