package com.gentoro.scheduler.storage;

import com.gentoro.scheduler.task.TaskResult;
import java.util.List;
import java.util.Optional;

/**
 * Persistence of task invocations. Implementations throw {@link
 * com.gentoro.scheduler.exception.StorageException} when the backing store fails.
 */
public interface TaskStore {
  /** Inserts a new row and returns its generated ID. */
  long insertTask(NewTaskRecord record);

  /** Returns the row with the given ID, provided it has not recorded a result yet. */
  Optional<TaskRecord> findPendingTask(long taskId);

  /** All rows that have not recorded a result yet, earliest scheduled first. */
  List<TaskRecord> findPendingTasks();

  /** A page of rows, most recently scheduled first. */
  List<TaskRecord> listTasks(int limit, int offset);

  long countTasks();

  /** Writes the invocation result fields of the given row. */
  void updateTaskResult(long taskId, TaskResult result, String logs, Long runtimeMs);

  /** Starts a transaction in which result updates and inserts succeed or fail together. */
  Transaction transaction();

  /**
   * A unit of work against the store. Changes become visible on {@link #commit()}; closing an
   * uncommitted transaction discards them.
   */
  interface Transaction extends AutoCloseable {
    void updateTaskResult(long taskId, TaskResult result, String logs, Long runtimeMs);

    long insertTask(NewTaskRecord record);

    void commit();

    @Override
    void close();
  }
}
