package com.gentoro.scheduler.storage;

import com.gentoro.scheduler.exception.StorageException;
import com.gentoro.scheduler.task.TaskResult;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Consumer;

/**
 * {@link TaskStore} that keeps rows in memory. Rows do not survive a restart. Transactions buffer
 * their changes and apply them atomically on commit.
 */
public final class InMemoryTaskStore implements TaskStore {
  private static final Comparator<TaskRecord> BY_SCHEDULED_DATE =
      Comparator.comparing(TaskRecord::scheduledDate).thenComparingLong(TaskRecord::taskId);

  private final Map<Long, TaskRecord> tasks = new TreeMap<>();
  private long nextTaskId = 1;

  @Override
  public synchronized long insertTask(NewTaskRecord record) {
    long taskId = nextTaskId++;
    putInserted(taskId, record);
    return taskId;
  }

  @Override
  public synchronized Optional<TaskRecord> findPendingTask(long taskId) {
    return Optional.ofNullable(tasks.get(taskId)).filter(TaskRecord::isPending);
  }

  @Override
  public synchronized List<TaskRecord> findPendingTasks() {
    return tasks.values().stream().filter(TaskRecord::isPending).sorted(BY_SCHEDULED_DATE).toList();
  }

  @Override
  public synchronized List<TaskRecord> listTasks(int limit, int offset) {
    return tasks.values().stream()
        .sorted(BY_SCHEDULED_DATE.reversed())
        .skip(offset)
        .limit(limit)
        .toList();
  }

  @Override
  public synchronized long countTasks() {
    return tasks.size();
  }

  @Override
  public synchronized void updateTaskResult(
      long taskId, TaskResult result, String logs, Long runtimeMs) {
    TaskRecord task = tasks.get(taskId);
    if (task == null) {
      throw new StorageException("Task #" + taskId + " does not exist");
    }
    tasks.put(
        taskId,
        new TaskRecord(
            task.taskId(),
            task.taskName(),
            task.params(),
            task.parentTaskId(),
            task.intervalMs(),
            task.scheduledDate(),
            result,
            logs,
            runtimeMs));
  }

  /** IDs are handed out on insert so the caller sees them before commit. */
  @Override
  public Transaction transaction() {
    return new BufferedTransaction();
  }

  private final class BufferedTransaction implements Transaction {
    private final List<Consumer<InMemoryTaskStore>> changes = new ArrayList<>();
    private boolean committed;

    @Override
    public void updateTaskResult(long taskId, TaskResult result, String logs, Long runtimeMs) {
      changes.add(store -> store.updateTaskResult(taskId, result, logs, runtimeMs));
    }

    @Override
    public long insertTask(NewTaskRecord record) {
      long taskId;
      synchronized (InMemoryTaskStore.this) {
        taskId = nextTaskId++;
      }
      changes.add(store -> store.putInserted(taskId, record));
      return taskId;
    }

    @Override
    public void commit() {
      if (committed) {
        throw new IllegalStateException("Already committed");
      }
      synchronized (InMemoryTaskStore.this) {
        Map<Long, TaskRecord> snapshot = new TreeMap<>(tasks);
        try {
          changes.forEach(change -> change.accept(InMemoryTaskStore.this));
        } catch (RuntimeException e) {
          tasks.clear();
          tasks.putAll(snapshot);
          throw e;
        }
      }
      committed = true;
    }

    @Override
    public void close() {
      changes.clear();
    }
  }

  private synchronized void putInserted(long taskId, NewTaskRecord record) {
    tasks.put(
        taskId,
        new TaskRecord(
            taskId,
            record.taskName(),
            record.params(),
            record.parentTaskId(),
            record.intervalMs(),
            record.scheduledDate(),
            null,
            null,
            null));
  }
}
