package com.gentoro.scheduler.storage;

import com.gentoro.scheduler.exception.StorageException;
import com.gentoro.scheduler.task.TaskResult;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** {@link TaskStore} backed by the {@code tasks} table. */
public final class JdbcTaskStore implements TaskStore {
  private static final String FIELDS =
      "task_id, task_name, task_params, task_parent_task_id, task_scheduled_interval_ms,"
          + " task_scheduled_date, task_invocation_result, task_invocation_logs,"
          + " task_invocation_time_ms";

  private static final String INSERT_TASK =
      "INSERT INTO tasks (task_name, task_params, task_parent_task_id,"
          + " task_scheduled_interval_ms, task_scheduled_date) VALUES (?, ?, ?, ?, ?)";

  private static final String SELECT_PENDING_TASK =
      "SELECT " + FIELDS + " FROM tasks WHERE task_id = ? AND task_invocation_result IS NULL";

  private static final String SELECT_PENDING_TASKS =
      "SELECT "
          + FIELDS
          + " FROM tasks WHERE task_invocation_result IS NULL"
          + " ORDER BY task_scheduled_date, task_id";

  private static final String SELECT_TASKS_PAGE =
      "SELECT "
          + FIELDS
          + " FROM tasks ORDER BY task_scheduled_date DESC, task_id DESC LIMIT ? OFFSET ?";

  private static final String COUNT_TASKS = "SELECT COUNT(*) FROM tasks";

  private static final String UPDATE_TASK_RESULT =
      "UPDATE tasks SET task_invocation_result = ?, task_invocation_logs = ?,"
          + " task_invocation_time_ms = ? WHERE task_id = ?";

  private final Storage storage;

  public JdbcTaskStore(Storage storage) {
    this.storage = storage;
  }

  @Override
  public long insertTask(NewTaskRecord record) {
    try {
      return insertTask(null, record);
    } catch (SQLException e) {
      throw new StorageException("Unable to insert task " + record.taskName(), e);
    }
  }

  private long insertTask(TransactionHandle transaction, NewTaskRecord record)
      throws SQLException {
    return DbOperation.execute(
        transaction,
        storage,
        con -> {
          try (PreparedStatement st =
              con.prepareStatement(INSERT_TASK, Statement.RETURN_GENERATED_KEYS)) {
            st.setString(1, record.taskName());
            st.setString(2, record.params());
            setNullableLong(st, 3, record.parentTaskId());
            setNullableLong(st, 4, record.intervalMs());
            st.setObject(5, record.scheduledDate().atOffset(ZoneOffset.UTC));
            st.executeUpdate();
            try (ResultSet keys = st.getGeneratedKeys()) {
              if (!keys.next()) {
                throw new SQLException("No ID was generated for the inserted task");
              }
              return keys.getLong(1);
            }
          }
        });
  }

  @Override
  public Optional<TaskRecord> findPendingTask(long taskId) {
    try {
      return DbOperation.execute(
          null,
          storage,
          con -> {
            try (PreparedStatement st = con.prepareStatement(SELECT_PENDING_TASK)) {
              st.setLong(1, taskId);
              try (ResultSet rs = st.executeQuery()) {
                return rs.next() ? Optional.of(readTask(rs)) : Optional.<TaskRecord>empty();
              }
            }
          });
    } catch (SQLException e) {
      throw new StorageException("Unable to read task #" + taskId, e);
    }
  }

  @Override
  public List<TaskRecord> findPendingTasks() {
    try {
      return DbOperation.execute(
          null,
          storage,
          con -> {
            try (PreparedStatement st = con.prepareStatement(SELECT_PENDING_TASKS)) {
              return readTasks(st);
            }
          });
    } catch (SQLException e) {
      throw new StorageException("Unable to read pending tasks", e);
    }
  }

  @Override
  public List<TaskRecord> listTasks(int limit, int offset) {
    try {
      return DbOperation.execute(
          null,
          storage,
          con -> {
            try (PreparedStatement st = con.prepareStatement(SELECT_TASKS_PAGE)) {
              st.setInt(1, limit);
              st.setInt(2, offset);
              return readTasks(st);
            }
          });
    } catch (SQLException e) {
      throw new StorageException("Unable to list tasks", e);
    }
  }

  @Override
  public long countTasks() {
    try {
      return DbOperation.execute(
          null,
          storage,
          con -> {
            try (PreparedStatement st = con.prepareStatement(COUNT_TASKS);
                ResultSet rs = st.executeQuery()) {
              return rs.next() ? rs.getLong(1) : 0L;
            }
          });
    } catch (SQLException e) {
      throw new StorageException("Unable to count tasks", e);
    }
  }

  @Override
  public void updateTaskResult(long taskId, TaskResult result, String logs, Long runtimeMs) {
    try {
      updateTaskResult(null, taskId, result, logs, runtimeMs);
    } catch (SQLException e) {
      throw new StorageException("Unable to store the result of task #" + taskId, e);
    }
  }

  private void updateTaskResult(
      TransactionHandle transaction, long taskId, TaskResult result, String logs, Long runtimeMs)
      throws SQLException {
    DbOperation.execute(
        transaction,
        storage,
        con -> {
          try (PreparedStatement st = con.prepareStatement(UPDATE_TASK_RESULT)) {
            st.setString(1, result.name());
            st.setString(2, logs);
            setNullableLong(st, 3, runtimeMs);
            st.setLong(4, taskId);
            st.executeUpdate();
          }
        });
  }

  @Override
  public Transaction transaction() {
    return new JdbcTransaction(new TransactionHandle(storage));
  }

  private final class JdbcTransaction implements Transaction {
    private final TransactionHandle handle;

    JdbcTransaction(TransactionHandle handle) {
      this.handle = handle;
    }

    @Override
    public void updateTaskResult(long taskId, TaskResult result, String logs, Long runtimeMs) {
      try {
        JdbcTaskStore.this.updateTaskResult(handle, taskId, result, logs, runtimeMs);
      } catch (SQLException e) {
        throw new StorageException("Unable to store the result of task #" + taskId, e);
      }
    }

    @Override
    public long insertTask(NewTaskRecord record) {
      try {
        return JdbcTaskStore.this.insertTask(handle, record);
      } catch (SQLException e) {
        throw new StorageException("Unable to insert task " + record.taskName(), e);
      }
    }

    @Override
    public void commit() {
      try {
        handle.commit();
      } catch (SQLException e) {
        throw new StorageException("Unable to commit the transaction", e);
      }
    }

    @Override
    public void close() {
      try {
        handle.close();
      } catch (SQLException e) {
        throw new StorageException("Unable to close the transaction", e);
      }
    }
  }

  private static List<TaskRecord> readTasks(PreparedStatement st) throws SQLException {
    List<TaskRecord> tasks = new ArrayList<>();
    try (ResultSet rs = st.executeQuery()) {
      while (rs.next()) {
        tasks.add(readTask(rs));
      }
    }
    return tasks;
  }

  private static TaskRecord readTask(ResultSet rs) throws SQLException {
    String result = rs.getString("task_invocation_result");
    return new TaskRecord(
        rs.getLong("task_id"),
        rs.getString("task_name"),
        rs.getString("task_params"),
        getNullableLong(rs, "task_parent_task_id"),
        getNullableLong(rs, "task_scheduled_interval_ms"),
        rs.getObject("task_scheduled_date", OffsetDateTime.class).toInstant(),
        result == null ? null : TaskResult.valueOf(result),
        rs.getString("task_invocation_logs"),
        getNullableLong(rs, "task_invocation_time_ms"));
  }

  private static Long getNullableLong(ResultSet rs, String column) throws SQLException {
    long value = rs.getLong(column);
    return rs.wasNull() ? null : value;
  }

  private static void setNullableLong(PreparedStatement st, int index, Long value)
      throws SQLException {
    if (value == null) {
      st.setNull(index, Types.BIGINT);
    } else {
      st.setLong(index, value);
    }
  }
}
