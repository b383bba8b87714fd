package com.gentoro.scheduler.storage;

import java.sql.Connection;
import java.sql.SQLException;

/** Runs a statement inside the given transaction, or on a connection of its own when none. */
public final class DbOperation {
  private DbOperation() {}

  public static void execute(TransactionHandle transaction, Storage storage, DbRunnable op)
      throws SQLException {
    execute(
        transaction,
        storage,
        con -> {
          op.execute(con);
          return null;
        });
  }

  public static <T> T execute(TransactionHandle transaction, Storage storage, DbSupplier<T> op)
      throws SQLException {
    if (transaction != null) {
      return op.execute(transaction.connect());
    }
    try (Connection con = storage.connect()) {
      return op.execute(con);
    }
  }

  @FunctionalInterface
  public interface DbRunnable {
    void execute(Connection connection) throws SQLException;
  }

  @FunctionalInterface
  public interface DbSupplier<T> {
    T execute(Connection connection) throws SQLException;
  }
}
