package com.gentoro.scheduler.storage;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * A JDBC transaction spanning several statements. The connection is opened lazily with
 * auto-commit disabled; closing the handle without {@link #commit()} rolls back.
 */
public final class TransactionHandle implements AutoCloseable {
  private final Storage storage;
  private boolean committed = false;
  private Connection con = null;

  public TransactionHandle(Storage storage) {
    this.storage = storage;
  }

  public synchronized Connection connect() throws SQLException {
    if (con != null) {
      return con;
    }
    con = storage.connect();
    con.setAutoCommit(false);
    return con;
  }

  public synchronized void commit() throws SQLException {
    if (con == null) {
      return;
    }
    if (committed) {
      throw new IllegalStateException("Already committed");
    }
    con.commit();
    committed = true;
  }

  @Override
  public synchronized void close() throws SQLException {
    if (con == null || con.isClosed()) {
      return;
    }
    try {
      if (!committed) {
        con.rollback();
      }
      con.setAutoCommit(true);
    } finally {
      con.close();
      con = null;
    }
  }
}
