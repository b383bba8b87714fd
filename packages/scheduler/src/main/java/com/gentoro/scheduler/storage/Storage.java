package com.gentoro.scheduler.storage;

import java.sql.Connection;
import java.sql.SQLException;

/** Source of JDBC connections to the scheduler database. */
public interface Storage {
  Connection connect() throws SQLException;
}
