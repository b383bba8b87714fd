package com.gentoro.scheduler.storage;

import com.gentoro.scheduler.exception.StorageException;
import com.gentoro.scheduler.logging.LoggingService;
import com.mchange.v2.c3p0.ComboPooledDataSource;
import java.sql.Connection;
import java.sql.SQLException;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.FlywayException;
import org.slf4j.Logger;

/** Pooled {@link Storage} whose schema is migrated with Flyway when it is opened. */
public final class DataSourceStorage implements Storage, AutoCloseable {
  private static final Logger log = LoggingService.getLogger(DataSourceStorage.class);

  public static final String MIGRATIONS_LOCATION = "classpath:db/migration";

  private static final String VALIDATION_QUERY_SQL = "select 1";

  private final ComboPooledDataSource dataSource;

  public DataSourceStorage(DatabaseConfiguration dbConfig) {
    dataSource = new ComboPooledDataSource();
    dataSource.setJdbcUrl(dbConfig.url());
    dataSource.setUser(dbConfig.username());
    dataSource.setPassword(dbConfig.password());
    dataSource.setMinPoolSize(dbConfig.minPoolSize());
    dataSource.setInitialPoolSize(dbConfig.minPoolSize());
    dataSource.setMaxPoolSize(dbConfig.maxPoolSize());
    dataSource.setTestConnectionOnCheckout(true);
    dataSource.setPreferredTestQuery(VALIDATION_QUERY_SQL);

    try {
      var flyway =
          Flyway.configure()
              .dataSource(dbConfig.url(), dbConfig.username(), dbConfig.password())
              .locations(MIGRATIONS_LOCATION)
              .load();
      var result = flyway.migrate();
      log.info(
          "Database schema is up to date ({} migration(s) applied)", result.migrationsExecuted);
    } catch (FlywayException e) {
      dataSource.close();
      throw new StorageException("Unable to migrate the scheduler database", e);
    }
  }

  @Override
  public Connection connect() throws SQLException {
    var conn = dataSource.getConnection();
    conn.setAutoCommit(true);
    return conn;
  }

  @Override
  public void close() {
    dataSource.close();
  }
}
