package com.gentoro.scheduler.storage;

import com.gentoro.scheduler.exception.ConfigException;
import org.apache.commons.configuration2.Configuration;

/** Connection and pool settings of the scheduler database, read from {@code storage.jdbc.*}. */
public record DatabaseConfiguration(
    String url, String username, String password, int minPoolSize, int maxPoolSize) {

  public static DatabaseConfiguration fromConfiguration(Configuration configuration) {
    Configuration jdbc = configuration.subset("storage.jdbc");
    String url = jdbc.getString("url");
    if (url == null || url.isBlank() || url.startsWith("${")) {
      throw new ConfigException("Missing required configuration: storage.jdbc.url");
    }
    int minPoolSize = jdbc.getInt("min-pool-size", 1);
    int maxPoolSize = jdbc.getInt("max-pool-size", 5);
    if (minPoolSize < 0 || maxPoolSize < 1 || minPoolSize > maxPoolSize) {
      throw new ConfigException(
          "Invalid pool size: min=" + minPoolSize + ", max=" + maxPoolSize);
    }
    return new DatabaseConfiguration(
        url,
        jdbc.getString("username", ""),
        jdbc.getString("password", ""),
        minPoolSize,
        maxPoolSize);
  }

  @Override
  public String toString() {
    return "DatabaseConfiguration[url=" + url + ", username=" + username + "]";
  }
}
