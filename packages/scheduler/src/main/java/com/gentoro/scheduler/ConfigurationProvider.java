package com.gentoro.scheduler;

import com.gentoro.scheduler.exception.ConfigException;
import com.gentoro.scheduler.logging.LoggingService;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.slf4j.Logger;

/**
 * Loads the YAML application configuration, from the given file or from {@code application.yaml}
 * on the classpath. Values may reference environment variables as {@code ${env:NAME}}.
 */
public class ConfigurationProvider {
  private static final Logger log = LoggingService.getLogger(ConfigurationProvider.class);

  public static final String DEFAULT_RESOURCE = "application.yaml";

  private final Configuration config;

  public ConfigurationProvider(String configFile) {
    this.config =
        configFile == null ? loadResource(DEFAULT_RESOURCE) : loadFile(Path.of(configFile));
  }

  public Configuration config() {
    return config;
  }

  private static Configuration loadFile(Path path) {
    if (!Files.isRegularFile(path)) {
      throw new ConfigException("Configuration file not found: " + path);
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      log.info("Loading configuration from {}", path.toAbsolutePath());
      return read(reader);
    } catch (IOException e) {
      throw new ConfigException("Unable to read configuration file " + path, e);
    }
  }

  static Configuration loadResource(String resource) {
    InputStream in = ConfigurationProvider.class.getClassLoader().getResourceAsStream(resource);
    if (in == null) {
      throw new ConfigException("Configuration resource not found: " + resource);
    }
    try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
      log.debug("Loading configuration from classpath:{}", resource);
      return read(reader);
    } catch (IOException e) {
      throw new ConfigException("Unable to read configuration resource " + resource, e);
    }
  }

  private static Configuration read(Reader reader) {
    YAMLConfiguration yaml = new YAMLConfiguration();
    try {
      yaml.read(reader);
    } catch (ConfigurationException e) {
      throw new ConfigException("Malformed YAML configuration", e);
    }
    return yaml;
  }
}
