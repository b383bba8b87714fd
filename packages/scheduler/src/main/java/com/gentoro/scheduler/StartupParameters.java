package com.gentoro.scheduler;

import com.gentoro.scheduler.exception.ConfigException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Command line parameters of the form {@code --name=value}; a bare {@code --flag} is "true". */
public class StartupParameters {
  private final Map<String, String> parameters = new LinkedHashMap<>();

  public StartupParameters(String[] args) {
    if (args == null) {
      return;
    }
    for (String arg : args) {
      if (!arg.startsWith("--") || arg.length() == 2) {
        throw new ConfigException("Unrecognized argument: " + arg);
      }
      String option = arg.substring(2);
      int separator = option.indexOf('=');
      if (separator < 0) {
        parameters.put(option, "true");
      } else {
        parameters.put(option.substring(0, separator), option.substring(separator + 1));
      }
    }
  }

  /** Path of the configuration file given with {@code --config}, or {@code null}. */
  public String configFile() {
    return getParameter("config", String.class);
  }

  public <T> T getParameter(String name, Class<T> type) {
    String value = parameters.get(name);
    if (value == null) {
      return null;
    }
    try {
      if (type == String.class) {
        return type.cast(value);
      } else if (type == Integer.class) {
        return type.cast(Integer.valueOf(value));
      } else if (type == Long.class) {
        return type.cast(Long.valueOf(value));
      } else if (type == Boolean.class) {
        return type.cast(Boolean.valueOf(value));
      }
    } catch (NumberFormatException e) {
      throw new ConfigException("Invalid value for --" + name + ": " + value, e);
    }
    throw new IllegalArgumentException("Unsupported parameter type: " + type.getName());
  }

  public Map<String, String> asMap() {
    return Collections.unmodifiableMap(parameters);
  }
}
