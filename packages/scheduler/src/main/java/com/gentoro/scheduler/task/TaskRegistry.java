package com.gentoro.scheduler.task;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.scheduler.logging.LoggingService;
import com.gentoro.scheduler.task.builtin.NoopComplexTask;
import com.gentoro.scheduler.task.builtin.NoopTask;
import com.gentoro.scheduler.task.builtin.PopulateSchedulerTask;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;

/**
 * Closed mapping from task names to their implementations and description functions. Registries
 * are immutable once built; {@link #builtIn()} holds the tasks shipped with the service.
 */
public final class TaskRegistry {
  private static final Logger log = LoggingService.getLogger(TaskRegistry.class);

  private static final TaskRegistry BUILT_IN = builder().registerBuiltIns().build();

  private final Map<String, TaskDefinition> definitions;

  private TaskRegistry(Map<String, TaskDefinition> definitions) {
    this.definitions = Collections.unmodifiableMap(new LinkedHashMap<>(definitions));
  }

  public static TaskRegistry builtIn() {
    return BUILT_IN;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Resolves a task name. Empty when the name is unknown. */
  public Optional<TaskDefinition> resolve(String taskName) {
    return Optional.ofNullable(taskName == null ? null : definitions.get(taskName));
  }

  public boolean contains(String taskName) {
    return taskName != null && definitions.containsKey(taskName);
  }

  public Set<String> taskNames() {
    return definitions.keySet();
  }

  /**
   * Describes an invocation of the named task. Falls back to the task name when the task is
   * unknown or its description function fails on the given parameters.
   */
  public String describe(String taskName, JsonNode params) {
    TaskDefinition definition = definitions.get(taskName);
    if (definition == null || definition.formatter() == null) {
      return taskName;
    }
    try {
      String description = definition.formatter().apply(params);
      return description == null || description.isBlank() ? taskName : description;
    } catch (RuntimeException e) {
      log.debug("Unable to describe task {}: {}", taskName, e.getMessage());
      return taskName;
    }
  }

  /** Builder collecting task registrations. Names must be unique. */
  public static final class Builder {
    private final Map<String, TaskDefinition> definitions = new LinkedHashMap<>();

    private Builder() {}

    public Builder registerBuiltIns() {
      register(NoopTask.NAME, NoopTask.class, NoopTask::new, NoopTask::describe);
      register(
          NoopComplexTask.NAME,
          NoopComplexTask.class,
          NoopComplexTask::new,
          NoopComplexTask::describe);
      register(
          PopulateSchedulerTask.NAME,
          PopulateSchedulerTask.class,
          PopulateSchedulerTask::new,
          PopulateSchedulerTask::describe);
      return this;
    }

    public <T extends BaseTask> Builder register(
        String name, Class<T> type, Supplier<T> factory) {
      return register(name, type, factory, params -> name);
    }

    public <T extends BaseTask> Builder register(
        String name, Class<T> type, Supplier<T> factory, Function<JsonNode, String> formatter) {
      if (name == null || name.isBlank()) {
        throw new IllegalArgumentException("Task name must not be blank");
      }
      if (definitions.containsKey(name)) {
        throw new IllegalArgumentException("Task already registered: " + name);
      }
      TaskKind kind =
          TaskWithParams.class.isAssignableFrom(type) ? TaskKind.PARAMETERIZED : TaskKind.SIMPLE;
      definitions.put(name, new TaskDefinition(name, kind, factory, formatter));
      return this;
    }

    public TaskRegistry build() {
      return new TaskRegistry(definitions);
    }
  }
}
