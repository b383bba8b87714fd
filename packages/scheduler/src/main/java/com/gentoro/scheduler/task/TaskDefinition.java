package com.gentoro.scheduler.task;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Registration of one task in the {@link TaskRegistry}.
 *
 * @param name unique name by which the task is addressed
 * @param kind whether the task takes parameters, resolved when the task is registered
 * @param factory creates a fresh instance for each invocation
 * @param formatter one-line, human readable description of an invocation given its parameters
 */
public record TaskDefinition(
    String name,
    TaskKind kind,
    Supplier<? extends BaseTask> factory,
    Function<JsonNode, String> formatter) {

  public BaseTask newInstance() {
    return factory.get();
  }
}
