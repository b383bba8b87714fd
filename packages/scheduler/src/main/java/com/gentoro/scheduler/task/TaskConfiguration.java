package com.gentoro.scheduler.task;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Configuration loaded into a {@link TaskContext}.
 *
 * @param taskId ID of the persisted row, {@code null} for ephemeral tasks
 * @param taskName name of the task, not guaranteed to be known to the registry
 * @param params parameters, never {@code null}
 * @param parentTaskId set when this is a manual re-run of a previously completed task
 * @param intervalMs delay after which the task should run again, {@code null} when not repeating
 */
public record TaskConfiguration(
    Long taskId, String taskName, JsonNode params, Long parentTaskId, Long intervalMs) {}
