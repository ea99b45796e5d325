package com.foreman.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of a task inside a task graph.
 *
 * @param id           unique identifier, never reused
 * @param owner        worker type that executes the task
 * @param description  free text, display only
 * @param phase        informational grouping label
 * @param dependencies ids of tasks that must be COMPLETED before this task becomes READY
 * @param status       current status
 * @param retryCount   retries consumed so far (0 on the first attempt)
 * @param result       delegate output, set once the task completes
 * @param error        failure or block reason, null otherwise
 * @param requirements worker parameters
 * @param materials    worker materials
 * @param startedAt    when the latest attempt entered IN_PROGRESS
 * @param finishedAt   when the task last left IN_PROGRESS or was blocked/cancelled
 */
public record Task(
    String id,
    String owner,
    String description,
    String phase,
    List<String> dependencies,
    TaskStatus status,
    int retryCount,
    TaskResult result,
    String error,
    Map<String, Object> requirements,
    List<String> materials,
    Instant startedAt,
    Instant finishedAt
) implements Serializable {
}
