package com.foreman.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * One applied status transition, in the order the graph applied it.
 */
public record StatusChange(
    String taskId,
    TaskStatus from,
    TaskStatus to,
    Instant at,
    String reason
) implements Serializable {
}
