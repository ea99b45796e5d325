package com.foreman.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a run is scheduled, used by the CLI progress output.
 *
 * @param eventType event type (e.g. "run.started", "task.started", "task.blocked")
 * @param runId     the run this event belongs to
 * @param taskId    the task this event relates to (nullable for run-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record ForemanEvent(
    String eventType,
    String runId,
    String taskId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static ForemanEvent of(String eventType, String runId, String taskId, Map<String, Object> payload) {
        return new ForemanEvent(eventType, runId, taskId, payload, Instant.now());
    }
}
