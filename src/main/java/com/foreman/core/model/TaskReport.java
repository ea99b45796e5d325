package com.foreman.core.model;

import java.io.Serializable;

/**
 * Per-task line of a {@link FinalReport}.
 */
public record TaskReport(
    String taskId,
    String owner,
    String phase,
    TaskStatus status,
    int retryCount,
    String error,
    String result
) implements Serializable {

    public static TaskReport from(Task task) {
        return new TaskReport(task.id(), task.owner(), task.phase(), task.status(), task.retryCount(),
                task.error(), task.result() != null ? task.result().summary() : null);
    }
}
