package com.foreman.core.model;

import java.io.Serializable;

/**
 * A non-fatal correction applied to a task graph, either while building it
 * or when the scheduler had to break a deadlock.
 *
 * @param kind    what was corrected
 * @param taskId  the task whose dependencies or status were changed
 * @param message human-readable description
 */
public record ValidationWarning(
    Kind kind,
    String taskId,
    String message
) implements Serializable {

    public enum Kind {
        DANGLING_DEPENDENCY,
        CYCLE_EDGE_REMOVED,
        DEADLOCK_BROKEN
    }

    @Override
    public String toString() {
        return kind + " [" + taskId + "]: " + message;
    }
}
