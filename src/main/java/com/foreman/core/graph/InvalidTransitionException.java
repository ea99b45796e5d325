package com.foreman.core.graph;

import com.foreman.core.model.TaskStatus;

/**
 * Thrown when a status change violates the task state machine. This is a defect in
 * the calling code; the graph is left unchanged.
 */
public class InvalidTransitionException extends RuntimeException {

    private final String taskId;
    private final TaskStatus from;
    private final TaskStatus to;

    public InvalidTransitionException(String taskId, TaskStatus from, TaskStatus to) {
        this(taskId, from, to, null);
    }

    public InvalidTransitionException(String taskId, TaskStatus from, TaskStatus to, String detail) {
        super("Task " + taskId + " cannot move from " + from + " to " + to
                + (detail != null ? " (" + detail + ")" : ""));
        this.taskId = taskId;
        this.from = from;
        this.to = to;
    }

    public String getTaskId() {
        return taskId;
    }

    public TaskStatus getFrom() {
        return from;
    }

    public TaskStatus getTo() {
        return to;
    }
}
