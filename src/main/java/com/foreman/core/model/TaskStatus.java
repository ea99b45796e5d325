package com.foreman.core.model;

/**
 * Status of a task within a task graph.
 * <p>
 * Forward-only: {@code PENDING -> READY -> IN_PROGRESS -> COMPLETED | FAILED}.
 * {@code FAILED} may return to {@code READY} on retry. {@code BLOCKED} and
 * {@code CANCELLED} are reached from {@code PENDING}/{@code READY} only.
 */
public enum TaskStatus {
    PENDING,
    READY,
    IN_PROGRESS,
    COMPLETED,
    FAILED,
    BLOCKED,
    CANCELLED;

    /** Terminal for the run: the scheduler will never touch the task again. */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == BLOCKED || this == CANCELLED;
    }
}
