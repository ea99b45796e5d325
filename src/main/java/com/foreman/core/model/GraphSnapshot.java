package com.foreman.core.model;

import java.io.Serializable;
import java.util.Map;

/**
 * Point-in-time counts of a task graph.
 *
 * @param totalTasks           number of tasks in the graph
 * @param counts               number of tasks per status (every status present, zero when unused)
 * @param completionPercentage share of COMPLETED tasks, 0-100
 */
public record GraphSnapshot(
    int totalTasks,
    Map<TaskStatus, Integer> counts,
    double completionPercentage
) implements Serializable {

    public int count(TaskStatus status) {
        return counts.getOrDefault(status, 0);
    }

    /** True while any task can still be dispatched or is running. */
    public boolean hasUnfinishedWork() {
        return count(TaskStatus.PENDING) + count(TaskStatus.READY) + count(TaskStatus.IN_PROGRESS) > 0;
    }
}
