package com.foreman.core.model;

import java.io.Serializable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a scheduler run.
 *
 * @param runId      identifier of the run
 * @param totalTasks number of tasks in the graph
 * @param counts     tasks per status at the end of the run
 * @param tasks      per-task status, error and result, in graph order
 * @param stalled    true when the iteration ceiling was hit with work left
 * @param cancelled  true when the run was stopped by a cancellation request
 * @param passes     scheduling passes executed
 * @param warnings   build and deadlock-breaker corrections
 * @param elapsed    wall-clock duration of the run
 */
public record FinalReport(
    String runId,
    int totalTasks,
    Map<TaskStatus, Integer> counts,
    List<TaskReport> tasks,
    boolean stalled,
    boolean cancelled,
    int passes,
    List<ValidationWarning> warnings,
    Duration elapsed
) implements Serializable {

    public int count(TaskStatus status) {
        return counts.getOrDefault(status, 0);
    }

    public RunStatus status() {
        if (cancelled) return RunStatus.CANCELLED;
        if (stalled) return RunStatus.STALLED;
        return count(TaskStatus.COMPLETED) == totalTasks ? RunStatus.COMPLETED : RunStatus.PARTIAL;
    }

    public TaskReport task(String taskId) {
        return tasks.stream()
                .filter(t -> t.taskId().equals(taskId))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown task: " + taskId));
    }

    /** Copy of this report with {@code leading} placed before the existing warnings. */
    public FinalReport withLeadingWarnings(List<ValidationWarning> leading) {
        if (leading.isEmpty()) return this;
        var merged = new ArrayList<ValidationWarning>(leading);
        merged.addAll(warnings);
        return new FinalReport(runId, totalTasks, counts, tasks, stalled, cancelled, passes,
                List.copyOf(merged), elapsed);
    }
}
