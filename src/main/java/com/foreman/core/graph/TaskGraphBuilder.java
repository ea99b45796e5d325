package com.foreman.core.graph;

import com.foreman.core.model.BuildResult;
import com.foreman.core.model.RawTask;
import com.foreman.core.model.ValidationWarning;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns an unvalidated task list into an acyclic {@link TaskGraph}.
 * <p>
 * Dependencies on unknown ids are removed, then a depth-first walk removes every
 * back edge it meets. Tasks themselves are never dropped: a task stripped of its
 * dependencies is simply schedulable earlier. Every correction is returned as a
 * {@link ValidationWarning}.
 */
@Service
public class TaskGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(TaskGraphBuilder.class);

    private final Clock clock;

    public TaskGraphBuilder() {
        this(Clock.systemUTC());
    }

    public TaskGraphBuilder(Clock clock) {
        this.clock = clock;
    }

    /**
     * Validates a raw task list and builds the graph.
     *
     * @param rawTasks tasks in the order they should appear in reports
     * @return the acyclic graph, every task PENDING, plus the corrections applied
     * @throws InvalidTaskListException if an id is missing or duplicated, or an owner is missing
     */
    public BuildResult build(List<RawTask> rawTasks) {
        checkStructure(rawTasks);
        var warnings = new ArrayList<ValidationWarning>();

        // id -> dependency ids, both in input order
        var edges = new LinkedHashMap<String, LinkedHashSet<String>>();
        for (RawTask task : rawTasks) {
            edges.put(task.id(), new LinkedHashSet<>(task.dependencies()));
        }

        for (var entry : edges.entrySet()) {
            var deps = entry.getValue();
            for (String dep : List.copyOf(deps)) {
                if (!edges.containsKey(dep)) {
                    deps.remove(dep);
                    warnings.add(danglingWarning(entry.getKey(), dep));
                }
            }
        }

        warnings.addAll(breakCycles(edges));

        var validated = new ArrayList<RawTask>(rawTasks.size());
        for (RawTask task : rawTasks) {
            validated.add(new RawTask(task.id(), task.owner(), task.description(), task.phase(),
                    List.copyOf(edges.get(task.id())), task.requirements(), task.materials()));
        }

        warnings.forEach(w -> log.warn("{}", w));
        log.info("Built task graph: {} tasks, {} correction(s)", validated.size(), warnings.size());
        return new BuildResult(new TaskGraph(validated, clock), List.copyOf(warnings));
    }

    /**
     * Iterative depth-first search over task -> dependency edges. An edge into a task
     * that is still on the traversal stack closes a cycle and is removed.
     */
    private List<ValidationWarning> breakCycles(Map<String, LinkedHashSet<String>> edges) {
        var warnings = new ArrayList<ValidationWarning>();
        var onStack = new HashSet<String>();
        var done = new HashSet<String>();
        Map<String, Iterator<String>> cursors = new HashMap<>();

        for (String root : edges.keySet()) {
            if (done.contains(root)) continue;

            Deque<String> stack = new ArrayDeque<>();
            stack.push(root);
            onStack.add(root);
            cursors.put(root, List.copyOf(edges.get(root)).iterator());

            while (!stack.isEmpty()) {
                String current = stack.peek();
                Iterator<String> cursor = cursors.get(current);
                if (!cursor.hasNext()) {
                    stack.pop();
                    onStack.remove(current);
                    done.add(current);
                    continue;
                }
                String dep = cursor.next();
                if (onStack.contains(dep)) {
                    edges.get(current).remove(dep);
                    warnings.add(new ValidationWarning(ValidationWarning.Kind.CYCLE_EDGE_REMOVED, current,
                            "Removed dependency " + current + " -> " + dep + " to break a cycle"));
                } else if (!done.contains(dep)) {
                    stack.push(dep);
                    onStack.add(dep);
                    cursors.put(dep, List.copyOf(edges.get(dep)).iterator());
                }
            }
        }
        return warnings;
    }

    static ValidationWarning danglingWarning(String taskId, String missingDependency) {
        return new ValidationWarning(ValidationWarning.Kind.DANGLING_DEPENDENCY, taskId,
                "Dependency '" + missingDependency + "' does not exist; removed");
    }

    /**
     * Rejects input the builder cannot repair by removing edges.
     */
    static void checkStructure(List<RawTask> rawTasks) {
        if (rawTasks == null) {
            throw new InvalidTaskListException("Task list must not be null");
        }
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < rawTasks.size(); i++) {
            RawTask task = rawTasks.get(i);
            if (task == null) {
                throw new InvalidTaskListException("Task at index " + i + " is null");
            }
            if (task.id() == null || task.id().isBlank()) {
                throw new InvalidTaskListException("Task at index " + i + " has no id");
            }
            if (task.owner() == null || task.owner().isBlank()) {
                throw new InvalidTaskListException("Task " + task.id() + " has no owner");
            }
            if (!seen.add(task.id())) {
                throw new InvalidTaskListException("Duplicate task id: " + task.id());
            }
        }
    }
}
