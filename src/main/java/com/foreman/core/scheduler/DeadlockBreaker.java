package com.foreman.core.scheduler;

import com.foreman.core.graph.TaskGraph;
import com.foreman.core.model.TaskStatus;
import com.foreman.core.model.ValidationWarning;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Moves stuck PENDING tasks forward after a pass made no progress.
 * <p>
 * Applied in order:
 * <ol>
 *   <li>a task waiting on a FAILED, BLOCKED or CANCELLED dependency is blocked, together
 *       with its own pending dependents;</li>
 *   <li>a task waiting on an id the graph does not contain, or sitting on a dependency
 *       cycle among stuck tasks, is forced READY.</li>
 * </ol>
 * Every other stuck task waits, directly or through other stuck tasks, on one of these,
 * so the next pass makes progress.
 * A graph built by the builder never reaches this class. It is a recovery path for graphs
 * built from unvalidated input and every action it takes is reported.
 */
@Component
public class DeadlockBreaker {

    private static final Logger log = LoggerFactory.getLogger(DeadlockBreaker.class);

    private static final Set<TaskStatus> DEAD = Set.of(TaskStatus.FAILED, TaskStatus.BLOCKED, TaskStatus.CANCELLED);

    public record Resolution(List<String> forcedReady, List<String> blocked, List<ValidationWarning> warnings) {

        public boolean isEmpty() {
            return forcedReady.isEmpty() && blocked.isEmpty();
        }
    }

    public Resolution breakDeadlock(TaskGraph graph) {
        var warnings = new ArrayList<ValidationWarning>();
        var blocked = new ArrayList<String>();

        for (String id : graph.idsWithStatus(TaskStatus.PENDING)) {
            if (graph.task(id).status() != TaskStatus.PENDING) continue;
            String deadDep = graph.unmetDependencies(id).stream()
                    .filter(dep -> graph.contains(dep) && DEAD.contains(graph.task(dep).status()))
                    .findFirst()
                    .orElse(null);
            if (deadDep == null) continue;

            String reason = "blocked: dependency " + deadDep + " can never complete";
            graph.block(id, reason);
            blocked.add(id);
            warnings.add(warning(id, "Blocked stuck task; dependency " + deadDep + " is "
                    + graph.task(deadDep).status()));
            for (String dependent : graph.dependentsOf(id)) {
                TaskStatus status = graph.task(dependent).status();
                if (status == TaskStatus.PENDING || status == TaskStatus.READY) {
                    graph.block(dependent, "blocked: dependency " + id + " blocked");
                    blocked.add(dependent);
                    warnings.add(warning(dependent, "Blocked stuck task; dependency " + id + " was blocked"));
                }
            }
        }

        List<String> stuck = graph.idsWithStatus(TaskStatus.PENDING);
        var stuckSet = new HashSet<>(stuck);
        var waitsOn = new HashMap<String, List<String>>();
        for (String id : stuck) {
            waitsOn.put(id, graph.unmetDependencies(id));
        }

        var force = new LinkedHashSet<String>();
        for (String id : stuck) {
            boolean missing = waitsOn.get(id).stream().anyMatch(dep -> !graph.contains(dep));
            if (missing || onCycle(id, waitsOn, stuckSet)) {
                force.add(id);
            }
        }

        for (String id : force) {
            String reason = "deadlock breaker: forced ready while waiting on " + waitsOn.get(id);
            graph.forceReady(id, reason);
            warnings.add(warning(id, "Forced ready while waiting on " + waitsOn.get(id)));
        }

        warnings.forEach(w -> log.warn("{}", w));
        return new Resolution(List.copyOf(force), List.copyOf(blocked), List.copyOf(warnings));
    }

    /** True when {@code start} can reach itself through unmet dependencies on stuck tasks. */
    private boolean onCycle(String start, Map<String, List<String>> waitsOn, Set<String> stuck) {
        var seen = new HashSet<String>();
        var queue = new ArrayDeque<String>();
        queue.add(start);
        while (!queue.isEmpty()) {
            for (String dep : waitsOn.getOrDefault(queue.poll(), List.of())) {
                if (dep.equals(start)) return true;
                if (stuck.contains(dep) && seen.add(dep)) {
                    queue.add(dep);
                }
            }
        }
        return false;
    }

    private static ValidationWarning warning(String taskId, String message) {
        return new ValidationWarning(ValidationWarning.Kind.DEADLOCK_BROKEN, taskId, message);
    }
}
