package com.foreman.core.graph;

import com.foreman.core.model.GraphSnapshot;
import com.foreman.core.model.RawTask;
import com.foreman.core.model.StatusChange;
import com.foreman.core.model.Task;
import com.foreman.core.model.TaskResult;
import com.foreman.core.model.TaskStatus;
import com.foreman.core.model.ValidationWarning;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * All tasks of one run, their dependency edges and their status.
 * <p>
 * Mutations are serialized by an internal lock and every applied transition is
 * appended to {@link #history()}. Queries that only read ({@link #snapshot()},
 * {@link #task(String)}, {@link #tasks()}) do not take the lock and may observe a
 * transition that is still being applied elsewhere.
 * <p>
 * Instances are created by {@link TaskGraphBuilder}, which guarantees the dependency
 * relation is acyclic and free of dangling references. {@link #fromUnvalidated(List)}
 * skips those guarantees.
 */
public class TaskGraph {

    private static final Logger log = LoggerFactory.getLogger(TaskGraph.class);

    private final Map<String, TaskNode> nodes = new ConcurrentHashMap<>();
    private final List<TaskNode> order = new CopyOnWriteArrayList<>();
    private final List<StatusChange> history = new CopyOnWriteArrayList<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Clock clock;

    TaskGraph(List<RawTask> tasks, Clock clock) {
        this.clock = clock;
        for (var raw : tasks) {
            if (nodes.containsKey(raw.id())) {
                throw new InvalidTaskListException("Duplicate task id: " + raw.id());
            }
            var node = new TaskNode(raw);
            nodes.put(node.id, node);
            order.add(node);
        }
    }

    /**
     * Builds a graph exactly as given: dangling dependencies are kept and cycles are
     * not broken. Tasks caught in either stay PENDING until the scheduler's deadlock
     * breaker steps in. Prefer {@link TaskGraphBuilder#build(List)}.
     */
    public static TaskGraph fromUnvalidated(List<RawTask> tasks) {
        TaskGraphBuilder.checkStructure(tasks);
        return new TaskGraph(tasks, Clock.systemUTC());
    }

    // -- Queries --------------------------------------------------------------

    public int size() {
        return order.size();
    }

    public boolean contains(String taskId) {
        return nodes.containsKey(taskId);
    }

    public Task task(String taskId) {
        return node(taskId).toTask();
    }

    /** All tasks in insertion order. */
    public List<Task> tasks() {
        return order.stream().map(TaskNode::toTask).toList();
    }

    public List<String> idsWithStatus(TaskStatus status) {
        return order.stream().filter(n -> n.status == status).map(n -> n.id).toList();
    }

    /** Every transition applied so far, oldest first. */
    public List<StatusChange> history() {
        return List.copyOf(history);
    }

    /**
     * Transitive dependents of a task: every task that directly or indirectly
     * depends on it, in graph order.
     */
    public List<String> dependentsOf(String taskId) {
        node(taskId);
        var direct = directDependents();
        var seen = new LinkedHashSet<String>();
        var queue = new ArrayDeque<String>();
        queue.add(taskId);
        while (!queue.isEmpty()) {
            for (String dependent : direct.getOrDefault(queue.poll(), List.of())) {
                if (!dependent.equals(taskId) && seen.add(dependent)) {
                    queue.add(dependent);
                }
            }
        }
        return order.stream().map(n -> n.id).filter(seen::contains).toList();
    }

    /** Dependencies of a task that are not yet COMPLETED. */
    public List<String> unmetDependencies(String taskId) {
        var node = node(taskId);
        var unmet = new ArrayList<String>();
        for (String dep : node.dependencies) {
            TaskNode depNode = nodes.get(dep);
            if (depNode == null || depNode.status != TaskStatus.COMPLETED) {
                unmet.add(dep);
            }
        }
        return unmet;
    }

    /**
     * Counts by status and completion percentage. Lock-free; may be slightly stale
     * while another thread is mutating the graph.
     */
    public GraphSnapshot snapshot() {
        var counts = new EnumMap<TaskStatus, Integer>(TaskStatus.class);
        for (TaskStatus status : TaskStatus.values()) {
            counts.put(status, 0);
        }
        List<TaskNode> current = List.copyOf(order);
        for (TaskNode node : current) {
            counts.merge(node.status, 1, Integer::sum);
        }
        int total = current.size();
        double pct = total > 0 ? counts.get(TaskStatus.COMPLETED) * 100.0 / total : 0.0;
        return new GraphSnapshot(total, Map.copyOf(counts), pct);
    }

    // -- Mutations ------------------------------------------------------------

    /**
     * Promotes every PENDING task whose dependencies are all COMPLETED to READY.
     *
     * @return ids of the tasks promoted by this call; order among them carries no priority
     */
    public List<String> readyTasks() {
        lock.lock();
        try {
            var promoted = new ArrayList<String>();
            for (TaskNode node : order) {
                if (node.status == TaskStatus.PENDING && dependenciesCompleted(node)) {
                    transition(node, TaskStatus.READY, "dependencies completed");
                    promoted.add(node.id);
                }
            }
            return promoted;
        } finally {
            lock.unlock();
        }
    }

    public void markInProgress(String taskId) {
        lock.lock();
        try {
            var node = require(taskId, TaskStatus.IN_PROGRESS, TaskStatus.READY);
            node.startedAt = now();
            node.finishedAt = null;
            transition(node, TaskStatus.IN_PROGRESS, "dispatched (attempt " + (node.retryCount + 1) + ")");
        } finally {
            lock.unlock();
        }
    }

    public void markCompleted(String taskId, TaskResult result) {
        lock.lock();
        try {
            var node = require(taskId, TaskStatus.COMPLETED, TaskStatus.IN_PROGRESS);
            node.result = result;
            node.error = null;
            node.finishedAt = now();
            transition(node, TaskStatus.COMPLETED, "delegate succeeded");
        } finally {
            lock.unlock();
        }
    }

    public void markFailed(String taskId, String error) {
        lock.lock();
        try {
            var node = require(taskId, TaskStatus.FAILED, TaskStatus.IN_PROGRESS);
            node.error = error;
            node.finishedAt = now();
            transition(node, TaskStatus.FAILED, error);
        } finally {
            lock.unlock();
        }
    }

    /** True when the task is FAILED and still has retry budget left. */
    public boolean canRetry(String taskId, int maxRetries) {
        var node = node(taskId);
        return node.status == TaskStatus.FAILED && node.retryCount < maxRetries;
    }

    /**
     * Moves a FAILED task back to READY for another attempt, consuming one retry.
     *
     * @throws InvalidTransitionException if the task is not FAILED or the budget is spent
     */
    public void retry(String taskId, int maxRetries) {
        lock.lock();
        try {
            var node = require(taskId, TaskStatus.READY, TaskStatus.FAILED);
            if (node.retryCount >= maxRetries) {
                throw new InvalidTransitionException(taskId, node.status, TaskStatus.READY,
                        "retry budget of " + maxRetries + " exhausted");
            }
            String previousError = node.error;
            node.retryCount++;
            node.error = null;
            transition(node, TaskStatus.READY, "retry " + node.retryCount + "/" + maxRetries
                    + " after: " + previousError);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks every transitive dependent of a permanently FAILED task that has not
     * started yet.
     *
     * @return ids of the tasks blocked by this call
     */
    public List<String> cascadeFailure(String failedTaskId) {
        lock.lock();
        try {
            var failed = node(failedTaskId);
            if (failed.status != TaskStatus.FAILED) {
                throw new InvalidTransitionException(failedTaskId, failed.status, TaskStatus.FAILED,
                        "only a FAILED task can cascade");
            }
            String reason = "blocked: dependency " + failedTaskId + " failed";
            var blocked = new ArrayList<String>();
            for (String id : dependentsOf(failedTaskId)) {
                TaskNode node = nodes.get(id);
                if (node.status == TaskStatus.PENDING || node.status == TaskStatus.READY) {
                    blockNode(node, reason);
                    blocked.add(id);
                }
            }
            return blocked;
        } finally {
            lock.unlock();
        }
    }

    /** Blocks a single PENDING or READY task. */
    public void block(String taskId, String reason) {
        lock.lock();
        try {
            var node = node(taskId);
            if (node.status != TaskStatus.PENDING && node.status != TaskStatus.READY) {
                throw new InvalidTransitionException(taskId, node.status, TaskStatus.BLOCKED);
            }
            blockNode(node, reason);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Promotes a PENDING task to READY regardless of its dependencies. Reserved for
     * the scheduler's deadlock breaker.
     */
    public void forceReady(String taskId, String reason) {
        lock.lock();
        try {
            var node = require(taskId, TaskStatus.READY, TaskStatus.PENDING);
            transition(node, TaskStatus.READY, reason);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks every PENDING or READY task CANCELLED.
     *
     * @return ids of the cancelled tasks
     */
    public List<String> cancelRemaining(String reason) {
        lock.lock();
        try {
            var cancelled = new ArrayList<String>();
            for (TaskNode node : order) {
                if (node.status == TaskStatus.PENDING || node.status == TaskStatus.READY) {
                    node.error = reason;
                    node.finishedAt = now();
                    transition(node, TaskStatus.CANCELLED, reason);
                    cancelled.add(node.id);
                }
            }
            return cancelled;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Adds a task to a live graph. Dependencies on ids the graph does not contain are
     * dropped and reported, as during a build. A new task cannot close a cycle because
     * no existing task can depend on it.
     *
     * @return corrections applied to the new task
     */
    public List<ValidationWarning> addTask(RawTask raw) {
        TaskGraphBuilder.checkStructure(List.of(raw));
        lock.lock();
        try {
            if (nodes.containsKey(raw.id())) {
                throw new InvalidTaskListException("Duplicate task id: " + raw.id());
            }
            var warnings = new ArrayList<ValidationWarning>();
            var deps = new ArrayList<String>();
            for (String dep : new LinkedHashSet<>(raw.dependencies())) {
                if (nodes.containsKey(dep)) {
                    deps.add(dep);
                } else {
                    warnings.add(TaskGraphBuilder.danglingWarning(raw.id(), dep));
                }
            }
            var node = new TaskNode(new RawTask(raw.id(), raw.owner(), raw.description(), raw.phase(),
                    deps, raw.requirements(), raw.materials()));
            nodes.put(node.id, node);
            order.add(node);
            warnings.forEach(w -> log.warn("{}", w));
            log.info("Added task {} [{}]: {}", node.id, node.owner, node.description);
            return warnings;
        } finally {
            lock.unlock();
        }
    }

    // -- Internals ------------------------------------------------------------

    private boolean dependenciesCompleted(TaskNode node) {
        for (String dep : node.dependencies) {
            TaskNode depNode = nodes.get(dep);
            if (depNode == null || depNode.status != TaskStatus.COMPLETED) {
                return false;
            }
        }
        return true;
    }

    private Map<String, List<String>> directDependents() {
        var direct = new HashMap<String, List<String>>();
        for (TaskNode node : order) {
            for (String dep : node.dependencies) {
                direct.computeIfAbsent(dep, k -> new ArrayList<>()).add(node.id);
            }
        }
        return direct;
    }

    private void blockNode(TaskNode node, String reason) {
        node.error = reason;
        node.finishedAt = now();
        transition(node, TaskStatus.BLOCKED, reason);
    }

    private TaskNode require(String taskId, TaskStatus to, TaskStatus expected) {
        var node = node(taskId);
        if (node.status != expected) {
            throw new InvalidTransitionException(taskId, node.status, to);
        }
        return node;
    }

    private TaskNode node(String taskId) {
        TaskNode node = taskId != null ? nodes.get(taskId) : null;
        if (node == null) {
            throw new IllegalArgumentException("Unknown task: " + taskId);
        }
        return node;
    }

    private void transition(TaskNode node, TaskStatus to, String reason) {
        TaskStatus from = node.status;
        node.status = to;
        history.add(new StatusChange(node.id, from, to, now(), reason));
        log.debug("Task {} [{}] {} -> {}: {}", node.id, node.owner, from, to, reason);
    }

    private Instant now() {
        return clock.instant();
    }

    /** Mutable per-task state; only written under the graph lock. */
    private static final class TaskNode {
        final String id;
        final String owner;
        final String description;
        final String phase;
        final List<String> dependencies;
        final Map<String, Object> requirements;
        final List<String> materials;

        volatile TaskStatus status = TaskStatus.PENDING;
        volatile int retryCount;
        volatile TaskResult result;
        volatile String error;
        volatile Instant startedAt;
        volatile Instant finishedAt;

        TaskNode(RawTask raw) {
            this.id = raw.id();
            this.owner = raw.owner();
            this.description = raw.description();
            this.phase = raw.phase();
            this.dependencies = List.copyOf(new LinkedHashSet<>(raw.dependencies()));
            this.requirements = raw.requirements();
            this.materials = raw.materials();
        }

        Task toTask() {
            return new Task(id, owner, description, phase, dependencies, status, retryCount,
                    result, error, requirements, materials, startedAt, finishedAt);
        }
    }
}
