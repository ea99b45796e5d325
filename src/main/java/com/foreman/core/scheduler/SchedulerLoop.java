package com.foreman.core.scheduler;

import com.foreman.core.delegate.Delegate;
import com.foreman.core.events.EventBus;
import com.foreman.core.events.ForemanEvent;
import com.foreman.core.graph.TaskGraph;
import com.foreman.core.logging.MdcContext;
import com.foreman.core.metrics.ForemanMetrics;
import com.foreman.core.model.FinalReport;
import com.foreman.core.model.SchedulerConfig;
import com.foreman.core.model.Task;
import com.foreman.core.model.TaskReport;
import com.foreman.core.model.TaskResult;
import com.foreman.core.model.TaskStatus;
import com.foreman.core.model.ValidationWarning;
import com.foreman.core.template.TaskBreakdown;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives a task graph to completion.
 * <p>
 * Each pass promotes newly ready tasks, dispatches every READY task to the delegate
 * (at most {@code maxParallel} in flight) and applies the outcomes as they arrive.
 * Outcomes are applied only by the thread calling {@link #run}, so cascades never race.
 * A task becomes ready only at the start of a pass, after all its dependencies have
 * been marked COMPLETED.
 * <p>
 * A delegate call that exceeds {@code perTaskTimeout} is recorded as a failed attempt and
 * abandoned. The call itself may keep running; its thread is interrupted when the run
 * ends, which the delegate is free to ignore.
 */
@Service
public class SchedulerLoop {

    private static final Logger log = LoggerFactory.getLogger(SchedulerLoop.class);
    private static final AtomicInteger RUN_COUNTER = new AtomicInteger(0);

    private final EventBus eventBus;
    private final ForemanMetrics metrics;
    private final DeadlockBreaker deadlockBreaker;

    @Autowired
    public SchedulerLoop(EventBus eventBus, ForemanMetrics metrics, DeadlockBreaker deadlockBreaker) {
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.deadlockBreaker = deadlockBreaker;
    }

    /** Test-friendly constructor: no metrics, private event bus. */
    public SchedulerLoop() {
        this(new EventBus(), null, new DeadlockBreaker());
    }

    public FinalReport run(TaskGraph graph, Delegate delegate, SchedulerConfig config) {
        return run("run-" + RUN_COUNTER.incrementAndGet(), graph, delegate, config, new RunCancellation());
    }

    /**
     * Runs the graph until every task is terminal, the run is cancelled or
     * {@code maxTotalIterations} passes have been used.
     *
     * @param runId        identifier used in logs, events and the report
     * @param graph        graph to drain; mutated in place
     * @param delegate     performs each task
     * @param config       timeout, retry and iteration limits
     * @param cancellation checked before every pass and before every dispatch
     * @return the final state of every task; a stall is reported, never thrown
     */
    public FinalReport run(String runId, TaskGraph graph, Delegate delegate, SchedulerConfig config,
                           RunCancellation cancellation) {
        long startNanos = System.nanoTime();
        var warnings = new ArrayList<ValidationWarning>();
        var run = new RunState(runId, graph, delegate, config, cancellation);
        int passes = 0;
        boolean stalled = false;
        boolean cancelled = false;

        MdcContext.setRun(runId);
        ExecutorService executor = Executors.newCachedThreadPool(delegateThreads(runId));
        try {
            log.info("Starting run {}: {} tasks, timeout={}s, maxRetries={}, maxPasses={}, maxParallel={}",
                    runId, graph.size(), config.perTaskTimeout().toSeconds(), config.maxRetries(),
                    config.maxTotalIterations(), config.maxParallel());
            publish(runId, "run.started", null, Map.of("totalTasks", graph.size()));

            while (graph.snapshot().hasUnfinishedWork()) {
                if (cancellation.isCancelled()) {
                    cancelled = true;
                    cancelRemaining(run);
                    break;
                }
                if (passes >= config.maxTotalIterations()) {
                    stalled = true;
                    log.warn("Run {} stalled: iteration ceiling of {} passes reached with {} task(s) unfinished",
                            runId, config.maxTotalIterations(), unfinished(graph));
                    publish(runId, "run.stalled", null, Map.of("passes", passes));
                    break;
                }
                passes++;
                MdcContext.setPass(runId, passes);

                PassResult pass = runPass(run, executor);
                log.info("Pass {} done: {} newly ready, {} completed, {} failed attempt(s), {}% complete",
                        passes, pass.newlyReady, pass.completed, pass.failed,
                        Math.round(graph.snapshot().completionPercentage()));

                if (!pass.madeProgress() && !graph.idsWithStatus(TaskStatus.PENDING).isEmpty()
                        && !cancellation.isCancelled()) {
                    warnings.addAll(breakDeadlock(run));
                }
            }
        } finally {
            executor.shutdownNow();
            MdcContext.clear();
            if (run.interrupted) {
                Thread.currentThread().interrupt();
            }
        }

        var report = report(runId, graph, stalled, cancelled, passes, warnings,
                Duration.ofNanos(System.nanoTime() - startNanos));
        log.info("Run {} finished {} after {} pass(es): {}", runId, report.status(), passes, report.counts());
        publish(runId, "run.completed", null, Map.of(
                "status", report.status().name(),
                "passes", passes,
                "completed", report.count(TaskStatus.COMPLETED),
                "failed", report.count(TaskStatus.FAILED),
                "blocked", report.count(TaskStatus.BLOCKED)));
        if (metrics != null) {
            metrics.recordRunResult(report.status().name());
            metrics.recordPasses(passes);
        }
        return report;
    }

    // -- One pass -------------------------------------------------------------

    private PassResult runPass(RunState run, ExecutorService executor) {
        var result = new PassResult();
        List<String> newlyReady = run.graph.readyTasks();
        result.newlyReady = newlyReady.size();
        for (String id : newlyReady) {
            publish(run.runId, "task.ready", id, Map.of("owner", run.graph.task(id).owner()));
        }

        Deque<String> queue = new ArrayDeque<>(dispatchOrder(run.graph));
        BlockingQueue<DispatchOutcome> outcomes = new LinkedBlockingQueue<>();
        int inFlight = 0;

        while (!queue.isEmpty() || inFlight > 0) {
            while (inFlight < run.config.maxParallel() && !queue.isEmpty() && !run.cancellation.isCancelled()) {
                String taskId = queue.poll();
                // A failure applied earlier in this pass may have blocked a queued task.
                if (run.graph.task(taskId).status() != TaskStatus.READY) {
                    log.info("Skipping task {}: now {}", taskId, run.graph.task(taskId).status());
                    continue;
                }
                dispatch(run, taskId, executor, outcomes);
                inFlight++;
            }
            if (inFlight == 0) {
                if (!queue.isEmpty()) {
                    log.info("Cancellation requested; {} ready task(s) not dispatched", queue.size());
                }
                break;
            }
            DispatchOutcome outcome;
            try {
                outcome = outcomes.take();
            } catch (InterruptedException e) {
                // Every in-flight call completes or times out, so keep draining.
                run.interrupted = true;
                run.cancellation.cancel("scheduler thread interrupted");
                continue;
            }
            inFlight--;
            apply(run, outcome, result);
        }
        return result;
    }

    /** READY ids, earliest construction phase first; unknown phases last, graph order within a phase. */
    static List<String> dispatchOrder(TaskGraph graph) {
        var ready = new ArrayList<>(graph.idsWithStatus(TaskStatus.READY));
        ready.sort(Comparator.comparingInt(id -> TaskBreakdown.phaseRank(graph.task(id).phase())));
        return ready;
    }

    private void dispatch(RunState run, String taskId, ExecutorService executor,
                          BlockingQueue<DispatchOutcome> outcomes) {
        run.graph.markInProgress(taskId);
        Task task = run.graph.task(taskId);
        log.info("Dispatching task {} [{}] attempt {}: {}", task.id(), task.owner(),
                task.retryCount() + 1, task.description());
        publish(run.runId, "task.started", taskId, Map.of(
                "owner", task.owner(),
                "attempt", task.retryCount() + 1,
                "description", task.description() != null ? task.description() : ""));

        long startMs = System.currentTimeMillis();
        CompletableFuture
                .supplyAsync(() -> execute(run, task), executor)
                .orTimeout(run.config.perTaskTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((taskResult, error) -> outcomes.add(new DispatchOutcome(
                        taskId, taskResult, unwrap(error), System.currentTimeMillis() - startMs)));
    }

    private TaskResult execute(RunState run, Task task) {
        MdcContext.setTask(run.runId, task.id(), task.owner());
        try {
            TaskResult result = run.delegate.execute(task);
            return result != null ? result : TaskResult.of("");
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new CompletionException(e);
        } finally {
            MdcContext.clear();
        }
    }

    private void apply(RunState run, DispatchOutcome outcome, PassResult result) {
        TaskGraph graph = run.graph;
        Task task = graph.task(outcome.taskId);
        if (metrics != null) {
            metrics.recordTaskExecution(task.owner(), outcome.elapsedMs);
        }

        if (outcome.error == null) {
            graph.markCompleted(outcome.taskId, outcome.result);
            result.completed++;
            log.info("Task {} [{}] completed in {}ms", task.id(), task.owner(), outcome.elapsedMs);
            publish(run.runId, "task.completed", task.id(), Map.of(
                    "owner", task.owner(), "elapsedMs", outcome.elapsedMs));
            recordOutcome("completed");
            return;
        }

        String error = describe(outcome.error, task, run.config);
        graph.markFailed(outcome.taskId, error);
        result.failed++;
        recordOutcome(outcome.error instanceof TimeoutException ? "timeout" : "failed");

        if (graph.canRetry(outcome.taskId, run.config.maxRetries())) {
            graph.retry(outcome.taskId, run.config.maxRetries());
            int retry = graph.task(outcome.taskId).retryCount();
            log.warn("Task {} [{}] failed ({}); retry {}/{}", task.id(), task.owner(), error,
                    retry, run.config.maxRetries());
            publish(run.runId, "task.retrying", task.id(), Map.of(
                    "owner", task.owner(), "error", error, "retry", retry));
            if (metrics != null) {
                metrics.incrementRetries(task.owner());
            }
            return;
        }

        log.error("Task {} [{}] failed permanently after {} retr{}: {}", task.id(), task.owner(),
                task.retryCount(), task.retryCount() == 1 ? "y" : "ies", error);
        publish(run.runId, "task.failed", task.id(), Map.of(
                "owner", task.owner(), "error", error, "retries", task.retryCount()));

        List<String> blocked = graph.cascadeFailure(outcome.taskId);
        if (!blocked.isEmpty()) {
            log.warn("Task {} failure blocked {} dependent(s): {}", task.id(), blocked.size(), blocked);
        }
        for (String id : blocked) {
            publish(run.runId, "task.blocked", id, Map.of("failedDependency", task.id()));
            recordOutcome("blocked");
        }
    }

    private List<ValidationWarning> breakDeadlock(RunState run) {
        log.warn("No progress in last pass with {} task(s) pending; invoking deadlock breaker",
                run.graph.idsWithStatus(TaskStatus.PENDING).size());
        DeadlockBreaker.Resolution resolution = deadlockBreaker.breakDeadlock(run.graph);
        for (String id : resolution.forcedReady()) {
            publish(run.runId, "scheduler.deadlock_broken", id, Map.of("action", "forced_ready"));
            if (metrics != null) metrics.incrementDeadlockBreaks("forced_ready");
        }
        for (String id : resolution.blocked()) {
            publish(run.runId, "scheduler.deadlock_broken", id, Map.of("action", "blocked"));
            if (metrics != null) metrics.incrementDeadlockBreaks("blocked");
        }
        if (resolution.isEmpty()) {
            log.warn("Deadlock breaker found nothing to move; run will stall at the iteration ceiling");
        }
        return resolution.warnings();
    }

    private void cancelRemaining(RunState run) {
        String reason = "cancelled: " + run.cancellation.reason();
        List<String> cancelledIds = run.graph.cancelRemaining(reason);
        log.warn("Run {} cancelled ({}); {} task(s) not run: {}", run.runId, run.cancellation.reason(),
                cancelledIds.size(), cancelledIds);
        for (String id : cancelledIds) {
            publish(run.runId, "task.cancelled", id, Map.of("reason", reason));
            recordOutcome("cancelled");
        }
    }

    // -- Helpers --------------------------------------------------------------

    private static FinalReport report(String runId, TaskGraph graph, boolean stalled, boolean cancelled,
                                      int passes, List<ValidationWarning> warnings, Duration elapsed) {
        var snapshot = graph.snapshot();
        var tasks = graph.tasks().stream().map(TaskReport::from).toList();
        return new FinalReport(runId, snapshot.totalTasks(), snapshot.counts(), tasks, stalled, cancelled,
                passes, List.copyOf(warnings), elapsed);
    }

    private static String describe(Throwable error, Task task, SchedulerConfig config) {
        if (error instanceof TimeoutException) {
            Duration timeout = config.perTaskTimeout();
            String limit = timeout.toMillis() % 1000 == 0 ? timeout.toSeconds() + "s" : timeout.toMillis() + "ms";
            return "Task " + task.id() + " timed out after " + limit;
        }
        String message = error.getMessage();
        return message != null && !message.isBlank() ? message : error.getClass().getSimpleName();
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static int unfinished(TaskGraph graph) {
        var snapshot = graph.snapshot();
        return snapshot.count(TaskStatus.PENDING) + snapshot.count(TaskStatus.READY);
    }

    private void recordOutcome(String outcome) {
        if (metrics != null) {
            metrics.recordTaskOutcome(outcome);
        }
    }

    private void publish(String runId, String type, String taskId, Map<String, Object> payload) {
        eventBus.publish(ForemanEvent.of(type, runId, taskId, payload));
    }

    private static ThreadFactory delegateThreads(String runId) {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "delegate-" + runId + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private static final class RunState {
        final String runId;
        final TaskGraph graph;
        final Delegate delegate;
        final SchedulerConfig config;
        final RunCancellation cancellation;
        boolean interrupted;

        RunState(String runId, TaskGraph graph, Delegate delegate, SchedulerConfig config,
                 RunCancellation cancellation) {
            this.runId = runId;
            this.graph = graph;
            this.delegate = delegate;
            this.config = config;
            this.cancellation = cancellation;
        }
    }

    private static final class PassResult {
        int newlyReady;
        int completed;
        int failed;

        boolean madeProgress() {
            return newlyReady + completed + failed > 0;
        }
    }

    private record DispatchOutcome(String taskId, TaskResult result, Throwable error, long elapsedMs) {}
}
