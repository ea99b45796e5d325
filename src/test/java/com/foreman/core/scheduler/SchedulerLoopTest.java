package com.foreman.core.scheduler;

import com.foreman.core.delegate.Delegate;
import com.foreman.core.delegate.DelegateException;
import com.foreman.core.delegate.OwnerRegistryDelegate;
import com.foreman.core.events.EventBus;
import com.foreman.core.events.ForemanEvent;
import com.foreman.core.graph.TaskGraph;
import com.foreman.core.graph.TaskGraphBuilder;
import com.foreman.core.metrics.ForemanMetrics;
import com.foreman.core.model.FinalReport;
import com.foreman.core.model.RawTask;
import com.foreman.core.model.RunStatus;
import com.foreman.core.model.SchedulerConfig;
import com.foreman.core.model.StatusChange;
import com.foreman.core.model.Task;
import com.foreman.core.model.TaskResult;
import com.foreman.core.model.TaskStatus;
import com.foreman.core.model.ValidationWarning;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class SchedulerLoopTest {

    private static final SchedulerConfig CONFIG = new SchedulerConfig(Duration.ofSeconds(5), 2, 50, 3);
    private static final Delegate SUCCEED = task -> TaskResult.of(task.id() + " done");

    private EventBus eventBus;
    private SimpleMeterRegistry registry;
    private SchedulerLoop scheduler;
    private TaskGraphBuilder builder;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
        registry = new SimpleMeterRegistry();
        scheduler = new SchedulerLoop(eventBus, new ForemanMetrics(registry), new DeadlockBreaker());
        builder = new TaskGraphBuilder();
    }

    private static RawTask task(String id, String... deps) {
        return new RawTask(id, "Carpenter", "Do " + id, "framing", Arrays.asList(deps));
    }

    private static RawTask phased(String id, String phase) {
        return new RawTask(id, "Carpenter", "Do " + id, phase, List.of());
    }

    private TaskGraph build(RawTask... tasks) {
        return builder.build(List.of(tasks)).graph();
    }

    /** Index in the history of the first change of {@code taskId} into {@code to}. */
    private static int indexOf(List<StatusChange> history, String taskId, TaskStatus to) {
        for (int i = 0; i < history.size(); i++) {
            if (history.get(i).taskId().equals(taskId) && history.get(i).to() == to) {
                return i;
            }
        }
        return -1;
    }

    /** Every dependency completed before its dependent was dispatched. */
    private static void assertDependencyOrder(TaskGraph graph) {
        var history = graph.history();
        for (Task task : graph.tasks()) {
            int started = indexOf(history, task.id(), TaskStatus.IN_PROGRESS);
            if (started < 0) continue;
            for (String dep : task.dependencies()) {
                int depCompleted = indexOf(history, dep, TaskStatus.COMPLETED);
                assertTrue(depCompleted >= 0 && depCompleted < started,
                        dep + " must complete before " + task.id() + " starts");
            }
        }
    }

    @Nested
    @DisplayName("Happy paths")
    class HappyPaths {

        @Test
        @DisplayName("Linear chain A -> B -> C runs strictly in order")
        void linearChain() {
            var calls = new CopyOnWriteArrayList<String>();
            var graph = build(task("A"), task("B", "A"), task("C", "B"));

            FinalReport report = scheduler.run(graph, t -> {
                calls.add(t.id());
                return TaskResult.of("ok");
            }, CONFIG);

            assertEquals(List.of("A", "B", "C"), calls);
            assertEquals(RunStatus.COMPLETED, report.status());
            assertEquals(3, report.count(TaskStatus.COMPLETED));
            assertEquals(0, report.count(TaskStatus.FAILED) + report.count(TaskStatus.BLOCKED));
            assertFalse(report.stalled());
            assertEquals(3, report.passes());
            assertDependencyOrder(graph);
        }

        @Test
        @DisplayName("Diamond: B and C run concurrently, D waits for both")
        void diamondRunsSiblingsConcurrently() throws Exception {
            var siblingsInFlight = new CountDownLatch(2);
            var maxConcurrent = new AtomicInteger();
            var running = new AtomicInteger();
            var graph = build(task("A"), task("B", "A"), task("C", "A"), task("D", "B", "C"));

            FinalReport report = scheduler.run(graph, t -> {
                int now = running.incrementAndGet();
                maxConcurrent.accumulateAndGet(now, Math::max);
                try {
                    if (t.id().equals("B") || t.id().equals("C")) {
                        siblingsInFlight.countDown();
                        assertTrue(siblingsInFlight.await(5, TimeUnit.SECONDS), "sibling never started");
                    }
                    return TaskResult.of("ok");
                } finally {
                    running.decrementAndGet();
                }
            }, CONFIG);

            assertEquals(RunStatus.COMPLETED, report.status());
            assertEquals(2, maxConcurrent.get());
            var history = graph.history();
            int dStarted = indexOf(history, "D", TaskStatus.IN_PROGRESS);
            assertTrue(indexOf(history, "B", TaskStatus.COMPLETED) < dStarted);
            assertTrue(indexOf(history, "C", TaskStatus.COMPLETED) < dStarted);
        }

        @Test
        @DisplayName("maxParallel caps the delegate calls in flight")
        void maxParallelCapsConcurrency() {
            var maxConcurrent = new AtomicInteger();
            var running = new AtomicInteger();
            var graph = build(task("A"), task("B"), task("C"), task("D"), task("E"));

            FinalReport report = scheduler.run(graph, t -> {
                maxConcurrent.accumulateAndGet(running.incrementAndGet(), Math::max);
                try {
                    Thread.sleep(30);
                    return TaskResult.of("ok");
                } finally {
                    running.decrementAndGet();
                }
            }, CONFIG.withMaxParallel(2));

            assertEquals(RunStatus.COMPLETED, report.status());
            assertTrue(maxConcurrent.get() <= 2);
            assertEquals(1, report.passes());
        }

        @Test
        @DisplayName("Ids with surrounding whitespace still order their dependents")
        void whitespaceIdsKeepOrder() {
            var calls = new CopyOnWriteArrayList<String>();
            var graph = build(task(" A "), task("B", " A "));

            FinalReport report = scheduler.run(graph, t -> {
                calls.add(t.id());
                return TaskResult.of("ok");
            }, CONFIG);

            assertEquals(List.of(" A ", "B"), calls);
            assertTrue(report.warnings().isEmpty());
            assertDependencyOrder(graph);
        }

        @Test
        @DisplayName("Ready work is dispatched earliest phase first, unknown phases last")
        void dispatchesInPhaseOrder() {
            var calls = new CopyOnWriteArrayList<String>();
            var graph = build(phased("paint", "finishing"), phased("punch", "walkthrough"),
                    phased("design", "planning"), phased("slab", "foundation"), phased("trim", "finishing"));

            FinalReport report = scheduler.run(graph, t -> {
                calls.add(t.id());
                return TaskResult.of("ok");
            }, CONFIG.withMaxParallel(1));

            assertEquals(RunStatus.COMPLETED, report.status());
            assertEquals(List.of("design", "slab", "paint", "trim", "punch"), calls);
        }

        @Test
        @DisplayName("Null delegate result counts as success")
        void nullResultIsSuccess() {
            var report = scheduler.run(build(task("A")), t -> null, CONFIG);

            assertEquals(TaskStatus.COMPLETED, report.task("A").status());
            assertEquals("", report.task("A").result());
        }

        @Test
        @DisplayName("Empty graph finishes immediately as completed")
        void emptyGraph() {
            var report = scheduler.run(build(), SUCCEED, CONFIG);

            assertEquals(RunStatus.COMPLETED, report.status());
            assertEquals(0, report.passes());
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("A fails on every attempt: 3 attempts, A FAILED, B BLOCKED")
        void retriesThenCascades() {
            var attempts = new AtomicInteger();
            var graph = build(task("A"), task("B", "A"));

            FinalReport report = scheduler.run(graph, t -> {
                attempts.incrementAndGet();
                throw new DelegateException("crew no-show");
            }, CONFIG);

            assertEquals(3, attempts.get());
            assertEquals(TaskStatus.FAILED, report.task("A").status());
            assertEquals(2, report.task("A").retryCount());
            assertEquals("crew no-show", report.task("A").error());
            assertEquals(TaskStatus.BLOCKED, report.task("B").status());
            assertEquals("blocked: dependency A failed", report.task("B").error());
            assertEquals(RunStatus.PARTIAL, report.status());
        }

        @Test
        @DisplayName("Failure cascades transitively and never touches independent work")
        void cascadeIsTransitive() {
            var graph = build(task("A"), task("C", "A"), task("B", "C"), task("X"));

            FinalReport report = scheduler.run(graph, t -> {
                if (t.id().equals("A")) throw new IllegalStateException("cracked slab");
                return TaskResult.of("ok");
            }, CONFIG.withMaxRetries(0));

            assertEquals(TaskStatus.FAILED, report.task("A").status());
            assertEquals(TaskStatus.BLOCKED, report.task("C").status());
            assertEquals(TaskStatus.BLOCKED, report.task("B").status());
            assertEquals(TaskStatus.COMPLETED, report.task("X").status());
            assertFalse(graph.history().stream()
                    .anyMatch(c -> (c.taskId().equals("B") || c.taskId().equals("C"))
                            && c.to() == TaskStatus.IN_PROGRESS));
        }

        @Test
        @DisplayName("Task succeeding on a retry completes and unblocks its dependents")
        void succeedsOnRetry() {
            var attempts = new ConcurrentHashMap<String, AtomicInteger>();
            var graph = build(task("A"), task("B", "A"));

            FinalReport report = scheduler.run(graph, t -> {
                int n = attempts.computeIfAbsent(t.id(), k -> new AtomicInteger()).incrementAndGet();
                if (t.id().equals("A") && n < 2) throw new DelegateException("rain delay");
                return TaskResult.of("ok");
            }, CONFIG);

            assertEquals(RunStatus.COMPLETED, report.status());
            assertEquals(1, report.task("A").retryCount());
            assertNull(report.task("A").error());
            assertDependencyOrder(graph);
        }

        @Test
        @DisplayName("Checked exceptions from the delegate are task failures")
        void checkedExceptionIsFailure() {
            var report = scheduler.run(build(task("A")), t -> {
                throw new IOException("supplier unreachable");
            }, CONFIG.withMaxRetries(0));

            assertEquals(TaskStatus.FAILED, report.task("A").status());
            assertEquals("supplier unreachable", report.task("A").error());
        }

        @Test
        @DisplayName("A delegate call that outlives the timeout is a failed attempt")
        void timeoutIsFailure() {
            var graph = build(task("A"), task("B", "A"));

            FinalReport report = scheduler.run(graph, t -> {
                Thread.sleep(2_000);
                return TaskResult.of("too late");
            }, CONFIG.withPerTaskTimeout(Duration.ofMillis(100)).withMaxRetries(0));

            assertEquals(TaskStatus.FAILED, report.task("A").status());
            assertEquals("Task A timed out after 100ms", report.task("A").error());
            assertEquals(TaskStatus.BLOCKED, report.task("B").status());
            assertTrue(report.elapsed().toMillis() < 2_000);
        }

        @Test
        @DisplayName("Unknown owner fails the task like any delegate error")
        void unknownOwner() {
            var registry = new OwnerRegistryDelegate(List.of());
            var report = scheduler.run(build(task("A")), registry, CONFIG.withMaxRetries(0));

            assertEquals(TaskStatus.FAILED, report.task("A").status());
            assertEquals("No worker registered for owner Carpenter", report.task("A").error());
        }

        @Test
        @DisplayName("Ready task blocked by a failure earlier in the same pass is skipped")
        void skipsQueuedTaskBlockedMidPass() {
            var calls = new CopyOnWriteArrayList<String>();
            var graph = TaskGraph.fromUnvalidated(List.of(task("A", "B"), task("B", "A")));

            FinalReport report = scheduler.run(graph, t -> {
                calls.add(t.id());
                throw new DelegateException("crew walked off");
            }, CONFIG.withMaxParallel(1).withMaxRetries(0));

            assertEquals(List.of("A"), calls);
            assertEquals(TaskStatus.FAILED, report.task("A").status());
            assertEquals(TaskStatus.BLOCKED, report.task("B").status());
            assertEquals(RunStatus.PARTIAL, report.status());
            assertEquals(2, report.passes());
        }

        @Test
        @DisplayName("retryCount never exceeds maxRetries")
        void retryBound() {
            var graph = build(task("A"), task("B"), task("C", "A", "B"));

            FinalReport report = scheduler.run(graph, t -> {
                throw new DelegateException("always");
            }, CONFIG.withMaxRetries(3));

            for (var task : report.tasks()) {
                assertTrue(task.retryCount() <= 3);
            }
            assertEquals(3, report.task("A").retryCount());
            assertEquals(TaskStatus.FAILED, report.task("A").status());
            assertEquals(TaskStatus.BLOCKED, report.task("C").status());
        }
    }

    @Nested
    @DisplayName("Termination")
    class Termination {

        @Test
        @DisplayName("Iteration ceiling stops a run that keeps retrying and reports it stalled")
        void iterationCeiling() {
            var graph = build(task("A"), task("B", "A"));

            FinalReport report = scheduler.run(graph, t -> {
                throw new DelegateException("never");
            }, new SchedulerConfig(Duration.ofSeconds(5), 100, 4, 3));

            assertTrue(report.stalled());
            assertEquals(RunStatus.STALLED, report.status());
            assertEquals(4, report.passes());
            assertEquals(4, report.task("A").retryCount());
            assertEquals(TaskStatus.READY, report.task("A").status());
            assertEquals(TaskStatus.PENDING, report.task("B").status());
        }

        @Test
        @DisplayName("Unvalidated cycle is broken by the deadlock breaker and the run completes")
        void deadlockBreakerOnCycle() {
            var graph = TaskGraph.fromUnvalidated(List.of(task("A", "B"), task("B", "A"), task("C", "A")));

            FinalReport report = scheduler.run(graph, SUCCEED, CONFIG);

            assertEquals(RunStatus.COMPLETED, report.status());
            assertTrue(report.warnings().stream()
                    .anyMatch(w -> w.kind() == ValidationWarning.Kind.DEADLOCK_BROKEN));
            assertEquals(2.0, registry.find("foreman.scheduler.deadlock_breaks")
                    .tag("action", "forced_ready").counter().count());
        }

        @Test
        @DisplayName("Unvalidated dangling dependency is forced ready after one idle pass")
        void deadlockBreakerOnMissingDependency() {
            var graph = TaskGraph.fromUnvalidated(List.of(task("A", "ghost")));

            FinalReport report = scheduler.run(graph, SUCCEED, CONFIG);

            assertEquals(TaskStatus.COMPLETED, report.task("A").status());
            assertEquals(2, report.passes());
            assertEquals(1, report.warnings().size());
        }

        @Test
        @DisplayName("Any graph terminates within the pass ceiling")
        void alwaysTerminates() {
            var graph = TaskGraph.fromUnvalidated(List.of(
                    task("A", "B"), task("B", "C"), task("C", "A"),
                    task("D", "D"), task("E", "nowhere", "A")));

            FinalReport report = scheduler.run(graph, t -> {
                throw new DelegateException("flaky");
            }, new SchedulerConfig(Duration.ofSeconds(5), 1, 6, 3));

            assertTrue(report.passes() <= 6);
            assertFalse(graph.snapshot().count(TaskStatus.IN_PROGRESS) > 0);
            assertEquals(5, report.tasks().size());
        }
    }

    @Nested
    @DisplayName("Cancellation")
    class Cancellation {

        @Test
        @DisplayName("Cancel lets in-flight work finish and cancels the rest")
        void cancelMidRun() {
            var cancellation = new RunCancellation();
            var graph = build(task("A"), task("C"), task("B", "A"));

            FinalReport report = scheduler.run("run-cancel", graph, t -> {
                if (t.id().equals("A")) cancellation.cancel("operator stop");
                return TaskResult.of("ok");
            }, CONFIG.withMaxParallel(1), cancellation);

            assertTrue(report.cancelled());
            assertEquals(RunStatus.CANCELLED, report.status());
            assertEquals(TaskStatus.COMPLETED, report.task("A").status());
            assertEquals(TaskStatus.CANCELLED, report.task("C").status());
            assertEquals(TaskStatus.CANCELLED, report.task("B").status());
            assertEquals("cancelled: operator stop", report.task("B").error());
        }

        @Test
        @DisplayName("A run cancelled before it starts dispatches nothing")
        void cancelledBeforeStart() {
            var cancellation = new RunCancellation();
            cancellation.cancel();
            var calls = new AtomicInteger();

            FinalReport report = scheduler.run("run-early", build(task("A"), task("B", "A")), t -> {
                calls.incrementAndGet();
                return TaskResult.of("ok");
            }, CONFIG, cancellation);

            assertEquals(0, calls.get());
            assertEquals(2, report.count(TaskStatus.CANCELLED));
            assertEquals(0, report.passes());
        }

        @Test
        @DisplayName("Interrupting the scheduler thread cancels the run and keeps the interrupt flag")
        void interruptCancels() throws Exception {
            var started = new CountDownLatch(1);
            var release = new CountDownLatch(1);
            var graph = build(task("A"), task("C"), task("B", "A"));
            var report = new AtomicReference<FinalReport>();
            var stillInterrupted = new AtomicBoolean();

            Thread runner = new Thread(() -> {
                report.set(scheduler.run("run-interrupt", graph, t -> {
                    started.countDown();
                    assertTrue(release.await(5, TimeUnit.SECONDS), "never released");
                    return TaskResult.of("ok");
                }, CONFIG.withMaxParallel(1), new RunCancellation()));
                stillInterrupted.set(Thread.currentThread().isInterrupted());
            }, "scheduler-under-test");
            runner.start();

            assertTrue(started.await(5, TimeUnit.SECONDS));
            runner.interrupt();
            release.countDown();
            runner.join(10_000);

            assertFalse(runner.isAlive());
            assertTrue(stillInterrupted.get());
            FinalReport result = report.get();
            assertEquals(RunStatus.CANCELLED, result.status());
            assertEquals(TaskStatus.COMPLETED, result.task("A").status());
            assertEquals(TaskStatus.CANCELLED, result.task("C").status());
            assertEquals(TaskStatus.CANCELLED, result.task("B").status());
            assertEquals("cancelled: scheduler thread interrupted", result.task("B").error());
        }
    }

    @Nested
    @DisplayName("Events and metrics")
    class EventsAndMetrics {

        @Test
        @DisplayName("Run publishes lifecycle events in order for its run id")
        void publishesEvents() {
            var events = new CopyOnWriteArrayList<ForemanEvent>();
            eventBus.subscribe("run-events", events::add);

            scheduler.run("run-events", build(task("A"), task("B", "A")), t -> {
                if (t.id().equals("B")) throw new DelegateException("no");
                return TaskResult.of("ok");
            }, CONFIG.withMaxRetries(1), new RunCancellation());

            var types = events.stream().map(ForemanEvent::eventType).toList();
            assertEquals("run.started", types.get(0));
            assertEquals("run.completed", types.get(types.size() - 1));
            assertTrue(types.contains("task.retrying"));
            assertTrue(types.contains("task.failed"));
            assertTrue(types.indexOf("task.retrying") < types.indexOf("task.failed"));
            assertEquals(Map.of("status", "PARTIAL", "passes", 3, "completed", 1, "failed", 1, "blocked", 0),
                    events.get(events.size() - 1).payload());
        }

        @Test
        @DisplayName("Outcomes, retries and run result are recorded")
        void recordsMetrics() {
            scheduler.run(build(task("A"), task("B", "A")), t -> {
                throw new DelegateException("no");
            }, CONFIG.withMaxRetries(1));

            assertEquals(2.0, registry.find("foreman.task.outcomes").tag("outcome", "failed").counter().count());
            assertEquals(1.0, registry.find("foreman.task.outcomes").tag("outcome", "blocked").counter().count());
            assertEquals(1.0, registry.find("foreman.task.retries").tag("owner", "Carpenter").counter().count());
            assertEquals(1.0, registry.find("foreman.runs.total").tag("status", "PARTIAL").counter().count());
            assertEquals(2, registry.find("foreman.task.duration").tag("owner", "Carpenter").timer().count());
        }
    }
}
